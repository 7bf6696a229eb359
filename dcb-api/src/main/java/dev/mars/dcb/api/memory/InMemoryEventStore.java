/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.dcb.api.memory;

import dev.mars.dcb.api.AppendCondition;
import dev.mars.dcb.api.DcbEventStore;
import dev.mars.dcb.api.Event;
import dev.mars.dcb.api.Query;
import dev.mars.dcb.api.ReadOptions;
import dev.mars.dcb.api.ReadResponse;
import dev.mars.dcb.api.SequencedEvent;
import dev.mars.dcb.api.error.DcbErrorCodes;
import dev.mars.dcb.api.exception.IntegrityException;
import dev.mars.dcb.api.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link DcbEventStore} that applies the same matching and
 * append-condition rules as a remote store.
 *
 * <p>Intended for tests and for prototyping decision logic without a server.
 * Positions start at 1. Appends are atomic: the condition is evaluated and the
 * batch is written under one lock. An append whose events all carry UUIDs that
 * are already stored is treated as a replay and returns the position of the
 * last of those events; a batch that only partially overlaps stored UUIDs is
 * rejected.
 */
public final class InMemoryEventStore implements DcbEventStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();
    private final List<SequencedEvent> log = new ArrayList<>();
    private final Map<UUID, Long> positionsByUuid = new HashMap<>();
    private volatile boolean storeClosed;

    @Override
    public ReadResponse read(ReadOptions options) {
        return new InMemoryReadResponse(options);
    }

    @Override
    public Optional<Long> head() {
        lock.lock();
        try {
            return log.isEmpty() ? Optional.empty() : Optional.of((long) log.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long append(List<Event> events, AppendCondition condition) {
        if (events == null || events.isEmpty()) {
            throw new ValidationException(DcbErrorCodes.VALIDATION_EMPTY_APPEND, "Cannot append an empty batch");
        }

        List<SequencedEvent> written = new ArrayList<>(events.size());
        long lastPosition;
        lock.lock();
        try {
            Optional<Long> replayed = replayedPosition(events);
            if (replayed.isPresent()) {
                logger.debug("Idempotent append of {} events resolved to position {}", events.size(), replayed.get());
                return replayed.get();
            }

            if (condition != null) {
                long from = condition.getAfter().orElse(0L);
                for (int i = (int) Math.min(from, log.size()); i < log.size(); i++) {
                    SequencedEvent stored = log.get(i);
                    if (condition.isViolatedBy(stored)) {
                        throw new IntegrityException("Append condition failed: event at position "
                            + stored.getPosition() + " matches " + condition.getFailIfEventsMatch());
                    }
                }
            }

            for (Event event : events) {
                SequencedEvent sequenced = new SequencedEvent(event, log.size() + 1L);
                log.add(sequenced);
                event.getUuid().ifPresent(uuid -> positionsByUuid.put(uuid, sequenced.getPosition()));
                written.add(sequenced);
            }
            lastPosition = log.size();
            appended.signalAll();
        } finally {
            lock.unlock();
        }

        logger.debug("Appended {} events, head is now {}", written.size(), lastPosition);
        return lastPosition;
    }

    /**
     * Ends all live subscriptions. The stored events remain readable.
     */
    @Override
    public void close() {
        storeClosed = true;
        lock.lock();
        try {
            appended.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private Optional<Long> replayedPosition(List<Event> events) {
        Set<UUID> seenInBatch = new HashSet<>();
        int known = 0;
        long last = 0;
        for (Event event : events) {
            Optional<UUID> uuid = event.getUuid();
            if (uuid.isEmpty()) {
                continue;
            }
            if (!seenInBatch.add(uuid.get())) {
                throw new IntegrityException(DcbErrorCodes.INTEGRITY_DUPLICATE_UUID,
                    "Duplicate UUID within batch: " + uuid.get());
            }
            Long position = positionsByUuid.get(uuid.get());
            if (position != null) {
                known++;
                last = Math.max(last, position);
            }
        }
        if (known == 0) {
            return Optional.empty();
        }
        if (known == events.size()) {
            return Optional.of(last);
        }
        throw new IntegrityException(DcbErrorCodes.INTEGRITY_DUPLICATE_UUID,
            "Batch reuses " + known + " stored UUIDs but also contains new events");
    }

    /**
     * Cursor over the log. Scans one event at a time under the store lock.
     */
    private final class InMemoryReadResponse implements ReadResponse {

        private final Query query;
        private final boolean backwards;
        private final boolean subscribe;
        private final Integer limit;
        private long cursor;
        private int yielded;
        private SequencedEvent next;
        private volatile boolean closed;

        private InMemoryReadResponse(ReadOptions options) {
            this.query = options.effectiveQuery();
            this.backwards = options.isBackwards();
            this.subscribe = options.isSubscribe();
            this.limit = options.getLimit().orElse(null);
            if (backwards) {
                this.cursor = options.getStart().orElse(Long.MAX_VALUE);
            } else {
                this.cursor = Math.max(1L, options.getStart().orElse(1L));
            }
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (closed || (limit != null && yielded >= limit)) {
                return false;
            }
            lock.lock();
            try {
                while (true) {
                    next = scan();
                    if (next != null) {
                        return true;
                    }
                    if (!subscribe || closed || storeClosed) {
                        return false;
                    }
                    appended.awaitUninterruptibly();
                    if (closed || storeClosed) {
                        return false;
                    }
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public SequencedEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            SequencedEvent result = next;
            next = null;
            yielded++;
            return result;
        }

        @Override
        public void close() {
            closed = true;
            lock.lock();
            try {
                appended.signalAll();
            } finally {
                lock.unlock();
            }
        }

        private SequencedEvent scan() {
            if (backwards) {
                cursor = Math.min(cursor, log.size());
                while (cursor >= 1) {
                    SequencedEvent candidate = log.get((int) (cursor - 1));
                    cursor--;
                    if (query.matches(candidate.getEvent())) {
                        return candidate;
                    }
                }
                return null;
            }
            while (cursor <= log.size()) {
                SequencedEvent candidate = log.get((int) (cursor - 1));
                cursor++;
                if (query.matches(candidate.getEvent())) {
                    return candidate;
                }
            }
            return null;
        }
    }
}
