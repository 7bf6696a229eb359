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

package dev.mars.dcb.api;

import dev.mars.dcb.api.exception.ValidationException;

import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of a read against a DCB event store.
 *
 * <p>Every optional parameter is an explicit absent value rather than a
 * sentinel. Reads default to a forward, unbounded, non-subscribing scan of
 * the whole log.
 *
 * <p>A live subscription cannot run backwards: building options with both
 * {@code backwards} and {@code subscribe} set fails with a
 * {@link ValidationException}.
 */
public final class ReadOptions {

    private static final ReadOptions DEFAULTS = builder().build();

    private final Query query;
    private final Long start;
    private final boolean backwards;
    private final Integer limit;
    private final boolean subscribe;

    private ReadOptions(Builder builder) {
        this.query = builder.query;
        this.start = builder.start;
        this.backwards = builder.backwards;
        this.limit = builder.limit;
        this.subscribe = builder.subscribe;
    }

    /**
     * Creates a new options builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns options for a forward read of every event.
     */
    public static ReadOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Returns options for a forward read of every event matching the query.
     */
    public static ReadOptions forQuery(Query query) {
        return builder().query(query).build();
    }

    public Optional<Query> getQuery() { return Optional.ofNullable(query); }

    /** Returns the query to send, the universal query when none was given */
    public Query effectiveQuery() { return query != null ? query : Query.all(); }

    public Optional<Long> getStart() { return Optional.ofNullable(start); }

    public boolean isBackwards() { return backwards; }

    public Optional<Integer> getLimit() { return Optional.ofNullable(limit); }

    public boolean isSubscribe() { return subscribe; }

    /**
     * Builder for ReadOptions.
     */
    public static class Builder {
        private Query query;
        private Long start;
        private boolean backwards;
        private Integer limit;
        private boolean subscribe;

        public Builder query(Query query) {
            this.query = query;
            return this;
        }

        public Builder start(Long start) {
            if (start != null && start < 0) {
                throw new ValidationException("start must be >= 0, was " + start);
            }
            this.start = start;
            return this;
        }

        public Builder backwards(boolean backwards) {
            this.backwards = backwards;
            return this;
        }

        public Builder limit(Integer limit) {
            if (limit != null && limit <= 0) {
                throw new ValidationException("limit must be positive, was " + limit);
            }
            this.limit = limit;
            return this;
        }

        public Builder subscribe(boolean subscribe) {
            this.subscribe = subscribe;
            return this;
        }

        public ReadOptions build() {
            if (backwards && subscribe) {
                throw new ValidationException("A subscription cannot read backwards");
            }
            return new ReadOptions(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReadOptions that = (ReadOptions) o;
        return backwards == that.backwards &&
               subscribe == that.subscribe &&
               Objects.equals(query, that.query) &&
               Objects.equals(start, that.start) &&
               Objects.equals(limit, that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, start, backwards, limit, subscribe);
    }

    @Override
    public String toString() {
        return "ReadOptions{" +
                "query=" + query +
                ", start=" + start +
                ", backwards=" + backwards +
                ", limit=" + limit +
                ", subscribe=" + subscribe +
                '}';
    }
}
