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

import java.util.Objects;
import java.util.Optional;

/**
 * Optimistic concurrency condition evaluated by the store together with an append.
 *
 * <p>The append is rejected if any stored event matching
 * {@link #getFailIfEventsMatch()} has a position strictly greater than
 * {@link #getAfter()}. Without a position every stored event is considered.
 * Events at exactly {@code after} do not count.
 *
 * <p>Typical use: read the consistency boundary up to the current head, decide,
 * then append with {@code AppendCondition.of(boundary, head)}.
 */
public final class AppendCondition {

    private final Query failIfEventsMatch;
    private final Long after;

    private AppendCondition(Query failIfEventsMatch, Long after) {
        this.failIfEventsMatch = Objects.requireNonNull(failIfEventsMatch, "failIfEventsMatch must not be null");
        if (after != null && after < 0) {
            throw new IllegalArgumentException("after must be >= 0, was " + after);
        }
        this.after = after;
    }

    /**
     * Creates a condition that fails if any matching event exists at all.
     */
    public static AppendCondition failIfEventsMatch(Query query) {
        return new AppendCondition(query, null);
    }

    /**
     * Creates a condition that fails if a matching event exists after the given position.
     *
     * @param query the consistency boundary
     * @param after the last position the caller has seen, or null for none
     */
    public static AppendCondition of(Query query, Long after) {
        return new AppendCondition(query, after);
    }

    /**
     * Creates a condition from an optional position, typically the result of a head call.
     */
    public static AppendCondition of(Query query, Optional<Long> after) {
        return new AppendCondition(query, after.orElse(null));
    }

    public Query getFailIfEventsMatch() { return failIfEventsMatch; }

    public Optional<Long> getAfter() { return Optional.ofNullable(after); }

    /**
     * Returns true if this stored event makes the condition fail.
     */
    public boolean isViolatedBy(SequencedEvent stored) {
        if (after != null && stored.getPosition() <= after) {
            return false;
        }
        return failIfEventsMatch.matches(stored.getEvent());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AppendCondition that = (AppendCondition) o;
        return failIfEventsMatch.equals(that.failIfEventsMatch) && Objects.equals(after, that.after);
    }

    @Override
    public int hashCode() {
        return Objects.hash(failIfEventsMatch, after);
    }

    @Override
    public String toString() {
        return "AppendCondition{failIfEventsMatch=" + failIfEventsMatch + ", after=" + after + '}';
    }
}
