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

/**
 * An {@link Event} together with the position the store assigned to it.
 *
 * <p>Positions start at 1, are strictly increasing and unique within one store.
 * Instances are only produced from store responses.
 */
public final class SequencedEvent {

    private final Event event;
    private final long position;

    public SequencedEvent(Event event, long position) {
        this.event = Objects.requireNonNull(event, "event must not be null");
        if (position < 1) {
            throw new IllegalArgumentException("position must be >= 1, was " + position);
        }
        this.position = position;
    }

    public Event getEvent() { return event; }

    public long getPosition() { return position; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SequencedEvent that = (SequencedEvent) o;
        return position == that.position && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, position);
    }

    @Override
    public String toString() {
        return "SequencedEvent{position=" + position + ", event=" + event + '}';
    }
}
