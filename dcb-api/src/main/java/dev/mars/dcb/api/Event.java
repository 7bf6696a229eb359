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

import dev.mars.dcb.api.error.DcbErrorCodes;
import dev.mars.dcb.api.exception.ValidationException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An immutable domain event as submitted to a DCB event store.
 *
 * <p>An event carries a type, an opaque binary payload, a list of tags used for
 * query filtering and an optional UUID the store uses to make appends
 * idempotent. Tags keep their insertion order so that events round-trip
 * unchanged, but matching treats them as a set.
 *
 * <p>Example usage:
 * <pre>{@code
 * Event event = Event.builder()
 *     .eventType("OrderCreated")
 *     .data("{\"orderId\":\"1\"}".getBytes(StandardCharsets.UTF_8))
 *     .tags("order", "order:1")
 *     .uuid(UUID.randomUUID())
 *     .build();
 * }</pre>
 */
public final class Event {

    private final String eventType;
    private final byte[] data;
    private final List<String> tags;
    private final UUID uuid;

    private Event(Builder builder) {
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType must not be null");
        this.data = builder.data != null ? builder.data.clone() : new byte[0];
        this.tags = List.copyOf(builder.tags);
        this.uuid = builder.uuid;
    }

    /**
     * Creates a new event builder.
     *
     * @return A new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates an event without an idempotency identifier.
     *
     * @param eventType The event type
     * @param data The binary payload
     * @param tags The tags, in order
     * @return A new event
     */
    public static Event of(String eventType, byte[] data, String... tags) {
        return builder().eventType(eventType).data(data).tags(tags).build();
    }

    /**
     * Parses a UUID string, failing with a {@link ValidationException} when it
     * is not a canonical 128-bit UUID.
     *
     * @param value the string to parse
     * @return the parsed UUID
     */
    public static UUID parseUuid(String value) {
        Objects.requireNonNull(value, "uuid must not be null");
        try {
            UUID parsed = UUID.fromString(value);
            // UUID.fromString tolerates short groups such as "1-1-1-1-1"
            if (!parsed.toString().equalsIgnoreCase(value)) {
                throw new IllegalArgumentException("not in canonical form");
            }
            return parsed;
        } catch (IllegalArgumentException e) {
            throw new ValidationException(DcbErrorCodes.VALIDATION_INVALID_UUID,
                "Invalid UUID: " + value, e);
        }
    }

    public String getEventType() { return eventType; }

    /** Returns a copy of the binary payload */
    public byte[] getData() { return data.clone(); }

    /** Returns the payload decoded as UTF-8, replacing malformed input */
    public String getDataAsString() { return new String(data, StandardCharsets.UTF_8); }

    public List<String> getTags() { return tags; }

    public Optional<UUID> getUuid() { return Optional.ofNullable(uuid); }

    /**
     * Returns true if the given tag is attached to this event. Comparison is
     * exact, with no case folding.
     */
    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    /**
     * Builder for Event.
     */
    public static class Builder {
        private String eventType;
        private byte[] data;
        private final List<String> tags = new ArrayList<>();
        private UUID uuid;

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder data(byte[] data) {
            this.data = data;
            return this;
        }

        public Builder data(String data) {
            this.data = data != null ? data.getBytes(StandardCharsets.UTF_8) : null;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(Objects.requireNonNull(tag, "tag must not be null"));
            return this;
        }

        public Builder tags(String... tags) {
            for (String tag : tags) {
                tag(tag);
            }
            return this;
        }

        public Builder tags(Collection<String> tags) {
            tags.forEach(this::tag);
            return this;
        }

        public Builder uuid(UUID uuid) {
            this.uuid = uuid;
            return this;
        }

        /**
         * Sets the idempotency identifier from its string form.
         *
         * @throws ValidationException if the value is not a valid UUID
         */
        public Builder uuid(String uuid) {
            this.uuid = uuid != null ? parseUuid(uuid) : null;
            return this;
        }

        public Event build() {
            return new Event(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event that = (Event) o;
        return eventType.equals(that.eventType) &&
               Arrays.equals(data, that.data) &&
               tags.equals(that.tags) &&
               Objects.equals(uuid, that.uuid);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(eventType, tags, uuid);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Event{" +
                "type='" + eventType + '\'' +
                ", tags=" + tags +
                ", uuid=" + uuid +
                ", dataLength=" + data.length +
                '}';
    }
}
