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
import dev.mars.dcb.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Event.
 */
@Tag(TestCategories.CORE)
class EventTest {

    @Test
    void builder_keepsAllFields() {
        UUID uuid = UUID.randomUUID();

        Event event = Event.builder()
            .eventType("OrderCreated")
            .data("x")
            .tags("order", "order:1")
            .uuid(uuid)
            .build();

        assertEquals("OrderCreated", event.getEventType());
        assertArrayEquals("x".getBytes(StandardCharsets.UTF_8), event.getData());
        assertEquals(List.of("order", "order:1"), event.getTags());
        assertEquals(uuid, event.getUuid().orElseThrow());
    }

    @Test
    void uuidString_canonical_isAccepted() {
        Event event = Event.builder()
            .eventType("Created")
            .uuid("123e4567-e89b-12d3-a456-426614174000")
            .build();

        assertEquals(UUID.fromString("123e4567-e89b-12d3-a456-426614174000"), event.getUuid().orElseThrow());
    }

    @Test
    void uuidString_upperCase_isAccepted() {
        Event event = Event.builder()
            .eventType("Created")
            .uuid("123E4567-E89B-12D3-A456-426614174000")
            .build();

        assertTrue(event.getUuid().isPresent());
    }

    @Test
    void uuidString_invalid_failsAtConstruction() {
        Event.Builder builder = Event.builder().eventType("Created");

        ValidationException ex = assertThrows(ValidationException.class, () -> builder.uuid("not-a-uuid"));

        assertEquals(DcbErrorCodes.VALIDATION_INVALID_UUID, ex.getErrorCode());
        assertTrue(ex.getMessage().contains("not-a-uuid"));
    }

    @Test
    void uuidString_shortGroups_isRejected() {
        assertThrows(ValidationException.class, () -> Event.parseUuid("1-1-1-1-1"));
    }

    @Test
    void missingData_defaultsToEmptyPayload() {
        Event event = Event.builder().eventType("Created").build();

        assertEquals(0, event.getData().length);
        assertTrue(event.getTags().isEmpty());
        assertTrue(event.getUuid().isEmpty());
    }

    @Test
    void missingType_isRejected() {
        assertThrows(NullPointerException.class, () -> Event.builder().data("x").build());
    }

    @Test
    void data_isDefensivelyCopied() {
        byte[] payload = {1, 2, 3};
        Event event = Event.of("Binary", payload);

        payload[0] = 9;
        event.getData()[1] = 9;

        assertArrayEquals(new byte[] {1, 2, 3}, event.getData());
    }

    @Test
    void binaryData_isPreserved() {
        byte[] payload = {0, (byte) 0xFF, 0x7F, (byte) 0x80, 0};

        Event event = Event.of("Binary", payload, "bin");

        assertArrayEquals(payload, event.getData());
        assertNotNull(event.getDataAsString());
    }

    @Test
    void equals_comparesPayloadContent() {
        Event first = Event.of("Created", new byte[] {1, 2}, "a");
        Event second = Event.of("Created", new byte[] {1, 2}, "a");
        Event other = Event.of("Created", new byte[] {1, 3}, "a");

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, other);
    }

    @Test
    void equals_isSensitiveToTagOrder() {
        assertNotEquals(
            Event.of("Created", new byte[0], "a", "b"),
            Event.of("Created", new byte[0], "b", "a"));
    }

    @Test
    void toString_omitsPayload() {
        Event event = Event.builder().eventType("Created").data("secret").tags("order:1").build();

        String rendered = event.toString();

        assertTrue(rendered.contains("Created"));
        assertTrue(rendered.contains("order:1"));
        assertFalse(rendered.contains("secret"));
    }
}
