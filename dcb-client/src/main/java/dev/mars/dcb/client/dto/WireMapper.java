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

package dev.mars.dcb.client.dto;

import dev.mars.dcb.api.AppendCondition;
import dev.mars.dcb.api.Event;
import dev.mars.dcb.api.Query;
import dev.mars.dcb.api.QueryItem;
import dev.mars.dcb.api.SequencedEvent;
import dev.mars.dcb.api.error.DcbErrorCodes;
import dev.mars.dcb.api.exception.CorruptionException;
import dev.mars.dcb.api.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the domain model and its wire representation.
 *
 * <p>Payloads received from the store are checked structurally; anything that
 * cannot describe a valid event is reported as a {@link CorruptionException}.
 */
public final class WireMapper {

    private WireMapper() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // Domain to wire
    // ========================================================================

    public static EventDto toDto(Event event) {
        return new EventDto(
            event.getEventType(),
            event.getData(),
            event.getTags(),
            event.getUuid().map(Object::toString).orElse(null));
    }

    public static List<EventDto> toDtos(List<Event> events) {
        List<EventDto> dtos = new ArrayList<>(events.size());
        for (Event event : events) {
            dtos.add(toDto(event));
        }
        return dtos;
    }

    public static QueryDto toDto(Query query) {
        List<QueryItemDto> items = new ArrayList<>(query.getItems().size());
        for (QueryItem item : query.getItems()) {
            items.add(new QueryItemDto(item.getTypes(), item.getTags()));
        }
        return new QueryDto(items);
    }

    public static AppendConditionDto toDto(AppendCondition condition) {
        if (condition == null) {
            return null;
        }
        return new AppendConditionDto(toDto(condition.getFailIfEventsMatch()), condition.getAfter().orElse(null));
    }

    // ========================================================================
    // Wire to domain
    // ========================================================================

    /**
     * Decodes an event received from the store.
     *
     * @throws CorruptionException if the envelope is incomplete or the UUID is malformed
     */
    public static Event toEvent(EventDto dto) {
        if (dto == null) {
            throw corrupt("event envelope is missing");
        }
        if (dto.eventType() == null) {
            throw corrupt("event envelope has no eventType");
        }
        if (dto.data() == null) {
            throw corrupt("event envelope has no data");
        }
        Event.Builder builder = Event.builder()
            .eventType(dto.eventType())
            .data(dto.data());
        if (dto.tags() != null) {
            for (String tag : dto.tags()) {
                if (tag == null) {
                    throw corrupt("event envelope contains a null tag");
                }
                builder.tag(tag);
            }
        }
        if (dto.uuid() != null) {
            try {
                builder.uuid(dto.uuid());
            } catch (ValidationException e) {
                throw new CorruptionException(DcbErrorCodes.CORRUPTION_INVALID_EVENT,
                    "Store returned an invalid event UUID: " + dto.uuid());
            }
        }
        return builder.build();
    }

    /**
     * Decodes an event with its position received from the store.
     *
     * @throws CorruptionException if the position is missing or not positive
     */
    public static SequencedEvent toSequencedEvent(SequencedEventDto dto) {
        if (dto == null) {
            throw corrupt("sequenced event is missing");
        }
        if (dto.position() == null || dto.position() < 1) {
            throw corrupt("sequenced event has invalid position " + dto.position());
        }
        return new SequencedEvent(toEvent(dto.event()), dto.position());
    }

    public static List<SequencedEvent> toSequencedEvents(List<SequencedEventDto> dtos) {
        if (dtos == null) {
            throw corrupt("read batch has no events array");
        }
        List<SequencedEvent> events = new ArrayList<>(dtos.size());
        for (SequencedEventDto dto : dtos) {
            events.add(toSequencedEvent(dto));
        }
        return events;
    }

    private static CorruptionException corrupt(String message) {
        return new CorruptionException(DcbErrorCodes.CORRUPTION_INVALID_EVENT, "Malformed store payload: " + message);
    }
}
