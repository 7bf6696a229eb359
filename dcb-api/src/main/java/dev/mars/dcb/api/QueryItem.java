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

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One conjunctive clause of a {@link Query}.
 *
 * <p>An event matches a query item if:
 * <ul>
 *   <li>the item has no types, or the event type is one of them, and</li>
 *   <li>every tag of the item is attached to the event.</li>
 * </ul>
 * An item with neither types nor tags matches every event.
 */
public final class QueryItem {

    private final List<String> types;
    private final List<String> tags;

    private QueryItem(List<String> types, List<String> tags) {
        this.types = List.copyOf(types);
        this.tags = List.copyOf(tags);
    }

    /**
     * Creates a query item.
     *
     * @param types event types to match, empty for any type
     * @param tags tags that must all be present, empty for no tag constraint
     * @return A new query item
     */
    public static QueryItem of(Collection<String> types, Collection<String> tags) {
        return new QueryItem(
            List.copyOf(Objects.requireNonNull(types, "types must not be null")),
            List.copyOf(Objects.requireNonNull(tags, "tags must not be null")));
    }

    /**
     * Creates a query item matching any of the given types, regardless of tags.
     */
    public static QueryItem types(String... types) {
        return new QueryItem(Arrays.asList(types), List.of());
    }

    /**
     * Creates a query item matching events carrying all of the given tags.
     */
    public static QueryItem tags(String... tags) {
        return new QueryItem(List.of(), Arrays.asList(tags));
    }

    /**
     * Returns a copy of this item restricted to the given tags as well.
     */
    public QueryItem withTags(String... tags) {
        return new QueryItem(types, Arrays.asList(tags));
    }

    public List<String> getTypes() { return types; }

    public List<String> getTags() { return tags; }

    /**
     * Tests whether the event satisfies this item.
     */
    public boolean matches(Event event) {
        if (!types.isEmpty() && !types.contains(event.getEventType())) {
            return false;
        }
        for (String tag : tags) {
            if (!event.hasTag(tag)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryItem that = (QueryItem) o;
        return types.equals(that.types) && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(types, tags);
    }

    @Override
    public String toString() {
        return "QueryItem{types=" + types + ", tags=" + tags + '}';
    }
}
