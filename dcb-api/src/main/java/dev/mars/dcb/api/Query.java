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
import java.util.List;
import java.util.Objects;

/**
 * A query over events, expressed as a disjunction of {@link QueryItem}s.
 *
 * <p>An event matches the query if it matches at least one item. A query
 * without items matches every event.
 *
 * <p>Example usage:
 * <pre>{@code
 * Query boundary = Query.of(
 *     QueryItem.types("UserRegistered").withTags("email:alice@example.com"),
 *     QueryItem.types("UserEmailChanged").withTags("email:alice@example.com"));
 * }</pre>
 */
public final class Query {

    private static final Query ALL = new Query(List.of());

    private final List<QueryItem> items;

    private Query(List<QueryItem> items) {
        this.items = List.copyOf(items);
    }

    /**
     * Returns the query matching every event.
     */
    public static Query all() {
        return ALL;
    }

    /**
     * Creates a query from the given items.
     */
    public static Query of(QueryItem... items) {
        return new Query(Arrays.asList(items));
    }

    /**
     * Creates a query from the given items.
     */
    public static Query of(List<QueryItem> items) {
        return new Query(Objects.requireNonNull(items, "items must not be null"));
    }

    public List<QueryItem> getItems() { return items; }

    /** Returns true if this query has no items and therefore matches everything */
    public boolean isAll() {
        return items.isEmpty();
    }

    /**
     * Tests whether the event matches this query.
     */
    public boolean matches(Event event) {
        if (items.isEmpty()) {
            return true;
        }
        for (QueryItem item : items) {
            if (item.matches(event)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return items.equals(((Query) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "Query{items=" + items + '}';
    }
}
