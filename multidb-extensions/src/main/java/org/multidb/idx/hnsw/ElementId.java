/*
 * ElementId.java
 *
 * This source file is part of the MultiDB open source project
 *
 * Copyright 2024-2026 the MultiDB project authors
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

package org.multidb.idx.hnsw;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import org.multidb.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Identifier of an element (a vector and the node representing it) in a vector index. Ids are issued by the index,
 * the graph structures in this package only store and compare them.
 */
@API(API.Status.EXPERIMENTAL)
public final class ElementId implements Comparable<ElementId> {
    private final long id;

    private ElementId(final long id) {
        this.id = id;
    }

    /**
     * Returns the {@code ElementId} for a given numeric id.
     * @param id the numeric id
     * @return a new {@code ElementId} that is equal to every other {@code ElementId} created from {@code id}
     */
    @Nonnull
    public static ElementId of(final long id) {
        return new ElementId(id);
    }

    public long getId() {
        return id;
    }

    @Override
    public int compareTo(@Nonnull final ElementId other) {
        return Long.compare(id, other.id);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ElementId)) {
            return false;
        }
        return id == ((ElementId)o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "EID[id=" + id + "]";
    }

    /**
     * Helper to extract the numeric ids of a number of element ids, e.g. for log messages.
     * @param elementIds the element ids
     * @return an immutable list of the numeric ids, rendered as {@code [1, 2, 3]} by {@code toString()}
     */
    @Nonnull
    public static List<Long> ids(@Nonnull final Iterable<ElementId> elementIds) {
        return Streams.stream(elementIds)
                .map(elementId -> Objects.requireNonNull(elementId).getId())
                .collect(ImmutableList.toImmutableList());
    }
}
