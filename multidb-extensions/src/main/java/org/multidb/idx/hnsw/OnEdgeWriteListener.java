/*
 * OnEdgeWriteListener.java
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

import org.multidb.annotation.API;

import javax.annotation.Nonnull;
import java.util.Set;

/**
 * Interface for call backs whenever an {@link UndirectedGraph} changes its adjacency. Callbacks are invoked
 * synchronously from within the mutating call and must not modify the graph.
 */
@API(API.Status.EXPERIMENTAL)
public interface OnEdgeWriteListener {
    OnEdgeWriteListener NOOP = new OnEdgeWriteListener() {
    };

    /**
     * Callback method invoked after an entry for {@code node} has been created. This also happens when a neighbor
     * that was not registered yet gets its entry created in order to store a reverse edge.
     * @param node the node that was created
     */
    @SuppressWarnings("unused")
    default void onNodeCreated(@Nonnull final ElementId node) {
        // nothing
    }

    /**
     * Callback method invoked after {@code node} has been removed and detached from all its former neighbors.
     * @param node the node that was removed
     * @param formerNeighbors the neighbors {@code node} had at the time of its removal
     */
    @SuppressWarnings("unused")
    default void onNodeRemoved(@Nonnull final ElementId node, @Nonnull final Set<ElementId> formerNeighbors) {
        // nothing
    }

    /**
     * Callback method invoked after {@code node} has been added to the neighbors of {@code neighbor} in order to
     * mirror an edge {@code node -> neighbor}.
     * @param neighbor the node whose neighbors were modified
     * @param node the node that was added
     */
    @SuppressWarnings("unused")
    default void onReverseEdgeAdded(@Nonnull final ElementId neighbor, @Nonnull final ElementId node) {
        // nothing
    }

    /**
     * Callback method invoked after {@code node} has been removed from the neighbors of {@code neighbor} in order to
     * mirror the removal of an edge {@code node -> neighbor}.
     * @param neighbor the node whose neighbors were modified
     * @param node the node that was removed
     */
    @SuppressWarnings("unused")
    default void onReverseEdgeRemoved(@Nonnull final ElementId neighbor, @Nonnull final ElementId node) {
        // nothing
    }
}
