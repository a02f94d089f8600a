/*
 * AdjacencyGraph.java
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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.multidb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Set;

/**
 * The adjacency of one layer of an HNSW graph. Edges are undirected: every operation that changes the neighbors of a
 * node also updates the neighbors of the nodes on the other end, so that for every node {@code a} with neighbor
 * {@code b}, {@code b} is registered and has {@code a} as a neighbor.
 * <p>
 * The index decides which edges to create, keep or drop. Implementations neither compute distances nor enforce a
 * maximum degree; {@link #getMMax()} is only used to size neighbor sets.
 */
@API(API.Status.EXPERIMENTAL)
public interface AdjacencyGraph {
    /**
     * The maximum degree this graph was configured with. Used as a capacity hint only.
     * @return the configured maximum degree
     */
    int getMMax();

    /**
     * Returns the neighbors of a node.
     * @param node the node
     * @return a read-only set of the neighbors of {@code node} (empty if the node is isolated), or {@code null} if
     *         {@code node} is not part of this graph
     */
    @Nullable
    Set<ElementId> getEdges(@Nonnull ElementId node);

    /**
     * Registers a node without any neighbors unless it is already registered. Does not touch any other node.
     * @param node the node
     * @return {@code true} if the node was created, {@code false} if it already existed in which case nothing was
     *         changed
     */
    @CanIgnoreReturnValue
    boolean addEmptyNode(@Nonnull ElementId node);

    /**
     * Inserts a new node together with its neighbors and adds the reverse edge to each of the neighbors, creating
     * the neighbor first if it is not registered. The call either installs all edges or, if {@code node} is
     * already registered, changes nothing.
     * @param node the node to insert
     * @param edges the neighbors of {@code node}
     * @return the neighbors that were linked to {@code node} in no particular order, or {@code null} if
     *         {@code node} already existed
     */
    @Nullable
    @CanIgnoreReturnValue
    List<ElementId> addNode(@Nonnull ElementId node, @Nonnull Set<ElementId> edges);

    /**
     * Replaces the neighbors of a node, or inserts the node if it is not registered yet. Reverse edges are only
     * reconciled for the neighbors that were added or removed by this call. Neighbors that were removed but are no
     * longer registered themselves are ignored.
     * <p>
     * {@code edges} is stored as given, so a set that contains {@code node} itself results in a self-loop.
     * @param node the node
     * @param edges the new neighbors of {@code node}
     */
    void setNode(@Nonnull ElementId node, @Nonnull Set<ElementId> edges);

    /**
     * Removes a node and removes it from the neighbors of each of its former neighbors. Former neighbors stay
     * registered even if they end up without any neighbors.
     * @param node the node to remove
     * @return the neighbors {@code node} had before its removal, or {@code null} if {@code node} was not registered
     */
    @Nullable
    @CanIgnoreReturnValue
    Set<ElementId> removeNode(@Nonnull ElementId node);

    /**
     * Adds a single undirected edge, registering either end if needed. An edge from a node to itself is ignored.
     * @param node1 one end of the edge
     * @param node2 the other end of the edge
     */
    @API(API.Status.INTERNAL)
    void addEdge(@Nonnull ElementId node1, @Nonnull ElementId node2);

    /**
     * Returns whether a node is registered.
     * @param node the node
     * @return {@code true} iff {@code node} is part of this graph
     */
    boolean contains(@Nonnull ElementId node);

    /**
     * Returns the registered nodes.
     * @return a read-only set of all nodes of this graph
     */
    @Nonnull
    Set<ElementId> nodes();

    /**
     * Returns the number of registered nodes.
     * @return the number of nodes
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Verifies that every edge of this graph is mirrored by its reverse edge. This walks the whole graph and is
     * meant for tests and debugging.
     * @throws GraphInconsistencyException for the first edge found that has no reverse edge
     */
    void checkSymmetry();
}
