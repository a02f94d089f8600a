/*
 * UndirectedGraph.java
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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.multidb.annotation.API;
import org.multidb.util.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An {@link AdjacencyGraph} kept in a single map from node to its set of neighbors. Nodes refer to each other only
 * through their {@link ElementId}s.
 * <p>
 * This class does no locking of its own. Callers must not mutate it concurrently with any other access; wrap it in
 * a {@link LockedUndirectedGraph} if it needs to be shared between threads.
 */
@API(API.Status.EXPERIMENTAL)
public class UndirectedGraph implements AdjacencyGraph {
    @Nonnull
    private static final Logger logger = LoggerFactory.getLogger(UndirectedGraph.class);

    private final int mMax;
    @Nonnull
    private final OnEdgeWriteListener onEdgeWriteListener;
    @Nonnull
    private final Map<ElementId, Set<ElementId>> nodes;

    public UndirectedGraph(final int mMax) {
        this(mMax, OnEdgeWriteListener.NOOP);
    }

    public UndirectedGraph(final int mMax, @Nonnull final OnEdgeWriteListener onEdgeWriteListener) {
        Preconditions.checkArgument(mMax >= 0, "mMax must not be negative");
        this.mMax = mMax;
        this.onEdgeWriteListener = Objects.requireNonNull(onEdgeWriteListener);
        this.nodes = Maps.newHashMap();
    }

    /**
     * Creates a graph for a layer of an HNSW index, sized for the maximum degree of that layer.
     * @param config the index configuration
     * @param layer the layer
     * @return a new empty graph
     */
    @Nonnull
    public static UndirectedGraph forLayer(@Nonnull final Config config, final int layer) {
        return forLayer(config, layer, OnEdgeWriteListener.NOOP);
    }

    @Nonnull
    public static UndirectedGraph forLayer(@Nonnull final Config config, final int layer,
                                           @Nonnull final OnEdgeWriteListener onEdgeWriteListener) {
        return new UndirectedGraph(config.getMMaxForLayer(layer), onEdgeWriteListener);
    }

    @Override
    public int getMMax() {
        return mMax;
    }

    /**
     * {@inheritDoc}
     * <p>
     * The returned set is a view that reflects later changes to this graph.
     */
    @Nullable
    @Override
    public Set<ElementId> getEdges(@Nonnull final ElementId node) {
        Objects.requireNonNull(node);
        final Set<ElementId> edges = nodes.get(node);
        return edges == null ? null : Collections.unmodifiableSet(edges);
    }

    @Override
    public boolean addEmptyNode(@Nonnull final ElementId node) {
        Objects.requireNonNull(node);
        if (nodes.containsKey(node)) {
            return false;
        }
        nodes.put(node, newNeighborSet());
        onEdgeWriteListener.onNodeCreated(node);
        return true;
    }

    @Nullable
    @Override
    public List<ElementId> addNode(@Nonnull final ElementId node, @Nonnull final Set<ElementId> edges) {
        checkEdges(node, edges);
        if (nodes.containsKey(node)) {
            if (logger.isDebugEnabled()) {
                logger.debug("node already exists; {}={}", LogMessageKeys.NODE, node);
            }
            return null;
        }

        final Set<ElementId> neighbors = newNeighborSet(edges);
        nodes.put(node, neighbors);
        onEdgeWriteListener.onNodeCreated(node);

        final List<ElementId> linked = ImmutableList.copyOf(neighbors);
        for (final ElementId neighbor : linked) {
            addReverseEdge(neighbor, node);
        }
        return linked;
    }

    @Override
    public void setNode(@Nonnull final ElementId node, @Nonnull final Set<ElementId> edges) {
        checkEdges(node, edges);
        final Set<ElementId> newNeighbors = newNeighborSet(edges);
        final Set<ElementId> oldNeighbors = nodes.put(node, newNeighbors);

        final List<ElementId> toAdd;
        final List<ElementId> toRemove;
        if (oldNeighbors == null) {
            onEdgeWriteListener.onNodeCreated(node);
            toAdd = ImmutableList.copyOf(newNeighbors);
            toRemove = ImmutableList.of();
        } else {
            toAdd = ImmutableList.copyOf(Sets.difference(newNeighbors, oldNeighbors));
            toRemove = ImmutableList.copyOf(Sets.difference(oldNeighbors, newNeighbors));
        }

        for (final ElementId neighbor : toAdd) {
            addReverseEdge(neighbor, node);
        }
        for (final ElementId neighbor : toRemove) {
            removeReverseEdge(neighbor, node);
        }

        if (logger.isTraceEnabled()) {
            logger.trace("set neighbors of node={}; added={}, removed={}", node,
                    ElementId.ids(toAdd), ElementId.ids(toRemove));
        }
    }

    @Nullable
    @Override
    public Set<ElementId> removeNode(@Nonnull final ElementId node) {
        Objects.requireNonNull(node);
        final Set<ElementId> formerNeighbors = nodes.remove(node);
        if (formerNeighbors == null) {
            return null;
        }

        for (final ElementId neighbor : formerNeighbors) {
            removeReverseEdge(neighbor, node);
        }

        final Set<ElementId> result = ImmutableSet.copyOf(formerNeighbors);
        onEdgeWriteListener.onNodeRemoved(node, result);
        if (logger.isTraceEnabled()) {
            logger.trace("removed node={}; formerNeighbors={}", node, ElementId.ids(result));
        }
        return result;
    }

    @Override
    public void addEdge(@Nonnull final ElementId node1, @Nonnull final ElementId node2) {
        Objects.requireNonNull(node1);
        Objects.requireNonNull(node2);
        if (!node1.equals(node2)) {
            addReverseEdge(node1, node2);
            addReverseEdge(node2, node1);
        }
    }

    @Override
    public boolean contains(@Nonnull final ElementId node) {
        Objects.requireNonNull(node);
        return nodes.containsKey(node);
    }

    /**
     * {@inheritDoc}
     * <p>
     * The returned set is a view that reflects later changes to this graph.
     */
    @Nonnull
    @Override
    public Set<ElementId> nodes() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    @Override
    public int size() {
        return nodes.size();
    }

    @Override
    public void checkSymmetry() {
        for (final Map.Entry<ElementId, Set<ElementId>> entry : nodes.entrySet()) {
            final ElementId node = entry.getKey();
            for (final ElementId neighbor : entry.getValue()) {
                final Set<ElementId> reverseNeighbors = nodes.get(neighbor);
                if (reverseNeighbors == null) {
                    throw inconsistency("neighbor is not part of the graph", node, neighbor);
                }
                if (!reverseNeighbors.contains(node)) {
                    throw inconsistency("edge is not mirrored by a reverse edge", node, neighbor);
                }
            }
        }
    }

    /**
     * Direct access to the underlying map, used by tests to set up states the public operations never produce.
     */
    @VisibleForTesting
    @Nonnull
    Map<ElementId, Set<ElementId>> getAdjacency() {
        return nodes;
    }

    @Override
    public String toString() {
        return "UndirectedGraph[mMax=" + mMax + ", nodes=" + nodes + "]";
    }

    /**
     * Adds {@code node} to the neighbors of {@code neighbor}, registering {@code neighbor} if needed.
     */
    private void addReverseEdge(@Nonnull final ElementId neighbor, @Nonnull final ElementId node) {
        Set<ElementId> neighborEdges = nodes.get(neighbor);
        if (neighborEdges == null) {
            neighborEdges = newNeighborSet();
            nodes.put(neighbor, neighborEdges);
            onEdgeWriteListener.onNodeCreated(neighbor);
        }
        if (neighborEdges.add(node)) {
            onEdgeWriteListener.onReverseEdgeAdded(neighbor, node);
        }
    }

    /**
     * Removes {@code node} from the neighbors of {@code neighbor}. Does nothing if {@code neighbor} is not registered.
     */
    private void removeReverseEdge(@Nonnull final ElementId neighbor, @Nonnull final ElementId node) {
        final Set<ElementId> neighborEdges = nodes.get(neighbor);
        if (neighborEdges != null && neighborEdges.remove(node)) {
            onEdgeWriteListener.onReverseEdgeRemoved(neighbor, node);
        }
    }

    @Nonnull
    private Set<ElementId> newNeighborSet() {
        return Sets.newHashSetWithExpectedSize(mMax);
    }

    @Nonnull
    private Set<ElementId> newNeighborSet(@Nonnull final Set<ElementId> edges) {
        final Set<ElementId> neighbors = Sets.newHashSetWithExpectedSize(Math.max(mMax, edges.size()));
        neighbors.addAll(edges);
        return neighbors;
    }

    @Nonnull
    private GraphInconsistencyException inconsistency(@Nonnull final String msg, @Nonnull final ElementId node,
                                                      @Nonnull final ElementId neighbor) {
        final GraphInconsistencyException exception = new GraphInconsistencyException(msg, node, neighbor);
        exception.addLogInfo(LogMessageKeys.NODE_COUNT, nodes.size(), LogMessageKeys.M_MAX, mMax);
        return exception;
    }

    private static void checkEdges(@Nonnull final ElementId node, @Nonnull final Set<ElementId> edges) {
        Objects.requireNonNull(node);
        Objects.requireNonNull(edges);
        for (final ElementId edge : edges) {
            Preconditions.checkNotNull(edge, "edges must not contain null");
        }
    }
}
