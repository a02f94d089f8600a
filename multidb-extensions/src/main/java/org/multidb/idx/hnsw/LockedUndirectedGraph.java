/*
 * LockedUndirectedGraph.java
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

import com.google.common.collect.ImmutableSet;
import org.multidb.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An {@link AdjacencyGraph} that can be shared between threads. All access to the wrapped {@link UndirectedGraph}
 * goes through one read/write lock covering the whole graph, as a single mutation touches the neighbors of several
 * nodes at once.
 * <p>
 * Read methods return immutable snapshots instead of views since a view would be read outside of the lock.
 */
@API(API.Status.EXPERIMENTAL)
public class LockedUndirectedGraph implements AdjacencyGraph {
    @Nonnull
    private final UndirectedGraph graph;
    @Nonnull
    private final ReentrantReadWriteLock lock;

    public LockedUndirectedGraph(@Nonnull final UndirectedGraph graph) {
        this.graph = graph;
        this.lock = new ReentrantReadWriteLock();
    }

    @Nonnull
    public static LockedUndirectedGraph forLayer(@Nonnull final Config config, final int layer) {
        return new LockedUndirectedGraph(UndirectedGraph.forLayer(config, layer));
    }

    @Override
    public int getMMax() {
        return graph.getMMax();
    }

    @Nullable
    @Override
    public Set<ElementId> getEdges(@Nonnull final ElementId node) {
        return read(() -> {
            final Set<ElementId> edges = graph.getEdges(node);
            return edges == null ? null : ImmutableSet.copyOf(edges);
        });
    }

    @Override
    public boolean addEmptyNode(@Nonnull final ElementId node) {
        return write(() -> graph.addEmptyNode(node));
    }

    @Nullable
    @Override
    public List<ElementId> addNode(@Nonnull final ElementId node, @Nonnull final Set<ElementId> edges) {
        return write(() -> graph.addNode(node, edges));
    }

    @Override
    public void setNode(@Nonnull final ElementId node, @Nonnull final Set<ElementId> edges) {
        write(() -> {
            graph.setNode(node, edges);
            return null;
        });
    }

    @Nullable
    @Override
    public Set<ElementId> removeNode(@Nonnull final ElementId node) {
        return write(() -> graph.removeNode(node));
    }

    @Override
    public void addEdge(@Nonnull final ElementId node1, @Nonnull final ElementId node2) {
        write(() -> {
            graph.addEdge(node1, node2);
            return null;
        });
    }

    @Override
    public boolean contains(@Nonnull final ElementId node) {
        return read(() -> graph.contains(node));
    }

    @Nonnull
    @Override
    public Set<ElementId> nodes() {
        return read(() -> ImmutableSet.copyOf(graph.nodes()));
    }

    @Override
    public int size() {
        return read(graph::size);
    }

    @Override
    public void checkSymmetry() {
        read(() -> {
            graph.checkSymmetry();
            return null;
        });
    }

    /**
     * Runs several operations on the wrapped graph as one unit, e.g. removing a node and reconnecting its former
     * neighbors. No other thread can access the graph while {@code action} runs. The graph passed to {@code action}
     * must not escape it.
     * @param action the operations to run
     * @param <T> the type of the result of {@code action}
     * @return the result of {@code action}
     */
    public <T> T withWriteLock(@Nonnull final Function<? super UndirectedGraph, T> action) {
        return write(() -> action.apply(graph));
    }

    /**
     * Runs several reads on the wrapped graph against one consistent state. The graph passed to {@code action} must
     * not be modified and must not escape it.
     * @param action the reads to run
     * @param <T> the type of the result of {@code action}
     * @return the result of {@code action}
     */
    public <T> T withReadLock(@Nonnull final Function<? super UndirectedGraph, T> action) {
        return read(() -> action.apply(graph));
    }

    @Override
    public String toString() {
        return read(() -> "Locked" + graph);
    }

    private <T> T read(@Nonnull final Supplier<T> supplier) {
        return locked(lock.readLock(), supplier);
    }

    private <T> T write(@Nonnull final Supplier<T> supplier) {
        return locked(lock.writeLock(), supplier);
    }

    private static <T> T locked(@Nonnull final Lock lock, @Nonnull final Supplier<T> supplier) {
        lock.lock();
        try {
            return supplier.get();
        } finally {
            lock.unlock();
        }
    }
}
