/*
 * UndirectedGraphTest.java
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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.multidb.test.RandomSeedSource;
import org.multidb.util.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.multidb.idx.hnsw.GraphTestHelpers.assertAdjacency;
import static org.multidb.idx.hnsw.GraphTestHelpers.id;
import static org.multidb.idx.hnsw.GraphTestHelpers.ids;
import static org.multidb.idx.hnsw.GraphTestHelpers.sorted;

/**
 * Tests for {@link UndirectedGraph}.
 */
class UndirectedGraphTest {
    private static final Logger logger = LoggerFactory.getLogger(UndirectedGraphTest.class);

    @Test
    void testBasicScenario() {
        final UndirectedGraph graph = new UndirectedGraph(10);
        Assertions.assertThat(graph.getMMax()).isEqualTo(10);
        Assertions.assertThat(graph.isEmpty()).isTrue();

        Assertions.assertThat(graph.addEmptyNode(id(0))).isTrue();
        assertAdjacency(graph, ImmutableMap.of(0L, ImmutableSet.of()));

        Assertions.assertThat(graph.addNode(id(1), ids(0))).containsExactly(id(0));
        assertAdjacency(graph, ImmutableMap.of(0L, ImmutableSet.of(1L), 1L, ImmutableSet.of(0L)));

        Assertions.assertThat(graph.addNode(id(1), ids(2))).isNull();
        assertAdjacency(graph, ImmutableMap.of(0L, ImmutableSet.of(1L), 1L, ImmutableSet.of(0L)));

        Assertions.assertThat(sorted(graph.addNode(id(2), ids(0, 1)))).containsExactly(id(0), id(1));
        assertAdjacency(graph, ImmutableMap.of(
                0L, ImmutableSet.of(1L, 2L),
                1L, ImmutableSet.of(0L, 2L),
                2L, ImmutableSet.of(0L, 1L)));

        graph.setNode(id(2), ids(1));
        assertAdjacency(graph, ImmutableMap.of(
                0L, ImmutableSet.of(1L),
                1L, ImmutableSet.of(0L, 2L),
                2L, ImmutableSet.of(1L)));

        Assertions.assertThat(graph.removeNode(id(2))).containsExactly(id(1));
        assertAdjacency(graph, ImmutableMap.of(0L, ImmutableSet.of(1L), 1L, ImmutableSet.of(0L)));
    }

    @Test
    void testAddSetAddEdgeRemoveAndReset() {
        final UndirectedGraph graph = new UndirectedGraph(10);

        Assertions.assertThat(graph.addEmptyNode(id(0))).isTrue();
        Assertions.assertThat(graph.addEmptyNode(id(0))).isFalse();
        assertAdjacency(graph, ImmutableMap.of(0L, ImmutableSet.of()));

        Assertions.assertThat(graph.addNode(id(1), ids(0))).containsExactly(id(0));
        Assertions.assertThat(graph.addNode(id(1), ids(2))).isNull();
        Assertions.assertThat(sorted(graph.addNode(id(2), ids(0, 1)))).containsExactly(id(0), id(1));
        Assertions.assertThat(sorted(graph.addNode(id(3), ids(1, 2)))).containsExactly(id(1), id(2));
        assertAdjacency(graph, ImmutableMap.of(
                0L, ImmutableSet.of(1L, 2L),
                1L, ImmutableSet.of(0L, 2L, 3L),
                2L, ImmutableSet.of(0L, 1L, 3L),
                3L, ImmutableSet.of(1L, 2L)));

        // change the neighbors of a node
        graph.setNode(id(3), ids(0));
        assertAdjacency(graph, ImmutableMap.of(
                0L, ImmutableSet.of(1L, 2L, 3L),
                1L, ImmutableSet.of(0L, 2L),
                2L, ImmutableSet.of(0L, 1L),
                3L, ImmutableSet.of(0L)));

        graph.addEdge(id(2), id(3));
        assertAdjacency(graph, ImmutableMap.of(
                0L, ImmutableSet.of(1L, 2L, 3L),
                1L, ImmutableSet.of(0L, 2L),
                2L, ImmutableSet.of(0L, 1L, 3L),
                3L, ImmutableSet.of(0L, 2L)));

        Assertions.assertThat(sorted(graph.removeNode(id(2)))).containsExactly(id(0), id(1), id(3));
        assertAdjacency(graph, ImmutableMap.of(
                0L, ImmutableSet.of(1L, 3L),
                1L, ImmutableSet.of(0L),
                3L, ImmutableSet.of(0L)));

        Assertions.assertThat(graph.removeNode(id(2))).isNull();

        // set a node that does not exist
        graph.setNode(id(2), ids(1));
        assertAdjacency(graph, ImmutableMap.of(
                0L, ImmutableSet.of(1L, 3L),
                1L, ImmutableSet.of(0L, 2L),
                2L, ImmutableSet.of(1L),
                3L, ImmutableSet.of(0L)));
    }

    @Test
    void testAddEmptyNodeIsIdempotent() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        Assertions.assertThat(graph.addNode(id(1), ids(2))).isNotNull();
        final Map<ElementId, Set<ElementId>> before = snapshot(graph);

        Assertions.assertThat(graph.addEmptyNode(id(1))).isFalse();
        Assertions.assertThat(graph.addEmptyNode(id(5))).isTrue();
        final Map<ElementId, Set<ElementId>> afterFirst = snapshot(graph);
        Assertions.assertThat(graph.addEmptyNode(id(5))).isFalse();

        Assertions.assertThat(snapshot(graph)).isEqualTo(afterFirst);
        Assertions.assertThat(afterFirst).containsAllEntriesOf(before).containsEntry(id(5), ImmutableSet.of());
    }

    @Test
    void testAddNodeCreatesMissingNeighbors() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        Assertions.assertThat(sorted(graph.addNode(id(7), ids(8, 9)))).containsExactly(id(8), id(9));
        assertAdjacency(graph, ImmutableMap.of(
                7L, ImmutableSet.of(8L, 9L),
                8L, ImmutableSet.of(7L),
                9L, ImmutableSet.of(7L)));
        graph.checkSymmetry();
    }

    @Test
    void testAddNodeRejectionDoesNotMutate() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        graph.addNode(id(1), ids(2, 3));
        final Map<ElementId, Set<ElementId>> before = snapshot(graph);

        Assertions.assertThat(graph.addNode(id(1), ids(4, 5))).isNull();
        Assertions.assertThat(graph.addNode(id(2), ImmutableSet.of())).isNull();

        Assertions.assertThat(snapshot(graph)).isEqualTo(before);
        Assertions.assertThat(graph.contains(id(4))).isFalse();
    }

    @Test
    void testAddNodeCopiesEdges() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        final Set<ElementId> edges = new HashSet<>(ids(1, 2));
        graph.addNode(id(0), edges);
        edges.add(id(3));

        Assertions.assertThat(graph.getEdges(id(0))).containsExactlyInAnyOrder(id(1), id(2));
        Assertions.assertThat(graph.contains(id(3))).isFalse();
    }

    @Test
    void testSetNodeIsDeltaMinimal() {
        final CountingOnEdgeWriteListener listener = new CountingOnEdgeWriteListener();
        final UndirectedGraph graph = new UndirectedGraph(8, listener);
        graph.addNode(id(0), ids(1, 2, 3));
        listener.reset();

        graph.setNode(id(0), ids(2, 3, 4));
        Assertions.assertThat(listener.getReverseEdgesAdded()).containsExactly(edge(4, 0));
        Assertions.assertThat(listener.getReverseEdgesRemoved()).containsExactly(edge(1, 0));
        Assertions.assertThat(listener.getNodesCreated()).containsExactly(id(4));
        listener.reset();

        graph.setNode(id(0), ids(2, 3, 4));
        Assertions.assertThat(listener.getReverseEdgesAdded()).isEmpty();
        Assertions.assertThat(listener.getReverseEdgesRemoved()).isEmpty();
        Assertions.assertThat(listener.getNodesCreated()).isEmpty();

        assertAdjacency(graph, ImmutableMap.of(
                0L, ImmutableSet.of(2L, 3L, 4L),
                1L, ImmutableSet.of(),
                2L, ImmutableSet.of(0L),
                3L, ImmutableSet.of(0L),
                4L, ImmutableSet.of(0L)));
    }

    @Test
    void testSetNodeIgnoresUnregisteredFormerNeighbors() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        graph.addNode(id(0), ids(1, 2));
        // put the graph into a state in which node 0 still points to a node that is gone
        graph.getAdjacency().remove(id(2));

        graph.setNode(id(0), ids(1));
        Assertions.assertThat(graph.contains(id(2))).isFalse();
        assertAdjacency(graph, ImmutableMap.of(0L, ImmutableSet.of(1L), 1L, ImmutableSet.of(0L)));
    }

    @Test
    void testSetNodeKeepsSelfLoop() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        graph.setNode(id(0), ids(0, 1));
        assertAdjacency(graph, ImmutableMap.of(0L, ImmutableSet.of(0L, 1L), 1L, ImmutableSet.of(0L)));
        graph.checkSymmetry();

        graph.setNode(id(0), ids(1));
        assertAdjacency(graph, ImmutableMap.of(0L, ImmutableSet.of(1L), 1L, ImmutableSet.of(0L)));

        graph.setNode(id(1), ids(0, 1));
        Assertions.assertThat(sorted(graph.removeNode(id(1)))).containsExactly(id(0), id(1));
        assertAdjacency(graph, ImmutableMap.of(0L, ImmutableSet.of()));
    }

    @Test
    void testAddEdgeIgnoresSelfLoop() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        graph.addEdge(id(3), id(3));
        Assertions.assertThat(graph.isEmpty()).isTrue();

        graph.addEmptyNode(id(3));
        graph.addEdge(id(3), id(3));
        assertAdjacency(graph, ImmutableMap.of(3L, ImmutableSet.of()));

        graph.addEdge(id(3), id(4));
        graph.addEdge(id(4), id(3));
        assertAdjacency(graph, ImmutableMap.of(3L, ImmutableSet.of(4L), 4L, ImmutableSet.of(3L)));
    }

    @Test
    void testRemoveNodeOrphansNeighbors() {
        final CountingOnEdgeWriteListener listener = new CountingOnEdgeWriteListener();
        final UndirectedGraph graph = new UndirectedGraph(4, listener);
        graph.addNode(id(0), ids(1, 2));
        graph.addEdge(id(1), id(2));

        final Set<ElementId> formerNeighbors = graph.removeNode(id(0));
        Assertions.assertThat(formerNeighbors).containsExactlyInAnyOrder(id(1), id(2));
        Assertions.assertThat(listener.getNodesRemoved()).containsExactly(id(0));
        Assertions.assertThat(graph.contains(id(0))).isFalse();
        for (final ElementId node : graph.nodes()) {
            Assertions.assertThat(graph.getEdges(node)).doesNotContain(id(0));
        }
        Assertions.assertThat(graph.removeNode(id(0))).isNull();
        Assertions.assertThat(listener.getNodesRemoved()).containsExactly(id(0));

        graph.removeNode(id(1));
        // neighbors that lose their last edge stay registered
        assertAdjacency(graph, ImmutableMap.of(2L, ImmutableSet.of()));
    }

    @Test
    void testGetEdgesOfAbsentNode() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        Assertions.assertThat(graph.getEdges(id(42))).isNull();
        graph.addEmptyNode(id(42));
        Assertions.assertThat(graph.getEdges(id(42))).isNotNull().isEmpty();
    }

    @Test
    void testViewsAreReadOnly() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        graph.addNode(id(0), ids(1));
        final Set<ElementId> edges = graph.getEdges(id(0));
        Assertions.assertThat(edges).isNotNull();

        Assertions.assertThatThrownBy(() -> edges.add(id(2))).isInstanceOf(UnsupportedOperationException.class);
        Assertions.assertThatThrownBy(() -> graph.nodes().remove(id(0)))
                .isInstanceOf(UnsupportedOperationException.class);
        graph.addNode(id(9), ids(0));
        Assertions.assertThatThrownBy(() -> graph.removeNode(id(9)).add(id(5)))
                .isInstanceOf(UnsupportedOperationException.class);

        graph.addEdge(id(0), id(3));
        Assertions.assertThat(edges).containsExactlyInAnyOrder(id(1), id(3));
    }

    @Test
    void testNullArguments() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        final Set<ElementId> edgesWithNull = new HashSet<>();
        edgesWithNull.add(id(1));
        edgesWithNull.add(null);

        Assertions.assertThatThrownBy(() -> graph.addNode(id(0), edgesWithNull))
                .isInstanceOf(NullPointerException.class);
        Assertions.assertThatThrownBy(() -> graph.setNode(id(0), edgesWithNull))
                .isInstanceOf(NullPointerException.class);
        Assertions.assertThat(graph.isEmpty()).isTrue();

        //noinspection DataFlowIssue
        Assertions.assertThatThrownBy(() -> graph.addEmptyNode(null)).isInstanceOf(NullPointerException.class);
        //noinspection DataFlowIssue
        Assertions.assertThatThrownBy(() -> graph.setNode(id(0), null)).isInstanceOf(NullPointerException.class);
        //noinspection DataFlowIssue
        Assertions.assertThatThrownBy(() -> graph.getEdges(null)).isInstanceOf(NullPointerException.class);
        //noinspection DataFlowIssue
        Assertions.assertThatThrownBy(() -> graph.contains(null)).isInstanceOf(NullPointerException.class);
        Assertions.assertThatThrownBy(() -> new UndirectedGraph(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testForLayer() {
        final Config config = Config.newBuilder().setM(8).setMMax(12).setMMax0(24).build();
        Assertions.assertThat(UndirectedGraph.forLayer(config, 0).getMMax()).isEqualTo(24);
        Assertions.assertThat(UndirectedGraph.forLayer(config, 1).getMMax()).isEqualTo(12);
        Assertions.assertThat(UndirectedGraph.forLayer(config, 5).getMMax()).isEqualTo(12);
        Assertions.assertThatThrownBy(() -> UndirectedGraph.forLayer(config, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDegreeIsNotEnforced() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        final Set<ElementId> manyEdges = ids(1, 2, 3, 4, 5, 6, 7, 8);
        Assertions.assertThat(graph.addNode(id(0), manyEdges)).hasSize(8);
        Assertions.assertThat(graph.getEdges(id(0))).hasSize(8);
        graph.checkSymmetry();
    }

    @Test
    void testCheckSymmetryDetectsOneDirectionalEdges() {
        final UndirectedGraph graph = new UndirectedGraph(4);
        graph.addNode(id(0), ids(1));
        graph.checkSymmetry();

        graph.getAdjacency().get(id(1)).remove(id(0));
        Assertions.assertThatThrownBy(graph::checkSymmetry)
                .isInstanceOfSatisfying(GraphInconsistencyException.class, e -> {
                    Assertions.assertThat(e.getLogInfo())
                            .containsEntry(LogMessageKeys.NODE.toString(), id(0))
                            .containsEntry(LogMessageKeys.NEIGHBOR.toString(), id(1))
                            .containsEntry(LogMessageKeys.NODE_COUNT.toString(), 2)
                            .containsEntry(LogMessageKeys.M_MAX.toString(), 4);
                });

        graph.getAdjacency().remove(id(1));
        Assertions.assertThatThrownBy(graph::checkSymmetry)
                .isInstanceOf(GraphInconsistencyException.class)
                .hasMessageContaining("not part of the graph");
    }

    @ParameterizedTest
    @RandomSeedSource({0x0fdbL, 0x5ca1eL, 123456L, 78910L, 1123581321345589L})
    void testRandomOperationsKeepSymmetry(final long seed) {
        final Random random = new Random(seed);
        final CountingOnEdgeWriteListener listener = new CountingOnEdgeWriteListener();
        final UndirectedGraph graph = new UndirectedGraph(8, listener);
        final int numIds = 50;

        for (int i = 0; i < 2000; i++) {
            final ElementId node = id(random.nextInt(numIds));
            final int operation = random.nextInt(5);
            switch (operation) {
                case 0:
                    final boolean existed = graph.contains(node);
                    Assertions.assertThat(graph.addEmptyNode(node)).isEqualTo(!existed);
                    break;
                case 1:
                    final Map<ElementId, Set<ElementId>> before = snapshot(graph);
                    final List<ElementId> linked = graph.addNode(node, randomEdges(random, numIds, node));
                    if (before.containsKey(node)) {
                        Assertions.assertThat(linked).isNull();
                        Assertions.assertThat(snapshot(graph)).isEqualTo(before);
                    } else {
                        Assertions.assertThat(linked).isNotNull();
                        Assertions.assertThat(graph.getEdges(node)).containsExactlyInAnyOrderElementsOf(linked);
                    }
                    break;
                case 2:
                    final Set<ElementId> edges = randomEdges(random, numIds, node);
                    graph.setNode(node, edges);
                    Assertions.assertThat(graph.getEdges(node)).isEqualTo(edges);
                    break;
                case 3:
                    final Set<ElementId> formerEdges = graph.contains(node)
                                                       ? ImmutableSet.copyOf(graph.getEdges(node)) : null;
                    Assertions.assertThat(graph.removeNode(node)).isEqualTo(formerEdges);
                    Assertions.assertThat(graph.contains(node)).isFalse();
                    break;
                default:
                    graph.addEdge(node, id(random.nextInt(numIds)));
                    break;
            }
            graph.checkSymmetry();
        }

        if (logger.isDebugEnabled()) {
            logger.debug("random operations done; seed={}, nodes={}, reverseEdgesAdded={}, reverseEdgesRemoved={}",
                    seed, graph.size(), listener.getReverseEdgesAdded().size(),
                    listener.getReverseEdgesRemoved().size());
        }
    }

    @Nonnull
    private static Set<ElementId> randomEdges(@Nonnull final Random random, final int numIds,
                                              @Nonnull final ElementId node) {
        final int numEdges = random.nextInt(6);
        final Set<ElementId> edges = new HashSet<>();
        for (int i = 0; i < numEdges; i++) {
            final ElementId neighbor = id(random.nextInt(numIds));
            if (!neighbor.equals(node)) {
                edges.add(neighbor);
            }
        }
        return edges;
    }

    @Nonnull
    private static Map<ElementId, Set<ElementId>> snapshot(@Nonnull final AdjacencyGraph graph) {
        final Map<ElementId, Set<ElementId>> result = Maps.newHashMap();
        for (final ElementId node : graph.nodes()) {
            result.put(node, ImmutableSet.copyOf(graph.getEdges(node)));
        }
        return result;
    }

    @Nonnull
    private static List<ElementId> edge(final long neighbor, final long node) {
        return Lists.newArrayList(id(neighbor), id(node));
    }
}
