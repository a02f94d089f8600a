/*
 * package-info.java
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

/**
 * Graph structures backing the HNSW vector index.
 * <p>
 * The index computes which nodes should be connected on each layer; the {@link org.multidb.idx.hnsw.AdjacencyGraph}
 * implementations in this package store those connections and keep every edge undirected, i.e. they add or remove
 * the reverse edge on the other end whenever the neighbors of a node change.
 * </p>
 */
package org.multidb.idx.hnsw;
