/*
 * GraphInconsistencyException.java
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
import org.multidb.util.LogMessageKeys;
import org.multidb.util.LoggableException;

import javax.annotation.Nonnull;

/**
 * Exception thrown if a graph is found to contain an edge that is not mirrored by its reverse edge.
 */
@SuppressWarnings("serial")
@API(API.Status.EXPERIMENTAL)
public class GraphInconsistencyException extends LoggableException {
    public GraphInconsistencyException(@Nonnull final String msg,
                                       @Nonnull final ElementId node,
                                       @Nonnull final ElementId neighbor) {
        super(msg, LogMessageKeys.NODE, node, LogMessageKeys.NEIGHBOR, neighbor);
    }
}
