/*
 * LogMessageKeys.java
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

package org.multidb.util;

import org.multidb.annotation.API;

import java.util.Locale;

/**
 * Keys used for the structured log information of {@link LoggableException}s raised by this library. All keys live
 * here so that collisions are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // graph
    NODE,
    NEIGHBOR,
    NODE_COUNT,
    M_MAX,
    ;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
