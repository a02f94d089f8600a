/*
 * LoggableException.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime exception that carries structured key/value information next to its message. Log sinks can emit the
 * pairs as separate fields which keeps them searchable. Keys are usually taken from {@link LogMessageKeys}.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException {
    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with a message and a flattened sequence of key/value pairs.
     *
     * @param msg error message
     * @param keyValues keys at even positions, their values at the following odd positions
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     * @see #addLogInfo(Object...)
     */
    public LoggableException(@Nonnull final String msg, @Nullable final Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull final String msg, @Nullable final Throwable cause) {
        super(msg, cause);
    }

    /**
     * Get the log information attached to this exception, in insertion order.
     *
     * @return an unmodifiable map of the log information
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Attach a single key/value pair. An existing value for the same key is replaced.
     *
     * @param key the key, usually a {@link LogMessageKeys}
     * @param value the value
     * @return this exception
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull final Object key, @Nullable final Object value) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(key.toString(), value);
        return this;
    }

    /**
     * Attach a flattened sequence of key/value pairs, e.g. {@code [NODE, n, NEIGHBOR, m]}. This is the format produced
     * by {@link #exportLogInfo()}.
     *
     * @param keyValues keys at even positions, their values at the following odd positions
     * @return this exception
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull final Object... keyValues) {
        if ((keyValues.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            addLogInfo(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return this;
    }

    /**
     * Flatten the log information into an array of alternating keys and values.
     *
     * @return the flattened log information
     */
    @Nonnull
    public Object[] exportLogInfo() {
        final Map<String, Object> info = getLogInfo();
        final Object[] flattened = new Object[info.size() * 2];
        int i = 0;
        for (final Map.Entry<String, Object> entry : info.entrySet()) {
            flattened[i++] = entry.getKey();
            flattened[i++] = entry.getValue();
        }
        return flattened;
    }
}
