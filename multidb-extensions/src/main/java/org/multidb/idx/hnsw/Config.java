/*
 * Config.java
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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.multidb.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Degree settings of an HNSW index. The graph structures in this package only use them to size the neighbor sets
 * they allocate; keeping the degree of a node within these bounds is up to the index.
 */
@SuppressWarnings("checkstyle:MemberName")
@API(API.Status.EXPERIMENTAL)
public final class Config {
    public static final int DEFAULT_M = 16;
    public static final int DEFAULT_M_MAX = DEFAULT_M;
    public static final int DEFAULT_M_MAX_0 = 2 * DEFAULT_M;

    private final int m;
    private final int mMax;
    private final int mMax0;

    private Config(final int m, final int mMax, final int mMax0) {
        Preconditions.checkArgument(m >= 4 && m <= 200, "m must be [4, 200]");
        Preconditions.checkArgument(mMax >= 4 && mMax <= 200, "mMax must be [4, 200]");
        Preconditions.checkArgument(mMax0 >= 4 && mMax0 <= 300, "mMax0 must be [4, 300]");
        Preconditions.checkArgument(m <= mMax, "m must be less than or equal to mMax");
        Preconditions.checkArgument(mMax <= mMax0, "mMax must be less than or equal to mMax0");

        this.m = m;
        this.mMax = mMax;
        this.mMax0 = mMax0;
    }

    /**
     * This attribute (named {@code M} by the HNSW paper) is the number of neighbors the index aims for when it
     * connects a new node.
     */
    public int getM() {
        return m;
    }

    /**
     * This attribute (named {@code M_max} by the HNSW paper) is the maximum number of neighbors of a node on a layer
     * greater than {@code 0}.
     */
    public int getMMax() {
        return mMax;
    }

    /**
     * This attribute (named {@code M_max0} by the HNSW paper) is the maximum number of neighbors of a node on layer
     * {@code 0}. Layer {@code 0} holds every element which is why it is usually allowed a higher degree.
     */
    public int getMMax0() {
        return mMax0;
    }

    /**
     * Returns the maximum degree of the given layer, {@link #getMMax0()} for layer {@code 0} and {@link #getMMax()}
     * for every layer above it.
     * @param layer the layer, must not be negative
     * @return the maximum degree of {@code layer}
     */
    public int getMMaxForLayer(final int layer) {
        Preconditions.checkArgument(layer >= 0, "layer must not be negative");
        return layer == 0 ? mMax0 : mMax;
    }

    @Nonnull
    public ConfigBuilder toBuilder() {
        return new ConfigBuilder(getM(), getMMax(), getMMax0());
    }

    @Nonnull
    public static ConfigBuilder newBuilder() {
        return new ConfigBuilder();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Config config = (Config)o;
        return m == config.m && mMax == config.mMax && mMax0 == config.mMax0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(m, mMax, mMax0);
    }

    @Override
    @Nonnull
    public String toString() {
        return "Config[" + "M=" + getM() + ", MMax=" + getMMax() + ", MMax0=" + getMMax0() + "]";
    }

    /**
     * Builder for {@link Config}.
     */
    @CanIgnoreReturnValue
    @SuppressWarnings("checkstyle:MemberName")
    public static class ConfigBuilder {
        private int m = DEFAULT_M;
        private int mMax = DEFAULT_M_MAX;
        private int mMax0 = DEFAULT_M_MAX_0;

        public ConfigBuilder() {
        }

        public ConfigBuilder(final int m, final int mMax, final int mMax0) {
            this.m = m;
            this.mMax = mMax;
            this.mMax0 = mMax0;
        }

        public int getM() {
            return m;
        }

        @Nonnull
        public ConfigBuilder setM(final int m) {
            this.m = m;
            return this;
        }

        public int getMMax() {
            return mMax;
        }

        @Nonnull
        public ConfigBuilder setMMax(final int mMax) {
            this.mMax = mMax;
            return this;
        }

        public int getMMax0() {
            return mMax0;
        }

        @Nonnull
        public ConfigBuilder setMMax0(final int mMax0) {
            this.mMax0 = mMax0;
            return this;
        }

        @Nonnull
        public Config build() {
            return new Config(getM(), getMMax(), getMMax0());
        }
    }
}
