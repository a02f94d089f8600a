/*
 * API.java
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

package org.multidb.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, method, constructor or field is for code outside of MultiDB.
 *
 * <p>
 * Members of an annotated type inherit the type's status unless they carry their own annotation. A status may move
 * towards {@link Status#STABLE} at any time; moving it the other way is bound by the rules given for each status.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the {@link Status} of the annotated element
     */
    Status value();

    /**
     * Stability levels, ordered from least to most stable.
     */
    enum Status {
        /**
         * Visible only because another MultiDB package needs it. Can change or disappear in any release.
         */
        INTERNAL,

        /**
         * Scheduled for removal. Kept until the next minor release at the earliest.
         */
        DEPRECATED,

        /**
         * New functionality whose shape is still moving. Use with care; can change without notice.
         */
        EXPERIMENTAL,

        /**
         * Can change with the next minor release, but not within a patch release.
         */
        UNSTABLE,

        /**
         * Only changes incompatibly with a major release.
         */
        STABLE
    }
}
