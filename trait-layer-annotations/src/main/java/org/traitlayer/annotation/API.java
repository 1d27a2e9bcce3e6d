/*
 * API.java
 *
 * This source file is part of the Trait Layer open source project
 *
 * Copyright 2025-2026 the Trait Layer project authors
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

package org.traitlayer.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks public types, fields, and methods with the level of stability that consumers of the Trait Layer can rely on.
 *
 * <p>
 * An annotated class or interface passes its status on to all of its members unless a member carries its own
 * annotation. A status may be raised (made more stable) at any time. It must not be lowered before the point that
 * the current status allows, as described on each {@link Status}.
 * </p>
 *
 * <p>
 * The key words "must", "must not", "shall", "shall not", "should", and "may" in this document are to be interpreted
 * as described in RFC 2119.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Return the {@link Status} of the API element.
     * @return the current stability status of the annotated element
     */
    Status value();

    /**
     * Stability statuses, ordered from least stable to most stable.
     */
    enum Status {
        /**
         * Public only so that other packages of the Trait Layer can reach it. External code should not use it. May
         * change at any time without notice.
         */
        INTERNAL,

        /**
         * Should not be used by new code. May be removed in the next minor release.
         */
        DEPRECATED,

        /**
         * A feature still under development. May change or disappear without a change in version.
         */
        EXPERIMENTAL,

        /**
         * May change in the next minor release without prior notice, but not before it.
         */
        UNSTABLE,

        /**
         * Kept backwards compatible until the next minor release, and deprecated for at least one minor release
         * before removal.
         */
        MAINTAINED,

        /**
         * Shall not change in a backwards-incompatible way or be removed until the next major release.
         */
        STABLE
    }
}
