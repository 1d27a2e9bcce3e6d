/*
 * ListMode.java
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

package org.traitlayer.field;

import org.traitlayer.annotation.API;

/**
 * How a field treats sequences of its base type.
 */
@API(API.Status.UNSTABLE)
public enum ListMode {
    /** Only a single value of the base type is admitted. */
    NONE,
    /** Either a single value or a {@link java.util.List} of values is admitted. */
    LENIENT,
    /** Only a {@link java.util.List} of values is admitted. */
    STRICT
}
