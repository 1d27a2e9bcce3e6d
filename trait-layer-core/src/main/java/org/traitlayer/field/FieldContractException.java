/*
 * FieldContractException.java
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

import org.traitlayer.TraitLayerException;
import org.traitlayer.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when a field template or field definition is itself malformed: both a default value and a default factory,
 * a name that is not a bare identifier, or an attempt to make a frozen template mutable.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class FieldContractException extends TraitLayerException {
    public FieldContractException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }
}
