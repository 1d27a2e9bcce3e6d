/*
 * Behavior.java
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

package org.traitlayer.capability;

import org.traitlayer.annotation.API;
import org.traitlayer.field.FieldAccess;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An operation a capability contributes to the models that carry it. The target is the model instance the behavior
 * is invoked on.
 */
@API(API.Status.UNSTABLE)
@FunctionalInterface
public interface Behavior {
    @Nullable
    Object invoke(@Nonnull FieldAccess target, @Nonnull Object... args);
}
