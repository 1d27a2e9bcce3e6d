/*
 * TypeShape.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A candidate type as seen by the capability machinery: a name, the module that declares it, the members it exposes,
 * and an identity object.
 *
 * <p>
 * The registry keys registrations by {@link #getIdentity()} and only holds it weakly, so registering a type never
 * keeps it alive. Shapes that wrap something else (such as {@link ClassShape}, which wraps a {@link Class}) return the
 * wrapped object. Shapes that are themselves the type (such as synthesized models) return {@code this} and may also
 * report {@link #isLive()} {@code false} once their owner has retired them.
 * </p>
 */
@API(API.Status.UNSTABLE)
public interface TypeShape {
    @Nonnull
    String getTypeName();

    /**
     * Get the module (package) that declares the type.
     * @return the module name, or {@code null} if the type has none
     */
    @Nullable
    String getModuleName();

    /**
     * Whether the type exposes a member of the given name and kind.
     * @param name member name
     * @param kind member kind
     * @return {@code true} if the member is present
     */
    boolean hasMember(@Nonnull String name, @Nonnull MemberKind kind);

    @Nonnull
    Object getIdentity();

    /**
     * Whether the type is still in use by its owner. Registrations of a type that is no longer live are removed by
     * {@link CapabilityRegistry#cleanupOrphanedReferences()}.
     * @return {@code true} until the type is retired
     */
    default boolean isLive() {
        return true;
    }

    @Nonnull
    static TypeShape of(@Nonnull Class<?> type) {
        return ClassShape.of(type);
    }
}
