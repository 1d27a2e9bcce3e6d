/*
 * MutableShape.java
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

package org.traitlayer.test;

import org.traitlayer.capability.MemberKind;
import org.traitlayer.capability.TypeShape;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * A type whose members can be added after creation, for tests that evolve a candidate between registrations.
 */
public class MutableShape implements TypeShape {
    @Nonnull
    private final String name;
    @Nullable
    private final String module;
    @Nonnull
    private final Set<String> attributes = new HashSet<>();
    @Nonnull
    private final Set<String> callables = new HashSet<>();
    private volatile boolean live = true;

    public MutableShape(@Nonnull String name, @Nullable String module) {
        this.name = name;
        this.module = module;
    }

    @Nonnull
    public MutableShape withAttributes(@Nonnull String... names) {
        Collections.addAll(attributes, names);
        return this;
    }

    @Nonnull
    public MutableShape withCallables(@Nonnull String... names) {
        Collections.addAll(callables, names);
        return this;
    }

    public void retire() {
        live = false;
    }

    @Nonnull
    @Override
    public String getTypeName() {
        return (module == null ? "" : module + ".") + name;
    }

    @Nullable
    @Override
    public String getModuleName() {
        return module;
    }

    @Override
    public boolean hasMember(@Nonnull String memberName, @Nonnull MemberKind kind) {
        return kind == MemberKind.ATTRIBUTE ? attributes.contains(memberName) : callables.contains(memberName);
    }

    @Nonnull
    @Override
    public Object getIdentity() {
        return this;
    }

    @Override
    public boolean isLive() {
        return live;
    }

    @Override
    public String toString() {
        return getTypeName();
    }
}
