/*
 * Member.java
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
import java.util.Objects;

/**
 * A named member that a capability requires or allows.
 */
@API(API.Status.UNSTABLE)
public final class Member {
    @Nonnull
    private final String name;
    @Nonnull
    private final MemberKind kind;

    public Member(@Nonnull String name, @Nonnull MemberKind kind) {
        this.name = name;
        this.kind = kind;
    }

    @Nonnull
    public static Member attribute(@Nonnull String name) {
        return new Member(name, MemberKind.ATTRIBUTE);
    }

    @Nonnull
    public static Member callable(@Nonnull String name) {
        return new Member(name, MemberKind.CALLABLE);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public MemberKind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Member member = (Member)o;
        return name.equals(member.name) && kind == member.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind);
    }

    @Override
    public String toString() {
        return kind == MemberKind.CALLABLE ? name + "()" : name;
    }
}
