/*
 * ClassShape.java
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
import org.traitlayer.util.NameUtils;

import javax.annotation.Nonnull;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;

/**
 * A {@link TypeShape} backed by Java reflection.
 *
 * <p>
 * An attribute member {@code m} is satisfied by a public field {@code m}, a record component {@code m}, or a public
 * non-void method without parameters named {@code m}, {@code getM} or {@code isM}. A callable member {@code m} is
 * satisfied by any public method named {@code m}. Both forms also accept the camel case spelling of a snake case
 * member, so {@code created_at} is satisfied by {@code getCreatedAt()}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class ClassShape implements TypeShape {
    @Nonnull
    private final Class<?> type;

    private ClassShape(@Nonnull Class<?> type) {
        this.type = type;
    }

    @Nonnull
    public static ClassShape of(@Nonnull Class<?> type) {
        return new ClassShape(type);
    }

    @Nonnull
    public Class<?> getType() {
        return type;
    }

    @Nonnull
    @Override
    public String getTypeName() {
        return type.getName();
    }

    @Nonnull
    @Override
    public String getModuleName() {
        return type.getPackageName();
    }

    @Nonnull
    @Override
    public Object getIdentity() {
        return type;
    }

    @Override
    public boolean hasMember(@Nonnull String name, @Nonnull MemberKind kind) {
        final String camel = NameUtils.toCamelCase(name);
        if (kind == MemberKind.CALLABLE) {
            return hasPublicMethod(name) || (!camel.equals(name) && hasPublicMethod(camel));
        }
        return hasAttribute(name) || (!camel.equals(name) && hasAttribute(camel));
    }

    private boolean hasPublicMethod(@Nonnull String name) {
        for (Method method : type.getMethods()) {
            if (method.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    private boolean hasAttribute(@Nonnull String name) {
        for (Field field : type.getFields()) {
            if (field.getName().equals(name) && !Modifier.isStatic(field.getModifiers())) {
                return true;
            }
        }
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                if (component.getName().equals(name)) {
                    return true;
                }
            }
        }
        final String capitalized = NameUtils.capitalize(name);
        for (Method method : type.getMethods()) {
            if (method.getParameterCount() == 0
                    && method.getReturnType() != void.class
                    && !Modifier.isStatic(method.getModifiers())) {
                final String methodName = method.getName();
                if (methodName.equals(name)
                        || methodName.equals("get" + capitalized)
                        || methodName.equals("is" + capitalized)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return type.equals(((ClassShape)o).type);
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return "ClassShape{" + type.getName() + "}";
    }
}
