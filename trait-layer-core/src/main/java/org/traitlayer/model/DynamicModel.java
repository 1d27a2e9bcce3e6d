/*
 * DynamicModel.java
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

package org.traitlayer.model;

import org.traitlayer.annotation.API;
import org.traitlayer.capability.Behavior;
import org.traitlayer.capability.CapabilityException;
import org.traitlayer.capability.HasTypeShape;
import org.traitlayer.capability.TypeShape;
import org.traitlayer.field.FieldAccess;
import org.traitlayer.field.FieldDefinition;
import org.traitlayer.field.FieldValidationException;
import org.traitlayer.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An instance of a {@link ModelType}. Every assignment, including the initial ones, is checked against the field's
 * template; frozen fields can only be assigned at construction.
 *
 * <p>
 * Instances are not thread-safe.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class DynamicModel implements FieldAccess, HasTypeShape {
    @Nonnull
    private final ModelType type;
    @Nonnull
    private final Map<String, Object> values;

    DynamicModel(@Nonnull ModelType type, @Nonnull Map<String, ?> initialValues) {
        this.type = type;
        for (String name : initialValues.keySet()) {
            if (type.getFieldDefinition(name) == null) {
                throw unknownField(name);
            }
        }
        final List<String> missing = new ArrayList<>();
        this.values = new LinkedHashMap<>();
        for (FieldDefinition field : type.getFieldDefinitions()) {
            final Object value;
            if (initialValues.containsKey(field.getName())) {
                value = initialValues.get(field.getName());
            } else if (field.isRequired()) {
                missing.add(field.getName());
                continue;
            } else {
                value = field.getDefaultValue();
            }
            field.validate(value);
            values.put(field.getName(), value);
        }
        if (!missing.isEmpty()) {
            throw new FieldValidationException("missing required fields",
                    LogMessageKeys.SCHEMA_NAME, type.getName(),
                    LogMessageKeys.MISSING, missing);
        }
    }

    @Nonnull
    public ModelType getType() {
        return type;
    }

    @Nonnull
    @Override
    public TypeShape getTypeShape() {
        return type;
    }

    @Override
    public boolean hasField(@Nonnull String name) {
        return type.getFieldDefinition(name) != null;
    }

    @Nullable
    @Override
    public Object get(@Nonnull String name) {
        if (!hasField(name)) {
            throw unknownField(name);
        }
        return values.get(name);
    }

    @Override
    public void set(@Nonnull String name, @Nullable Object value) {
        final FieldDefinition field = type.getFieldDefinition(name);
        if (field == null) {
            throw unknownField(name);
        }
        if (field.isFrozen()) {
            throw new FieldValidationException("field is frozen",
                    LogMessageKeys.SCHEMA_NAME, type.getName(),
                    LogMessageKeys.FIELD_NAME, name);
        }
        field.validate(value);
        values.put(name, value);
    }

    /**
     * Run one of the type's behaviors with this instance as its target.
     * @param behaviorName the behavior
     * @param args its arguments
     * @return whatever the behavior returns
     * @throws CapabilityException if the type has no such behavior
     */
    @Nullable
    public Object invoke(@Nonnull String behaviorName, @Nonnull Object... args) {
        final Behavior behavior = type.getBehavior(behaviorName);
        if (behavior == null) {
            throw new CapabilityException("unknown behavior",
                    LogMessageKeys.SCHEMA_NAME, type.getName(),
                    LogMessageKeys.BEHAVIOR, behaviorName);
        }
        return behavior.invoke(this, args);
    }

    /**
     * Get the current values in schema order.
     * @return an unmodifiable copy of the values
     */
    @Nonnull
    public Map<String, Object> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Nonnull
    private FieldValidationException unknownField(@Nonnull String name) {
        return new FieldValidationException("unknown field",
                LogMessageKeys.SCHEMA_NAME, type.getName(),
                LogMessageKeys.FIELD_NAME, name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DynamicModel that = (DynamicModel)o;
        return type == that.type && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(type), values);
    }

    @Override
    public String toString() {
        return type.getName() + values;
    }
}
