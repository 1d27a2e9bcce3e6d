/*
 * ModelType.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.traitlayer.annotation.API;
import org.traitlayer.capability.Behavior;
import org.traitlayer.capability.MemberKind;
import org.traitlayer.capability.TypeShape;
import org.traitlayer.field.FieldDefinition;
import org.traitlayer.schema.Schema;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * A runtime type synthesized from a {@link Schema} and a set of behaviors by a {@link ModelFactory}.
 *
 * <p>
 * A model type is its own {@link TypeShape}: its attributes are the schema's fields and its callables are its
 * behaviors, so it can be registered for any capability whose required members it covers. Its identity is the type
 * object itself. Once {@linkplain #retire() retired} it is no longer live, its registrations are dropped by the next
 * registry cleanup, and its factory builds a fresh type for the same schema.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class ModelType implements TypeShape {
    @Nonnull
    private final Schema schema;
    @Nonnull
    private final ImmutableMap<String, Behavior> behaviors;
    @Nonnull
    private final String module;
    @Nonnull
    private final ImmutableList<FieldDefinition> fieldDefinitions;
    @Nonnull
    private final ImmutableMap<String, FieldDefinition> fieldsByName;
    private volatile boolean live = true;

    ModelType(@Nonnull Schema schema, @Nonnull Map<String, Behavior> behaviors, @Nonnull String module) {
        this.schema = schema;
        this.behaviors = ImmutableMap.copyOf(behaviors);
        this.module = module;
        this.fieldDefinitions = schema.createFields();
        final ImmutableMap.Builder<String, FieldDefinition> byName = ImmutableMap.builderWithExpectedSize(fieldDefinitions.size());
        for (FieldDefinition field : fieldDefinitions) {
            byName.put(field.getName(), field);
        }
        this.fieldsByName = byName.build();
    }

    @Nonnull
    public Schema getSchema() {
        return schema;
    }

    @Nonnull
    public String getName() {
        return schema.getName();
    }

    @Nonnull
    @Override
    public String getTypeName() {
        return module + "." + schema.getName();
    }

    @Nonnull
    @Override
    public String getModuleName() {
        return module;
    }

    @Override
    public boolean hasMember(@Nonnull String name, @Nonnull MemberKind kind) {
        return kind == MemberKind.ATTRIBUTE ? fieldsByName.containsKey(name) : behaviors.containsKey(name);
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

    /**
     * Mark this type as no longer in use. Existing instances keep working.
     */
    public void retire() {
        live = false;
    }

    @Nonnull
    public ImmutableList<FieldDefinition> getFieldDefinitions() {
        return fieldDefinitions;
    }

    @Nullable
    public FieldDefinition getFieldDefinition(@Nonnull String name) {
        return fieldsByName.get(name);
    }

    @Nonnull
    public ImmutableMap<String, Behavior> getBehaviors() {
        return behaviors;
    }

    @Nullable
    public Behavior getBehavior(@Nonnull String name) {
        return behaviors.get(name);
    }

    /**
     * Create an instance from field values. Omitted fields get their defaults.
     * @param values initial values by field name
     * @return the new instance
     * @throws org.traitlayer.field.FieldValidationException if a value is rejected, a field is unknown, or a
     * required field is missing
     */
    @Nonnull
    public DynamicModel newInstance(@Nonnull Map<String, ?> values) {
        return new DynamicModel(this, values);
    }

    @Nonnull
    public DynamicModel newInstance() {
        return newInstance(ImmutableMap.of());
    }

    @Override
    public String toString() {
        return "ModelType{" + getTypeName() + ", fields=" + fieldsByName.keySet() + ", behaviors=" + behaviors.keySet()
               + (live ? "" : ", retired") + "}";
    }
}
