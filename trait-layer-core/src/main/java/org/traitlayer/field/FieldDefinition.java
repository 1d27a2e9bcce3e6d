/*
 * FieldDefinition.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A {@link FieldTemplate} bound to a field name. Created by {@link FieldTemplate#createField(String)} and by
 * {@link org.traitlayer.schema.Schema#createFields()}.
 */
@API(API.Status.UNSTABLE)
public final class FieldDefinition {
    @Nonnull
    private final String name;
    @Nonnull
    private final FieldTemplate template;

    FieldDefinition(@Nonnull String name, @Nonnull FieldTemplate template) {
        this.name = name;
        this.template = template;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public FieldTemplate getTemplate() {
        return template;
    }

    @Nonnull
    public Class<?> getType() {
        return template.getType();
    }

    public boolean isRequired() {
        return template.isRequired();
    }

    public boolean isFrozen() {
        return template.isFrozen();
    }

    /**
     * The default for a new instance, freshly produced if the field has a default factory.
     * @return the default value
     */
    @Nullable
    public Object getDefaultValue() {
        return template.resolveDefault();
    }

    /**
     * Check a value against this field.
     * @param value candidate value
     * @throws FieldValidationException if the value is not valid
     */
    public void validate(@Nullable Object value) {
        template.validate(name, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldDefinition that = (FieldDefinition)o;
        return name.equals(that.name) && template.equals(that.template);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, template);
    }

    @Override
    public String toString() {
        return name + ": " + template;
    }
}
