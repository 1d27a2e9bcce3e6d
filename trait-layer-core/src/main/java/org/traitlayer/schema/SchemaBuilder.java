/*
 * SchemaBuilder.java
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

package org.traitlayer.schema;

import com.google.common.base.Preconditions;
import org.traitlayer.annotation.API;
import org.traitlayer.field.FieldContractException;
import org.traitlayer.field.FieldTemplate;
import org.traitlayer.logging.LogMessageKeys;
import org.traitlayer.util.NameUtils;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A builder for {@link Schema}. The builder is mutable working state; {@link #build()} takes an immutable snapshot,
 * so the builder can keep being used afterwards.
 */
@API(API.Status.UNSTABLE)
public class SchemaBuilder {
    @Nonnull
    private final String name;
    @Nonnull
    private final Map<String, FieldTemplate> fields = new LinkedHashMap<>();
    @Nonnull
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    SchemaBuilder(@Nonnull String name) {
        this.name = name;
    }

    /**
     * Add a field. A field of the same name keeps its position and gets the new template.
     * @param fieldName the field name
     * @param template the template
     * @return this builder
     * @throws FieldContractException if the name is not a bare identifier
     */
    @Nonnull
    public SchemaBuilder addField(@Nonnull String fieldName, @Nonnull FieldTemplate template) {
        if (!NameUtils.isIdentifier(fieldName)) {
            throw new FieldContractException("field name is not a valid identifier",
                    LogMessageKeys.SCHEMA_NAME, name,
                    LogMessageKeys.FIELD_NAME, fieldName);
        }
        fields.put(fieldName, Preconditions.checkNotNull(template, "template"));
        return this;
    }

    @Nonnull
    public SchemaBuilder addFields(@Nonnull Map<String, FieldTemplate> newFields) {
        for (Map.Entry<String, FieldTemplate> entry : newFields.entrySet()) {
            addField(entry.getKey(), entry.getValue());
        }
        return this;
    }

    @Nonnull
    public SchemaBuilder withMetadata(@Nonnull String key, @Nonnull Object value) {
        metadata.put(key, Preconditions.checkNotNull(value, "metadata value"));
        return this;
    }

    @Nonnull
    public SchemaBuilder withMetadata(@Nonnull Map<String, ?> newMetadata) {
        for (Map.Entry<String, ?> entry : newMetadata.entrySet()) {
            withMetadata(entry.getKey(), entry.getValue());
        }
        return this;
    }

    /**
     * Add all fields of another schema. Its metadata is not copied.
     * @param schema the schema to take fields from
     * @return this builder
     */
    @Nonnull
    public SchemaBuilder extend(@Nonnull Schema schema) {
        return addFields(schema.getFields());
    }

    public boolean hasField(@Nonnull String fieldName) {
        return fields.containsKey(fieldName);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Schema build() {
        return new Schema(name, fields, metadata);
    }
}
