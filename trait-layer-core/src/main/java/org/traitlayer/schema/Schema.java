/*
 * Schema.java
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

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import org.traitlayer.annotation.API;
import org.traitlayer.field.FieldDefinition;
import org.traitlayer.field.FieldTemplate;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * An immutable, named, ordered set of field templates plus metadata.
 *
 * <p>
 * Field order is kept for presentation and for {@link #createFields()}, but equality and the
 * {@linkplain #getContentHash() content hash} only depend on the name, the field-to-template mapping and the
 * metadata. So two schemas with the same content are equal however they were built, whether through a
 * {@link SchemaBuilder}, {@link #merge(Schema)} or {@link #extend(String, FieldTemplate)}.
 * </p>
 *
 * <p>
 * The derived views ({@link #getFieldNames()}, {@link #getRequiredFields()}, {@link #getOptionalFields()} and the
 * content hash) are computed on first access and cached.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class Schema {
    @Nonnull
    private final String name;
    @Nonnull
    private final ImmutableMap<String, FieldTemplate> fields;
    @Nonnull
    private final ImmutableMap<String, Object> metadata;

    @Nonnull
    private final Supplier<ImmutableList<String>> requiredFieldsSupplier;
    @Nonnull
    private final Supplier<ImmutableList<String>> optionalFieldsSupplier;
    @Nonnull
    private final Supplier<String> contentHashSupplier;

    Schema(@Nonnull String name, @Nonnull Map<String, FieldTemplate> fields, @Nonnull Map<String, Object> metadata) {
        this.name = name;
        this.fields = ImmutableMap.copyOf(fields);
        this.metadata = ImmutableMap.copyOf(metadata);
        this.requiredFieldsSupplier = Suppliers.memoize(() -> filterFields(true));
        this.optionalFieldsSupplier = Suppliers.memoize(() -> filterFields(false));
        this.contentHashSupplier = Suppliers.memoize(this::computeContentHash);
    }

    @Nonnull
    public static SchemaBuilder newBuilder(@Nonnull String name) {
        return new SchemaBuilder(name);
    }

    @Nonnull
    public SchemaBuilder toBuilder() {
        return new SchemaBuilder(name).addFields(fields).withMetadata(metadata);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Map<String, FieldTemplate> getFields() {
        return fields;
    }

    @Nullable
    public FieldTemplate getField(@Nonnull String fieldName) {
        return fields.get(fieldName);
    }

    public boolean hasField(@Nonnull String fieldName) {
        return fields.containsKey(fieldName);
    }

    @Nonnull
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Get the field names in schema order.
     * @return the field names
     */
    @Nonnull
    public Set<String> getFieldNames() {
        return fields.keySet();
    }

    /**
     * Get the names of the fields that must be supplied, in schema order.
     * @return the required field names
     * @see FieldTemplate#isRequired()
     */
    @Nonnull
    public ImmutableList<String> getRequiredFields() {
        return requiredFieldsSupplier.get();
    }

    /**
     * Get the names of the fields that may be omitted, in schema order.
     * @return the optional field names
     */
    @Nonnull
    public ImmutableList<String> getOptionalFields() {
        return optionalFieldsSupplier.get();
    }

    @Nonnull
    private ImmutableList<String> filterFields(boolean required) {
        final ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (Map.Entry<String, FieldTemplate> entry : fields.entrySet()) {
            if (entry.getValue().isRequired() == required) {
                builder.add(entry.getKey());
            }
        }
        return builder.build();
    }

    /**
     * Get a hex SHA-256 digest of the schema content. Fields and metadata are visited in sorted key order, so the
     * digest does not depend on insertion order. Each template contributes its type name, flags, default value,
     * description and metadata. Validators and default factories are code and contribute only whether they are
     * present, so the digest is the same in every process while schemas that differ only in such code share it.
     * {@link #equals(Object)} still tells them apart.
     * @return the content hash
     */
    @Nonnull
    public String getContentHash() {
        return contentHashSupplier.get();
    }

    @Nonnull
    private String computeContentHash() {
        final Hasher hasher = Hashing.sha256().newHasher();
        hasher.putString(name, StandardCharsets.UTF_8).putByte((byte)0);
        for (Map.Entry<String, FieldTemplate> entry : new TreeMap<>(fields).entrySet()) {
            hasher.putString(entry.getKey(), StandardCharsets.UTF_8).putByte((byte)1);
            putTemplate(hasher, entry.getValue());
        }
        hasher.putByte((byte)0);
        putEntries(hasher, metadata);
        return hasher.hash().toString();
    }

    private static void putTemplate(@Nonnull Hasher hasher, @Nonnull FieldTemplate template) {
        hasher.putString(template.getType().getName(), StandardCharsets.UTF_8)
                .putBoolean(template.isNullable())
                .putString(template.getListMode().name(), StandardCharsets.UTF_8)
                .putBoolean(template.isFrozen())
                .putBoolean(template.hasDefault())
                .putBoolean(template.getDefaultFactory() != null)
                .putBoolean(template.getValidator() != null)
                .putString(String.valueOf(template.getDefaultValue()), StandardCharsets.UTF_8)
                .putByte((byte)2)
                .putString(String.valueOf(template.getDescription()), StandardCharsets.UTF_8)
                .putByte((byte)2);
        putEntries(hasher, template.getMetadata());
    }

    private static void putEntries(@Nonnull Hasher hasher, @Nonnull Map<String, Object> entries) {
        for (Map.Entry<String, Object> entry : new TreeMap<>(entries).entrySet()) {
            hasher.putString(entry.getKey(), StandardCharsets.UTF_8)
                    .putByte((byte)1)
                    .putString(String.valueOf(entry.getValue()), StandardCharsets.UTF_8)
                    .putByte((byte)2);
        }
        hasher.putByte((byte)0);
    }

    /**
     * Bind every template to its field name, in schema order.
     * @return the field definitions
     */
    @Nonnull
    public ImmutableList<FieldDefinition> createFields() {
        final ImmutableList.Builder<FieldDefinition> builder = ImmutableList.builderWithExpectedSize(fields.size());
        for (Map.Entry<String, FieldTemplate> entry : fields.entrySet()) {
            builder.add(entry.getValue().createField(entry.getKey()));
        }
        return builder.build();
    }

    /**
     * Merge another schema into this one, named {@code thisName_otherName}.
     * @param other the schema whose fields and metadata win on collision
     * @return the merged schema
     */
    @Nonnull
    public Schema merge(@Nonnull Schema other) {
        return merge(other, null);
    }

    /**
     * Merge another schema into this one. Fields keep this schema's order followed by the other's new fields. On a
     * name collision the other schema's template or metadata value wins.
     * @param other the other schema
     * @param mergedName the new name, or {@code null} for {@code thisName_otherName}
     * @return the merged schema
     */
    @Nonnull
    public Schema merge(@Nonnull Schema other, @Nullable String mergedName) {
        final Map<String, FieldTemplate> mergedFields = new LinkedHashMap<>(fields);
        mergedFields.putAll(other.fields);
        final Map<String, Object> mergedMetadata = new LinkedHashMap<>(metadata);
        mergedMetadata.putAll(other.metadata);
        return new Schema(mergedName == null ? name + "_" + other.name : mergedName, mergedFields, mergedMetadata);
    }

    @Nonnull
    public Schema select(@Nonnull String... fieldNames) {
        return select(Arrays.asList(fieldNames), null);
    }

    /**
     * Keep only the named fields, in this schema's order. Names that are not fields of this schema are ignored.
     * @param fieldNames the fields to keep
     * @param selectedName the new name, or {@code null} for {@code thisName_subset}
     * @return the selected schema, with this schema's metadata
     */
    @Nonnull
    public Schema select(@Nonnull Collection<String> fieldNames, @Nullable String selectedName) {
        final Map<String, FieldTemplate> selected = new LinkedHashMap<>();
        for (Map.Entry<String, FieldTemplate> entry : fields.entrySet()) {
            if (fieldNames.contains(entry.getKey())) {
                selected.put(entry.getKey(), entry.getValue());
            }
        }
        return new Schema(selectedName == null ? name + "_subset" : selectedName, selected, metadata);
    }

    /**
     * Add or replace fields, keeping the name and metadata.
     * @param extraFields fields to add; existing names are overwritten in place
     * @return the extended schema
     */
    @Nonnull
    public Schema extend(@Nonnull Map<String, FieldTemplate> extraFields) {
        return toBuilder().addFields(extraFields).build();
    }

    @Nonnull
    public Schema extend(@Nonnull String fieldName, @Nonnull FieldTemplate template) {
        return toBuilder().addField(fieldName, template).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Schema schema = (Schema)o;
        return name.equals(schema.name) && fields.equals(schema.fields) && metadata.equals(schema.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fields, metadata);
    }

    @Override
    public String toString() {
        return "Schema{" + name + ", fields=" + fields.keySet() + (metadata.isEmpty() ? "" : ", metadata=" + metadata) + "}";
    }
}
