/*
 * FieldTemplate.java
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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Primitives;
import org.traitlayer.annotation.API;
import org.traitlayer.logging.LogMessageKeys;
import org.traitlayer.util.NameUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A reusable description of one field: its base type, its default (a value or a factory, never both), whether it
 * admits {@code null}, whether it admits lists of the base type, an optional validator, a frozen flag and
 * descriptive metadata.
 *
 * <p>
 * Templates are immutable. The derivations {@link #asNullable()}, {@link #asListable(boolean)} and the
 * {@code with*} methods return new templates. The validator always sees single non-null values of the base type:
 * {@code null} is decided by the nullable flag alone, and a list is checked element by element.
 * </p>
 *
 * <p>
 * Binding a template to a name with {@link #createField(String)} produces a {@link FieldDefinition}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class FieldTemplate {
    @Nonnull
    private final Class<?> type;
    private final boolean nullable;
    @Nonnull
    private final ListMode listMode;
    private final boolean hasDefault;
    @Nullable
    private final Object defaultValue;
    @Nullable
    private final Supplier<?> defaultFactory;
    @Nullable
    private final Predicate<Object> validator;
    private final boolean frozen;
    @Nullable
    private final String description;
    @Nonnull
    private final ImmutableMap<String, Object> metadata;

    private FieldTemplate(@Nonnull Builder builder) {
        this.type = builder.type;
        this.nullable = builder.nullable;
        this.listMode = builder.listMode;
        this.hasDefault = builder.hasDefault;
        this.defaultValue = builder.defaultValue;
        this.defaultFactory = builder.defaultFactory;
        this.validator = builder.validator;
        this.frozen = builder.frozen;
        this.description = builder.description;
        this.metadata = ImmutableMap.copyOf(builder.metadata);
    }

    @Nonnull
    public static Builder newBuilder(@Nonnull Class<?> type) {
        return new Builder(type);
    }

    /**
     * A required, non-nullable template of the given type with no validator.
     * @param type the base type
     * @return a new template
     */
    @Nonnull
    public static FieldTemplate of(@Nonnull Class<?> type) {
        return newBuilder(type).build();
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public Class<?> getType() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    @Nonnull
    public ListMode getListMode() {
        return listMode;
    }

    public boolean isListable() {
        return listMode != ListMode.NONE;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    @Nullable
    public Object getDefaultValue() {
        return defaultValue;
    }

    @Nullable
    public Supplier<?> getDefaultFactory() {
        return defaultFactory;
    }

    @Nullable
    public Predicate<Object> getValidator() {
        return validator;
    }

    public boolean isFrozen() {
        return frozen;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    @Nonnull
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Whether a value must be supplied for this field, i.e. it is not nullable and has neither a default value nor a
     * default factory.
     * @return {@code true} if the field is required
     */
    public boolean isRequired() {
        return !nullable && !hasDefault && defaultFactory == null;
    }

    /**
     * Produce the default for a new instance: a fresh value from the factory if there is one, otherwise the default
     * value (which is {@code null} when there is none).
     * @return the default
     */
    @Nullable
    public Object resolveDefault() {
        if (defaultFactory != null) {
            return defaultFactory.get();
        }
        return defaultValue;
    }

    /**
     * Derive a template that admits {@code null} and defaults to it. Any default factory is dropped. The validator is
     * kept unchanged and is never consulted for {@code null}. Applying this more than once has the same result as
     * applying it once.
     * @return a nullable template
     */
    @Nonnull
    public FieldTemplate asNullable() {
        if (nullable && hasDefault && defaultValue == null && defaultFactory == null) {
            return this;
        }
        return toBuilder()
                .setNullable(true)
                .setDefault(null)
                .setDefaultFactory(null)
                .build();
    }

    /**
     * Derive a template that admits lists of the base type. In lenient mode a single value is still admitted; in
     * strict mode only lists are. The validator is applied to each element of a list and once to a single value.
     * @param strict whether single values are rejected
     * @return a listable template
     */
    @Nonnull
    public FieldTemplate asListable(boolean strict) {
        final ListMode mode = strict ? ListMode.STRICT : ListMode.LENIENT;
        if (listMode == mode) {
            return this;
        }
        return toBuilder().setListMode(mode).build();
    }

    @Nonnull
    public FieldTemplate asListable() {
        return asListable(false);
    }

    /**
     * Derive a template whose validator is the conjunction of the current validator (if any) and the given one.
     * @param additional the validator to add
     * @return a new template
     */
    @Nonnull
    public FieldTemplate withValidator(@Nonnull Predicate<Object> additional) {
        return toBuilder()
                .setValidator(validator == null ? additional : validator.and(additional))
                .build();
    }

    @Nonnull
    public FieldTemplate withDefault(@Nullable Object value) {
        return toBuilder().setDefaultFactory(null).setDefault(value).build();
    }

    @Nonnull
    public FieldTemplate withDefaultFactory(@Nonnull Supplier<?> factory) {
        return toBuilder().clearDefault().setDefaultFactory(factory).build();
    }

    @Nonnull
    public FieldTemplate withDescription(@Nullable String newDescription) {
        return toBuilder().setDescription(newDescription).build();
    }

    @Nonnull
    public FieldTemplate withFrozen(boolean newFrozen) {
        return toBuilder().setFrozen(newFrozen).build();
    }

    @Nonnull
    public FieldTemplate withMetadata(@Nonnull String key, @Nonnull Object value) {
        return toBuilder().putMetadata(key, value).build();
    }

    /**
     * Whether the value has an admissible shape: {@code null} only when nullable, otherwise an instance of the base
     * type, or a list of such instances when listable. The validator is not consulted.
     * @param value candidate value
     * @return {@code true} if the shape is admissible
     */
    public boolean accepts(@Nullable Object value) {
        return shapeError(value) == null;
    }

    /**
     * Whether the value has an admissible shape and passes the validator.
     * @param value candidate value
     * @return {@code true} if the value is valid for this template
     */
    public boolean isValid(@Nullable Object value) {
        return shapeError(value) == null && passesValidator(value);
    }

    /**
     * Check a value against this template.
     * @param fieldName name used in the error, if any
     * @param value candidate value
     * @throws FieldValidationException if the value is not valid
     */
    public void validate(@Nonnull String fieldName, @Nullable Object value) {
        final String error = shapeError(value);
        if (error != null) {
            throw new FieldValidationException(error,
                    LogMessageKeys.FIELD_NAME, fieldName,
                    LogMessageKeys.FIELD_TYPE, describeType(),
                    LogMessageKeys.VALUE_TYPE, value == null ? "null" : value.getClass().getName());
        }
        if (!passesValidator(value)) {
            throw new FieldValidationException("value rejected by field validator",
                    LogMessageKeys.FIELD_NAME, fieldName,
                    LogMessageKeys.FIELD_TYPE, describeType());
        }
    }

    @Nullable
    private String shapeError(@Nullable Object value) {
        if (value == null) {
            return nullable ? null : "null value for non-nullable field";
        }
        if (value instanceof List<?>) {
            if (listMode == ListMode.NONE && !isInstance(value)) {
                return "list value for non-list field";
            }
            if (listMode != ListMode.NONE) {
                for (Object element : (List<?>)value) {
                    if (element == null || !isInstance(element)) {
                        return "list element has wrong type";
                    }
                }
            }
            return null;
        }
        if (listMode == ListMode.STRICT) {
            return "single value for strict list field";
        }
        return isInstance(value) ? null : "value has wrong type";
    }

    private boolean passesValidator(@Nullable Object value) {
        if (value == null || validator == null) {
            return true;
        }
        if (value instanceof List<?> && listMode != ListMode.NONE) {
            for (Object element : (List<?>)value) {
                if (!validator.test(element)) {
                    return false;
                }
            }
            return true;
        }
        return validator.test(value);
    }

    private boolean isInstance(@Nonnull Object value) {
        return Primitives.wrap(type).isInstance(value);
    }

    @Nonnull
    private String describeType() {
        final String base = type.getSimpleName();
        switch (listMode) {
            case LENIENT:
                return (nullable ? "nullable " : "") + base + " or List<" + base + ">";
            case STRICT:
                return (nullable ? "nullable " : "") + "List<" + base + ">";
            case NONE:
            default:
                return (nullable ? "nullable " : "") + base;
        }
    }

    /**
     * Bind this template to a field name.
     * @param name the field name
     * @return a field definition
     * @throws FieldContractException if the name is not a bare identifier
     */
    @Nonnull
    public FieldDefinition createField(@Nonnull String name) {
        return createField(name, builder -> { });
    }

    /**
     * Bind this template, with some properties overridden, to a field name.
     * @param name the field name
     * @param overrides changes applied to a copy of this template
     * @return a field definition
     * @throws FieldContractException if the name is not a bare identifier, if the overrides leave both a default
     * value and a default factory, or if they make a frozen template mutable
     */
    @Nonnull
    public FieldDefinition createField(@Nonnull String name, @Nonnull Consumer<Builder> overrides) {
        if (!NameUtils.isIdentifier(name)) {
            throw new FieldContractException("field name is not a valid identifier",
                    LogMessageKeys.FIELD_NAME, name);
        }
        final Builder builder = toBuilder();
        overrides.accept(builder);
        if (frozen && !builder.frozen) {
            throw new FieldContractException("frozen field cannot be made mutable",
                    LogMessageKeys.FIELD_NAME, name);
        }
        final FieldTemplate template;
        try {
            template = builder.build();
        } catch (FieldContractException e) {
            throw e.addLogInfo(LogMessageKeys.FIELD_NAME.toString(), name);
        }
        return new FieldDefinition(name, template);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldTemplate that = (FieldTemplate)o;
        return nullable == that.nullable &&
               hasDefault == that.hasDefault &&
               frozen == that.frozen &&
               type.equals(that.type) &&
               listMode == that.listMode &&
               Objects.equals(defaultValue, that.defaultValue) &&
               Objects.equals(defaultFactory, that.defaultFactory) &&
               Objects.equals(validator, that.validator) &&
               Objects.equals(description, that.description) &&
               metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, nullable, listMode, hasDefault, defaultValue, defaultFactory, validator, frozen,
                description, metadata);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("FieldTemplate{").append(describeType());
        if (hasDefault) {
            sb.append(", default=").append(defaultValue);
        }
        if (defaultFactory != null) {
            sb.append(", factory");
        }
        if (validator != null) {
            sb.append(", validated");
        }
        if (frozen) {
            sb.append(", frozen");
        }
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link FieldTemplate}.
     */
    public static final class Builder {
        @Nonnull
        private Class<?> type;
        private boolean nullable;
        @Nonnull
        private ListMode listMode = ListMode.NONE;
        private boolean hasDefault;
        @Nullable
        private Object defaultValue;
        @Nullable
        private Supplier<?> defaultFactory;
        @Nullable
        private Predicate<Object> validator;
        private boolean frozen;
        @Nullable
        private String description;
        @Nonnull
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(@Nonnull Class<?> type) {
            this.type = type;
        }

        private Builder(@Nonnull FieldTemplate template) {
            this.type = template.type;
            this.nullable = template.nullable;
            this.listMode = template.listMode;
            this.hasDefault = template.hasDefault;
            this.defaultValue = template.defaultValue;
            this.defaultFactory = template.defaultFactory;
            this.validator = template.validator;
            this.frozen = template.frozen;
            this.description = template.description;
            this.metadata.putAll(template.metadata);
        }

        @Nonnull
        public Builder setType(@Nonnull Class<?> type) {
            this.type = type;
            return this;
        }

        @Nonnull
        public Builder setNullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        @Nonnull
        public Builder setListMode(@Nonnull ListMode listMode) {
            this.listMode = listMode;
            return this;
        }

        /**
         * Set the default value. {@code null} is a legitimate default for nullable fields.
         * @param defaultValue the default
         * @return this builder
         */
        @Nonnull
        public Builder setDefault(@Nullable Object defaultValue) {
            this.hasDefault = true;
            this.defaultValue = defaultValue;
            return this;
        }

        @Nonnull
        public Builder clearDefault() {
            this.hasDefault = false;
            this.defaultValue = null;
            return this;
        }

        @Nonnull
        public Builder setDefaultFactory(@Nullable Supplier<?> defaultFactory) {
            this.defaultFactory = defaultFactory;
            return this;
        }

        @Nonnull
        public Builder setValidator(@Nullable Predicate<Object> validator) {
            this.validator = validator;
            return this;
        }

        @Nonnull
        public Builder setFrozen(boolean frozen) {
            this.frozen = frozen;
            return this;
        }

        @Nonnull
        public Builder setDescription(@Nullable String description) {
            this.description = description;
            return this;
        }

        @Nonnull
        public Builder putMetadata(@Nonnull String key, @Nonnull Object value) {
            Preconditions.checkNotNull(value, "metadata value");
            this.metadata.put(key, value);
            return this;
        }

        /**
         * Build the template.
         * @return a new template
         * @throws FieldContractException if both a default value and a default factory are set
         */
        @Nonnull
        public FieldTemplate build() {
            if (hasDefault && defaultFactory != null) {
                throw new FieldContractException("field cannot have both a default value and a default factory",
                        LogMessageKeys.FIELD_TYPE, type.getName());
            }
            return new FieldTemplate(this);
        }
    }
}
