/*
 * FieldAccess.java
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
import org.traitlayer.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Read and write access to the named fields of a model instance. Behaviors receive their target through this
 * interface, and format adapters read and write fields through it without knowing the concrete model type.
 */
@API(API.Status.UNSTABLE)
public interface FieldAccess {
    /**
     * Whether the target has a field of this name.
     * @param name field name
     * @return {@code true} if the field exists
     */
    boolean hasField(@Nonnull String name);

    /**
     * Get the current value of a field.
     * @param name field name
     * @return the value, possibly {@code null}
     * @throws FieldValidationException if there is no such field
     */
    @Nullable
    Object get(@Nonnull String name);

    /**
     * Assign a field, enforcing the field's contract.
     * @param name field name
     * @param value new value
     * @throws FieldValidationException if there is no such field or the value is rejected
     */
    void set(@Nonnull String name, @Nullable Object value);

    /**
     * Get the current value of a field, cast to the expected type.
     * @param name field name
     * @param type expected value type
     * @param <T> expected value type
     * @return the value, possibly {@code null}
     * @throws FieldValidationException if there is no such field or the value has another type
     */
    @Nullable
    default <T> T get(@Nonnull String name, @Nonnull Class<T> type) {
        final Object value = get(name);
        if (value != null && !type.isInstance(value)) {
            throw new FieldValidationException("field value has unexpected type",
                    LogMessageKeys.FIELD_NAME, name,
                    LogMessageKeys.FIELD_TYPE, type.getName(),
                    LogMessageKeys.VALUE_TYPE, value.getClass().getName());
        }
        return type.cast(value);
    }
}
