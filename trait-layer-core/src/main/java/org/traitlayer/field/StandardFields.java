/*
 * StandardFields.java
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

import java.time.Instant;
import java.util.ArrayList;
import java.util.UUID;

/**
 * Field templates shared by the built-in capabilities.
 */
@API(API.Status.MAINTAINED)
public final class StandardFields {
    /** A unique identifier, generated once and never changed. */
    public static final FieldTemplate ID = FieldTemplate.newBuilder(UUID.class)
            .setDefaultFactory(UUID::randomUUID)
            .setFrozen(true)
            .setDescription("Unique identifier")
            .build();

    public static final FieldTemplate CREATED_AT = FieldTemplate.newBuilder(Instant.class)
            .setDefaultFactory(Instant::now)
            .setDescription("Creation timestamp")
            .build();

    public static final FieldTemplate UPDATED_AT = FieldTemplate.newBuilder(Instant.class)
            .setDefaultFactory(Instant::now)
            .setDescription("Last update timestamp")
            .build();

    /** Optimistic locking version, starting at 1. */
    public static final FieldTemplate VERSION = FieldTemplate.newBuilder(Integer.class)
            .setDefault(1)
            .setValidator(value -> (Integer)value > 0)
            .setDescription("Version number for optimistic locking")
            .build();

    public static final FieldTemplate DELETED = FieldTemplate.newBuilder(Boolean.class)
            .setDefault(false)
            .setDescription("Soft deletion flag")
            .build();

    public static final FieldTemplate DELETED_AT = FieldTemplate.newBuilder(Instant.class)
            .setDescription("Deletion timestamp")
            .build()
            .asNullable();

    public static final FieldTemplate DELETED_BY = FieldTemplate.newBuilder(String.class)
            .setDescription("User who deleted the record")
            .build()
            .asNullable();

    public static final FieldTemplate CREATED_BY = FieldTemplate.newBuilder(String.class)
            .setDescription("User who created the record")
            .build()
            .asNullable();

    public static final FieldTemplate UPDATED_BY = FieldTemplate.newBuilder(String.class)
            .setDescription("User who last updated the record")
            .build()
            .asNullable();

    public static final FieldTemplate TAGS = FieldTemplate.newBuilder(String.class)
            .setListMode(ListMode.LENIENT)
            .setDefaultFactory(ArrayList::new)
            .setDescription("Tags attached to the record")
            .build();

    private StandardFields() {
    }
}
