/*
 * StandardCapabilities.java
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

package org.traitlayer.capability.standard;

import com.google.common.collect.ImmutableList;
import org.traitlayer.annotation.API;
import org.traitlayer.capability.CapabilityDefinition;
import org.traitlayer.capability.CapabilityException;
import org.traitlayer.field.FieldAccess;
import org.traitlayer.field.StandardFields;
import org.traitlayer.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The built-in capabilities. Registries that load provided definitions get them through
 * {@link StandardCapabilityProvider}.
 *
 * <p>
 * Behaviors that take arguments read them positionally, for example {@code invoke("addTag", "urgent")}.
 * </p>
 */
@API(API.Status.MAINTAINED)
public final class StandardCapabilities {
    public static final String MODULE = "org.traitlayer.capability.standard";

    public static final String IDENTIFIABLE = "identifiable";
    public static final String TEMPORAL = "temporal";
    public static final String AUDITABLE = "auditable";
    public static final String VERSIONABLE = "versionable";
    public static final String SOFT_DELETABLE = "soft_deletable";
    public static final String TAGGABLE = "taggable";

    private static final String ID = "id";
    private static final String CREATED_AT = "created_at";
    private static final String UPDATED_AT = "updated_at";
    private static final String CREATED_BY = "created_by";
    private static final String UPDATED_BY = "updated_by";
    private static final String VERSION = "version";
    private static final String DELETED = "deleted";
    private static final String DELETED_AT = "deleted_at";
    private static final String DELETED_BY = "deleted_by";
    private static final String TAGS = "tags";

    /** Has a unique, immutable {@code id}. */
    public static final CapabilityDefinition IDENTIFIABLE_DEFINITION = CapabilityDefinition.newBuilder(IDENTIFIABLE)
            .setModule(MODULE)
            .setDescription("Has a unique identifier")
            .addRequiredField(ID, StandardFields.ID)
            .addBehavior("getId", (target, args) -> target.get(ID))
            .addBehavior("equalsById", (target, args) -> {
                final Object other = argument(args, 0, "equalsById");
                return other instanceof FieldAccess
                       && ((FieldAccess)other).hasField(ID)
                       && Objects.equals(target.get(ID), ((FieldAccess)other).get(ID));
            })
            .build();

    /** Tracks creation and last update times. */
    public static final CapabilityDefinition TEMPORAL_DEFINITION = CapabilityDefinition.newBuilder(TEMPORAL)
            .setModule(MODULE)
            .setDescription("Has creation and update timestamps")
            .addRequiredField(CREATED_AT, StandardFields.CREATED_AT)
            .addRequiredField(UPDATED_AT, StandardFields.UPDATED_AT)
            .addBehavior("touch", (target, args) -> {
                touch(target);
                return null;
            })
            .addBehavior("age", (target, args) ->
                    Duration.between(target.get(CREATED_AT, Instant.class), Instant.now()))
            .addBehavior("wasModified", (target, args) ->
                    target.get(UPDATED_AT, Instant.class).isAfter(target.get(CREATED_AT, Instant.class)))
            .build();

    /** Records who created and last updated a value. */
    public static final CapabilityDefinition AUDITABLE_DEFINITION = CapabilityDefinition.newBuilder(AUDITABLE)
            .setModule(MODULE)
            .setDescription("Tracks who created and modified it")
            .addPrerequisite(IDENTIFIABLE, TEMPORAL)
            .addOptionalField(CREATED_BY, StandardFields.CREATED_BY)
            .addOptionalField(UPDATED_BY, StandardFields.UPDATED_BY)
            .addBehavior("setCreatedBy", (target, args) -> {
                target.set(CREATED_BY, argument(args, 0, "setCreatedBy"));
                return null;
            })
            .addBehavior("setUpdatedBy", (target, args) -> {
                target.set(UPDATED_BY, argument(args, 0, "setUpdatedBy"));
                touch(target);
                return null;
            })
            .addBehavior("getAuditInfo", (target, args) -> {
                final Map<String, Object> info = new LinkedHashMap<>();
                for (String field : ImmutableList.of(CREATED_BY, UPDATED_BY)) {
                    if (target.hasField(field)) {
                        info.put(field, target.get(field));
                    }
                }
                return Collections.unmodifiableMap(info);
            })
            .build();

    /** Carries a version number for optimistic locking. */
    public static final CapabilityDefinition VERSIONABLE_DEFINITION = CapabilityDefinition.newBuilder(VERSIONABLE)
            .setModule(MODULE)
            .setDescription("Has a version number")
            .addRequiredField(VERSION, StandardFields.VERSION)
            .addBehavior("incrementVersion", (target, args) -> {
                target.set(VERSION, target.get(VERSION, Integer.class) + 1);
                touch(target);
                return null;
            })
            .addBehavior("checkVersion", (target, args) ->
                    Objects.equals(target.get(VERSION), argument(args, 0, "checkVersion")))
            .build();

    /** Can be marked deleted and restored. */
    public static final CapabilityDefinition SOFT_DELETABLE_DEFINITION = CapabilityDefinition.newBuilder(SOFT_DELETABLE)
            .setModule(MODULE)
            .setDescription("Supports soft deletion")
            .addRequiredField(DELETED, StandardFields.DELETED)
            .addOptionalField(DELETED_AT, StandardFields.DELETED_AT)
            .addOptionalField(DELETED_BY, StandardFields.DELETED_BY)
            .addBehavior("softDelete", (target, args) -> {
                target.set(DELETED, true);
                setIfPresent(target, DELETED_AT, Instant.now());
                if (args.length > 0) {
                    setIfPresent(target, DELETED_BY, args[0]);
                }
                return null;
            })
            .addBehavior("restore", (target, args) -> {
                target.set(DELETED, false);
                setIfPresent(target, DELETED_AT, null);
                setIfPresent(target, DELETED_BY, null);
                return null;
            })
            .addBehavior("isActive", (target, args) -> !Boolean.TRUE.equals(target.get(DELETED)))
            .build();

    /** Carries a list of string tags. */
    public static final CapabilityDefinition TAGGABLE_DEFINITION = CapabilityDefinition.newBuilder(TAGGABLE)
            .setModule(MODULE)
            .setDescription("Can be tagged")
            .addRequiredField(TAGS, StandardFields.TAGS)
            .addBehavior("addTag", (target, args) -> {
                final Object tag = argument(args, 0, "addTag");
                final List<Object> tags = tags(target);
                if (!tags.contains(tag)) {
                    tags.add(tag);
                    target.set(TAGS, tags);
                }
                return null;
            })
            .addBehavior("removeTag", (target, args) -> {
                final List<Object> tags = tags(target);
                if (tags.remove(argument(args, 0, "removeTag"))) {
                    target.set(TAGS, tags);
                }
                return null;
            })
            .addBehavior("hasTag", (target, args) -> tags(target).contains(argument(args, 0, "hasTag")))
            .addBehavior("clearTags", (target, args) -> {
                target.set(TAGS, new ArrayList<>());
                return null;
            })
            .build();

    private static final List<CapabilityDefinition> ALL = ImmutableList.of(
            IDENTIFIABLE_DEFINITION,
            TEMPORAL_DEFINITION,
            AUDITABLE_DEFINITION,
            VERSIONABLE_DEFINITION,
            SOFT_DELETABLE_DEFINITION,
            TAGGABLE_DEFINITION);

    private StandardCapabilities() {
    }

    @Nonnull
    public static List<CapabilityDefinition> all() {
        return ALL;
    }

    private static void touch(@Nonnull FieldAccess target) {
        setIfPresent(target, UPDATED_AT, Instant.now());
    }

    private static void setIfPresent(@Nonnull FieldAccess target, @Nonnull String field, @Nullable Object value) {
        if (target.hasField(field)) {
            target.set(field, value);
        }
    }

    // A copy, so changes go through FieldAccess.set and its validation.
    @Nonnull
    private static List<Object> tags(@Nonnull FieldAccess target) {
        final Object value = target.get(TAGS);
        final List<Object> tags = new ArrayList<>();
        if (value instanceof List<?>) {
            tags.addAll((List<?>)value);
        } else if (value != null) {
            tags.add(value);
        }
        return tags;
    }

    @Nonnull
    private static Object argument(@Nonnull Object[] args, int index, @Nonnull String behavior) {
        if (args.length <= index || args[index] == null) {
            throw new CapabilityException("missing behavior argument",
                    LogMessageKeys.BEHAVIOR, behavior,
                    LogMessageKeys.COUNT, index + 1);
        }
        return args[index];
    }
}
