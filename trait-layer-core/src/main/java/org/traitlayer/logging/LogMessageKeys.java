/*
 * LogMessageKeys.java
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

package org.traitlayer.logging;

import org.traitlayer.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the Trait Layer.
 * All keys live here so that collisions are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // general keys
    MESSAGE,
    REASON,
    OLD,
    NEW,
    COUNT,
    // capabilities
    CAPABILITY,
    CAPABILITY_VERSION("version"),
    CAPABILITIES,
    MISSING,
    CONFLICTING,
    MODULE_NAME("module"),
    POLICY,
    PROVIDER,
    // types and registrations
    TYPE_NAME("type"),
    TYPE_TOKEN("token"),
    RECORDS,
    // schemas and fields
    SCHEMA_NAME("schema"),
    FIELD_NAME("field"),
    MEMBER_NAME("member"),
    FIELD_TYPE,
    VALUE_TYPE,
    BEHAVIOR,
    CONTENT_HASH("hash"),
    // caches
    CACHE_SIZE,
    ;

    @Nonnull
    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
