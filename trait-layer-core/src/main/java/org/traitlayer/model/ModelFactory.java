/*
 * ModelFactory.java
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

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.traitlayer.annotation.API;
import org.traitlayer.capability.Behavior;
import org.traitlayer.capability.CapabilityDefinition;
import org.traitlayer.logging.KeyValueLogMessage;
import org.traitlayer.logging.LogMessageKeys;
import org.traitlayer.schema.Schema;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;

/**
 * Synthesizes {@link ModelType}s from schemas.
 *
 * <p>
 * Types are cached by schema content and behaviors, so building a content-equal schema again returns the same type.
 * The cache holds types weakly: a type nobody references any more can be reclaimed, after which the next request
 * synthesizes a new one. A {@linkplain ModelType#retire() retired} type is never returned.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class ModelFactory {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelFactory.class);
    public static final String DEFAULT_MODULE = "org.traitlayer.model.synthesized";

    @Nonnull
    private final String module;
    @Nonnull
    private final Cache<ModelKey, ModelType> cache = CacheBuilder.newBuilder()
            .weakValues()
            .recordStats()
            .build();

    public ModelFactory() {
        this(DEFAULT_MODULE);
    }

    /**
     * Create a factory whose types belong to the given module, for the purpose of coherence checks.
     * @param module module name reported by the synthesized types
     */
    public ModelFactory(@Nonnull String module) {
        this.module = module;
    }

    @Nonnull
    public String getModule() {
        return module;
    }

    @Nonnull
    public ModelType build(@Nonnull Schema schema) {
        return build(schema, ImmutableMap.of());
    }

    /**
     * Build a model type from a capability definition's fields and behaviors.
     * @param definition the definition
     * @return the model type
     */
    @Nonnull
    public ModelType build(@Nonnull CapabilityDefinition definition) {
        return build(definition.toSchema(), definition.getBehaviors());
    }

    /**
     * Get the type for a schema and behaviors, synthesizing it if there is no live cached one.
     * @param schema the schema
     * @param behaviors behaviors by name
     * @return the model type
     */
    @Nonnull
    public ModelType build(@Nonnull Schema schema, @Nonnull Map<String, Behavior> behaviors) {
        final ModelKey key = new ModelKey(schema, ImmutableMap.copyOf(behaviors));
        synchronized (cache) {
            final ModelType cached = cache.getIfPresent(key);
            if (cached != null && cached.isLive()) {
                return cached;
            }
            final ModelType type = new ModelType(schema, behaviors, module);
            cache.put(key, type);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of(cached == null ? "synthesized model type" : "replaced retired model type",
                        LogMessageKeys.SCHEMA_NAME, schema.getName(),
                        LogMessageKeys.CONTENT_HASH, schema.getContentHash(),
                        LogMessageKeys.MODULE_NAME, module));
            }
            return type;
        }
    }

    @Nonnull
    public CacheStats getCacheStats() {
        return cache.stats();
    }

    public long getCacheSize() {
        return cache.size();
    }

    public void clearCache() {
        cache.invalidateAll();
    }

    private static final class ModelKey {
        @Nonnull
        private final String contentHash;
        @Nonnull
        private final Schema schema;
        @Nonnull
        private final ImmutableMap<String, Behavior> behaviors;

        ModelKey(@Nonnull Schema schema, @Nonnull ImmutableMap<String, Behavior> behaviors) {
            this.contentHash = schema.getContentHash();
            this.schema = schema;
            this.behaviors = behaviors;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            ModelKey that = (ModelKey)o;
            return contentHash.equals(that.contentHash) && schema.equals(that.schema) && behaviors.equals(that.behaviors);
        }

        @Override
        public int hashCode() {
            return Objects.hash(contentHash, behaviors);
        }
    }
}
