/*
 * CapabilityRegistryConfig.java
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

package org.traitlayer.capability;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import org.traitlayer.annotation.API;
import org.traitlayer.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Settings for a {@link CapabilityRegistry}.
 *
 * <p>
 * The settings can also be read from {@link Properties} whose keys start with {@value #PROPERTY_PREFIX}:
 * </p>
 * <ul>
 *     <li>{@code redefinition-policy}: {@code replace} or {@code reject}</li>
 *     <li>{@code local-modules}: comma-separated module names</li>
 *     <li>{@code structural-fallback}: {@code true} or {@code false}</li>
 *     <li>{@code composition-cache-size}: maximum number of cached compositions</li>
 *     <li>{@code load-provided-definitions}: {@code true} or {@code false}</li>
 * </ul>
 */
@API(API.Status.UNSTABLE)
public final class CapabilityRegistryConfig {
    public static final String PROPERTY_PREFIX = "traitlayer.registry.";
    public static final String REDEFINITION_POLICY_PROPERTY = PROPERTY_PREFIX + "redefinition-policy";
    public static final String LOCAL_MODULES_PROPERTY = PROPERTY_PREFIX + "local-modules";
    public static final String STRUCTURAL_FALLBACK_PROPERTY = PROPERTY_PREFIX + "structural-fallback";
    public static final String COMPOSITION_CACHE_SIZE_PROPERTY = PROPERTY_PREFIX + "composition-cache-size";
    public static final String LOAD_PROVIDED_DEFINITIONS_PROPERTY = PROPERTY_PREFIX + "load-provided-definitions";

    public static final long DEFAULT_COMPOSITION_CACHE_SIZE = 256;

    /** Defaults: replace on redefinition, no local modules, structural fallback on, no provided definitions. */
    public static final CapabilityRegistryConfig DEFAULT = newBuilder().build();

    /**
     * What happens when a definition is registered under a name that already has a non-sealed definition.
     * Sealed names are always refused.
     */
    public enum RedefinitionPolicy {
        /** The new definition replaces the old one. */
        REPLACE,
        /** The new definition is refused with a {@link DuplicateCapabilityException}. */
        REJECT
    }

    @Nonnull
    private final RedefinitionPolicy redefinitionPolicy;
    @Nonnull
    private final ImmutableSet<String> localModules;
    private final boolean structuralFallback;
    private final long compositionCacheSize;
    private final boolean loadProvidedDefinitions;

    private CapabilityRegistryConfig(@Nonnull Builder builder) {
        this.redefinitionPolicy = builder.redefinitionPolicy;
        this.localModules = ImmutableSet.copyOf(builder.localModules);
        this.structuralFallback = builder.structuralFallback;
        this.compositionCacheSize = builder.compositionCacheSize;
        this.loadProvidedDefinitions = builder.loadProvidedDefinitions;
    }

    @Nonnull
    public RedefinitionPolicy getRedefinitionPolicy() {
        return redefinitionPolicy;
    }

    @Nonnull
    public ImmutableSet<String> getLocalModules() {
        return localModules;
    }

    public boolean isStructuralFallback() {
        return structuralFallback;
    }

    public long getCompositionCacheSize() {
        return compositionCacheSize;
    }

    public boolean isLoadProvidedDefinitions() {
        return loadProvidedDefinitions;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder()
                .setRedefinitionPolicy(redefinitionPolicy)
                .setLocalModules(localModules)
                .setStructuralFallback(structuralFallback)
                .setCompositionCacheSize(compositionCacheSize)
                .setLoadProvidedDefinitions(loadProvidedDefinitions);
    }

    /**
     * Read a configuration from properties. Missing keys keep their defaults.
     * @param properties the properties
     * @return the configuration
     * @throws CapabilityException if a value cannot be parsed
     */
    @Nonnull
    public static CapabilityRegistryConfig fromProperties(@Nonnull Properties properties) {
        final Builder builder = newBuilder();
        final String policy = properties.getProperty(REDEFINITION_POLICY_PROPERTY);
        if (policy != null) {
            try {
                builder.setRedefinitionPolicy(RedefinitionPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new CapabilityException("invalid redefinition policy", e)
                        .addLogInfo(LogMessageKeys.POLICY.toString(), policy);
            }
        }
        final String modules = properties.getProperty(LOCAL_MODULES_PROPERTY);
        if (modules != null) {
            builder.setLocalModules(Splitter.on(',').trimResults().omitEmptyStrings().splitToList(modules));
        }
        final String fallback = properties.getProperty(STRUCTURAL_FALLBACK_PROPERTY);
        if (fallback != null) {
            builder.setStructuralFallback(parseBoolean(STRUCTURAL_FALLBACK_PROPERTY, fallback));
        }
        final String cacheSize = properties.getProperty(COMPOSITION_CACHE_SIZE_PROPERTY);
        if (cacheSize != null) {
            try {
                final long size = Long.parseLong(cacheSize.trim());
                Preconditions.checkArgument(size >= 0);
                builder.setCompositionCacheSize(size);
            } catch (IllegalArgumentException e) {
                throw new CapabilityException("invalid composition cache size", e)
                        .addLogInfo(LogMessageKeys.CACHE_SIZE.toString(), cacheSize);
            }
        }
        final String loadProvided = properties.getProperty(LOAD_PROVIDED_DEFINITIONS_PROPERTY);
        if (loadProvided != null) {
            builder.setLoadProvidedDefinitions(parseBoolean(LOAD_PROVIDED_DEFINITIONS_PROPERTY, loadProvided));
        }
        return builder.build();
    }

    @Nonnull
    public static CapabilityRegistryConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static boolean parseBoolean(@Nonnull String key, @Nonnull String value) {
        final String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        } else if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new CapabilityException("invalid boolean property", key, value);
    }

    @Override
    public String toString() {
        return "CapabilityRegistryConfig{redefinitionPolicy=" + redefinitionPolicy
               + ", localModules=" + localModules
               + ", structuralFallback=" + structuralFallback
               + ", compositionCacheSize=" + compositionCacheSize
               + ", loadProvidedDefinitions=" + loadProvidedDefinitions + "}";
    }

    /**
     * Builder for {@link CapabilityRegistryConfig}.
     */
    public static final class Builder {
        @Nonnull
        private RedefinitionPolicy redefinitionPolicy = RedefinitionPolicy.REPLACE;
        @Nonnull
        private final Set<String> localModules = new LinkedHashSet<>();
        private boolean structuralFallback = true;
        private long compositionCacheSize = DEFAULT_COMPOSITION_CACHE_SIZE;
        private boolean loadProvidedDefinitions;

        private Builder() {
        }

        @Nonnull
        public Builder setRedefinitionPolicy(@Nonnull RedefinitionPolicy redefinitionPolicy) {
            this.redefinitionPolicy = redefinitionPolicy;
            return this;
        }

        @Nonnull
        public Builder setLocalModules(@Nonnull Collection<String> modules) {
            localModules.clear();
            localModules.addAll(modules);
            return this;
        }

        @Nonnull
        public Builder addLocalModules(@Nonnull String... modules) {
            localModules.addAll(Arrays.asList(modules));
            return this;
        }

        @Nonnull
        public Builder setStructuralFallback(boolean structuralFallback) {
            this.structuralFallback = structuralFallback;
            return this;
        }

        @Nonnull
        public Builder setCompositionCacheSize(long compositionCacheSize) {
            this.compositionCacheSize = compositionCacheSize;
            return this;
        }

        @Nonnull
        public Builder setLoadProvidedDefinitions(boolean loadProvidedDefinitions) {
            this.loadProvidedDefinitions = loadProvidedDefinitions;
            return this;
        }

        @Nonnull
        public CapabilityRegistryConfig build() {
            Preconditions.checkArgument(compositionCacheSize >= 0, "composition cache size must not be negative");
            return new CapabilityRegistryConfig(this);
        }
    }
}
