/*
 * CapabilityRegistryStats.java
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

import com.google.common.collect.ImmutableMap;
import org.traitlayer.annotation.API;

import javax.annotation.Nonnull;

/**
 * A snapshot of a registry's counters.
 */
@API(API.Status.UNSTABLE)
public final class CapabilityRegistryStats {
    private final long registrations;
    private final long rejections;
    private final long lookups;
    private final long activeImplementations;
    private final long registeredTypes;
    private final long capabilities;
    private final long sealedCapabilities;
    private final long compositionCacheHits;
    private final long compositionCacheMisses;
    private final long compositionCacheSize;

    @SuppressWarnings("squid:S00107")
    CapabilityRegistryStats(long registrations, long rejections, long lookups, long activeImplementations,
                            long registeredTypes, long capabilities, long sealedCapabilities,
                            long compositionCacheHits, long compositionCacheMisses, long compositionCacheSize) {
        this.registrations = registrations;
        this.rejections = rejections;
        this.lookups = lookups;
        this.activeImplementations = activeImplementations;
        this.registeredTypes = registeredTypes;
        this.capabilities = capabilities;
        this.sealedCapabilities = sealedCapabilities;
        this.compositionCacheHits = compositionCacheHits;
        this.compositionCacheMisses = compositionCacheMisses;
        this.compositionCacheSize = compositionCacheSize;
    }

    /**
     * Get the number of records created since the registry was created or reset.
     * @return the registration count
     */
    public long getRegistrations() {
        return registrations;
    }

    public long getRejections() {
        return rejections;
    }

    /**
     * Get the number of {@code hasCapability} queries answered.
     * @return the lookup count
     */
    public long getLookups() {
        return lookups;
    }

    /**
     * Get the number of records whose type is still reachable and live.
     * @return the active record count
     */
    public long getActiveImplementations() {
        return activeImplementations;
    }

    public long getRegisteredTypes() {
        return registeredTypes;
    }

    public long getCapabilities() {
        return capabilities;
    }

    public long getSealedCapabilities() {
        return sealedCapabilities;
    }

    public long getCompositionCacheHits() {
        return compositionCacheHits;
    }

    public long getCompositionCacheMisses() {
        return compositionCacheMisses;
    }

    public long getCompositionCacheSize() {
        return compositionCacheSize;
    }

    @Nonnull
    public ImmutableMap<String, Long> toMap() {
        return ImmutableMap.<String, Long>builder()
                .put("registrations", registrations)
                .put("rejections", rejections)
                .put("lookups", lookups)
                .put("active_implementations", activeImplementations)
                .put("registered_types", registeredTypes)
                .put("capabilities", capabilities)
                .put("sealed_capabilities", sealedCapabilities)
                .put("composition_cache_hits", compositionCacheHits)
                .put("composition_cache_misses", compositionCacheMisses)
                .put("composition_cache_size", compositionCacheSize)
                .build();
    }

    @Override
    public String toString() {
        return "CapabilityRegistryStats" + toMap();
    }
}
