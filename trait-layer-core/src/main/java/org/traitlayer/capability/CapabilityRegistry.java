/*
 * CapabilityRegistry.java
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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Suppliers;
import com.google.common.cache.CacheStats;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.MapMaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.traitlayer.annotation.API;
import org.traitlayer.logging.KeyValueLogMessage;
import org.traitlayer.logging.LogMessageKeys;
import org.traitlayer.util.ServiceLoaderProvider;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The store of capability definitions and of which types carry which capabilities.
 *
 * <p>
 * Registering a capability on a type runs three checks in order and stops at the first failure:
 * </p>
 * <ol>
 *     <li>{@linkplain StructuralValidator structural}: the type exposes every required member;</li>
 *     <li>{@linkplain CoherenceGuard coherence}: the type or the capability is local to this registry;</li>
 *     <li>{@linkplain DependencyResolver dependency}: every prerequisite is already carried by the type or is
 *     registered in the same call.</li>
 * </ol>
 * <p>
 * Only when all checks pass are {@link ImplementationRecord}s created. A rejection leaves the registry exactly as it
 * was and is reported as a {@link RegistrationResult} with a {@link RejectionReason}.
 * </p>
 *
 * <p>
 * The registry only references types weakly. Each type gets a token on first registration; its records are kept
 * under that token until {@link #cleanupOrphanedReferences()} finds the type reclaimed or retired, or until
 * {@link #unregister(TypeShape)} removes them explicitly.
 * </p>
 *
 * <p>
 * All state is guarded by a single read-write lock. Registrations and administrative changes take the write lock, so
 * a reader never sees a token in one map and not in another. Queries take the read lock and run concurrently.
 * </p>
 *
 * <p>
 * Prefer creating a registry and passing it to the code that needs it. {@link #instance()} is a process-wide registry
 * for code that cannot be handed one.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class CapabilityRegistry {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityRegistry.class);
    @Nonnull
    private static final Supplier<CapabilityRegistry> INSTANCE = Suppliers.memoize(() ->
            new CapabilityRegistry(CapabilityRegistryConfig.fromSystemProperties().toBuilder()
                    .setLoadProvidedDefinitions(true)
                    .build()));

    @Nonnull
    private final CapabilityRegistryConfig config;
    @Nonnull
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Nonnull
    private final Map<String, CapabilityDefinition> definitions = new LinkedHashMap<>();
    @Nonnull
    private final Set<String> sealed = new HashSet<>();
    @Nonnull
    private final Set<String> localModules = new LinkedHashSet<>();
    // Weak keys compare by identity, which is what a type identity needs.
    @Nonnull
    private final Map<Object, Long> typeTokens = new MapMaker().weakKeys().makeMap();
    @Nonnull
    private final Map<Long, List<ImplementationRecord>> records = new HashMap<>();
    @Nonnull
    private final AtomicLong nextToken = new AtomicLong(1);

    @Nonnull
    private final LongAdder registrations = new LongAdder();
    @Nonnull
    private final LongAdder rejections = new LongAdder();
    @Nonnull
    private final LongAdder lookups = new LongAdder();

    @Nonnull
    private final CapabilityComposer composer;
    @Nonnull
    private final DependencyResolver dependencyResolver;

    public CapabilityRegistry() {
        this(CapabilityRegistryConfig.DEFAULT);
    }

    public CapabilityRegistry(@Nonnull CapabilityRegistryConfig config) {
        this.config = config;
        this.composer = new CapabilityComposer(config.getCompositionCacheSize());
        this.dependencyResolver = new DependencyResolver(this::getCapabilityDefinition);
        this.localModules.addAll(config.getLocalModules());
        if (config.isLoadProvidedDefinitions()) {
            loadProvidedDefinitions();
        }
    }

    /**
     * Get the process-wide registry. It is created on first use from {@link CapabilityRegistryConfig#fromSystemProperties()}
     * with provided definitions loaded.
     * @return the process-wide registry
     */
    @Nonnull
    public static CapabilityRegistry instance() {
        return INSTANCE.get();
    }

    @Nonnull
    public CapabilityRegistryConfig getConfig() {
        return config;
    }

    private void loadProvidedDefinitions() {
        final List<CapabilityDefinitionProvider> providers = ServiceLoaderProvider.loadAll(CapabilityDefinitionProvider.class);
        lock.writeLock().lock();
        try {
            for (CapabilityDefinitionProvider provider : providers) {
                for (CapabilityDefinition definition : provider.getCapabilityDefinitions()) {
                    if (definitions.containsKey(definition.getName())) {
                        if (LOGGER.isWarnEnabled()) {
                            LOGGER.warn(KeyValueLogMessage.of("duplicate provided capability definition",
                                    LogMessageKeys.CAPABILITY, definition.getName(),
                                    LogMessageKeys.PROVIDER, provider.getProviderName()));
                        }
                    } else {
                        definitions.put(definition.getName(), definition);
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Definitions

    /**
     * Register a capability definition. A name that already has a definition is replaced or refused according to
     * the {@linkplain CapabilityRegistryConfig#getRedefinitionPolicy() redefinition policy}. Existing type
     * registrations are kept either way.
     * @param definition the definition
     * @return the registered definition
     * @throws DuplicateCapabilityException if the name is sealed, or is taken and the policy is
     * {@link CapabilityRegistryConfig.RedefinitionPolicy#REJECT}
     */
    @Nonnull
    public CapabilityDefinition registerCapability(@Nonnull CapabilityDefinition definition) {
        final String name = definition.getName();
        lock.writeLock().lock();
        try {
            if (sealed.contains(name)) {
                throw new DuplicateCapabilityException("capability is sealed", ImmutableList.of(name));
            }
            final CapabilityDefinition existing = definitions.get(name);
            if (existing != null && existing != definition) {
                if (config.getRedefinitionPolicy() == CapabilityRegistryConfig.RedefinitionPolicy.REJECT) {
                    throw new DuplicateCapabilityException("capability is already defined", ImmutableList.of(name));
                }
                if (LOGGER.isWarnEnabled()) {
                    LOGGER.warn(KeyValueLogMessage.of("redefining capability",
                            LogMessageKeys.CAPABILITY, name,
                            LogMessageKeys.OLD, existing.getVersion(),
                            LogMessageKeys.NEW, definition.getVersion()));
                }
            } else if (existing == null && LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("registered capability definition",
                        LogMessageKeys.CAPABILITY, name,
                        LogMessageKeys.CAPABILITY_VERSION, definition.getVersion(),
                        LogMessageKeys.MODULE_NAME, definition.getModule()));
            }
            definitions.put(name, definition);
            return definition;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace a definition with a modified copy.
     * @param name the capability
     * @param changes changes applied to a builder initialized from the current definition
     * @return the new definition
     * @throws CapabilityException if the name is unknown
     * @throws SealedCapabilityException if the capability is sealed
     */
    @Nonnull
    public CapabilityDefinition alterCapability(@Nonnull String name, @Nonnull Consumer<CapabilityDefinition.Builder> changes) {
        lock.writeLock().lock();
        try {
            final CapabilityDefinition existing = requireDefinition(name);
            if (sealed.contains(name)) {
                throw new SealedCapabilityException("cannot change members of sealed capability", ImmutableList.of(name));
            }
            final CapabilityDefinition.Builder builder = existing.toBuilder();
            changes.accept(builder);
            final CapabilityDefinition altered = builder.build();
            definitions.put(name, altered);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("altered capability definition",
                        LogMessageKeys.CAPABILITY, name));
            }
            return altered;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Seal a capability so that its definition can no longer change. Types can still be registered. Sealing twice
     * has no further effect.
     * @param name the capability
     * @throws CapabilityException if the name is unknown
     */
    public void seal(@Nonnull String name) {
        lock.writeLock().lock();
        try {
            requireDefinition(name);
            if (sealed.add(name) && LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("sealed capability",
                        LogMessageKeys.CAPABILITY, name));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isSealed(@Nonnull String name) {
        lock.readLock().lock();
        try {
            return sealed.contains(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Nullable
    public CapabilityDefinition getCapabilityDefinition(@Nonnull String name) {
        lock.readLock().lock();
        try {
            return definitions.get(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Nonnull
    public ImmutableSet<String> getCapabilityNames() {
        lock.readLock().lock();
        try {
            return ImmutableSet.copyOf(definitions.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get each capability's direct prerequisites.
     * @return capability name to prerequisite names, in registration order
     */
    @Nonnull
    public ImmutableMap<String, ImmutableSet<String>> getDependencyGraph() {
        lock.readLock().lock();
        try {
            final ImmutableMap.Builder<String, ImmutableSet<String>> graph = ImmutableMap.builderWithExpectedSize(definitions.size());
            for (CapabilityDefinition definition : definitions.values()) {
                graph.put(definition.getName(), definition.getPrerequisites());
            }
            return graph.build();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Nonnull
    public DependencyResolver getDependencyResolver() {
        return dependencyResolver;
    }

    @Nonnull
    public CapabilityComposer getComposer() {
        return composer;
    }

    /**
     * Compose registered capabilities by name.
     * @param names the capabilities, in priority order
     * @param resolver the collision policy
     * @return the composed definition
     * @throws CapabilityException if a name is unknown or the capabilities disagree on a member's kind
     */
    @Nonnull
    public CapabilityDefinition compose(@Nonnull List<String> names, @Nonnull ConflictResolver resolver) {
        final List<CapabilityDefinition> toCompose = new ArrayList<>(names.size());
        lock.readLock().lock();
        try {
            for (String name : names) {
                toCompose.add(requireDefinition(name));
            }
        } finally {
            lock.readLock().unlock();
        }
        return composer.compose(toCompose, resolver);
    }

    @Nonnull
    public CapabilityDefinition compose(@Nonnull String... names) {
        return compose(Arrays.asList(names), ConflictResolver.firstWins());
    }

    @Nonnull
    private CapabilityDefinition requireDefinition(@Nonnull String name) {
        final CapabilityDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new CapabilityException("unknown capability", LogMessageKeys.CAPABILITY, name);
        }
        return definition;
    }

    // Local modules

    public void addLocalModule(@Nonnull String module) {
        Preconditions.checkArgument(!module.isEmpty(), "module name must not be empty");
        lock.writeLock().lock();
        try {
            if (localModules.add(module) && LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("added local module",
                        LogMessageKeys.MODULE_NAME, module));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Nonnull
    public ImmutableSet<String> getLocalModules() {
        lock.readLock().lock();
        try {
            return ImmutableSet.copyOf(localModules);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get a guard over a snapshot of the current local modules.
     * @return a coherence guard
     */
    @Nonnull
    public CoherenceGuard getCoherenceGuard() {
        return new CoherenceGuard(getLocalModules());
    }

    // Registration

    @Nonnull
    public RegistrationResult register(@Nonnull TypeShape type, @Nonnull String capability) {
        return registerAll(type, ImmutableList.of(capability));
    }

    @Nonnull
    public RegistrationResult register(@Nonnull Class<?> type, @Nonnull String capability) {
        return register(TypeShape.of(type), capability);
    }

    /**
     * Register several capabilities on a type at once. Prerequisites may be satisfied by capabilities the type
     * already carries or by others in the same call. Capabilities the type already carries are left as they are,
     * so repeating a registration changes nothing.
     * @param type the type
     * @param capabilities the capability names
     * @return the outcome; on failure the registry is unchanged
     */
    @Nonnull
    public RegistrationResult registerAll(@Nonnull TypeShape type, @Nonnull Collection<String> capabilities) {
        return registerAll(type, capabilities, false);
    }

    /**
     * Register capabilities on a type the caller owns, such as one it has just synthesized. The type counts as local
     * for this registration only, so the coherence check passes without adding its module to the local modules.
     * Structural and dependency checks run as usual.
     * @param type the owned type
     * @param capabilities the capability names
     * @return the outcome; on failure the registry is unchanged
     */
    @Nonnull
    public RegistrationResult registerOwnedType(@Nonnull TypeShape type, @Nonnull Collection<String> capabilities) {
        return registerAll(type, capabilities, true);
    }

    @Nonnull
    private RegistrationResult registerAll(@Nonnull TypeShape type, @Nonnull Collection<String> capabilities,
                                           boolean ownedType) {
        Preconditions.checkArgument(!capabilities.isEmpty(), "no capabilities to register");
        Preconditions.checkArgument(type.isLive(), "cannot register capabilities on a retired type");
        final List<String> requested = ImmutableList.copyOf(new LinkedHashSet<>(capabilities));
        lock.writeLock().lock();
        try {
            final List<String> unknown = new ArrayList<>();
            final List<CapabilityDefinition> requestedDefinitions = new ArrayList<>(requested.size());
            for (String name : requested) {
                final CapabilityDefinition definition = definitions.get(name);
                if (definition == null) {
                    unknown.add(name);
                } else {
                    requestedDefinitions.add(definition);
                }
            }
            if (!unknown.isEmpty()) {
                return reject(type, requested, RejectionReason.DEPENDENCY, CheckResult.of(unknown), "unknown capability");
            }

            final Long existingToken = typeTokens.get(type.getIdentity());
            final List<ImplementationRecord> existing = existingToken == null
                                                        ? Collections.emptyList()
                                                        : records.getOrDefault(existingToken, Collections.emptyList());
            final Map<String, ImplementationRecord> carried = new LinkedHashMap<>();
            for (ImplementationRecord record : existing) {
                carried.put(record.getCapabilityName(), record);
            }
            final List<CapabilityDefinition> toAdd = new ArrayList<>();
            for (CapabilityDefinition definition : requestedDefinitions) {
                if (!carried.containsKey(definition.getName())) {
                    toAdd.add(definition);
                }
            }

            if (!toAdd.isEmpty()) {
                final Set<String> missingMembers = new LinkedHashSet<>();
                for (CapabilityDefinition definition : toAdd) {
                    missingMembers.addAll(StructuralValidator.validate(type, definition).getNames());
                }
                if (!missingMembers.isEmpty()) {
                    return reject(type, requested, RejectionReason.STRUCTURAL, CheckResult.of(missingMembers),
                            "type is missing required members");
                }

                if (!ownedType) {
                    final CoherenceGuard guard = new CoherenceGuard(localModules);
                    for (CapabilityDefinition definition : toAdd) {
                        final CheckResult coherence = guard.validate(type, definition);
                        if (!coherence.isOk()) {
                            return reject(type, requested, RejectionReason.COHERENCE, coherence,
                                    "neither type nor capability is local");
                        }
                    }
                }

                final List<String> adding = toAdd.stream().map(CapabilityDefinition::getName).collect(ImmutableList.toImmutableList());
                final Set<String> available = new HashSet<>(carried.keySet());
                available.addAll(adding);
                final CheckResult dependencies = dependencyResolver.resolve(adding, available);
                if (!dependencies.isOk()) {
                    return reject(type, requested, RejectionReason.DEPENDENCY, dependencies,
                            "missing prerequisite capabilities");
                }

                final long token = existingToken == null ? nextToken.getAndIncrement() : existingToken;
                if (existingToken == null) {
                    typeTokens.put(type.getIdentity(), token);
                }
                final List<ImplementationRecord> tokenRecords = records.computeIfAbsent(token, t -> new ArrayList<>());
                final Instant now = Instant.now();
                for (String name : adding) {
                    final ImplementationRecord record = new ImplementationRecord(name, type, now, token);
                    tokenRecords.add(record);
                    carried.put(name, record);
                }
                registrations.add(adding.size());
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("registered capabilities",
                            LogMessageKeys.TYPE_NAME, type.getTypeName(),
                            LogMessageKeys.CAPABILITIES, adding,
                            LogMessageKeys.TYPE_TOKEN, token));
                }
            }

            final List<ImplementationRecord> result = new ArrayList<>(requested.size());
            for (String name : requested) {
                result.add(carried.get(name));
            }
            return RegistrationResult.success(type.getTypeName(), requested, result);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Nonnull
    public RegistrationResult registerAll(@Nonnull Class<?> type, @Nonnull Collection<String> capabilities) {
        return registerAll(TypeShape.of(type), capabilities);
    }

    /**
     * Register capabilities and throw if the registration is rejected.
     * @param type the type
     * @param capabilities the capability names
     * @return the successful outcome
     * @throws CapabilityRegistrationException the exception matching the rejection reason
     */
    @Nonnull
    public RegistrationResult registerOrThrow(@Nonnull TypeShape type, @Nonnull String... capabilities) {
        return registerAll(type, Arrays.asList(capabilities)).orElseThrow();
    }

    @Nonnull
    private RegistrationResult reject(@Nonnull TypeShape type, @Nonnull List<String> requested,
                                      @Nonnull RejectionReason reason, @Nonnull CheckResult check,
                                      @Nonnull String message) {
        rejections.increment();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("rejected capability registration",
                    LogMessageKeys.TYPE_NAME, type.getTypeName(),
                    LogMessageKeys.CAPABILITIES, requested,
                    LogMessageKeys.REASON, reason.getCode(),
                    LogMessageKeys.MISSING, check.getNames()));
        }
        return RegistrationResult.failure(type.getTypeName(), requested, reason, check, message);
    }

    // Queries

    /**
     * Whether a type carries a capability. A type that was never registered for the capability is checked
     * structurally instead, unless the structural fallback is disabled. Such a type skips the coherence and
     * dependency checks.
     * @param type the type
     * @param capability the capability name
     * @return {@code true} if the type carries or structurally satisfies the capability
     */
    public boolean hasCapability(@Nonnull TypeShape type, @Nonnull String capability) {
        lookups.increment();
        final CapabilityDefinition definition;
        lock.readLock().lock();
        try {
            definition = definitions.get(capability);
            if (definition == null) {
                return false;
            }
            final ImplementationRecord record = findRecord(type, capability);
            if (record != null) {
                return true;
            }
        } finally {
            lock.readLock().unlock();
        }
        return config.isStructuralFallback() && StructuralValidator.satisfies(type, definition);
    }

    public boolean hasCapability(@Nonnull Class<?> type, @Nonnull String capability) {
        return hasCapability(TypeShape.of(type), capability);
    }

    /**
     * Get the capabilities explicitly registered on a type, in registration order.
     * @param type the type
     * @return the capability names, empty if the type is unknown or retired
     */
    @Nonnull
    public ImmutableSet<String> getCapabilities(@Nonnull TypeShape type) {
        lock.readLock().lock();
        try {
            final ImmutableSet.Builder<String> names = ImmutableSet.builder();
            for (ImplementationRecord record : liveRecords(type)) {
                names.add(record.getCapabilityName());
            }
            return names.build();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Nonnull
    public ImmutableSet<String> getCapabilities(@Nonnull Class<?> type) {
        return getCapabilities(TypeShape.of(type));
    }

    @Nullable
    public ImplementationRecord getImplementationRecord(@Nonnull TypeShape type, @Nonnull String capability) {
        lock.readLock().lock();
        try {
            return findRecord(type, capability);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Nullable
    private ImplementationRecord findRecord(@Nonnull TypeShape type, @Nonnull String capability) {
        for (ImplementationRecord record : liveRecords(type)) {
            if (record.getCapabilityName().equals(capability)) {
                return record;
            }
        }
        return null;
    }

    @Nonnull
    private List<ImplementationRecord> liveRecords(@Nonnull TypeShape type) {
        if (!type.isLive()) {
            return Collections.emptyList();
        }
        final Long token = typeTokens.get(type.getIdentity());
        if (token == null) {
            return Collections.emptyList();
        }
        return records.getOrDefault(token, Collections.emptyList());
    }

    @Nonnull
    public CapabilityRegistryStats getPerformanceStats() {
        final CacheStats cacheStats = composer.getCacheStats();
        lock.readLock().lock();
        try {
            long active = 0;
            for (List<ImplementationRecord> tokenRecords : records.values()) {
                for (ImplementationRecord record : tokenRecords) {
                    if (!record.isStale()) {
                        active++;
                    }
                }
            }
            return new CapabilityRegistryStats(registrations.sum(), rejections.sum(), lookups.sum(), active,
                    records.size(), definitions.size(), sealed.size(),
                    cacheStats.hitCount(), cacheStats.missCount(), composer.getCacheSize());
        } finally {
            lock.readLock().unlock();
        }
    }

    // Cleanup

    /**
     * Remove every record whose type has been reclaimed or retired. Each record is resolved at the moment it is
     * examined. Types left without records lose their token.
     * @return the number of records removed
     */
    public int cleanupOrphanedReferences() {
        int removed = 0;
        lock.writeLock().lock();
        try {
            final Iterator<Map.Entry<Long, List<ImplementationRecord>>> tokens = records.entrySet().iterator();
            while (tokens.hasNext()) {
                final Map.Entry<Long, List<ImplementationRecord>> entry = tokens.next();
                final Iterator<ImplementationRecord> tokenRecords = entry.getValue().iterator();
                while (tokenRecords.hasNext()) {
                    if (tokenRecords.next().resolve() == null) {
                        tokenRecords.remove();
                        removed++;
                    }
                }
                if (entry.getValue().isEmpty()) {
                    tokens.remove();
                    typeTokens.values().removeIf(token -> token.equals(entry.getKey()));
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0 && LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("removed orphaned capability registrations",
                    LogMessageKeys.COUNT, removed));
        }
        return removed;
    }

    /**
     * Remove every registration of a type, for use when its owner tears it down.
     * @param type the type
     * @return the number of records removed
     */
    public int unregister(@Nonnull TypeShape type) {
        lock.writeLock().lock();
        try {
            final Long token = typeTokens.remove(type.getIdentity());
            if (token == null) {
                return 0;
            }
            final List<ImplementationRecord> removed = records.remove(token);
            final int count = removed == null ? 0 : removed.size();
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("unregistered type",
                        LogMessageKeys.TYPE_NAME, type.getTypeName(),
                        LogMessageKeys.TYPE_TOKEN, token,
                        LogMessageKeys.RECORDS, count));
            }
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Return the registry to its initial state: only configured local modules and, if configured, provided
     * definitions. Counters and caches are cleared.
     */
    @VisibleForTesting
    public void reset() {
        lock.writeLock().lock();
        try {
            definitions.clear();
            sealed.clear();
            localModules.clear();
            localModules.addAll(config.getLocalModules());
            typeTokens.clear();
            records.clear();
            registrations.reset();
            rejections.reset();
            lookups.reset();
            composer.clearCache();
        } finally {
            lock.writeLock().unlock();
        }
        if (config.isLoadProvidedDefinitions()) {
            loadProvidedDefinitions();
        }
    }
}
