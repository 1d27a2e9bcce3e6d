/*
 * CapabilityComposer.java
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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.traitlayer.annotation.API;
import org.traitlayer.field.FieldTemplate;
import org.traitlayer.logging.KeyValueLogMessage;
import org.traitlayer.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges several capability definitions into one.
 *
 * <p>
 * Definitions are visited in the order given. The result requires every member any input requires, allows the other
 * members any input allows, and carries the union of the inputs' prerequisites less the inputs themselves. Fields and
 * behaviors keep the order in which their names first appear. When a name is contributed a second time, the
 * {@link ConflictResolver} decides which contribution is kept, so the set of names never depends on input order while
 * the winning templates may. A member that is an attribute in one input and a callable in another cannot be merged
 * and fails the composition.
 * </p>
 *
 * <p>
 * Composition only reads definitions. Results are cached by the exact list of input definitions and the resolver, so
 * repeating a request returns the identical object.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class CapabilityComposer {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityComposer.class);
    private static final Joiner NAME_JOINER = Joiner.on('+');

    @Nonnull
    private final Cache<CompositionKey, CapabilityDefinition> cache;

    public CapabilityComposer(long maximumCacheSize) {
        Preconditions.checkArgument(maximumCacheSize >= 0, "cache size must not be negative");
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maximumCacheSize)
                .recordStats()
                .build();
    }

    @Nonnull
    public CapabilityDefinition compose(@Nonnull CapabilityDefinition... definitions) {
        return compose(Arrays.asList(definitions), ConflictResolver.firstWins());
    }

    /**
     * Compose definitions, resolving name collisions with the given policy.
     * @param definitions the definitions, in priority order for {@link ConflictResolver#firstWins()}
     * @param resolver the collision policy
     * @return the merged definition, named by joining the input names with {@code +}
     * @throws CapabilityException if a member is an attribute in one definition and a callable in another
     */
    @Nonnull
    public CapabilityDefinition compose(@Nonnull List<CapabilityDefinition> definitions,
                                        @Nonnull ConflictResolver resolver) {
        Preconditions.checkArgument(!definitions.isEmpty(), "nothing to compose");
        final CompositionKey key = new CompositionKey(ImmutableList.copyOf(definitions), resolver);
        synchronized (cache) {
            CapabilityDefinition composed = cache.getIfPresent(key);
            if (composed == null) {
                composed = merge(key.definitions, resolver);
                cache.put(key, composed);
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("composed capabilities",
                            LogMessageKeys.CAPABILITY, composed.getName(),
                            LogMessageKeys.CACHE_SIZE, cache.size()));
                }
            }
            return composed;
        }
    }

    @Nonnull
    private static CapabilityDefinition merge(@Nonnull List<CapabilityDefinition> definitions,
                                              @Nonnull ConflictResolver resolver) {
        final List<String> names = definitions.stream().map(CapabilityDefinition::getName).collect(ImmutableList.toImmutableList());
        checkMemberKinds(definitions);
        final Map<String, FieldTemplate> fields = new LinkedHashMap<>();
        final Map<String, Behavior> behaviors = new LinkedHashMap<>();
        final Set<String> prerequisites = new LinkedHashSet<>();
        for (CapabilityDefinition definition : definitions) {
            definition.getFields().forEach((name, template) ->
                    fields.merge(name, template, (previous, candidate) -> resolver.resolveField(name, previous, candidate, definition)));
            definition.getBehaviors().forEach((name, behavior) ->
                    behaviors.merge(name, behavior, (previous, candidate) -> resolver.resolveBehavior(name, previous, candidate, definition)));
            prerequisites.addAll(definition.getPrerequisites());
        }
        prerequisites.removeAll(names);

        final CapabilityDefinition.Builder builder = CapabilityDefinition.newBuilder(NAME_JOINER.join(names))
                .setDescription("Composition of " + String.join(", ", names))
                .setModule(commonModule(definitions))
                .setComposedFrom(names)
                .addPrerequisites(prerequisites);
        for (CapabilityDefinition definition : definitions) {
            for (Member member : definition.getRequiredMembers()) {
                builder.addRequiredMember(member.getName(), member.getKind());
            }
        }
        for (CapabilityDefinition definition : definitions) {
            for (Member member : definition.getOptionalMembers()) {
                builder.addOptionalMember(member.getName(), member.getKind());
            }
        }
        // Members were added above; these only record templates and implementations.
        fields.forEach((name, template) -> {
            if (isRequiredAnywhere(definitions, name)) {
                builder.addRequiredField(name, template);
            } else {
                builder.addOptionalField(name, template);
            }
        });
        behaviors.forEach(builder::addBehavior);
        return builder.build();
    }

    /**
     * A member name must mean the same kind of member in every input. Neither kind can stand in for the other, so
     * there is nothing for a {@link ConflictResolver} to choose between.
     */
    private static void checkMemberKinds(@Nonnull List<CapabilityDefinition> definitions) {
        final Map<String, Member> seen = new HashMap<>();
        final Map<String, String> owners = new HashMap<>();
        for (CapabilityDefinition definition : definitions) {
            for (Member member : Iterables.concat(definition.getRequiredMembers(), definition.getOptionalMembers())) {
                final Member previous = seen.putIfAbsent(member.getName(), member);
                if (previous == null) {
                    owners.put(member.getName(), definition.getName());
                } else if (previous.getKind() != member.getKind()) {
                    throw new CapabilityException("member kinds conflict",
                            LogMessageKeys.MEMBER_NAME, member.getName(),
                            LogMessageKeys.CONFLICTING, ImmutableList.of(owners.get(member.getName()), definition.getName()));
                }
            }
        }
    }

    private static boolean isRequiredAnywhere(@Nonnull List<CapabilityDefinition> definitions, @Nonnull String name) {
        for (CapabilityDefinition definition : definitions) {
            if (definition.isRequired(name)) {
                return true;
            }
        }
        return false;
    }

    @Nullable
    private static String commonModule(@Nonnull List<CapabilityDefinition> definitions) {
        final String module = definitions.get(0).getModule();
        for (CapabilityDefinition definition : definitions) {
            if (!Objects.equals(module, definition.getModule())) {
                return null;
            }
        }
        return module;
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

    /**
     * Cache key. Definitions compare by identity, so a redefined capability never hits an entry built from its
     * previous definition.
     */
    private static final class CompositionKey {
        @Nonnull
        private final ImmutableList<CapabilityDefinition> definitions;
        @Nonnull
        private final ConflictResolver resolver;

        CompositionKey(@Nonnull ImmutableList<CapabilityDefinition> definitions, @Nonnull ConflictResolver resolver) {
            this.definitions = definitions;
            this.resolver = resolver;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            CompositionKey that = (CompositionKey)o;
            return definitions.equals(that.definitions) && resolver.equals(that.resolver);
        }

        @Override
        public int hashCode() {
            return Objects.hash(definitions, resolver);
        }
    }
}
