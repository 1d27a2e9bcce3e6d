/*
 * DependencyResolver.java
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

import com.google.common.collect.ImmutableSet;
import org.traitlayer.annotation.API;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Checks that a set of capabilities carries all of its transitive prerequisites. Missing prerequisites are reported,
 * never added.
 */
@API(API.Status.UNSTABLE)
public class DependencyResolver {
    @Nonnull
    private final Function<String, CapabilityDefinition> lookup;

    /**
     * Create a resolver over the given definitions.
     * @param lookup maps a capability name to its definition, or to {@code null} if unknown
     */
    public DependencyResolver(@Nonnull Function<String, CapabilityDefinition> lookup) {
        this.lookup = lookup;
    }

    /**
     * Compute the given names plus all of their transitive prerequisites, in discovery order. Unknown names are
     * included but contribute no prerequisites. Cycles are tolerated.
     * @param names the starting capabilities
     * @return the closure
     */
    @Nonnull
    public ImmutableSet<String> closure(@Nonnull Collection<String> names) {
        final Set<String> seen = new LinkedHashSet<>(names);
        final Deque<String> pending = new ArrayDeque<>(names);
        while (!pending.isEmpty()) {
            final CapabilityDefinition definition = lookup.apply(pending.poll());
            if (definition == null) {
                continue;
            }
            for (String prerequisite : definition.getPrerequisites()) {
                if (seen.add(prerequisite)) {
                    pending.add(prerequisite);
                }
            }
        }
        return ImmutableSet.copyOf(seen);
    }

    /**
     * Check that a requested set is closed under prerequisites.
     * @param requested the capabilities requested together
     * @return a passed result, or a failed one naming every prerequisite outside {@code requested}
     */
    @Nonnull
    public CheckResult resolve(@Nonnull Collection<String> requested) {
        return resolve(requested, requested);
    }

    /**
     * Check that every transitive prerequisite of {@code requested} is in {@code available}.
     * @param requested the capabilities being added
     * @param available the capabilities already carried or added at the same time
     * @return a passed result, or a failed one naming every missing prerequisite
     */
    @Nonnull
    public CheckResult resolve(@Nonnull Collection<String> requested, @Nonnull Collection<String> available) {
        final Set<String> missing = new TreeSet<>();
        for (String name : closure(requested)) {
            if (!requested.contains(name) && !available.contains(name)) {
                missing.add(name);
            }
        }
        return CheckResult.of(missing);
    }
}
