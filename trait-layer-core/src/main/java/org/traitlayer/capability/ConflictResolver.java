/*
 * ConflictResolver.java
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

import org.traitlayer.annotation.API;
import org.traitlayer.field.FieldTemplate;

import javax.annotation.Nonnull;

/**
 * Decides which definition wins when several composed capabilities contribute a field or behavior of the same name.
 * The {@code owner} is the capability contributing the candidate.
 */
@API(API.Status.UNSTABLE)
@FunctionalInterface
public interface ConflictResolver {
    @Nonnull
    FieldTemplate resolveField(@Nonnull String name, @Nonnull FieldTemplate previous,
                               @Nonnull FieldTemplate candidate, @Nonnull CapabilityDefinition owner);

    /**
     * Resolve a behavior collision. Keeps the earlier behavior unless overridden.
     * @param name behavior name
     * @param previous the behavior seen first
     * @param candidate the behavior contributed by {@code owner}
     * @param owner the capability contributing {@code candidate}
     * @return the behavior to keep
     */
    @Nonnull
    default Behavior resolveBehavior(@Nonnull String name, @Nonnull Behavior previous,
                                     @Nonnull Behavior candidate, @Nonnull CapabilityDefinition owner) {
        return previous;
    }

    /**
     * The default policy: the capability listed first keeps its field and behavior.
     * @return a resolver keeping the earliest contribution
     */
    @Nonnull
    static ConflictResolver firstWins() {
        return Policies.FIRST_WINS;
    }

    /**
     * The capability listed last replaces earlier fields and behaviors.
     * @return a resolver keeping the latest contribution
     */
    @Nonnull
    static ConflictResolver lastWins() {
        return Policies.LAST_WINS;
    }

    /**
     * Shared instances of the built-in policies.
     */
    final class Policies {
        static final ConflictResolver FIRST_WINS = (name, previous, candidate, owner) -> previous;
        static final ConflictResolver LAST_WINS = new ConflictResolver() {
            @Nonnull
            @Override
            public FieldTemplate resolveField(@Nonnull String name, @Nonnull FieldTemplate previous,
                                              @Nonnull FieldTemplate candidate, @Nonnull CapabilityDefinition owner) {
                return candidate;
            }

            @Nonnull
            @Override
            public Behavior resolveBehavior(@Nonnull String name, @Nonnull Behavior previous,
                                            @Nonnull Behavior candidate, @Nonnull CapabilityDefinition owner) {
                return candidate;
            }
        };

        private Policies() {
        }
    }
}
