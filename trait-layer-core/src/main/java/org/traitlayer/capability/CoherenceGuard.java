/*
 * CoherenceGuard.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.traitlayer.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;

/**
 * Enforces the orphan rule: a capability may be attached to a type only if the type or the capability is local,
 * meaning declared in one of the registrant's own modules. Two unrelated code bases thus cannot both attach
 * expectations to the same foreign type through a foreign capability.
 *
 * <p>
 * A module is local if it equals one of the local modules or lies below one, so {@code com.acme} covers
 * {@code com.acme.model}. A capability without a module was declared by the registrant and is always local.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class CoherenceGuard {
    @Nonnull
    private final ImmutableSet<String> localModules;

    public CoherenceGuard(@Nonnull Collection<String> localModules) {
        this.localModules = ImmutableSet.copyOf(localModules);
    }

    @Nonnull
    public ImmutableSet<String> getLocalModules() {
        return localModules;
    }

    public boolean isLocalModule(@Nullable String module) {
        if (module == null) {
            return false;
        }
        for (String local : localModules) {
            if (module.equals(local) || module.startsWith(local + ".")) {
                return true;
            }
        }
        return false;
    }

    public boolean isLocal(@Nonnull TypeShape type) {
        return isLocalModule(type.getModuleName());
    }

    public boolean isLocal(@Nonnull CapabilityDefinition definition) {
        return definition.getModule() == null || isLocalModule(definition.getModule());
    }

    /**
     * Check whether the capability may be attached to the type.
     * @param type the candidate type
     * @param definition the capability
     * @return a passed result, or a failed one naming the type and the capability
     */
    @Nonnull
    public CheckResult validate(@Nonnull TypeShape type, @Nonnull CapabilityDefinition definition) {
        if (isLocal(type) || isLocal(definition)) {
            return CheckResult.passed();
        }
        return CheckResult.of(ImmutableList.of(type.getTypeName(), definition.getName()));
    }
}
