/*
 * CapabilityDefinitionProvider.java
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

import javax.annotation.Nonnull;
import java.util.Collection;

/**
 * A source of capability definitions, discovered through {@link org.traitlayer.util.ServiceLoaderProvider} when a
 * registry is configured to {@linkplain CapabilityRegistryConfig#isLoadProvidedDefinitions() load provided
 * definitions}.
 *
 * <p>
 * Implementations are usually registered with {@code @AutoService(CapabilityDefinitionProvider.class)}. When two
 * providers supply the same name, the first one loaded wins and the other is logged and ignored.
 * </p>
 */
@API(API.Status.UNSTABLE)
public interface CapabilityDefinitionProvider {
    /**
     * A name for this provider, used in log messages.
     * @return the provider name
     */
    @Nonnull
    default String getProviderName() {
        return getClass().getName();
    }

    @Nonnull
    Collection<CapabilityDefinition> getCapabilityDefinitions();
}
