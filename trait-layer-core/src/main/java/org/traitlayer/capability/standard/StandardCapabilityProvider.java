/*
 * StandardCapabilityProvider.java
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

package org.traitlayer.capability.standard;

import com.google.auto.service.AutoService;
import org.traitlayer.annotation.API;
import org.traitlayer.capability.CapabilityDefinition;
import org.traitlayer.capability.CapabilityDefinitionProvider;

import javax.annotation.Nonnull;
import java.util.Collection;

/**
 * Supplies the {@linkplain StandardCapabilities built-in capabilities} to registries that load provided definitions.
 */
@AutoService(CapabilityDefinitionProvider.class)
@API(API.Status.INTERNAL)
public class StandardCapabilityProvider implements CapabilityDefinitionProvider {
    @Nonnull
    @Override
    public String getProviderName() {
        return "standard";
    }

    @Nonnull
    @Override
    public Collection<CapabilityDefinition> getCapabilityDefinitions() {
        return StandardCapabilities.all();
    }
}
