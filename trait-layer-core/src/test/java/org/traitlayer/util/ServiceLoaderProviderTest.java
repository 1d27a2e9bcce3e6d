/*
 * ServiceLoaderProviderTest.java
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

package org.traitlayer.util;

import org.junit.jupiter.api.Test;
import org.traitlayer.capability.CapabilityDefinitionProvider;
import org.traitlayer.capability.standard.StandardCapabilityProvider;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ServiceLoaderProvider}.
 */
public class ServiceLoaderProviderTest {

    @Test
    public void findsStandardProvider() {
        final List<CapabilityDefinitionProvider> providers = ServiceLoaderProvider.loadAll(CapabilityDefinitionProvider.class);
        assertTrue(providers.stream().anyMatch(StandardCapabilityProvider.class::isInstance));
    }

    @Test
    public void loaderFixedOnceUsed() {
        ServiceLoaderProvider.loadAll(CapabilityDefinitionProvider.class);
        // Re-installing the loader already in use is allowed.
        ServiceLoaderProvider.initialize(ServiceLoaderProvider.DEFAULT_LOADER);
        assertThrows(IllegalStateException.class, () -> ServiceLoaderProvider.initialize(clazz -> List.of()));
    }
}
