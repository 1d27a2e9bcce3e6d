/*
 * DependencyResolverTest.java
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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DependencyResolver}.
 */
public class DependencyResolverTest {
    private static final Map<String, CapabilityDefinition> DEFINITIONS = ImmutableMap.of(
            "identifiable", CapabilityDefinition.newBuilder("identifiable").build(),
            "temporal", CapabilityDefinition.newBuilder("temporal").build(),
            "auditable", CapabilityDefinition.newBuilder("auditable").addPrerequisite("identifiable", "temporal").build(),
            "reviewed", CapabilityDefinition.newBuilder("reviewed").addPrerequisite("auditable").build(),
            "ping", CapabilityDefinition.newBuilder("ping").addPrerequisite("pong").build(),
            "pong", CapabilityDefinition.newBuilder("pong").addPrerequisite("ping").build());

    private final DependencyResolver resolver = new DependencyResolver(DEFINITIONS::get);

    @Test
    public void closureIsTransitive() {
        assertThat(resolver.closure(List.of("reviewed")), contains("reviewed", "auditable", "identifiable", "temporal"));
    }

    @Test
    public void closureToleratesCycles() {
        assertThat(resolver.closure(List.of("ping")), containsInAnyOrder("ping", "pong"));
        assertTrue(resolver.resolve(List.of("ping", "pong")).isOk());
        assertThat(resolver.resolve(List.of("ping")).getNames(), contains("pong"));
    }

    @Test
    public void closureKeepsUnknownNames() {
        assertThat(resolver.closure(List.of("unknown", "temporal")), contains("unknown", "temporal"));
    }

    @Test
    public void missingTransitivePrerequisites() {
        final CheckResult result = resolver.resolve(List.of("reviewed"));
        assertFalse(result.isOk());
        assertThat(result.getNames(), contains("auditable", "identifiable", "temporal"));
    }

    @Test
    public void closedSetPasses() {
        assertTrue(resolver.resolve(List.of("identifiable", "temporal", "auditable")).isOk());
    }

    @Test
    public void availableCapabilitiesCount() {
        assertTrue(resolver.resolve(List.of("auditable"), List.of("identifiable", "temporal")).isOk());
        assertThat(resolver.resolve(List.of("auditable"), List.of("identifiable")).getNames(), contains("temporal"));
    }
}
