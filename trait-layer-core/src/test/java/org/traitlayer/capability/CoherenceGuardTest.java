/*
 * CoherenceGuardTest.java
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

import org.junit.jupiter.api.Test;
import org.traitlayer.test.MutableShape;

import java.time.Duration;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CoherenceGuard}.
 */
public class CoherenceGuardTest {
    private static final CapabilityDefinition VENDOR = CapabilityDefinition.newBuilder("serializable")
            .setModule("com.vendor.caps")
            .build();
    private static final CapabilityDefinition OWN = CapabilityDefinition.newBuilder("printable")
            .setModule("com.example.app.caps")
            .build();
    private static final CapabilityDefinition UNOWNED = CapabilityDefinition.newBuilder("inline").build();

    private final CoherenceGuard guard = new CoherenceGuard(List.of("com.example.app"));

    @Test
    public void moduleMatching() {
        assertTrue(guard.isLocalModule("com.example.app"));
        assertTrue(guard.isLocalModule("com.example.app.model"));
        assertFalse(guard.isLocalModule("com.example.application"));
        assertFalse(guard.isLocalModule("com.example"));
        assertFalse(guard.isLocalModule(null));
    }

    @Test
    public void foreignTypeWithForeignCapability() {
        final CheckResult result = guard.validate(ClassShape.of(Duration.class), VENDOR);
        assertFalse(result.isOk());
        assertThat(result.getNames(), contains("java.time.Duration", "serializable"));
    }

    @Test
    public void foreignTypeWithLocalCapability() {
        assertTrue(guard.validate(ClassShape.of(Duration.class), OWN).isOk());
    }

    @Test
    public void localTypeWithForeignCapability() {
        assertTrue(guard.validate(new MutableShape("Invoice", "com.example.app.billing"), VENDOR).isOk());
    }

    @Test
    public void capabilityWithoutModuleIsLocal() {
        assertTrue(guard.isLocal(UNOWNED));
        assertTrue(guard.validate(ClassShape.of(Duration.class), UNOWNED).isOk());
    }

    @Test
    public void typeWithoutModuleIsForeign() {
        final MutableShape anonymous = new MutableShape("Anonymous", null);
        assertFalse(guard.isLocal(anonymous));
        assertFalse(guard.validate(anonymous, VENDOR).isOk());
    }

    @Test
    public void noLocalModules() {
        final CoherenceGuard empty = new CoherenceGuard(List.of());
        assertFalse(empty.validate(new MutableShape("Invoice", "com.example.app"), VENDOR).isOk());
        assertTrue(empty.validate(new MutableShape("Invoice", "com.example.app"), UNOWNED).isOk());
    }
}
