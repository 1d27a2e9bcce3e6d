/*
 * CapabilityModelBuilderTest.java
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

package org.traitlayer.model;

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.traitlayer.capability.CapabilityDefinition;
import org.traitlayer.capability.CapabilityException;
import org.traitlayer.capability.CapabilityRegistry;
import org.traitlayer.capability.ConflictResolver;
import org.traitlayer.capability.DependencyViolationException;
import org.traitlayer.capability.MemberKind;
import org.traitlayer.capability.StructuralViolationException;
import org.traitlayer.capability.standard.StandardCapabilities;
import org.traitlayer.field.FieldTemplate;
import org.traitlayer.field.FieldValidationException;
import org.traitlayer.test.LogAppenderRule;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CapabilityModelBuilder}.
 */
public class CapabilityModelBuilderTest {
    private static final FieldTemplate LABEL = FieldTemplate.of(String.class);
    private static final FieldTemplate SHORT_LABEL = FieldTemplate.of(String.class).withValidator(value -> ((String)value).length() <= 3);

    @RegisterExtension
    final LogAppenderRule logs = new LogAppenderRule("CapabilityModelBuilderTestLogs", CapabilityModelBuilder.class, Level.DEBUG);

    private CapabilityRegistry registry;
    private ModelFactory factory;

    @BeforeEach
    public void setUp() {
        registry = new CapabilityRegistry();
        for (CapabilityDefinition definition : StandardCapabilities.all()) {
            registry.registerCapability(definition);
        }
        registry.registerCapability(CapabilityDefinition.newBuilder("labeled")
                .addRequiredField("label", LABEL)
                .build());
        registry.registerCapability(CapabilityDefinition.newBuilder("short_labeled")
                .addRequiredField("label", SHORT_LABEL)
                .build());
        factory = new ModelFactory();
    }

    @Test
    public void buildAndRegister() {
        final ModelType user = new CapabilityModelBuilder(registry, factory)
                .setName("User")
                .addCapabilities("identifiable", "temporal")
                .addField("email", FieldTemplate.of(String.class))
                .build();
        assertThat(user.getSchema().getFieldNames(), contains("id", "created_at", "updated_at", "email"));
        assertThat(user.getSchema().getMetadata(), hasEntry("capabilities", (Object)List.of("identifiable", "temporal")));
        assertThat(registry.getCapabilities(user), contains("identifiable", "temporal"));
        assertThat(registry.getLocalModules(), empty());
        assertFalse(registry.getCoherenceGuard().isLocal(user));
        assertEquals("user@example.com", user.newInstance(Map.of("email", "user@example.com")).get("email"));
        assertThat(logs.getLastLogEventMessage(), containsString("built capability model"));
        assertThat(logs.getLastLogEventMessage(), containsString("schema=\"User\""));
    }

    @Test
    public void rebuildingReturnsTheSameType() {
        final CapabilityModelBuilder builder = new CapabilityModelBuilder(registry, factory)
                .setName("Post")
                .addCapabilities("identifiable", "taggable");
        final ModelType first = builder.build();
        assertThat(builder.build(), sameInstance(first));
        assertThat(registry.getPerformanceStats().getRegistrations(), equalTo(2L));
    }

    @Test
    public void missingPrerequisites() {
        DependencyViolationException e = assertThrows(DependencyViolationException.class,
                () -> new CapabilityModelBuilder(registry, factory).addCapabilities("identifiable", "auditable").build());
        assertThat(e.getMessage(), containsString("missing prerequisite capabilities: temporal"));
        assertThat(e.getNames(), contains("temporal"));
        assertThat(factory.getCacheSize(), equalTo(0L));
    }

    @Test
    public void unknownCapability() {
        CapabilityException e = assertThrows(CapabilityException.class,
                () -> new CapabilityModelBuilder(registry, factory).addCapabilities("nope").build());
        assertThat(e.getMessage(), containsString("unknown capability"));
    }

    @Test
    public void withoutCapabilities() {
        final ModelType plain = new CapabilityModelBuilder(registry, factory)
                .addField("label", LABEL)
                .addBehavior("shout", (target, args) -> ((String)target.get("label")).toUpperCase())
                .build();
        assertThat(plain.getName(), equalTo("Model"));
        assertThat(registry.getCapabilities(plain), empty());
        assertFalse(registry.getLocalModules().contains(ModelFactory.DEFAULT_MODULE));
        assertEquals("HI", plain.newInstance(Map.of("label", "hi")).invoke("shout"));
        assertTrue(registry.hasCapability(plain, "labeled"));
    }

    @Test
    public void extraFieldReplacesCapabilityField() {
        final ModelType type = new CapabilityModelBuilder(registry, factory)
                .addCapabilities("versionable")
                .addField("version", FieldTemplate.of(Integer.class).withDefault(7))
                .build();
        assertEquals(7, type.newInstance().get("version"));
    }

    @Test
    public void conflictResolution() {
        final ModelType firstWins = new CapabilityModelBuilder(registry, factory)
                .setName("First")
                .addCapabilities("labeled", "short_labeled")
                .build();
        assertThat(firstWins.getSchema().getField("label"), sameInstance(LABEL));
        firstWins.newInstance(Map.of("label", "long label"));

        final ModelType lastWins = new CapabilityModelBuilder(registry, factory)
                .setName("Last")
                .addCapabilities("labeled", "short_labeled")
                .setConflictResolver(ConflictResolver.lastWins())
                .build();
        assertThat(lastWins.getSchema().getField("label"), sameInstance(SHORT_LABEL));
        assertThrows(FieldValidationException.class, () -> lastWins.newInstance(Map.of("label", "long label")));
    }

    @Test
    public void rejectedBuildLeavesRegistryUnchanged() {
        registry.registerCapability(CapabilityDefinition.newBuilder("keyed")
                .setModule("com.vendor.caps")
                .addRequiredMember("key", MemberKind.ATTRIBUTE)
                .build());
        StructuralViolationException e = assertThrows(StructuralViolationException.class,
                () -> new CapabilityModelBuilder(registry, factory).addCapabilities("keyed").build());
        assertThat(e.getNames(), contains("key"));
        assertThat(registry.getLocalModules(), empty());
        assertThat(registry.getPerformanceStats().getRegistrations(), equalTo(0L));
        assertThat(registry.getPerformanceStats().getActiveImplementations(), equalTo(0L));

        final ModelType keyed = new CapabilityModelBuilder(registry, factory)
                .addCapabilities("keyed")
                .addField("key", FieldTemplate.of(String.class))
                .build();
        assertThat(registry.getCapabilities(keyed), contains("keyed"));
        assertThat(registry.getLocalModules(), empty());
    }

    @Test
    public void localFactoryModule() {
        registry.addLocalModule("com.example");
        final ModelType type = new CapabilityModelBuilder(registry, new ModelFactory("com.example.models"))
                .addCapabilities("identifiable")
                .build();
        assertThat(type.getModuleName(), equalTo("com.example.models"));
        assertThat(registry.getLocalModules(), contains("com.example"));
        assertTrue(registry.hasCapability(type, "identifiable"));
    }
}
