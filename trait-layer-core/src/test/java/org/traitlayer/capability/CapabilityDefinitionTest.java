/*
 * CapabilityDefinitionTest.java
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
import org.traitlayer.field.FieldTemplate;
import org.traitlayer.schema.Schema;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CapabilityDefinition} and {@link RegistrationResult}.
 */
public class CapabilityDefinitionTest {

    @Test
    public void builderDefaults() {
        final CapabilityDefinition definition = CapabilityDefinition.newBuilder("plain").build();
        assertThat(definition.getVersion(), equalTo(CapabilityDefinition.DEFAULT_VERSION));
        assertThat(definition.getModule(), nullValue());
        assertFalse(definition.isComposite());
        assertTrue(definition.getRequiredMembers().isEmpty());
    }

    @Test
    public void requiredWinsOverOptional() {
        final CapabilityDefinition definition = CapabilityDefinition.newBuilder("named")
                .addOptionalMember("name", MemberKind.ATTRIBUTE)
                .addRequiredMember("name", MemberKind.ATTRIBUTE)
                .addOptionalMember("name", MemberKind.ATTRIBUTE)
                .build();
        assertThat(definition.getRequiredMembers(), contains(Member.attribute("name")));
        assertTrue(definition.getOptionalMembers().isEmpty());
    }

    @Test
    public void optionalFieldsAreNullable() {
        final CapabilityDefinition definition = CapabilityDefinition.newBuilder("described")
                .addOptionalField("description", FieldTemplate.of(String.class))
                .build();
        assertTrue(definition.getFields().get("description").isNullable());
        assertFalse(definition.getFields().get("description").isRequired());
        assertThat(definition.getOptionalMembers(), contains(Member.attribute("description")));
    }

    @Test
    public void behaviorsAreRequiredCallables() {
        final CapabilityDefinition definition = CapabilityDefinition.newBuilder("greeter")
                .addBehavior("greet", (target, args) -> "hi")
                .build();
        assertThat(definition.getRequiredMembers(), contains(Member.callable("greet")));
    }

    @Test
    public void toSchema() {
        final Schema schema = CapabilityDefinition.newBuilder("labeled")
                .addRequiredField("label", FieldTemplate.of(String.class))
                .addOptionalField("color", FieldTemplate.of(String.class))
                .build()
                .toSchema();
        assertThat(schema.getName(), equalTo("labeled"));
        assertThat(schema.getFieldNames(), contains("label", "color"));
        assertThat(schema.getRequiredFields(), contains("label"));
        assertThat(schema.getMetadata(), hasEntry(CapabilityDefinition.CAPABILITY_METADATA_KEY, (Object)"labeled"));
    }

    @Test
    public void toBuilderCopies() {
        final CapabilityDefinition original = CapabilityDefinition.newBuilder("base")
                .setModule("com.example")
                .addRequiredMember("id", MemberKind.ATTRIBUTE)
                .addPrerequisite("other")
                .build();
        final CapabilityDefinition copy = original.toBuilder().setVersion("2.0.0").build();
        assertThat(copy.getModule(), equalTo("com.example"));
        assertThat(copy.getRequiredMembers(), equalTo(original.getRequiredMembers()));
        assertThat(copy.getPrerequisites(), contains("other"));
        assertThat(original.getVersion(), equalTo(CapabilityDefinition.DEFAULT_VERSION));
    }

    @Test
    public void blankName() {
        assertThrows(CapabilityException.class, () -> CapabilityDefinition.newBuilder(" ").build());
    }

    @Test
    public void invalidMemberName() {
        CapabilityException e = assertThrows(CapabilityException.class,
                () -> CapabilityDefinition.newBuilder("broken").addRequiredMember("not valid", MemberKind.CALLABLE).build());
        assertThat(e.getMessage(), containsString("not a valid identifier"));
    }

    @Test
    public void selfPrerequisite() {
        CapabilityException e = assertThrows(CapabilityException.class,
                () -> CapabilityDefinition.newBuilder("loop").addPrerequisite("loop").build());
        assertThat(e.getMessage(), containsString("own prerequisite"));
    }

    @Test
    public void successHasNoException() {
        final RegistrationResult result = RegistrationResult.success("com.example.Type", List.of("plain"), List.of());
        assertTrue(result.isSuccess());
        assertThrows(IllegalStateException.class, result::toException);
        assertThat(result.orElseThrow(), equalTo(result));
    }

    @Test
    public void failureMapsToException() {
        final RegistrationResult result = RegistrationResult.failure("com.example.Type", List.of("auditable"),
                RejectionReason.DEPENDENCY, CheckResult.of(List.of("temporal", "identifiable")), "missing prerequisite capabilities");
        assertThat(result.getMessage(), equalTo("missing prerequisite capabilities: identifiable, temporal"));
        final CapabilityRegistrationException e = result.toException();
        assertThat(e, instanceOf(DependencyViolationException.class));
        assertThat(e.getLogInfo(), hasEntry("missing", (Object)List.of("identifiable", "temporal")));
        assertThat(e.getLogInfo(), hasEntry("reason", (Object)"dependency"));
    }
}
