/*
 * ModelFactoryTest.java
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

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.traitlayer.capability.Behavior;
import org.traitlayer.capability.CapabilityException;
import org.traitlayer.capability.MemberKind;
import org.traitlayer.capability.standard.StandardCapabilities;
import org.traitlayer.field.FieldTemplate;
import org.traitlayer.field.FieldValidationException;
import org.traitlayer.field.StandardFields;
import org.traitlayer.schema.Schema;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ModelFactory}, {@link ModelType} and {@link DynamicModel}.
 */
public class ModelFactoryTest {
    private static final FieldTemplate NAME = FieldTemplate.of(String.class).withValidator(value -> !((String)value).isEmpty());
    private static final FieldTemplate AGE = FieldTemplate.of(Integer.class).withDefault(0);
    private static final Behavior GREET = (target, args) -> "hello " + target.get("name");

    private static Schema person() {
        return Schema.newBuilder("Person")
                .addField("name", NAME)
                .addField("age", AGE)
                .addField("nickname", FieldTemplate.of(String.class).asNullable())
                .build();
    }

    @Test
    public void equivalentSchemasShareAType() {
        final ModelFactory factory = new ModelFactory();
        final ModelType first = factory.build(person(), ImmutableMap.of("greet", GREET));
        final Schema reordered = Schema.newBuilder("Person")
                .addField("age", AGE)
                .build()
                .merge(person(), "Person");
        final ModelType second = factory.build(reordered, ImmutableMap.of("greet", GREET));
        assertThat(second, sameInstance(first));
        assertThat(factory.getCacheStats().hitCount(), equalTo(1L));
        assertThat(factory.getCacheSize(), equalTo(1L));
    }

    @Test
    public void differentBehaviorsDifferentTypes() {
        final ModelFactory factory = new ModelFactory();
        final ModelType plain = factory.build(person());
        final ModelType greeting = factory.build(person(), ImmutableMap.of("greet", GREET));
        assertThat(greeting, not(sameInstance(plain)));
        assertFalse(plain.hasMember("greet", MemberKind.CALLABLE));
        assertTrue(greeting.hasMember("greet", MemberKind.CALLABLE));
        assertTrue(greeting.hasMember("age", MemberKind.ATTRIBUTE));
        assertFalse(greeting.hasMember("age", MemberKind.CALLABLE));
    }

    @Test
    public void retiredTypeIsReplaced() {
        final ModelFactory factory = new ModelFactory();
        final ModelType first = factory.build(person());
        first.retire();
        assertFalse(first.isLive());
        final ModelType second = factory.build(person());
        assertThat(second, not(sameInstance(first)));
        assertTrue(second.isLive());
        assertThat(factory.build(person()), sameInstance(second));
        assertEquals("still works", first.newInstance(Map.of("name", "still works")).get("name"));
    }

    @Test
    public void clearCache() {
        final ModelFactory factory = new ModelFactory();
        final ModelType first = factory.build(person());
        factory.clearCache();
        assertThat(factory.build(person()), not(sameInstance(first)));
    }

    @Test
    public void typeNames() {
        final ModelType type = new ModelFactory("com.example.models").build(person());
        assertThat(type.getName(), equalTo("Person"));
        assertThat(type.getTypeName(), equalTo("com.example.models.Person"));
        assertThat(type.getModuleName(), equalTo("com.example.models"));
        assertThat(new ModelFactory().build(person()).getModuleName(), equalTo(ModelFactory.DEFAULT_MODULE));
    }

    @Test
    public void fromDefinition() {
        final ModelType type = new ModelFactory().build(StandardCapabilities.TEMPORAL_DEFINITION);
        assertThat(type.getName(), equalTo("temporal"));
        assertThat(type.getSchema().getMetadata(), hasEntry("capability", (Object)"temporal"));
        assertThat(type.getSchema().getFieldNames(), contains("created_at", "updated_at"));
        assertTrue(type.hasMember("touch", MemberKind.CALLABLE));
    }

    @Test
    public void defaultsAndValidation() {
        final DynamicModel ann = new ModelFactory().build(person()).newInstance(Map.of("name", "Ann"));
        assertEquals(0, ann.get("age"));
        assertThat(ann.get("nickname"), nullValue());
        assertThat(ann.get("age", Integer.class), equalTo(0));
        assertThat(ann.toMap().keySet(), contains("name", "age", "nickname"));

        ann.set("age", 30);
        ann.set("nickname", "annie");
        ann.set("nickname", null);
        assertThrows(FieldValidationException.class, () -> ann.set("age", "thirty"));
        assertThrows(FieldValidationException.class, () -> ann.set("name", ""));
        assertThrows(FieldValidationException.class, () -> ann.set("name", null));
        assertEquals(30, ann.get("age"));
    }

    @Test
    public void missingRequiredFields() {
        FieldValidationException e = assertThrows(FieldValidationException.class, () -> new ModelFactory().build(person()).newInstance());
        assertThat(e.getMessage(), containsString("missing required fields"));
        assertThat(e.getLogInfo(), hasEntry("missing", (Object)List.of("name")));
    }

    @Test
    public void invalidInitialValue() {
        assertThrows(FieldValidationException.class,
                () -> new ModelFactory().build(person()).newInstance(Map.of("name", "Ann", "age", -1L)));
    }

    @Test
    public void unknownFields() {
        final ModelType type = new ModelFactory().build(person());
        FieldValidationException e = assertThrows(FieldValidationException.class,
                () -> type.newInstance(Map.of("name", "Ann", "email", "ann@example.com")));
        assertThat(e.getMessage(), containsString("unknown field"));
        final DynamicModel ann = type.newInstance(Map.of("name", "Ann"));
        assertFalse(ann.hasField("email"));
        assertThrows(FieldValidationException.class, () -> ann.get("email"));
        assertThrows(FieldValidationException.class, () -> ann.set("email", "ann@example.com"));
        assertThrows(FieldValidationException.class, () -> ann.get("name", Integer.class));
    }

    @Test
    public void nullInitialValueForNullableField() {
        final Map<String, Object> values = new HashMap<>();
        values.put("name", "Ann");
        values.put("nickname", null);
        assertThat(new ModelFactory().build(person()).newInstance(values).get("nickname"), nullValue());
    }

    @Test
    public void behaviors() {
        final DynamicModel ann = new ModelFactory().build(person(), ImmutableMap.of("greet", GREET)).newInstance(Map.of("name", "Ann"));
        assertEquals("hello Ann", ann.invoke("greet"));
        CapabilityException e = assertThrows(CapabilityException.class, () -> ann.invoke("wave"));
        assertThat(e.getMessage(), containsString("unknown behavior"));
    }

    @Test
    public void instanceEquality() {
        final ModelType type = new ModelFactory().build(person());
        final DynamicModel first = type.newInstance(Map.of("name", "Ann"));
        final DynamicModel second = type.newInstance(Map.of("name", "Ann"));
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        second.set("age", 1);
        assertNotEquals(first, second);
        assertNotEquals(first, new ModelFactory().build(person()).newInstance(Map.of("name", "Ann")));
        assertThat(first.toString(), containsString("Person"));
    }

    @Test
    public void toMapIsACopy() {
        final DynamicModel ann = new ModelFactory().build(person()).newInstance(Map.of("name", "Ann"));
        final Map<String, Object> snapshot = ann.toMap();
        ann.set("age", 5);
        assertEquals(0, snapshot.get("age"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("age", 1));
    }

    @Test
    public void frozenFieldsAreSetOnlyAtConstruction() {
        final Schema schema = Schema.newBuilder("Keyed").addField("id", StandardFields.ID).build();
        final DynamicModel keyed = new ModelFactory().build(schema).newInstance();
        FieldValidationException e = assertThrows(FieldValidationException.class, () -> keyed.set("id", keyed.get("id")));
        assertThat(e.getMessage(), containsString("field is frozen"));
    }
}
