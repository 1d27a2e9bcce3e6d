/*
 * FieldTemplateTest.java
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

package org.traitlayer.field;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FieldTemplate} and its derivations.
 */
public class FieldTemplateTest {
    private static final Predicate<Object> POSITIVE = value -> (Integer)value > 0;

    @Test
    public void defaultAndFactoryConflict() {
        FieldContractException e = assertThrows(FieldContractException.class, () ->
                FieldTemplate.newBuilder(Integer.class).setDefault(1).setDefaultFactory(() -> 2).build());
        assertThat(e.getMessage(), containsString("both a default value and a default factory"));
    }

    @Test
    public void requiredness() {
        assertTrue(FieldTemplate.of(String.class).isRequired());
        assertFalse(FieldTemplate.of(String.class).withDefault("x").isRequired());
        assertFalse(FieldTemplate.of(String.class).withDefaultFactory(() -> "x").isRequired());
        assertFalse(FieldTemplate.of(String.class).asNullable().isRequired());
    }

    @Test
    public void nullableShortCircuitsValidator() {
        final AtomicInteger calls = new AtomicInteger();
        final FieldTemplate template = FieldTemplate.of(Integer.class)
                .withValidator(value -> {
                    calls.incrementAndGet();
                    return (Integer)value > 0;
                })
                .asNullable();
        assertTrue(template.isValid(null));
        assertThat(calls.get(), equalTo(0));
        assertTrue(template.isValid(5));
        assertFalse(template.isValid(-5));
        assertThat(calls.get(), equalTo(2));
        assertThat(template.resolveDefault(), nullValue());
        assertTrue(template.hasDefault());
    }

    @Test
    public void nonNullableRejectsNull() {
        FieldValidationException e = assertThrows(FieldValidationException.class,
                () -> FieldTemplate.of(String.class).validate("name", null));
        assertThat(e.getMessage(), containsString("null value for non-nullable field"));
        assertEquals("name", e.getLogInfo().get("field"));
    }

    @Test
    public void asNullableIsIdempotent() {
        final FieldTemplate once = FieldTemplate.of(Integer.class).withValidator(POSITIVE).withDefault(3).asNullable();
        final FieldTemplate twice = once.asNullable();
        assertThat(twice, sameInstance(once));
        assertEquals(once, FieldTemplate.of(Integer.class).withValidator(POSITIVE).withDefault(3).asNullable());
        assertThat(once.resolveDefault(), nullValue());
    }

    @Test
    public void asNullableDropsFactory() {
        final FieldTemplate template = StandardFields.CREATED_AT.asNullable();
        assertThat(template.getDefaultFactory(), nullValue());
        assertThat(template.resolveDefault(), nullValue());
    }

    @Test
    public void lenientList() {
        final FieldTemplate template = FieldTemplate.of(Integer.class).withValidator(POSITIVE).asListable();
        assertThat(template.getListMode(), equalTo(ListMode.LENIENT));
        assertTrue(template.isValid(4));
        assertTrue(template.isValid(List.of(1, 2, 3)));
        assertTrue(template.isValid(List.of()));
        assertFalse(template.isValid(List.of(1, -2)));
        assertFalse(template.isValid(-1));
        assertFalse(template.accepts(List.of("a")));
    }

    @Test
    public void strictList() {
        final FieldTemplate template = FieldTemplate.of(String.class).asListable(true);
        assertTrue(template.isValid(List.of("a", "b")));
        FieldValidationException e = assertThrows(FieldValidationException.class, () -> template.validate("tags", "a"));
        assertThat(e.getMessage(), containsString("single value for strict list field"));
    }

    @Test
    public void listElementsMustNotBeNull() {
        final List<String> withNull = new ArrayList<>();
        withNull.add(null);
        assertFalse(FieldTemplate.of(String.class).asListable().accepts(withNull));
    }

    @Test
    public void listRejectedByScalarTemplate() {
        assertFalse(FieldTemplate.of(String.class).accepts(List.of("a")));
    }

    @Test
    public void asListableKeepsMode() {
        final FieldTemplate lenient = FieldTemplate.of(String.class).asListable(false);
        assertThat(lenient.asListable(false), sameInstance(lenient));
        assertThat(lenient.asListable(true).getListMode(), equalTo(ListMode.STRICT));
    }

    @Test
    public void nullableListable() {
        final FieldTemplate template = FieldTemplate.of(String.class).asListable(true).asNullable();
        assertTrue(template.isValid(null));
        assertTrue(template.isValid(List.of("x")));
        assertFalse(template.isValid("x"));
    }

    @Test
    public void primitiveTypesAreBoxed() {
        assertTrue(FieldTemplate.of(int.class).accepts(5));
        assertFalse(FieldTemplate.of(int.class).accepts(5L));
    }

    @Test
    public void validatorsAreConjoined() {
        final FieldTemplate template = FieldTemplate.of(Integer.class)
                .withValidator(POSITIVE)
                .withValidator(value -> (Integer)value < 10);
        assertTrue(template.isValid(5));
        assertFalse(template.isValid(0));
        assertFalse(template.isValid(10));
        FieldValidationException e = assertThrows(FieldValidationException.class, () -> template.validate("n", 11));
        assertThat(e.getMessage(), containsString("rejected by field validator"));
    }

    @Test
    public void wrongType() {
        FieldValidationException e = assertThrows(FieldValidationException.class,
                () -> FieldTemplate.of(Instant.class).validate("when", "yesterday"));
        assertThat(e.getMessage(), containsString("value has wrong type"));
    }

    @Test
    public void derivationsDoNotModifyOriginal() {
        final FieldTemplate original = FieldTemplate.of(String.class);
        original.asNullable();
        original.asListable();
        original.withDescription("changed");
        original.withMetadata("index", true);
        assertEquals(FieldTemplate.of(String.class), original);
        assertNotEquals(original, original.withMetadata("index", true));
    }

    @Test
    public void defaultFactoryProducesFreshValues() {
        final Object first = StandardFields.TAGS.resolveDefault();
        final Object second = StandardFields.TAGS.resolveDefault();
        assertThat(first, instanceOf(ArrayList.class));
        assertThat(first, not(sameInstance(second)));
        assertThat(StandardFields.ID.resolveDefault(), instanceOf(UUID.class));
        assertNotEquals(StandardFields.ID.resolveDefault(), StandardFields.ID.resolveDefault());
    }

    @Test
    public void createField() {
        final FieldDefinition field = FieldTemplate.of(Integer.class).withDefault(1).createField("count");
        assertThat(field.getName(), equalTo("count"));
        assertEquals(1, field.getDefaultValue());
        assertFalse(field.isRequired());
        field.validate(3);
    }

    @Test
    public void createFieldWithOverrides() {
        final FieldDefinition field = StandardFields.VERSION.createField("revision", builder -> builder.setDefault(5));
        assertEquals(5, field.getDefaultValue());
        assertThat(field.getTemplate().getValidator(), sameInstance(StandardFields.VERSION.getValidator()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1st", "with-dash", "has space", "dotted.name"})
    public void createFieldRejectsInvalidNames(String name) {
        FieldContractException e = assertThrows(FieldContractException.class, () -> FieldTemplate.of(String.class).createField(name));
        assertThat(e.getMessage(), containsString("not a valid identifier"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"id", "_private", "created_at", "Field2"})
    public void createFieldAcceptsIdentifiers(String name) {
        assertThat(FieldTemplate.of(String.class).createField(name).getName(), equalTo(name));
    }

    @Test
    public void createFieldRejectsBothDefaults() {
        FieldContractException e = assertThrows(FieldContractException.class, () ->
                FieldTemplate.of(Integer.class).withDefault(1).createField("n", builder -> builder.setDefaultFactory(() -> 2)));
        assertThat(e.getMessage(), containsString("both a default value and a default factory"));
        assertEquals("n", e.getLogInfo().get("field"));
    }

    @Test
    public void createFieldCannotUnfreeze() {
        FieldContractException e = assertThrows(FieldContractException.class, () ->
                StandardFields.ID.createField("id", builder -> builder.setFrozen(false)));
        assertThat(e.getMessage(), containsString("frozen field cannot be made mutable"));
        assertTrue(StandardFields.ID.createField("id", builder -> builder.setFrozen(true)).isFrozen());
    }

    @Test
    public void mutableFieldCanBeFrozen() {
        assertTrue(FieldTemplate.of(String.class).createField("code", builder -> builder.setFrozen(true)).isFrozen());
    }
}
