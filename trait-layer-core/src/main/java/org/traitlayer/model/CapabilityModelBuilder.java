/*
 * CapabilityModelBuilder.java
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

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.traitlayer.annotation.API;
import org.traitlayer.capability.Behavior;
import org.traitlayer.capability.CapabilityDefinition;
import org.traitlayer.capability.CapabilityRegistry;
import org.traitlayer.capability.CheckResult;
import org.traitlayer.capability.ConflictResolver;
import org.traitlayer.capability.DependencyViolationException;
import org.traitlayer.field.FieldTemplate;
import org.traitlayer.logging.KeyValueLogMessage;
import org.traitlayer.logging.LogMessageKeys;
import org.traitlayer.schema.Schema;
import org.traitlayer.schema.SchemaBuilder;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a registered model type from capability names and extra fields.
 *
 * <p>
 * {@link #build()} checks that the requested capabilities include all of their prerequisites, composes them, builds a
 * schema from the composition plus the extra fields, synthesizes the type with the {@link ModelFactory}, and
 * registers the capabilities on it. The caller owns the types it synthesizes, so they pass the coherence check
 * without their module being added to the registry's local modules. A rejected registration changes nothing in the
 * registry.
 * </p>
 *
 * <pre>{@code
 * ModelType user = new CapabilityModelBuilder(registry, factory)
 *         .setName("User")
 *         .addCapabilities("identifiable", "temporal")
 *         .addField("email", FieldTemplate.of(String.class))
 *         .build();
 * }</pre>
 */
@API(API.Status.EXPERIMENTAL)
public class CapabilityModelBuilder {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityModelBuilder.class);

    @Nonnull
    private final CapabilityRegistry registry;
    @Nonnull
    private final ModelFactory factory;
    @Nonnull
    private String name = "Model";
    @Nonnull
    private final Set<String> capabilities = new LinkedHashSet<>();
    @Nonnull
    private final Map<String, FieldTemplate> extraFields = new LinkedHashMap<>();
    @Nonnull
    private final Map<String, Behavior> extraBehaviors = new LinkedHashMap<>();
    @Nonnull
    private ConflictResolver conflictResolver = ConflictResolver.firstWins();

    public CapabilityModelBuilder(@Nonnull CapabilityRegistry registry, @Nonnull ModelFactory factory) {
        this.registry = registry;
        this.factory = factory;
    }

    @Nonnull
    public CapabilityModelBuilder setName(@Nonnull String name) {
        this.name = name;
        return this;
    }

    @Nonnull
    public CapabilityModelBuilder addCapabilities(@Nonnull String... names) {
        return addCapabilities(Arrays.asList(names));
    }

    @Nonnull
    public CapabilityModelBuilder addCapabilities(@Nonnull Collection<String> names) {
        capabilities.addAll(names);
        return this;
    }

    /**
     * Add a field beyond those the capabilities contribute. It replaces a capability field of the same name.
     * @param fieldName the field name
     * @param template its template
     * @return this builder
     */
    @Nonnull
    public CapabilityModelBuilder addField(@Nonnull String fieldName, @Nonnull FieldTemplate template) {
        extraFields.put(fieldName, template);
        return this;
    }

    @Nonnull
    public CapabilityModelBuilder addBehavior(@Nonnull String behaviorName, @Nonnull Behavior behavior) {
        extraBehaviors.put(behaviorName, behavior);
        return this;
    }

    @Nonnull
    public CapabilityModelBuilder setConflictResolver(@Nonnull ConflictResolver conflictResolver) {
        this.conflictResolver = conflictResolver;
        return this;
    }

    /**
     * Build and register the model type.
     * @return the registered type
     * @throws org.traitlayer.capability.CapabilityException if a capability is unknown
     * @throws DependencyViolationException if a prerequisite of a requested capability is not requested
     * @throws org.traitlayer.capability.CapabilityRegistrationException if the registration is rejected
     */
    @Nonnull
    public ModelType build() {
        final List<String> names = ImmutableList.copyOf(capabilities);
        final SchemaBuilder schemaBuilder = Schema.newBuilder(name);
        final Map<String, Behavior> behaviors = new LinkedHashMap<>();
        if (!names.isEmpty()) {
            final CheckResult dependencies = registry.getDependencyResolver().resolve(names);
            if (!dependencies.isOk()) {
                throw new DependencyViolationException("missing prerequisite capabilities: "
                                                       + String.join(", ", dependencies.getNames()),
                        dependencies.getNames());
            }
            final CapabilityDefinition composed = registry.compose(names, conflictResolver);
            schemaBuilder.addFields(composed.getFields())
                    .withMetadata("capabilities", names);
            behaviors.putAll(composed.getBehaviors());
        }
        schemaBuilder.addFields(extraFields);
        behaviors.putAll(extraBehaviors);
        final ModelType type = factory.build(schemaBuilder.build(), behaviors);
        if (!names.isEmpty()) {
            registry.registerOwnedType(type, names).orElseThrow();
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("built capability model",
                    LogMessageKeys.SCHEMA_NAME, name,
                    LogMessageKeys.CAPABILITIES, names,
                    LogMessageKeys.CONTENT_HASH, type.getSchema().getContentHash()));
        }
        return type;
    }
}
