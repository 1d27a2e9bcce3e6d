/*
 * CapabilityDefinition.java
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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.traitlayer.annotation.API;
import org.traitlayer.field.FieldTemplate;
import org.traitlayer.logging.LogMessageKeys;
import org.traitlayer.schema.Schema;
import org.traitlayer.schema.SchemaBuilder;
import org.traitlayer.util.NameUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A named contract that types can opt into: the members they must expose, the members they may expose, the
 * capabilities they must also carry, and descriptive metadata.
 *
 * <p>
 * A definition may also supply field templates for its attribute members and {@link Behavior}s for its callable
 * members. These are what {@link CapabilityComposer} merges and what a synthesized model gets when it is built from
 * the definition.
 * </p>
 *
 * <p>
 * Definitions are immutable. Changing a registered definition means building a new one, through
 * {@link CapabilityRegistry#registerCapability(CapabilityDefinition)} or
 * {@link CapabilityRegistry#alterCapability(String, java.util.function.Consumer)}, and is refused once the name is
 * sealed.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class CapabilityDefinition {
    public static final String DEFAULT_VERSION = "1.0.0";
    /** Schema metadata key naming the capability a schema was derived from. */
    public static final String CAPABILITY_METADATA_KEY = "capability";

    @Nonnull
    private final String name;
    @Nonnull
    private final String version;
    @Nullable
    private final String description;
    @Nullable
    private final String module;
    @Nonnull
    private final ImmutableSet<Member> requiredMembers;
    @Nonnull
    private final ImmutableSet<Member> optionalMembers;
    @Nonnull
    private final ImmutableMap<String, FieldTemplate> fields;
    @Nonnull
    private final ImmutableMap<String, Behavior> behaviors;
    @Nonnull
    private final ImmutableSet<String> prerequisites;
    @Nonnull
    private final ImmutableList<String> composedFrom;

    private CapabilityDefinition(@Nonnull Builder builder) {
        this.name = builder.name;
        this.version = builder.version;
        this.description = builder.description;
        this.module = builder.module;
        this.requiredMembers = toMembers(builder.requiredMembers);
        this.optionalMembers = toMembers(builder.optionalMembers);
        this.fields = ImmutableMap.copyOf(builder.fields);
        this.behaviors = ImmutableMap.copyOf(builder.behaviors);
        this.prerequisites = ImmutableSet.copyOf(builder.prerequisites);
        this.composedFrom = ImmutableList.copyOf(builder.composedFrom);
    }

    @Nonnull
    private static ImmutableSet<Member> toMembers(@Nonnull Map<String, MemberKind> members) {
        final ImmutableSet.Builder<Member> builder = ImmutableSet.builderWithExpectedSize(members.size());
        members.forEach((memberName, kind) -> builder.add(new Member(memberName, kind)));
        return builder.build();
    }

    @Nonnull
    public static Builder newBuilder(@Nonnull String name) {
        return new Builder(name);
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public String getVersion() {
        return version;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    /**
     * Get the module (package) that declares this capability, or {@code null} if it was declared by the registrant
     * itself and so is always local.
     * @return the declaring module
     */
    @Nullable
    public String getModule() {
        return module;
    }

    @Nonnull
    public ImmutableSet<Member> getRequiredMembers() {
        return requiredMembers;
    }

    @Nonnull
    public ImmutableSet<Member> getOptionalMembers() {
        return optionalMembers;
    }

    @Nonnull
    public ImmutableMap<String, FieldTemplate> getFields() {
        return fields;
    }

    @Nonnull
    public ImmutableMap<String, Behavior> getBehaviors() {
        return behaviors;
    }

    @Nonnull
    public ImmutableSet<String> getPrerequisites() {
        return prerequisites;
    }

    /**
     * Get the names of the definitions this one was composed from, in composition order.
     * @return the source definitions, empty unless this is a composition
     */
    @Nonnull
    public ImmutableList<String> getComposedFrom() {
        return composedFrom;
    }

    public boolean isComposite() {
        return !composedFrom.isEmpty();
    }

    public boolean isRequired(@Nonnull String memberName) {
        return requiredMembers.stream().anyMatch(member -> member.getName().equals(memberName));
    }

    /**
     * Build a schema from this definition's field templates, in declaration order.
     * @return a schema named after this capability
     */
    @Nonnull
    public Schema toSchema() {
        final SchemaBuilder builder = Schema.newBuilder(name)
                .addFields(fields)
                .withMetadata(CAPABILITY_METADATA_KEY, name);
        return builder.build();
    }

    @Override
    public String toString() {
        return name + "@" + version + (module == null ? "" : "[" + module + "]")
               + "{required=" + requiredMembers + ", optional=" + optionalMembers
               + (prerequisites.isEmpty() ? "" : ", prerequisites=" + prerequisites) + "}";
    }

    /**
     * Builder for {@link CapabilityDefinition}.
     */
    public static final class Builder {
        @Nonnull
        private final String name;
        @Nonnull
        private String version = DEFAULT_VERSION;
        @Nullable
        private String description;
        @Nullable
        private String module;
        @Nonnull
        private final Map<String, MemberKind> requiredMembers = new LinkedHashMap<>();
        @Nonnull
        private final Map<String, MemberKind> optionalMembers = new LinkedHashMap<>();
        @Nonnull
        private final Map<String, FieldTemplate> fields = new LinkedHashMap<>();
        @Nonnull
        private final Map<String, Behavior> behaviors = new LinkedHashMap<>();
        @Nonnull
        private final Set<String> prerequisites = new LinkedHashSet<>();
        @Nonnull
        private List<String> composedFrom = ImmutableList.of();

        private Builder(@Nonnull String name) {
            this.name = name;
        }

        private Builder(@Nonnull CapabilityDefinition definition) {
            this.name = definition.name;
            this.version = definition.version;
            this.description = definition.description;
            this.module = definition.module;
            definition.requiredMembers.forEach(member -> requiredMembers.put(member.getName(), member.getKind()));
            definition.optionalMembers.forEach(member -> optionalMembers.put(member.getName(), member.getKind()));
            this.fields.putAll(definition.fields);
            this.behaviors.putAll(definition.behaviors);
            this.prerequisites.addAll(definition.prerequisites);
            this.composedFrom = definition.composedFrom;
        }

        @Nonnull
        public String getName() {
            return name;
        }

        @Nonnull
        public Builder setVersion(@Nonnull String version) {
            this.version = Preconditions.checkNotNull(version, "version");
            return this;
        }

        @Nonnull
        public Builder setDescription(@Nullable String description) {
            this.description = description;
            return this;
        }

        @Nonnull
        public Builder setModule(@Nullable String module) {
            this.module = module;
            return this;
        }

        @Nonnull
        public Builder addRequiredMember(@Nonnull String memberName, @Nonnull MemberKind kind) {
            optionalMembers.remove(memberName);
            requiredMembers.put(memberName, kind);
            return this;
        }

        @Nonnull
        public Builder addOptionalMember(@Nonnull String memberName, @Nonnull MemberKind kind) {
            if (!requiredMembers.containsKey(memberName)) {
                optionalMembers.put(memberName, kind);
            }
            return this;
        }

        /**
         * Require an attribute member and supply the template used when models are synthesized.
         * @param fieldName the attribute name
         * @param template its template
         * @return this builder
         */
        @Nonnull
        public Builder addRequiredField(@Nonnull String fieldName, @Nonnull FieldTemplate template) {
            fields.put(fieldName, template);
            return addRequiredMember(fieldName, MemberKind.ATTRIBUTE);
        }

        /**
         * Allow an attribute member. A template that would make the field required is made nullable, since a model
         * must be constructible without an optional field.
         * @param fieldName the attribute name
         * @param template its template
         * @return this builder
         */
        @Nonnull
        public Builder addOptionalField(@Nonnull String fieldName, @Nonnull FieldTemplate template) {
            fields.put(fieldName, template.isRequired() ? template.asNullable() : template);
            return addOptionalMember(fieldName, MemberKind.ATTRIBUTE);
        }

        /**
         * Require a callable member and supply its implementation for synthesized models.
         * @param behaviorName the callable name
         * @param behavior its implementation
         * @return this builder
         */
        @Nonnull
        public Builder addBehavior(@Nonnull String behaviorName, @Nonnull Behavior behavior) {
            behaviors.put(behaviorName, behavior);
            return addRequiredMember(behaviorName, MemberKind.CALLABLE);
        }

        @Nonnull
        public Builder addPrerequisite(@Nonnull String... names) {
            return addPrerequisites(Arrays.asList(names));
        }

        @Nonnull
        public Builder addPrerequisites(@Nonnull Collection<String> names) {
            prerequisites.addAll(names);
            return this;
        }

        @Nonnull
        public Builder setComposedFrom(@Nonnull List<String> names) {
            this.composedFrom = ImmutableList.copyOf(names);
            return this;
        }

        /**
         * Build the definition.
         * @return a new definition
         * @throws CapabilityException if the name is blank, a member name is not an identifier, or the capability
         * lists itself as a prerequisite
         */
        @Nonnull
        public CapabilityDefinition build() {
            if (name.isBlank()) {
                throw new CapabilityException("capability name must not be blank");
            }
            for (String memberName : requiredMembers.keySet()) {
                checkMemberName(memberName);
            }
            for (String memberName : optionalMembers.keySet()) {
                checkMemberName(memberName);
            }
            if (prerequisites.contains(name)) {
                throw new CapabilityException("capability cannot be its own prerequisite",
                        LogMessageKeys.CAPABILITY, name);
            }
            return new CapabilityDefinition(this);
        }

        private void checkMemberName(@Nonnull String memberName) {
            if (!NameUtils.isIdentifier(memberName)) {
                throw new CapabilityException("member name is not a valid identifier",
                        LogMessageKeys.CAPABILITY, name,
                        LogMessageKeys.FIELD_NAME, memberName);
            }
        }
    }
}
