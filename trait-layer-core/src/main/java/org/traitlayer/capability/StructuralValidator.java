/*
 * StructuralValidator.java
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

import org.traitlayer.annotation.API;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a type exposes every member a capability requires. Optional members are not checked.
 */
@API(API.Status.UNSTABLE)
public final class StructuralValidator {
    private StructuralValidator() {
    }

    /**
     * Validate a type against a capability.
     * @param type the candidate type
     * @param definition the capability
     * @return a passed result, or a failed one naming the missing members
     */
    @Nonnull
    public static CheckResult validate(@Nonnull TypeShape type, @Nonnull CapabilityDefinition definition) {
        final List<String> missing = new ArrayList<>();
        for (Member member : definition.getRequiredMembers()) {
            if (!type.hasMember(member.getName(), member.getKind())) {
                missing.add(member.getName());
            }
        }
        return CheckResult.of(missing);
    }

    public static boolean satisfies(@Nonnull TypeShape type, @Nonnull CapabilityDefinition definition) {
        return validate(type, definition).isOk();
    }
}
