/*
 * StructuralViolationException.java
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
import java.util.Collection;

/**
 * Thrown when a type does not expose every member a capability requires.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class StructuralViolationException extends CapabilityRegistrationException {
    public StructuralViolationException(@Nonnull String msg, @Nonnull Collection<String> names) {
        super(msg, RejectionReason.STRUCTURAL, names);
    }
}
