/*
 * RejectionReason.java
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
import java.util.Locale;

/**
 * Why a capability registration was rejected.
 */
@API(API.Status.UNSTABLE)
public enum RejectionReason {
    /** The type does not expose every required member. */
    STRUCTURAL,
    /** Neither the type nor the capability is local to the registrant. */
    COHERENCE,
    /** A prerequisite capability is not carried by the type, or the capability is unknown. */
    DEPENDENCY,
    /** The capability name is sealed or may not be redefined. */
    DUPLICATE,
    /** The capability is sealed and its members cannot change. */
    SEALED;

    @Nonnull
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
