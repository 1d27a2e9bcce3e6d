/*
 * CapabilityRegistrationException.java
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

import com.google.common.collect.ImmutableList;
import org.traitlayer.annotation.API;
import org.traitlayer.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Collection;

/**
 * Base of the exceptions that reject a capability registration or definition. Each one carries a
 * {@link RejectionReason} and the names that were missing or in conflict.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public abstract class CapabilityRegistrationException extends CapabilityException {
    @Nonnull
    private final RejectionReason reason;
    @Nonnull
    private final ImmutableList<String> names;

    protected CapabilityRegistrationException(@Nonnull String msg, @Nonnull RejectionReason reason,
                                              @Nonnull Collection<String> names) {
        super(msg, LogMessageKeys.REASON, reason.getCode());
        this.reason = reason;
        this.names = ImmutableList.copyOf(names);
        final LogMessageKeys namesKey = reason == RejectionReason.STRUCTURAL || reason == RejectionReason.DEPENDENCY
                                        ? LogMessageKeys.MISSING
                                        : LogMessageKeys.CONFLICTING;
        addLogInfo(namesKey.toString(), this.names);
    }

    @Nonnull
    public RejectionReason getReason() {
        return reason;
    }

    /**
     * Get the missing or conflicting names that caused the rejection.
     * @return the names, sorted
     */
    @Nonnull
    public ImmutableList<String> getNames() {
        return names;
    }
}
