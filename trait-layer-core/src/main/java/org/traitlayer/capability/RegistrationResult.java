/*
 * RegistrationResult.java
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

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import org.traitlayer.annotation.API;
import org.traitlayer.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * The outcome of registering capabilities on a type. A success lists the records of every requested capability,
 * whether created by this call or already present. A failure has a {@link RejectionReason}, the missing or
 * conflicting names, and a message, and means the registry was not changed.
 */
@API(API.Status.UNSTABLE)
public final class RegistrationResult {
    @Nonnull
    private final String typeName;
    @Nonnull
    private final ImmutableList<String> capabilities;
    @Nullable
    private final RejectionReason reason;
    @Nonnull
    private final ImmutableList<String> names;
    @Nonnull
    private final String message;
    @Nonnull
    private final ImmutableList<ImplementationRecord> records;

    private RegistrationResult(@Nonnull String typeName, @Nonnull List<String> capabilities,
                               @Nullable RejectionReason reason, @Nonnull List<String> names,
                               @Nonnull String message, @Nonnull List<ImplementationRecord> records) {
        this.typeName = typeName;
        this.capabilities = ImmutableList.copyOf(capabilities);
        this.reason = reason;
        this.names = ImmutableList.copyOf(names);
        this.message = message;
        this.records = ImmutableList.copyOf(records);
    }

    @Nonnull
    static RegistrationResult success(@Nonnull String typeName, @Nonnull List<String> capabilities,
                                      @Nonnull List<ImplementationRecord> records) {
        return new RegistrationResult(typeName, capabilities, null, ImmutableList.of(),
                "registered " + capabilities + " on " + typeName, records);
    }

    @Nonnull
    static RegistrationResult failure(@Nonnull String typeName, @Nonnull List<String> capabilities,
                                      @Nonnull RejectionReason reason, @Nonnull CheckResult check,
                                      @Nonnull String message) {
        return new RegistrationResult(typeName, capabilities, reason, check.getNames(),
                message + ": " + String.join(", ", check.getNames()), ImmutableList.of());
    }

    public boolean isSuccess() {
        return reason == null;
    }

    @Nonnull
    public String getTypeName() {
        return typeName;
    }

    @Nonnull
    public ImmutableList<String> getCapabilities() {
        return capabilities;
    }

    @Nullable
    public RejectionReason getReason() {
        return reason;
    }

    /**
     * Get the names that caused a rejection: missing members for {@link RejectionReason#STRUCTURAL}, the type and
     * capability for {@link RejectionReason#COHERENCE}, missing prerequisites or unknown capabilities for
     * {@link RejectionReason#DEPENDENCY}.
     * @return sorted names, empty on success
     */
    @Nonnull
    public ImmutableList<String> getNames() {
        return names;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    @Nonnull
    public ImmutableList<ImplementationRecord> getRecords() {
        return records;
    }

    /**
     * Convert a failed result into the matching exception.
     * @return the exception describing the rejection
     * @throws IllegalStateException if the registration succeeded
     */
    @Nonnull
    public CapabilityRegistrationException toException() {
        if (reason == null) {
            throw new IllegalStateException("registration succeeded");
        }
        final CapabilityRegistrationException exception;
        switch (reason) {
            case STRUCTURAL:
                exception = new StructuralViolationException(message, names);
                break;
            case COHERENCE:
                exception = new CoherenceViolationException(message, names);
                break;
            case DEPENDENCY:
                exception = new DependencyViolationException(message, names);
                break;
            case DUPLICATE:
                exception = new DuplicateCapabilityException(message, names);
                break;
            case SEALED:
                exception = new SealedCapabilityException(message, names);
                break;
            default:
                throw new VerifyException("unknown rejection reason " + reason);
        }
        exception.addLogInfo(LogMessageKeys.TYPE_NAME.toString(), typeName);
        exception.addLogInfo(LogMessageKeys.CAPABILITIES.toString(), capabilities);
        return exception;
    }

    /**
     * Throw the matching exception if the registration failed.
     * @return this result, if successful
     * @throws CapabilityRegistrationException if the registration failed
     */
    @Nonnull
    public RegistrationResult orElseThrow() {
        if (!isSuccess()) {
            throw toException();
        }
        return this;
    }

    @Override
    public String toString() {
        return (isSuccess() ? "success" : reason.getCode()) + ": " + message;
    }
}
