/*
 * ImplementationRecord.java
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
import javax.annotation.Nullable;
import java.lang.ref.WeakReference;
import java.time.Instant;

/**
 * One registered association between a capability and a type. The type is referenced weakly, and records for the
 * same type share a token that the registry allocated when the type was first registered.
 */
@API(API.Status.UNSTABLE)
public final class ImplementationRecord {
    @Nonnull
    private final String capabilityName;
    @Nonnull
    private final String typeName;
    @Nonnull
    private final WeakReference<Object> identity;
    @Nonnull
    private final Instant registeredAt;
    private final long token;

    ImplementationRecord(@Nonnull String capabilityName, @Nonnull TypeShape type, @Nonnull Instant registeredAt, long token) {
        this.capabilityName = capabilityName;
        this.typeName = type.getTypeName();
        this.identity = new WeakReference<>(type.getIdentity());
        this.registeredAt = registeredAt;
        this.token = token;
    }

    @Nonnull
    public String getCapabilityName() {
        return capabilityName;
    }

    /**
     * Get the name the type had when it was registered. Kept so that stale records can still be reported.
     * @return the type name
     */
    @Nonnull
    public String getTypeName() {
        return typeName;
    }

    @Nonnull
    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public long getToken() {
        return token;
    }

    /**
     * Resolve the back-reference. Each call looks again, so a caller must not assume an earlier answer still holds.
     * @return the type identity, or {@code null} if it has been reclaimed or retired
     */
    @Nullable
    public Object resolve() {
        final Object referent = identity.get();
        if (referent instanceof TypeShape && !((TypeShape)referent).isLive()) {
            return null;
        }
        return referent;
    }

    public boolean isStale() {
        return resolve() == null;
    }

    @Override
    public String toString() {
        return "ImplementationRecord{" + capabilityName + " on " + typeName + ", token=" + token + ", registeredAt=" + registeredAt + "}";
    }
}
