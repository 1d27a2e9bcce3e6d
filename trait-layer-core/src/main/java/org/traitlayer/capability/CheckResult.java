/*
 * CheckResult.java
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
import com.google.common.collect.Ordering;
import org.traitlayer.annotation.API;

import javax.annotation.Nonnull;
import java.util.Collection;

/**
 * The outcome of one of the registration checks: whether it passed, and the sorted names that were missing or in
 * conflict.
 */
@API(API.Status.UNSTABLE)
public final class CheckResult {
    private static final CheckResult PASSED = new CheckResult(ImmutableList.of());

    @Nonnull
    private final ImmutableList<String> names;

    private CheckResult(@Nonnull ImmutableList<String> names) {
        this.names = names;
    }

    @Nonnull
    public static CheckResult passed() {
        return PASSED;
    }

    /**
     * A result listing the given names. An empty collection means the check passed.
     * @param names missing or conflicting names
     * @return the result
     */
    @Nonnull
    public static CheckResult of(@Nonnull Collection<String> names) {
        if (names.isEmpty()) {
            return PASSED;
        }
        return new CheckResult(ImmutableList.sortedCopyOf(Ordering.natural(), names));
    }

    public boolean isOk() {
        return names.isEmpty();
    }

    @Nonnull
    public ImmutableList<String> getNames() {
        return names;
    }

    @Override
    public String toString() {
        return isOk() ? "passed" : "failed" + names;
    }
}
