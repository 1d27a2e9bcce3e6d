/*
 * NameUtils.java
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

package org.traitlayer.util;

import com.google.common.base.CaseFormat;
import org.traitlayer.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.regex.Pattern;

/**
 * Helpers for member and field names.
 */
@API(API.Status.INTERNAL)
public final class NameUtils {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private NameUtils() {
    }

    /**
     * Whether the given string is a bare identifier: a letter or underscore followed by letters, digits or
     * underscores.
     *
     * @param name the candidate name
     * @return {@code true} if {@code name} is a valid identifier
     */
    public static boolean isIdentifier(@Nullable String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /**
     * Convert a {@code snake_case} name to {@code camelCase}. Names without underscores are returned unchanged and
     * leading underscores are kept.
     *
     * @param name the name to convert
     * @return the camel case form
     */
    @Nonnull
    public static String toCamelCase(@Nonnull String name) {
        if (name.indexOf('_') < 0) {
            return name;
        }
        int start = 0;
        while (start < name.length() && name.charAt(start) == '_') {
            start++;
        }
        return name.substring(0, start) + CaseFormat.LOWER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name.substring(start));
    }

    /**
     * Upper-case the first character, as used to form accessor names like {@code getCreatedAt}.
     *
     * @param name the name
     * @return the name with its first character in upper case
     */
    @Nonnull
    public static String capitalize(@Nonnull String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
