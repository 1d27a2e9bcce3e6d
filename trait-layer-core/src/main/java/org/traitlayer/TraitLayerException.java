/*
 * TraitLayerException.java
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

package org.traitlayer;

import org.traitlayer.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the exceptions thrown by the Trait Layer. Besides a message, each exception carries key/value pairs that
 * can be logged in a searchable form, usually keyed by {@link org.traitlayer.logging.LogMessageKeys}.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class TraitLayerException extends RuntimeException {
    private static final Object[] EMPTY_LOG_INFO = new Object[0];

    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with the given message and a sequence of key-value pairs.
     *
     * @param msg error message
     * @param keyValues flattened key-value pairs
     * @throws IllegalArgumentException if <code>keyValues</code> has an odd number of elements
     * @see #addLogInfo(Object...)
     */
    public TraitLayerException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public TraitLayerException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public TraitLayerException(@Nonnull String msg) {
        super(msg);
    }

    /**
     * Get the log information associated with this exception as a map.
     *
     * @return a single map with all log information
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Add a key/value pair to the log information.
     *
     * @param description key of the pair
     * @param object value of the pair
     * @return this exception
     */
    @Nonnull
    public TraitLayerException addLogInfo(@Nonnull String description, @Nullable Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add a list of key/value pairs to the log information. Every even element is a key and every odd element is the
     * value for the key before it, so <code>["k0", "v0", "k1", "v1"]</code> adds two pairs. This is the same format
     * that {@link #exportLogInfo()} produces.
     *
     * @param keyValue flattened map of key-value pairs
     * @return this exception
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    public TraitLayerException addLogInfo(@Nonnull Object... keyValue) {
        if ((keyValue.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    /**
     * Export the log information as a flattened array of alternating keys and values.
     *
     * @return a flattened map of key-value pairs
     */
    @Nonnull
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return EMPTY_LOG_INFO;
        }
        Object[] exportedInfo = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exportedInfo[i] = entry.getKey();
            exportedInfo[i + 1] = entry.getValue();
            i += 2;
        }
        return exportedInfo;
    }
}
