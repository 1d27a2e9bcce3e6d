/*
 * TraitLayerExceptionTest.java
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

import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;
import org.traitlayer.logging.LogMessageKeys;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.emptyArray;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link TraitLayerException}.
 */
public class TraitLayerExceptionTest {

    @Test
    public void logInfoFromConstructor() {
        final TraitLayerException e = new TraitLayerException("bad", LogMessageKeys.CAPABILITY, "temporal", LogMessageKeys.COUNT, 2);
        assertThat(e.getLogInfo(), hasEntry("capability", (Object)"temporal"));
        assertThat(e.getLogInfo(), hasEntry("count", (Object)2));
        assertThat(e.exportLogInfo(), Matchers.<Object>arrayContaining("capability", "temporal", "count", 2));
    }

    @Test
    public void noLogInfo() {
        final TraitLayerException e = new TraitLayerException("bad");
        assertThat(e.getLogInfo(), anEmptyMap());
        assertThat(e.exportLogInfo(), emptyArray());
    }

    @Test
    public void unbalancedLogInfo() {
        final TraitLayerException e = new TraitLayerException("bad");
        assertThrows(IllegalArgumentException.class, () -> e.addLogInfo("key", "value", "dangling"));
    }
}
