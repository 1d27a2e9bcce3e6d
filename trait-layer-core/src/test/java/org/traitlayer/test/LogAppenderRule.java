/*
 * LogAppenderRule.java
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

package org.traitlayer.test;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A JUnit extension that captures the log events of one logger for the duration of each test. Register it with
 * {@code @RegisterExtension}.
 */
public class LogAppenderRule implements BeforeEachCallback, AfterEachCallback {
    private LogAppender logAppender;
    private Logger logger;
    @Nonnull
    private final String name;
    @Nonnull
    private final Class<?> clazz;
    @Nonnull
    private final Level level;
    private Level beforeLogLevel;

    private static class LogAppender extends AbstractAppender {
        private final List<LogEvent> log = Collections.synchronizedList(new ArrayList<>());

        protected LogAppender(String name) {
            super(name, null, null, false, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            log.add(event.toImmutable());
        }

        public List<LogEvent> getLogs() {
            synchronized (log) {
                return new ArrayList<>(log);
            }
        }
    }

    public LogAppenderRule(@Nonnull String name, @Nonnull Class<?> clazz, @Nonnull Level level) {
        this.name = name;
        this.clazz = clazz;
        this.level = level;
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        logAppender = new LogAppender(name);
        logger = (Logger)LogManager.getLogger(clazz);
        logger.addAppender(logAppender);
        beforeLogLevel = logger.getLevel();
        logger.setLevel(level);
        logAppender.start();
    }

    @Override
    public void afterEach(ExtensionContext context) {
        if (logAppender != null) {
            logAppender.stop();
        }
        if (logger != null) {
            logger.removeAppender(logAppender);
            logger.setLevel(beforeLogLevel);
        }
    }

    public List<LogEvent> getLogEvents() {
        return logAppender.getLogs();
    }

    public List<String> getMessages(@Nonnull Level atLevel) {
        return getLogEvents().stream()
                .filter(event -> event.getLevel().equals(atLevel))
                .map(event -> event.getMessage().getFormattedMessage())
                .collect(Collectors.toList());
    }

    public String getLastLogEventMessage() {
        final List<LogEvent> events = getLogEvents();
        return events.get(events.size() - 1).getMessage().getFormattedMessage();
    }
}
