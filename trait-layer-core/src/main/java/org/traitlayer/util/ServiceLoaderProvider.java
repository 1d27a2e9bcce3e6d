/*
 * ServiceLoaderProvider.java
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

import com.google.common.collect.ImmutableList;
import org.traitlayer.annotation.API;

import javax.annotation.Nonnull;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * The single place where the Trait Layer discovers services, such as
 * {@link org.traitlayer.capability.CapabilityDefinitionProvider}s. {@link ServiceLoader} is used unless another
 * mechanism, for example a dependency injection framework, is installed first with {@link #initialize(Function)}.
 */
@API(API.Status.INTERNAL)
public final class ServiceLoaderProvider {
    public static final Function<Class<?>, Iterable<?>> DEFAULT_LOADER = ServiceLoader::load;

    @Nonnull
    private static volatile Function<Class<?>, Iterable<?>> serviceLoader = DEFAULT_LOADER;
    private static final AtomicBoolean used = new AtomicBoolean();

    private ServiceLoaderProvider() {
        // Singleton utility class
    }

    /**
     * Replace the default service loader. Once any service has been loaded the loader is fixed, so registries built
     * earlier and later never see different providers.
     *
     * @param loader replacement service loader
     * @throws IllegalStateException if a service has already been loaded with a different loader
     */
    public static synchronized void initialize(@Nonnull final Function<Class<?>, Iterable<?>> loader) {
        if (used.get() && !serviceLoader.equals(loader)) {
            throw new IllegalStateException("ServiceLoaderProvider already initialized");
        }
        serviceLoader = loader;
    }

    /**
     * Load the instances of the given service.
     *
     * @param clazz service class
     * @param <T> service type
     * @return the service instances, in the order the loader produced them
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public static <T> Iterable<T> load(@Nonnull final Class<T> clazz) {
        used.set(true);
        return (Iterable<T>) serviceLoader.apply(clazz);
    }

    /**
     * Load the instances of the given service into a list, so that callers can iterate them while holding a lock
     * without re-entering the loader.
     *
     * @param clazz service class
     * @param <T> service type
     * @return the service instances
     */
    @Nonnull
    public static <T> ImmutableList<T> loadAll(@Nonnull final Class<T> clazz) {
        return ImmutableList.copyOf(load(clazz));
    }
}
