/*
 * Capabilities.java
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

import com.google.common.collect.ImmutableSet;
import org.traitlayer.annotation.API;
import org.traitlayer.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * Static helpers for opting types into capabilities and for asking what a value supports.
 *
 * <p>
 * The {@code attach} methods run a full registration and throw the matching {@link CapabilityRegistrationException}
 * if it is rejected, so they are meant to be the last step of defining a type. For a class annotated with
 * {@link ImplementsCapabilities}:
 * </p>
 * <pre>{@code
 * public class Order {
 *     static {
 *         Capabilities.attachDeclared(registry, Order.class);
 *     }
 * }
 * }</pre>
 */
@API(API.Status.UNSTABLE)
public final class Capabilities {
    private Capabilities() {
    }

    /**
     * Register capabilities on a type, failing if any check fails.
     * @param registry the registry
     * @param type the type
     * @param capabilities capability names
     * @param <T> the type's shape
     * @return {@code type}
     * @throws CapabilityRegistrationException if the registration is rejected
     */
    @Nonnull
    public static <T extends TypeShape> T attach(@Nonnull CapabilityRegistry registry, @Nonnull T type,
                                                 @Nonnull String... capabilities) {
        registry.registerAll(type, Arrays.asList(capabilities)).orElseThrow();
        return type;
    }

    @Nonnull
    public static <T> Class<T> attach(@Nonnull CapabilityRegistry registry, @Nonnull Class<T> type,
                                      @Nonnull String... capabilities) {
        attach(registry, TypeShape.of(type), capabilities);
        return type;
    }

    /**
     * Register the capabilities named by the class's {@link ImplementsCapabilities} annotation.
     * @param registry the registry
     * @param type an annotated class
     * @param <T> the class
     * @return {@code type}
     * @throws CapabilityException if the class is not annotated or declares no capabilities
     * @throws CapabilityRegistrationException if the registration is rejected
     */
    @Nonnull
    public static <T> Class<T> attachDeclared(@Nonnull CapabilityRegistry registry, @Nonnull Class<T> type) {
        final ImmutableSet<String> declared = declaredCapabilities(type);
        if (declared.isEmpty()) {
            throw new CapabilityException("class declares no capabilities",
                    LogMessageKeys.TYPE_NAME, type.getName());
        }
        return attach(registry, type, declared.toArray(new String[0]));
    }

    /**
     * Get the capabilities a class declares with {@link ImplementsCapabilities}.
     * @param type the class
     * @return the declared names, empty if the class is not annotated
     */
    @Nonnull
    public static ImmutableSet<String> declaredCapabilities(@Nonnull Class<?> type) {
        final ImplementsCapabilities annotation = type.getAnnotation(ImplementsCapabilities.class);
        return annotation == null ? ImmutableSet.of() : ImmutableSet.copyOf(annotation.value());
    }

    /**
     * Get the shape of a value's type: the shape it reports if it implements {@link HasTypeShape}, otherwise the
     * shape of its class.
     * @param value the value
     * @return the shape
     */
    @Nonnull
    public static TypeShape shapeOf(@Nonnull Object value) {
        if (value instanceof HasTypeShape) {
            return ((HasTypeShape)value).getTypeShape();
        }
        return TypeShape.of(value.getClass());
    }

    /**
     * Whether a value's type carries a capability, for dispatching on what a value supports.
     * @param registry the registry
     * @param value the value, possibly {@code null}
     * @param capability the capability name
     * @return {@code false} for {@code null}, otherwise {@link CapabilityRegistry#hasCapability(TypeShape, String)}
     */
    public static boolean supports(@Nonnull CapabilityRegistry registry, @Nullable Object value, @Nonnull String capability) {
        return value != null && registry.hasCapability(shapeOf(value), capability);
    }
}
