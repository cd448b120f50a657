/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.chunkcache.config;

import static java.util.Objects.requireNonNull;

import java.util.Optional;

/**
 * A configurable parameter of the chunk cache.
 *
 * @param <T> The type of the parameter's value.
 * @param key The unique key identifying the parameter.
 * @param title A human-readable title of the parameter.
 * @param description A human-readable description of the parameter.
 * @param group A logical grouping for the parameter (e.g., "cache", "download", "proxy").
 * @param type The {@link Class} representing the type of the parameter's value.
 * @param defaultValue An {@link Optional} containing the default value of the parameter, if any.
 */
public record CacheParameter<T>(
        String key, String title, String description, String group, Class<T> type, Optional<T> defaultValue) {

    /** Storage and chunking parameters. */
    public static final String GROUP_CACHE = "cache";
    /** Origin download parameters. */
    public static final String GROUP_DOWNLOAD = "download";
    /** Local HTTP proxy parameters. */
    public static final String GROUP_PROXY = "proxy";

    public CacheParameter {
        requireNonNull(key, "Parameter key cannot be null");
        requireNonNull(title, "Parameter title cannot be null");
        requireNonNull(description, "Parameter description cannot be null");
        requireNonNull(group, "Parameter group cannot be null");
        requireNonNull(type, "Parameter type cannot be null");
        requireNonNull(defaultValue, "Parameter default value optional cannot be null");
        defaultValue.ifPresent(v -> {
            if (!type.isInstance(v)) {
                throw new IllegalArgumentException(
                        "Default value of %s is not a %s: %s".formatted(key, type.getSimpleName(), v));
            }
        });
    }

    /**
     * @return the default value
     * @throws java.util.NoSuchElementException if the parameter has no default
     */
    public T requireDefault() {
        return defaultValue.orElseThrow();
    }

    /**
     * Creates a new {@link Builder} for constructing a {@link CacheParameter}.
     *
     * @return A new {@link Builder} instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder class for {@link CacheParameter}.
     */
    public static class Builder {
        String key;
        String title;
        String description = "";
        String group;

        @SuppressWarnings("rawtypes")
        Class type;

        Optional<Object> defaultValue = Optional.empty();

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(Class<?> type) {
            this.type = type;
            return this;
        }

        public Builder group(String group) {
            this.group = group;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = Optional.ofNullable(defaultValue);
            return this;
        }

        /**
         * Builds a new {@link CacheParameter} instance.
         *
         * @param <T> The type of the parameter value.
         * @return A new {@link CacheParameter}.
         * @throws NullPointerException if key, title, group, or type is {@code null}.
         */
        @SuppressWarnings("unchecked")
        public <T> CacheParameter<T> build() {
            return new CacheParameter<>(key, title, description, group, type, (Optional<T>) (Optional<?>) defaultValue);
        }
    }
}
