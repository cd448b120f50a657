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
package io.tileverse.chunkcache;

/**
 * Download priority of a chunk, declared from most to least urgent.
 */
public enum Priority {
    /** Needed right now for playback. */
    CRITICAL,
    /** Lookahead chunks ahead of the playback position. */
    HIGH,
    /** User-requested pre-caching. */
    MEDIUM,
    /** Background sequential fill. */
    LOW;

    public boolean isHigherThan(Priority other) {
        return ordinal() < other.ordinal();
    }
}
