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
package io.tileverse.chunkcache.index;

import static java.util.Objects.requireNonNull;

/**
 * Identifies a cached media object at a given quality.
 *
 * @param sourceId the upstream media source
 * @param mediaId the media item within the source
 * @param quality the quality variant, e.g. {@code original} or {@code 1080p}
 */
public record CacheEntryKey(String sourceId, String mediaId, String quality) {

    public CacheEntryKey {
        requireNonNull(sourceId, "sourceId");
        requireNonNull(mediaId, "mediaId");
        requireNonNull(quality, "quality");
    }

    public static CacheEntryKey of(String sourceId, String mediaId, String quality) {
        return new CacheEntryKey(sourceId, mediaId, quality);
    }

    @Override
    public String toString() {
        return sourceId + "/" + mediaId + "/" + quality;
    }
}
