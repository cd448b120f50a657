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
package io.tileverse.chunkcache.store;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * How a cache file is grown to its expected size.
 */
public enum FileAllocation {
    /** Writes a single byte at the last position, leaving a hole the file system doesn't back with blocks. */
    SPARSE {
        @Override
        void grow(FileChannel channel, long currentSize, long targetSize) throws IOException {
            channel.write(ByteBuffer.allocate(1), targetSize - 1);
        }
    },
    /** Writes zeros over the whole extension. */
    PREALLOCATED {
        @Override
        void grow(FileChannel channel, long currentSize, long targetSize) throws IOException {
            ByteBuffer zeros = ByteBuffer.allocate(ZERO_BLOCK_SIZE);
            long position = currentSize;
            while (position < targetSize) {
                zeros.clear();
                zeros.limit((int) Math.min(ZERO_BLOCK_SIZE, targetSize - position));
                while (zeros.hasRemaining()) {
                    position += channel.write(zeros, position);
                }
            }
        }
    };

    private static final Logger logger = LoggerFactory.getLogger(FileAllocation.class);

    static final int ZERO_BLOCK_SIZE = 1024 * 1024;

    private static final Set<String> SPARSE_CAPABLE = Set.of(
            "ext3", "ext4", "xfs", "btrfs", "zfs", "tmpfs", "overlay", "f2fs", "apfs", "ntfs", "refs", "jfs");

    /**
     * Grows the file from {@code currentSize} to {@code targetSize} bytes.
     */
    abstract void grow(FileChannel channel, long currentSize, long targetSize) throws IOException;

    /**
     * Probes the file store of {@code directory} for sparse file support.
     *
     * @param directory an existing directory
     * @return {@link #SPARSE} if the file store type is known to support holes, {@link #PREALLOCATED} otherwise
     */
    public static FileAllocation probe(Path directory) {
        try {
            FileStore store = Files.getFileStore(directory);
            String type = store.type().toLowerCase(Locale.ROOT);
            FileAllocation allocation = SPARSE_CAPABLE.contains(type) ? SPARSE : PREALLOCATED;
            logger.debug("File store {} of {} is {}, using {} allocation", store.name(), directory, type, allocation);
            return allocation;
        } catch (IOException e) {
            logger.warn("Unable to probe file store of {}, using pre-allocated files: {}", directory, e.getMessage());
            return PREALLOCATED;
        }
    }
}
