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

import java.io.IOException;
import java.util.Locale;

/**
 * Failure reading or writing the on-disk cache file of an entry.
 */
public class ChunkStorageException extends IOException {

    private static final long serialVersionUID = 1L;

    private final boolean diskFull;

    public ChunkStorageException(String message) {
        super(message);
        this.diskFull = false;
    }

    public ChunkStorageException(String message, IOException cause) {
        super(message, cause);
        this.diskFull = isNoSpaceLeft(cause);
    }

    /**
     * @return {@code true} if the underlying failure was the file system running out of space
     */
    public boolean isDiskFull() {
        return diskFull;
    }

    static boolean isNoSpaceLeft(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("no space left") || lower.contains("not enough space")) {
                    return true;
                }
            }
        }
        return false;
    }
}
