package me.golemcore.chartwatch.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.concurrent.CompletableFuture;

/**
 * Port for text document storage inside the local workspace. Documents are
 * addressed by a top-level directory and a relative path.
 */
public interface StoragePort {

    /**
     * Write text content to file, replacing any previous content.
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file.
     *
     * @return completed with {@code null} when the file does not exist
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file. Missing files are ignored.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Atomically write text content to file with optional backup.
     *
     * <p>
     * The content is written to a {@code .tmp} sibling, fsynced, then renamed
     * over the target. With {@code backup} the previous version is kept as
     * {@code .bak}.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
