/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.segmentlog.storage;

import dev.mars.segmentlog.naming.FileDetails;

import java.nio.file.Path;

/**
 * A verified log file found by a directory listing.
 * <p>
 * Rebuilt on every listing; never cached.
 *
 * @param name         base file name
 * @param path         absolute path of the file
 * @param sizeBytes    file size in bytes
 * @param modTimeNanos last modification time, nanoseconds since the epoch
 * @param details      details decoded from the name
 */
public record LogFileInfo(String name, Path path, long sizeBytes, long modTimeNanos, FileDetails details) {
}
