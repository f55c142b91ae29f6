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

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * A newly created segment, open for appending.
 * <p>
 * {@code symlinkUpdated} reports whether the "latest" symlink now points at this
 * segment. It is informational; a segment is usable either way.
 *
 * @param channel        append-only channel; owned by the caller
 * @param path           absolute path of the segment
 * @param symlinkUpdated whether the severity's symlink was replaced
 */
public record CreatedSegment(FileChannel channel, Path path, boolean symlinkUpdated) implements Closeable {

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
