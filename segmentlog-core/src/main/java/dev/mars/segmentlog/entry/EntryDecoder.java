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
package dev.mars.segmentlog.entry;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Forward-only reader of log entries from one open stream.
 * <p>
 * End of data is reported as an empty result; corruption is reported by
 * throwing {@link CorruptEntryException}.
 */
public interface EntryDecoder extends Closeable {

    /**
     * Decodes the next entry.
     *
     * @return the next entry, or empty at end of data
     * @throws CorruptEntryException if the data at the current position is not a valid entry
     * @throws IOException           if the underlying stream fails
     */
    Optional<LogEntry> next() throws IOException;
}
