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

/**
 * Log entry model and its on-disk record format.
 * <p>
 * Entries are framed by {@link dev.mars.segmentlog.entry.BinaryEntryCodec}; the storage
 * layer only depends on the {@link dev.mars.segmentlog.entry.EntryEncoder} and
 * {@link dev.mars.segmentlog.entry.EntryDecoderFactory} seams.
 */
package dev.mars.segmentlog.entry;
