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
 * Segment storage: listing, creation, access and time-ordered retrieval.
 * <ul>
 *   <li>{@link dev.mars.segmentlog.storage.SegmentLog} - Facade over everything below</li>
 *   <li>{@link dev.mars.segmentlog.storage.LogFileLister} - Verified files across all log directories</li>
 *   <li>{@link dev.mars.segmentlog.storage.SegmentCreator} - New segments and "latest" symlinks</li>
 *   <li>{@link dev.mars.segmentlog.storage.EntryFetcher} - Multi-segment, time-windowed reads</li>
 *   <li>{@link dev.mars.segmentlog.storage.LogFileAccess} - Name-checked file access</li>
 * </ul>
 * <p>
 * <b>Directory Layout:</b>
 * <pre>
 * logs/
 *  ├─ app.host.alice.log.INFO.2026-01-02T03_04_05Z.4242    // segment
 *  ├─ app.host.alice.log.INFO.2026-01-02T09_00_00Z.4242    // newer segment
 *  ├─ app.host.alice.log.ERROR.2026-01-02T03_04_05Z.4242
 *  ├─ app.INFO  -&gt; app.host.alice.log.INFO.2026-01-02T09_00_00Z.4242
 *  └─ app.ERROR -&gt; app.host.alice.log.ERROR.2026-01-02T03_04_05Z.4242
 * </pre>
 * Old segments are never compressed or deleted here.
 */
package dev.mars.segmentlog.storage;
