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
package dev.mars.segmentlog.naming;

import java.time.Instant;

/**
 * Everything that can be recovered from a log file name.
 * <p>
 * Produced by {@link LogFileNames#parse(String)}.
 *
 * @param program  unescaped program name
 * @param host     unescaped host name
 * @param userName unescaped user name
 * @param severity severity of the stream the file belongs to
 * @param time     segment creation time (second precision)
 * @param pid      id of the process that created the file
 */
public record FileDetails(
        String program,
        String host,
        String userName,
        Severity severity,
        Instant time,
        long pid
) {

    /**
     * Creation time as nanoseconds since the epoch, saturated to
     * {@link Long#MIN_VALUE}/{@link Long#MAX_VALUE} outside 1677..2262.
     */
    public long timeNanos() {
        try {
            return Math.addExact(Math.multiplyExact(time.getEpochSecond(), 1_000_000_000L), time.getNano());
        } catch (ArithmeticException e) {
            return time.getEpochSecond() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    /** The identity portion of the name. */
    public ProcessIdentity identity() {
        return new ProcessIdentity(program, host, userName, pid);
    }
}
