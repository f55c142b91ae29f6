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

import java.util.Optional;

/**
 * Log severity, ordered from least to most severe.
 * <p>
 * The enum constant name is the token written into log file names, so
 * {@link #fromName(String)} is case-sensitive.
 */
public enum Severity {
    INFO(0),
    WARNING(1),
    ERROR(2),
    FATAL(3);

    private static final Severity[] BY_CODE = values();

    private final int code;

    Severity(int code) {
        this.code = code;
    }

    /** Single-byte code used by the binary entry format. */
    public int code() {
        return code;
    }

    /** True if this severity is {@code other} or worse. */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Looks up a severity by its exact file name token.
     *
     * @param name the token, e.g. {@code "WARNING"}
     * @return the severity, or empty if the token is unknown
     */
    public static Optional<Severity> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (Severity severity : BY_CODE) {
            if (severity.name().equals(name)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up a severity by its binary code.
     *
     * @return the severity, or empty if the code is out of range
     */
    public static Optional<Severity> fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.of(BY_CODE[code]);
    }
}
