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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * The process identity embedded in every log file name.
 * <p>
 * Captured once at startup and treated as read-only afterwards.
 *
 * @param program  program name (base name, no directory)
 * @param host     short host name
 * @param userName user running the process
 * @param pid      process id
 */
public record ProcessIdentity(String program, String host, String userName, long pid) {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessIdentity.class);

    static final String UNKNOWN_HOST = "unknownhost";
    static final String UNKNOWN_USER = "unknownuser";

    public ProcessIdentity {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(userName, "userName");
        if (program.isEmpty() || host.isEmpty() || userName.isEmpty()) {
            throw new IllegalArgumentException("Identity fields must not be empty: program=" + program +
                    ", host=" + host + ", userName=" + userName);
        }
        if (hasSeparator(program) || hasSeparator(host) || hasSeparator(userName)) {
            throw new IllegalArgumentException("Identity fields must not contain path separators: program=" +
                    program + ", host=" + host + ", userName=" + userName);
        }
        if (pid < 0) {
            throw new IllegalArgumentException("pid must not be negative: " + pid);
        }
    }

    /**
     * Resolves the identity of the running JVM.
     *
     * @param program the program name to record
     */
    public static ProcessIdentity current(String program) {
        return new ProcessIdentity(program, localHost(), localUser(), ProcessHandle.current().pid());
    }

    /**
     * Returns its argument truncated at the first period.
     * For instance, given {@code "www.example.com"} it returns {@code "www"}.
     */
    public static String shortHostname(String hostname) {
        int dot = hostname.indexOf('.');
        return dot >= 0 ? hostname.substring(0, dot) : hostname;
    }

    private static boolean hasSeparator(String field) {
        return field.indexOf('/') >= 0 || field.indexOf('\\') >= 0;
    }

    private static String localHost() {
        try {
            String name = shortHostname(InetAddress.getLocalHost().getHostName());
            return name.isEmpty() ? UNKNOWN_HOST : name;
        } catch (UnknownHostException e) {
            LOG.debug("Could not resolve local host name: {}", e.getMessage());
            return UNKNOWN_HOST;
        }
    }

    private static String localUser() {
        String user = System.getProperty("user.name");
        if (user == null || user.isBlank()) {
            return UNKNOWN_USER;
        }
        // Windows account names may carry a DOMAIN\ prefix
        return user.replace('\\', '_').replace('/', '_');
    }
}
