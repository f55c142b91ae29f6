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
package dev.mars.segmentlog.demo;

import dev.mars.segmentlog.entry.BinaryEntryCodec;
import dev.mars.segmentlog.entry.EntryDecoder;
import dev.mars.segmentlog.entry.LogEntry;
import dev.mars.segmentlog.naming.Severity;
import dev.mars.segmentlog.storage.LogDirectories;
import dev.mars.segmentlog.storage.LogFileAccess;
import dev.mars.segmentlog.storage.LogFileInfo;
import dev.mars.segmentlog.storage.SegmentLog;
import dev.mars.segmentlog.storage.SegmentLogConfig;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Demo entry point for segment logging.
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link SegmentLogConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (log directory only)</li>
 *   <li>System properties: {@code -Dsegmentlog.logDirs=/path -Dsegmentlog.program=demo ...}</li>
 *   <li>Environment variables: {@code SEGMENTLOG_LOG_DIRS, SEGMENTLOG_PROGRAM, ...}</li>
 *   <li>Properties file: {@code segmentlog.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl segmentlog-demo -am
 *
 * # Write, list and fetch sample entries
 * java -jar segmentlog-demo/target/segmentlog-demo-1.0-SNAPSHOT.jar demo /tmp/segmentlog-demo
 *
 * # Print every entry of one log file (trusted local use, absolute path allowed)
 * java -jar segmentlog-demo/target/segmentlog-demo-1.0-SNAPSHOT.jar dump /tmp/segmentlog-demo/demo.host.me.log.INFO.2026-01-02T03_04_05Z.4242
 * </pre>
 */
public class SegmentLogDemo {

    public static void main(String[] args) throws Exception {
        String command = args.length > 0 ? args[0] : "demo";
        switch (command) {
            case "demo" -> runDemo(args.length > 1 ? args[1] : null);
            case "dump" -> {
                if (args.length < 2) {
                    usage();
                    return;
                }
                dump(args[1]);
            }
            default -> usage();
        }
    }

    private static void usage() {
        System.out.println("Usage:");
        System.out.println("  SegmentLogDemo demo [logDir]");
        System.out.println("  SegmentLogDemo dump <absolute-log-file>");
    }

    private static void runDemo(String logDir) {
        System.out.println("+---------------------------------------+");
        System.out.println("|         Segment Log Demo              |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        SegmentLogConfig.Builder builder = SegmentLogConfig.builder().program("demo");
        if (logDir != null && !logDir.isBlank()) {
            builder.logDir(Path.of(logDir));
        }
        SegmentLogConfig config = builder.build();
        System.out.println("Configuration: " + config);
        System.out.println();

        try (SegmentLog log = new SegmentLog(config)) {
            long start = nowNanos();
            log.append(new LogEntry(nowNanos(), Severity.INFO, "SegmentLogDemo.java", 90, "demo started"));
            log.append(new LogEntry(nowNanos(), Severity.WARNING, "SegmentLogDemo.java", 91, "disk 85% full"));
            log.append(new LogEntry(nowNanos(), Severity.ERROR, "SegmentLogDemo.java", 92, "request failed"));
            log.append(new LogEntry(nowNanos(), Severity.INFO, "SegmentLogDemo.java", 93, "demo finishing"));
            log.flush();
            long end = nowNanos();
            System.out.println("[OK] Appended 4 entries");

            List<LogFileInfo> files = log.listLogFiles();
            files.sort(Comparator.comparing(LogFileInfo::name));
            System.out.println("\n  Log files (" + files.size() + "):");
            for (LogFileInfo file : files) {
                System.out.printf("    %-70s %8d bytes%n", file.name(), file.sizeBytes());
            }

            for (Severity severity : Severity.values()) {
                List<LogEntry> entries = log.fetchEntries(severity, start, end);
                System.out.println("\n  " + severity + " stream: " + entries.size() + " entries");
                for (LogEntry entry : entries) {
                    print(entry);
                }
            }
        }

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  Segment log demo complete!           |");
        System.out.println("+---------------------------------------+");
    }

    private static void dump(String file) throws Exception {
        Path path = Path.of(file).toAbsolutePath();
        LogFileAccess access = new LogFileAccess(LogDirectories.of(path.getParent()));
        try (InputStream in = access.open(path.toString(), true);
             EntryDecoder decoder = new BinaryEntryCodec().open(in)) {
            Optional<LogEntry> entry;
            int count = 0;
            while ((entry = decoder.next()).isPresent()) {
                print(entry.get());
                count++;
            }
            System.out.println(count + " entries");
        }
    }

    private static void print(LogEntry entry) {
        Instant time = Instant.ofEpochSecond(0, entry.timeNanos());
        System.out.printf("    %s %-7s %s:%d] %s%n",
                time, entry.severity(), entry.file(), entry.line(), entry.message());
    }

    private static long nowNanos() {
        Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }
}
