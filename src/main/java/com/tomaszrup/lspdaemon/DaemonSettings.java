////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspdaemon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Immutable configuration for one invocation of the daemon layer.
 *
 * <p>Values are read from system properties ({@code -Dlspdaemon.basePort=19300})
 * and fall back to environment variables ({@code LSPDAEMON_BASE_PORT=19300}),
 * then to built-in defaults. Tests construct instances through
 * {@link #builder()} instead.</p>
 */
public final class DaemonSettings {

    private static final Logger logger = LoggerFactory.getLogger(DaemonSettings.class);

    static final String PROPERTY_PREFIX = "lspdaemon.";
    static final String ENV_PREFIX = "LSPDAEMON_";

    public static final String STATE_DIR = "stateDir";
    public static final String STATE_PREFIX = "statePrefix";
    public static final String BASE_PORT = "basePort";
    public static final String PORT_RANGE = "portRange";
    public static final String PORT_ATTEMPTS = "portAttempts";
    public static final String WORKER_NAME = "workerName";
    public static final String WORKER_COMMAND = "workerCommand";
    public static final String LANGUAGE_ID = "languageId";
    public static final String REQUEST_TIMEOUT_MS = "requestTimeoutMs";
    public static final String DIAGNOSTICS_TIMEOUT_MS = "diagnosticsTimeoutMs";
    public static final String POLL_INTERVAL_MS = "pollIntervalMs";

    private final Path stateDir;
    private final String statePrefix;
    private final int basePort;
    private final int portRange;
    private final int portAttempts;
    private final String workerName;
    /** Explicit worker command line; empty when the worker should be located. */
    private final List<String> workerCommand;
    private final String languageId;
    private final long requestTimeoutMs;
    private final long diagnosticsTimeoutMs;
    private final long pollIntervalMs;

    private DaemonSettings(Builder builder) {
        this.stateDir = builder.stateDir;
        this.statePrefix = builder.statePrefix;
        this.basePort = builder.basePort;
        this.portRange = builder.portRange;
        this.portAttempts = builder.portAttempts;
        this.workerName = builder.workerName;
        this.workerCommand = Collections.unmodifiableList(builder.workerCommand);
        this.languageId = builder.languageId;
        this.requestTimeoutMs = builder.requestTimeoutMs;
        this.diagnosticsTimeoutMs = builder.diagnosticsTimeoutMs;
        this.pollIntervalMs = builder.pollIntervalMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Settings from the JVM's system properties and the process environment. */
    public static DaemonSettings fromSystem() {
        return from(System.getProperties(), System.getenv());
    }

    static DaemonSettings from(Properties properties, Map<String, String> env) {
        Builder builder = builder();
        String value;
        if ((value = lookup(properties, env, STATE_DIR)) != null) {
            builder.stateDir(Paths.get(value));
        }
        if ((value = lookup(properties, env, STATE_PREFIX)) != null) {
            builder.statePrefix(value);
        }
        builder.basePort(intValue(properties, env, BASE_PORT, builder.basePort));
        builder.portRange(intValue(properties, env, PORT_RANGE, builder.portRange));
        builder.portAttempts(intValue(properties, env, PORT_ATTEMPTS, builder.portAttempts));
        if ((value = lookup(properties, env, WORKER_NAME)) != null) {
            builder.workerName(value);
        }
        if ((value = lookup(properties, env, WORKER_COMMAND)) != null) {
            builder.workerCommand(splitCommand(value));
        }
        if ((value = lookup(properties, env, LANGUAGE_ID)) != null) {
            builder.languageId(value);
        }
        builder.requestTimeoutMs(longValue(properties, env, REQUEST_TIMEOUT_MS, builder.requestTimeoutMs));
        builder.diagnosticsTimeoutMs(longValue(properties, env, DIAGNOSTICS_TIMEOUT_MS, builder.diagnosticsTimeoutMs));
        builder.pollIntervalMs(longValue(properties, env, POLL_INTERVAL_MS, builder.pollIntervalMs));
        return builder.build();
    }

    /**
     * Maps {@code basePort} to {@code LSPDAEMON_BASE_PORT}.
     */
    static String envName(String key) {
        StringBuilder sb = new StringBuilder(ENV_PREFIX);
        for (char c : key.toCharArray()) {
            if (Character.isUpperCase(c)) {
                sb.append('_');
            }
            sb.append(Character.toUpperCase(c));
        }
        return sb.toString();
    }

    private static String lookup(Properties properties, Map<String, String> env, String key) {
        String value = properties.getProperty(PROPERTY_PREFIX + key);
        if (value == null || value.isBlank()) {
            value = env.get(envName(key));
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intValue(Properties properties, Map<String, String> env, String key, int fallback) {
        String value = lookup(properties, env, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value for {}: '{}'", key, value);
            return fallback;
        }
    }

    private static long longValue(Properties properties, Map<String, String> env, String key, long fallback) {
        String value = lookup(properties, env, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value for {}: '{}'", key, value);
            return fallback;
        }
    }

    private static List<String> splitCommand(String value) {
        return Arrays.stream(value.trim().split("\\s+"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public Path getStateDir() {
        return stateDir;
    }

    public String getStatePrefix() {
        return statePrefix;
    }

    public int getBasePort() {
        return basePort;
    }

    public int getPortRange() {
        return portRange;
    }

    public int getPortAttempts() {
        return portAttempts;
    }

    public String getWorkerName() {
        return workerName;
    }

    public List<String> getWorkerCommand() {
        return workerCommand;
    }

    public String getLanguageId() {
        return languageId;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public long getDiagnosticsTimeoutMs() {
        return diagnosticsTimeoutMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    /**
     * The settings as {@code lspdaemon.*} system properties, in a form that
     * {@link #fromSystem()} reads back in a child JVM.
     */
    public Map<String, String> toSystemProperties() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put(PROPERTY_PREFIX + STATE_DIR, stateDir.toString());
        props.put(PROPERTY_PREFIX + STATE_PREFIX, statePrefix);
        props.put(PROPERTY_PREFIX + BASE_PORT, Integer.toString(basePort));
        props.put(PROPERTY_PREFIX + PORT_RANGE, Integer.toString(portRange));
        props.put(PROPERTY_PREFIX + PORT_ATTEMPTS, Integer.toString(portAttempts));
        props.put(PROPERTY_PREFIX + WORKER_NAME, workerName);
        if (!workerCommand.isEmpty()) {
            props.put(PROPERTY_PREFIX + WORKER_COMMAND, String.join(" ", workerCommand));
        }
        props.put(PROPERTY_PREFIX + LANGUAGE_ID, languageId);
        props.put(PROPERTY_PREFIX + REQUEST_TIMEOUT_MS, Long.toString(requestTimeoutMs));
        props.put(PROPERTY_PREFIX + DIAGNOSTICS_TIMEOUT_MS, Long.toString(diagnosticsTimeoutMs));
        props.put(PROPERTY_PREFIX + POLL_INTERVAL_MS, Long.toString(pollIntervalMs));
        return props;
    }

    @Override
    public String toString() {
        return "DaemonSettings{stateDir=" + stateDir
                + ", basePort=" + basePort
                + ", portRange=" + portRange
                + ", worker=" + (workerCommand.isEmpty() ? workerName : workerCommand)
                + ", requestTimeoutMs=" + requestTimeoutMs
                + ", diagnosticsTimeoutMs=" + diagnosticsTimeoutMs + "}";
    }

    public static final class Builder {
        private Path stateDir = Paths.get(System.getProperty("java.io.tmpdir"), "lsp-daemon");
        private String statePrefix = "ra";
        private int basePort = 19200;
        private int portRange = 100;
        private int portAttempts = 100;
        private String workerName = "rust-analyzer";
        private List<String> workerCommand = Collections.emptyList();
        private String languageId = "rust";
        private long requestTimeoutMs = 30_000;
        private long diagnosticsTimeoutMs = 3_000;
        private long pollIntervalMs = 100;

        private Builder() {
        }

        public Builder stateDir(Path stateDir) {
            this.stateDir = stateDir;
            return this;
        }

        public Builder statePrefix(String statePrefix) {
            this.statePrefix = statePrefix;
            return this;
        }

        public Builder basePort(int basePort) {
            this.basePort = basePort;
            return this;
        }

        public Builder portRange(int portRange) {
            this.portRange = portRange;
            return this;
        }

        public Builder portAttempts(int portAttempts) {
            this.portAttempts = portAttempts;
            return this;
        }

        public Builder workerName(String workerName) {
            this.workerName = workerName;
            return this;
        }

        public Builder workerCommand(List<String> workerCommand) {
            this.workerCommand = workerCommand == null ? Collections.emptyList() : List.copyOf(workerCommand);
            return this;
        }

        public Builder languageId(String languageId) {
            this.languageId = languageId;
            return this;
        }

        public Builder requestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
            return this;
        }

        public Builder diagnosticsTimeoutMs(long diagnosticsTimeoutMs) {
            this.diagnosticsTimeoutMs = diagnosticsTimeoutMs;
            return this;
        }

        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        public DaemonSettings build() {
            if (portRange <= 0) {
                throw new IllegalArgumentException("portRange must be positive: " + portRange);
            }
            if (portAttempts <= 0) {
                throw new IllegalArgumentException("portAttempts must be positive: " + portAttempts);
            }
            if (pollIntervalMs <= 0) {
                throw new IllegalArgumentException("pollIntervalMs must be positive: " + pollIntervalMs);
            }
            return new DaemonSettings(this);
        }
    }
}
