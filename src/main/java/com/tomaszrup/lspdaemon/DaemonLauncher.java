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

import com.tomaszrup.lspdaemon.state.DaemonRecord;
import com.tomaszrup.lspdaemon.state.DaemonStateStore;
import com.tomaszrup.lspdaemon.state.ProjectHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Starts a detached {@code serve} JVM that hosts a project's worker and
 * waits for its state record to appear.
 *
 * <p>A short-lived invocation that spawned the worker itself would take the
 * proxy down when it exits. The hosting JVM outlives the invocation and
 * exits on its own when the worker does.</p>
 */
public class DaemonLauncher {

    private static final Logger logger = LoggerFactory.getLogger(DaemonLauncher.class);

    private final DaemonSettings settings;
    private final DaemonStateStore stateStore;
    private final long startTimeoutMs;

    public DaemonLauncher(DaemonSettings settings, DaemonStateStore stateStore) {
        this(settings, stateStore, settings.getRequestTimeoutMs());
    }

    DaemonLauncher(DaemonSettings settings, DaemonStateStore stateStore, long startTimeoutMs) {
        this.settings = settings;
        this.stateStore = stateStore;
        this.startTimeoutMs = startTimeoutMs;
    }

    /**
     * Returns the port of the project's live worker, launching a hosting JVM
     * first when there is none.
     *
     * @throws DaemonException if the host cannot be started, exits early, or
     *         does not publish a record in time
     */
    public int ensureDaemon(Path projectRoot) {
        Path root = ProjectHash.canonical(projectRoot);
        Optional<DaemonRecord> existing = stateStore.lookup(root);
        if (existing.isPresent()) {
            return existing.get().getPort();
        }

        List<String> command = hostCommand(root);
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(root.toFile());
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        Path hostLog = stateStore.getHostLog(root);
        try {
            Files.createDirectories(hostLog.getParent());
            pb.redirectError(ProcessBuilder.Redirect.appendTo(hostLog.toFile()));
        } catch (IOException e) {
            logger.warn("Cannot create host log {}, discarding its output: {}", hostLog, e.getMessage());
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        }

        Process host;
        try {
            host = pb.start();
            host.getOutputStream().close();
        } catch (IOException e) {
            throw new DaemonException("Failed to launch daemon host: " + e.getMessage(), e);
        }
        logger.info("Launched daemon host pid {} for {}", host.pid(), root);
        return awaitRecord(root, host);
    }

    private int awaitRecord(Path root, Process host) {
        long deadline = System.currentTimeMillis() + startTimeoutMs;
        while (System.currentTimeMillis() < deadline) {
            Optional<DaemonRecord> record = stateStore.lookup(root);
            if (record.isPresent()) {
                return record.get().getPort();
            }
            if (!host.isAlive()) {
                throw new DaemonException("Daemon host for " + root + " exited with code " + host.exitValue()
                        + " before the worker was ready");
            }
            try {
                Thread.sleep(settings.getPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DaemonException("Interrupted while waiting for daemon host", e);
            }
        }
        host.destroy();
        throw new DaemonException("Daemon host for " + root + " did not start within " + startTimeoutMs + "ms");
    }

    List<String> hostCommand(Path root) {
        List<String> command = new ArrayList<>();
        command.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        for (Map.Entry<String, String> property : settings.toSystemProperties().entrySet()) {
            command.add("-D" + property.getKey() + "=" + property.getValue());
        }
        String logLevel = System.getProperty(DaemonMain.LOG_LEVEL_PROPERTY);
        if (logLevel != null) {
            command.add("-D" + DaemonMain.LOG_LEVEL_PROPERTY + "=" + logLevel);
        }
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(DaemonMain.class.getName());
        command.add("serve");
        command.add(root.toString());
        return command;
    }
}
