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
package com.tomaszrup.lspdaemon.process;

import com.tomaszrup.lspdaemon.WorkerNotFoundException;
import com.tomaszrup.lspdaemon.state.DaemonStateStore;
import com.tomaszrup.lspdaemon.state.ProjectHash;
import com.tomaszrup.lspdaemon.util.MdcProjectContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one worker process and everything whose lifetime is bound to it.
 *
 * <p>The worker runs with the project root as working directory. Its stdin
 * and stdout are pipes that only the proxy touches; stderr is appended to a
 * log file next to the state file and never reaches the framed stream.</p>
 *
 * <p>When the process exits, for whatever reason, a finalizer closes the
 * attached proxy endpoint, deletes the project's state record and runs the
 * registered termination callbacks. The finalizer runs at most once. The
 * worker is never restarted from here; the next caller that finds no live
 * record spawns a new one.</p>
 */
public class ProcessSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(ProcessSupervisor.class);

    private final Path projectRoot;
    private final Process process;
    private final DaemonStateStore stateStore;
    private final AtomicBoolean terminated = new AtomicBoolean();
    private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();
    private volatile Closeable endpoint;

    private ProcessSupervisor(Path projectRoot, Process process, DaemonStateStore stateStore) {
        this.projectRoot = projectRoot;
        this.process = process;
        this.stateStore = stateStore;
    }

    /**
     * Starts the worker for a project.
     *
     * @throws WorkerNotFoundException when the command cannot be executed
     */
    public static ProcessSupervisor spawn(Path projectRoot, List<String> command, DaemonStateStore stateStore) {
        Path root = ProjectHash.canonical(projectRoot);
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(root.toFile());
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        pb.redirectOutput(ProcessBuilder.Redirect.PIPE);
        try {
            Path stderrLog = stateStore.getStderrLog(root);
            Files.createDirectories(stderrLog.getParent());
            pb.redirectError(ProcessBuilder.Redirect.appendTo(stderrLog.toFile()));
        } catch (IOException e) {
            logger.warn("Cannot create stderr log for {}, discarding worker stderr: {}", root, e.getMessage());
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new WorkerNotFoundException("Failed to start worker " + command + ": " + e.getMessage(), e);
        }
        logger.info("Started worker pid {} for {}: {}", process.pid(), root, command);

        ProcessSupervisor supervisor = new ProcessSupervisor(root, process, stateStore);
        Runnable onExit = MdcProjectContext.wrap(supervisor::finish);
        process.onExit().whenComplete((p, error) -> onExit.run());
        return supervisor;
    }

    public long getPid() {
        return process.pid();
    }

    public Path getProjectRoot() {
        return projectRoot;
    }

    /** Worker stdin; the proxy's only writer target. */
    public OutputStream getStdin() {
        return process.getOutputStream();
    }

    /** Worker stdout; read only by the proxy's stdout pump. */
    public InputStream getStdout() {
        return process.getInputStream();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Binds a resource to the worker's lifetime. If the worker has already
     * exited the resource is closed right away.
     */
    public void attach(Closeable resource) {
        this.endpoint = resource;
        if (terminated.get()) {
            closeEndpoint(resource);
        }
    }

    /** Registers a callback run once after the worker has exited and been cleaned up. */
    public void onTermination(Runnable callback) {
        exitFuture.whenComplete((code, error) -> {
            try {
                callback.run();
            } catch (RuntimeException e) {
                logger.warn("Termination callback failed for pid {}: {}", process.pid(), e.getMessage(), e);
            }
        });
    }

    /** Completes with the worker's exit code after cleanup has run. */
    public CompletableFuture<Integer> awaitExit() {
        return exitFuture;
    }

    /**
     * Asks the worker and its child processes to terminate. Cleanup happens
     * through the normal exit path.
     */
    public void stop() {
        logger.info("Stopping worker pid {}", process.pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
    }

    private void finish() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        int exitCode = process.exitValue();
        logger.info("Worker pid {} for {} exited with code {}", process.pid(), projectRoot, exitCode);
        Closeable current = endpoint;
        if (current != null) {
            closeEndpoint(current);
        }
        stateStore.removeIfOwnedBy(projectRoot, process.pid());
        exitFuture.complete(exitCode);
    }

    private void closeEndpoint(Closeable resource) {
        try {
            resource.close();
        } catch (IOException e) {
            logger.debug("Error closing endpoint of pid {}: {}", process.pid(), e.getMessage());
        }
    }
}
