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

import com.tomaszrup.lspdaemon.net.PortAllocator;
import com.tomaszrup.lspdaemon.net.ProxyEndpoint;
import com.tomaszrup.lspdaemon.net.ProxyListener;
import com.tomaszrup.lspdaemon.process.ProcessSupervisor;
import com.tomaszrup.lspdaemon.process.WorkerLocator;
import com.tomaszrup.lspdaemon.rpc.ConnectionCache;
import com.tomaszrup.lspdaemon.rpc.RpcClient;
import com.tomaszrup.lspdaemon.state.DaemonRecord;
import com.tomaszrup.lspdaemon.state.DaemonStateStore;
import com.tomaszrup.lspdaemon.state.ProjectHash;
import com.tomaszrup.lspdaemon.util.MdcProjectContext;
import org.eclipse.lsp4j.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of the daemon layer for a caller that wants diagnostics for a
 * file.
 *
 * <p>{@link #ensureWorker(Path)} makes sure a worker is running for the
 * project and reachable on a loopback port, spawning one in this process if
 * the state store has no live record. {@link #queryDiagnostics} then talks to
 * that port through a cached {@link RpcClient}.</p>
 *
 * <p>Workers spawned here live as long as this JVM does. A process that
 * spawns workers must keep running until {@link #awaitHostedWorkers()}
 * completes, otherwise the workers lose their proxy.</p>
 */
public class DaemonManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DaemonManager.class);

    private final DaemonSettings settings;
    private final ExecutorPools executorPools;
    private final DaemonStateStore stateStore;
    private final PortAllocator portAllocator;
    private final WorkerLocator workerLocator;
    private final ProxyListener proxyListener;
    private final ConnectionCache connectionCache;
    private final Map<Path, ProcessSupervisor> hostedWorkers = new ConcurrentHashMap<>();

    public DaemonManager(DaemonSettings settings) {
        this(settings, new ExecutorPools());
    }

    DaemonManager(DaemonSettings settings, ExecutorPools executorPools) {
        this.settings = settings;
        this.executorPools = executorPools;
        this.stateStore = new DaemonStateStore(settings.getStateDir(), settings.getStatePrefix());
        this.portAllocator = new PortAllocator(settings.getBasePort(), settings.getPortRange(),
                settings.getPortAttempts());
        this.workerLocator = new WorkerLocator(settings.getWorkerName(), settings.getWorkerCommand());
        this.proxyListener = new ProxyListener(executorPools);
        this.connectionCache = new ConnectionCache(() -> new RpcClient(executorPools.getEventLoop(), settings));
    }

    public DaemonStateStore getStateStore() {
        return stateStore;
    }

    public DaemonSettings getSettings() {
        return settings;
    }

    /**
     * Returns the port of the project's live worker, starting one first if
     * none is running.
     *
     * @throws WorkerNotFoundException if no worker executable is available
     * @throws PortAllocationException if no port in the project's window is free
     * @throws DaemonException if the worker dies during start-up or its
     *         record cannot be written
     */
    public synchronized int ensureWorker(Path projectRoot) {
        Path root = ProjectHash.canonical(projectRoot);
        MdcProjectContext.setProject(root, ProjectHash.hex(root));

        Path lockFile = stateStore.getStartLock(root);
        try {
            Files.createDirectories(lockFile.getParent());
        } catch (IOException e) {
            throw new DaemonException("Cannot create state directory " + lockFile.getParent() + ": "
                    + e.getMessage(), e);
        }
        // other processes starting a worker for the same project wait here
        try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            return ensureWorkerLocked(root);
        } catch (IOException e) {
            throw new DaemonException("Cannot lock " + lockFile + ": " + e.getMessage(), e);
        }
    }

    private int ensureWorkerLocked(Path root) {
        Optional<DaemonRecord> existing = stateStore.lookup(root);
        if (existing.isPresent()) {
            logger.debug("Reusing worker pid {} on port {}", existing.get().getPid(), existing.get().getPort());
            return existing.get().getPort();
        }

        List<String> command = workerLocator.locate();
        int port = portAllocator.allocate(root);
        ProcessSupervisor worker = ProcessSupervisor.spawn(root, command, stateStore);

        ProxyEndpoint endpoint;
        try {
            endpoint = proxyListener.start(port, worker);
        } catch (IOException e) {
            worker.stop();
            throw new DaemonException("Cannot bind proxy on port " + port + ": " + e.getMessage(), e);
        }
        worker.attach(endpoint);
        hostedWorkers.put(root, worker);
        worker.onTermination(() -> hostedWorkers.remove(root, worker));

        DaemonRecord record = new DaemonRecord(worker.getPid(), port, root, System.currentTimeMillis(), false);
        try {
            stateStore.persist(record);
        } catch (IOException e) {
            worker.stop();
            throw new DaemonException("Cannot write daemon state for " + root + ": " + e.getMessage(), e);
        }
        if (!worker.isAlive()) {
            // the exit finalizer may have run before the record existed
            stateStore.removeIfOwnedBy(root, worker.getPid());
            throw new DaemonException("Worker for " + root + " exited during start-up, see "
                    + stateStore.getStderrLog(root));
        }
        logger.info("Worker pid {} for {} ready on port {}", worker.getPid(), root, port);
        return port;
    }

    /**
     * Sends the file's current content to the worker and waits for its
     * diagnostics. An empty list means none arrived within the diagnostics
     * timeout.
     */
    public CompletableFuture<List<Diagnostic>> queryDiagnostics(int port, Path file, Path projectRoot) {
        Path root = ProjectHash.canonical(projectRoot);
        MdcProjectContext.setProject(root, ProjectHash.hex(root));

        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new DaemonException("Cannot read " + file + ": " + e.getMessage(), e));
        }
        String uri = file.toAbsolutePath().normalize().toUri().toString();
        boolean workerInitialized = stateStore.lookup(root).map(DaemonRecord::isInitialized).orElse(false);

        return connectionCache.get(root, port, workerInitialized).thenCompose(client -> {
            if (!workerInitialized) {
                recordInitialized(root);
            }
            return client.syncDocument(uri, text)
                    .thenCompose(ignored -> client.awaitDiagnostics(uri, settings.getDiagnosticsTimeoutMs()));
        });
    }

    private void recordInitialized(Path root) {
        try {
            stateStore.markInitialized(root);
        } catch (IOException e) {
            logger.warn("Cannot mark worker for {} as initialized: {}", root, e.getMessage());
        }
    }

    /** The live record for a project, if any. */
    public Optional<DaemonRecord> status(Path projectRoot) {
        return stateStore.lookup(projectRoot);
    }

    /**
     * Terminates the project's live worker, whichever process hosts it.
     *
     * @return whether a live worker was found
     */
    public boolean stop(Path projectRoot) {
        Path root = ProjectHash.canonical(projectRoot);
        ProcessSupervisor hosted = hostedWorkers.get(root);
        if (hosted != null) {
            hosted.stop();
            return true;
        }
        Optional<DaemonRecord> record = stateStore.lookup(root);
        if (record.isEmpty()) {
            return false;
        }
        long pid = record.get().getPid();
        boolean signalled = ProcessHandle.of(pid).map(handle -> {
            handle.descendants().forEach(ProcessHandle::destroy);
            return handle.destroy();
        }).orElse(false);
        logger.info("Stop requested for worker pid {} of {}: {}", pid, root, signalled ? "signalled" : "not running");
        if (!signalled) {
            stateStore.removeIfOwnedBy(root, pid);
        }
        return signalled;
    }

    public boolean isHostingWorkers() {
        return !hostedWorkers.isEmpty();
    }

    /** Completes once every worker spawned by this manager has exited. */
    public CompletableFuture<Void> awaitHostedWorkers() {
        List<CompletableFuture<Integer>> exits = new ArrayList<>();
        for (ProcessSupervisor worker : hostedWorkers.values()) {
            exits.add(worker.awaitExit());
        }
        return CompletableFuture.allOf(exits.toArray(new CompletableFuture<?>[0]));
    }

    /**
     * Closes cached connections and the executor pools. Workers hosted here
     * keep running until this JVM exits.
     */
    @Override
    public void close() {
        try {
            connectionCache.closeAll().get(settings.getRequestTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.debug("Closing connections did not finish cleanly: {}", e.getMessage());
        }
        if (hostedWorkers.isEmpty()) {
            executorPools.shutdownAll();
        }
        MdcProjectContext.clear();
    }
}
