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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspdaemon.process;

import com.tomaszrup.lspdaemon.StubWorker;
import com.tomaszrup.lspdaemon.WorkerNotFoundException;
import com.tomaszrup.lspdaemon.state.DaemonRecord;
import com.tomaszrup.lspdaemon.state.DaemonStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ProcessSupervisor} using {@link StubWorker} as the child
 * process.
 */
class ProcessSupervisorTests {

    @TempDir
    Path tempDir;

    private Path projectRoot;
    private DaemonStateStore store;
    private ProcessSupervisor worker;

    @BeforeEach
    void setUp() throws IOException {
        projectRoot = Files.createDirectories(tempDir.resolve("project"));
        store = new DaemonStateStore(tempDir.resolve("state"), "ra");
    }

    @AfterEach
    void tearDown() throws Exception {
        if (worker != null && worker.isAlive()) {
            worker.stop();
            worker.awaitExit().get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void exitRemovesRecordAndClosesEndpoint() throws Exception {
        worker = ProcessSupervisor.spawn(projectRoot, StubWorker.command(), store);
        store.persist(new DaemonRecord(worker.getPid(), 19299, projectRoot, System.currentTimeMillis(), false));
        AtomicInteger closes = new AtomicInteger();
        worker.attach(closes::incrementAndGet);
        CountDownLatch callback = new CountDownLatch(1);
        worker.onTermination(callback::countDown);

        assertTrue(worker.isAlive());
        assertTrue(store.lookup(projectRoot).isPresent());

        worker.stop();
        worker.awaitExit().get(10, TimeUnit.SECONDS);

        assertTrue(callback.await(5, TimeUnit.SECONDS));
        assertEquals(1, closes.get());
        assertFalse(Files.exists(store.getStateFile(projectRoot)));
    }

    @Test
    void stdinEndOfStreamEndsTheWorker() throws Exception {
        worker = ProcessSupervisor.spawn(projectRoot, StubWorker.command(), store);

        worker.getStdin().close();

        assertEquals(0, worker.awaitExit().get(10, TimeUnit.SECONDS));
    }

    @Test
    void exitCodeIsReported() throws Exception {
        worker = ProcessSupervisor.spawn(projectRoot, StubWorker.command("--fail-fast"), store);

        assertEquals(7, worker.awaitExit().get(10, TimeUnit.SECONDS));
        assertFalse(worker.isAlive());
    }

    @Test
    void stderrGoesToLogInProjectDirectory() throws Exception {
        worker = ProcessSupervisor.spawn(projectRoot, StubWorker.command("--fail-fast"), store);
        worker.awaitExit().get(10, TimeUnit.SECONDS);

        String log = new String(Files.readAllBytes(store.getStderrLog(projectRoot)), StandardCharsets.UTF_8);
        assertTrue(log.contains("stub worker started in " + projectRoot.toRealPath()), log);
    }

    @Test
    void successorRecordSurvivesLateExit() throws Exception {
        worker = ProcessSupervisor.spawn(projectRoot, StubWorker.command(), store);
        long successor = ProcessHandle.current().pid();
        store.persist(new DaemonRecord(successor, 19298, projectRoot, System.currentTimeMillis(), false));

        worker.stop();
        worker.awaitExit().get(10, TimeUnit.SECONDS);

        assertEquals(successor, store.lookup(projectRoot).orElseThrow().getPid());
    }

    @Test
    void attachAfterExitClosesImmediately() throws Exception {
        worker = ProcessSupervisor.spawn(projectRoot, StubWorker.command("--fail-fast"), store);
        worker.awaitExit().get(10, TimeUnit.SECONDS);
        AtomicInteger closes = new AtomicInteger();

        worker.attach(closes::incrementAndGet);

        assertEquals(1, closes.get());
    }

    @Test
    void missingExecutableIsWorkerNotFound() {
        assertThrows(WorkerNotFoundException.class, () -> ProcessSupervisor.spawn(projectRoot,
                Arrays.asList(tempDir.resolve("no-such-analyzer").toString()), store));
    }
}
