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
package com.tomaszrup.lspdaemon.net;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tomaszrup.lspdaemon.ExecutorPools;
import com.tomaszrup.lspdaemon.StubWorker;
import com.tomaszrup.lspdaemon.process.ProcessSupervisor;
import com.tomaszrup.lspdaemon.rpc.MessageFramer;
import com.tomaszrup.lspdaemon.state.DaemonStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ProxyListener} and {@link ProxyEndpoint}: bytes relayed in
 * both directions, one session at a time, and teardown when the worker exits.
 */
class ProxyListenerTests {

    @TempDir
    Path tempDir;

    private ExecutorPools pools;
    private ProcessSupervisor worker;
    private ProxyEndpoint endpoint;

    @BeforeEach
    void setUp() throws IOException {
        pools = new ExecutorPools();
        Path projectRoot = Files.createDirectories(tempDir.resolve("project"));
        DaemonStateStore store = new DaemonStateStore(tempDir.resolve("state"), "ra");
        worker = ProcessSupervisor.spawn(projectRoot, StubWorker.command(), store);
        endpoint = new ProxyListener(pools).start(0, worker);
        worker.attach(endpoint);
    }

    @AfterEach
    void tearDown() throws Exception {
        endpoint.close();
        if (worker.isAlive()) {
            worker.stop();
            worker.awaitExit().get(10, TimeUnit.SECONDS);
        }
        pools.shutdownAll();
    }

    /** Minimal framed peer over a plain socket. */
    private static final class Session implements AutoCloseable {
        private final Socket socket;
        private final MessageFramer framer = new MessageFramer();
        private final Deque<String> inbox = new ArrayDeque<>();

        Session(int port) throws IOException {
            socket = new Socket(InetAddress.getLoopbackAddress(), port);
            socket.setSoTimeout(10_000);
        }

        void send(String json) throws IOException {
            socket.getOutputStream().write(MessageFramer.encode(json));
            socket.getOutputStream().flush();
        }

        void request(int id, String method) throws IOException {
            send("{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"" + method + "\",\"params\":{}}");
        }

        JsonObject read() throws IOException {
            InputStream in = socket.getInputStream();
            byte[] buffer = new byte[4096];
            while (inbox.isEmpty()) {
                int n = in.read(buffer);
                if (n == -1) {
                    throw new IOException("connection closed");
                }
                inbox.addAll(framer.append(buffer, 0, n));
            }
            return JsonParser.parseString(inbox.poll()).getAsJsonObject();
        }

        void timeout(int millis) throws IOException {
            socket.setSoTimeout(millis);
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }

    @Test
    void relaysRequestAndResponse() throws Exception {
        try (Session session = new Session(endpoint.getPort())) {
            session.request(1, "initialize");

            JsonObject response = session.read();
            assertEquals(1, response.get("id").getAsInt());
            assertTrue(response.getAsJsonObject("result").has("capabilities"));
        }
        assertEquals(1, endpoint.getSessionCount());
    }

    @Test
    void secondSessionWaitsForFirstToClose() throws Exception {
        Session first = new Session(endpoint.getPort());
        first.request(1, "initialize");
        assertEquals(1, first.read().get("id").getAsInt());

        try (Session second = new Session(endpoint.getPort())) {
            second.request(2, "stub/stats");
            second.timeout(300);
            assertThrows(SocketTimeoutException.class, second::read);

            first.close();
            second.timeout(10_000);
            JsonObject stats = second.read();
            assertEquals(2, stats.get("id").getAsInt());
            assertEquals(1, stats.getAsJsonObject("result").get("initializeCount").getAsInt());
        }
    }

    @Test
    void workerExitClosesListenerAndSession() throws Exception {
        int port = endpoint.getPort();
        try (Session session = new Session(port)) {
            session.send("{\"jsonrpc\":\"2.0\",\"method\":\"stub/exit\"}");

            assertEquals(3, worker.awaitExit().get(10, TimeUnit.SECONDS));
            assertThrows(IOException.class, session::read);
        }
        assertTrue(endpoint.isClosed());
        assertThrows(IOException.class, () -> new Socket(InetAddress.getLoopbackAddress(), port).close());
    }

    @Test
    void occupiedPortFailsToStart() throws Exception {
        try (ServerSocket taken = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            assertThrows(IOException.class, () -> new ProxyListener(pools).start(taken.getLocalPort(), worker));
        }
    }

    @Test
    void closeIsIdempotent() {
        endpoint.close();
        endpoint.close();
        assertTrue(endpoint.isClosed());
    }
}
