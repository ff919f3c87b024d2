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
package com.tomaszrup.lspdaemon.net;

import com.tomaszrup.lspdaemon.process.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A listening socket bound to one worker for the worker's lifetime.
 *
 * <p>Client connections are served one at a time in accept order. While a
 * connection is attached its bytes go verbatim to the worker's stdin, and
 * the worker's stdout goes verbatim to it. Connections that arrive in the
 * meantime wait in the listen backlog until the attached one closes, so two
 * callers never interleave writes on the worker's stdin.</p>
 *
 * <p>Worker output produced while no connection is attached is dropped.</p>
 */
public class ProxyEndpoint implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ProxyEndpoint.class);

    private static final int BUFFER_SIZE = 8192;

    private final ServerSocket serverSocket;
    private final ProcessSupervisor worker;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicInteger sessionCount = new AtomicInteger();
    private volatile Socket session;

    ProxyEndpoint(ServerSocket serverSocket, ProcessSupervisor worker) {
        this.serverSocket = serverSocket;
        this.worker = worker;
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Number of client connections accepted so far. */
    public int getSessionCount() {
        return sessionCount.get();
    }

    /**
     * Accepts connections until the endpoint is closed, relaying each
     * connection's inbound bytes to the worker's stdin.
     */
    void acceptLoop() {
        while (!closed.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (!closed.get()) {
                    logger.warn("Proxy on port {} stopped accepting: {}", getPort(), e.getMessage());
                }
                return;
            }
            int id = sessionCount.incrementAndGet();
            logger.debug("Client session {} attached on port {}", id, getPort());
            session = socket;
            try {
                relayToWorker(socket);
            } finally {
                session = null;
                closeQuietly(socket);
                logger.debug("Client session {} detached", id);
            }
        }
    }

    private void relayToWorker(Socket socket) {
        byte[] buffer = new byte[BUFFER_SIZE];
        try {
            InputStream in = socket.getInputStream();
            OutputStream stdin = worker.getStdin();
            int read;
            while ((read = in.read(buffer)) != -1) {
                stdin.write(buffer, 0, read);
                stdin.flush();
            }
        } catch (SocketException e) {
            logger.debug("Client connection ended: {}", e.getMessage());
        } catch (IOException e) {
            if (!closed.get()) {
                logger.warn("Relay to worker stdin failed: {}", e.getMessage());
            }
        }
    }

    /**
     * Copies the worker's stdout to whichever connection is attached, until
     * the worker closes its stdout.
     */
    void pumpWorkerOutput() {
        byte[] buffer = new byte[BUFFER_SIZE];
        try {
            InputStream stdout = worker.getStdout();
            int read;
            while ((read = stdout.read(buffer)) != -1) {
                Socket target = session;
                if (target == null) {
                    logger.debug("Dropping {} bytes of worker output, no client attached", read);
                    continue;
                }
                try {
                    OutputStream out = target.getOutputStream();
                    out.write(buffer, 0, read);
                    out.flush();
                } catch (IOException e) {
                    logger.debug("Client went away while relaying worker output: {}", e.getMessage());
                    closeQuietly(target);
                }
            }
            logger.info("Worker stdout reached end of stream");
        } catch (IOException e) {
            if (!closed.get()) {
                logger.warn("Reading worker stdout failed: {}", e.getMessage());
            }
        }
        Socket target = session;
        if (target != null) {
            closeQuietly(target);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Closing proxy on port {}", getPort());
        closeQuietly(serverSocket);
        Socket target = session;
        if (target != null) {
            closeQuietly(target);
        }
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            logger.debug("Error while closing {}: {}", closeable, e.getMessage());
        }
    }
}
