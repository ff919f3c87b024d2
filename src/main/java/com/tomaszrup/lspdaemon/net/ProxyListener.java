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

import com.tomaszrup.lspdaemon.ExecutorPools;
import com.tomaszrup.lspdaemon.process.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Binds the loopback listener for a worker and starts its relay loops.
 *
 * <p>The proxy is a transparent byte pipe: it does not frame, parse or
 * buffer messages beyond the socket and pipe buffers.</p>
 */
public class ProxyListener {

    private static final Logger logger = LoggerFactory.getLogger(ProxyListener.class);

    private static final int BACKLOG = 50;

    private final ExecutorPools executorPools;

    public ProxyListener(ExecutorPools executorPools) {
        this.executorPools = executorPools;
    }

    /**
     * @throws IOException if the port cannot be bound
     */
    public ProxyEndpoint start(int port, ProcessSupervisor worker) throws IOException {
        ServerSocket serverSocket = new ServerSocket();
        try {
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), BACKLOG);
        } catch (IOException e) {
            serverSocket.close();
            throw e;
        }
        ProxyEndpoint endpoint = new ProxyEndpoint(serverSocket, worker);
        executorPools.getRelayPool().execute(endpoint::acceptLoop);
        executorPools.getRelayPool().execute(endpoint::pumpWorkerOutput);
        logger.info("Proxy for worker pid {} listening on 127.0.0.1:{}", worker.getPid(), endpoint.getPort());
        return endpoint;
    }
}
