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

import com.tomaszrup.lspdaemon.PortAllocationException;
import com.tomaszrup.lspdaemon.state.ProjectHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.file.Path;

/**
 * Picks the loopback port a project's proxy listens on.
 *
 * <p>The search starts at {@code basePort + numericHash % range} so the same
 * project usually lands on the same port, then probes upward by binding and
 * immediately closing a socket. Another process can still take the port
 * between the probe and the real bind; that window is not guarded.</p>
 */
public class PortAllocator {

    private static final Logger logger = LoggerFactory.getLogger(PortAllocator.class);

    private static final int MAX_PORT = 65535;

    private final int basePort;
    private final int range;
    private final int maxAttempts;

    public PortAllocator(int basePort, int range, int maxAttempts) {
        if (range <= 0 || maxAttempts <= 0) {
            throw new IllegalArgumentException("range and maxAttempts must be positive");
        }
        this.basePort = basePort;
        this.range = range;
        this.maxAttempts = maxAttempts;
    }

    /** First port probed for the project. */
    public int startPort(Path projectRoot) {
        return basePort + (int) (ProjectHash.numeric(projectRoot) % range);
    }

    /**
     * @return a port that was free at probe time
     * @throws PortAllocationException when every probed port is taken
     */
    public int allocate(Path projectRoot) {
        int start = startPort(projectRoot);
        for (int port = start; port < start + maxAttempts && port <= MAX_PORT; port++) {
            if (isFree(port)) {
                logger.debug("Allocated port {} for {} (start {})", port, projectRoot, start);
                return port;
            }
        }
        throw new PortAllocationException(start, maxAttempts);
    }

    static boolean isFree(int port) {
        try (ServerSocket probe = new ServerSocket()) {
            probe.setReuseAddress(true);
            probe.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
