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
package com.tomaszrup.lspdaemon.rpc;

import com.tomaszrup.lspdaemon.state.ProjectHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Keeps at most one connected and initialized client per (project, port)
 * pair for the lifetime of this process.
 *
 * <p>Concurrent callers asking for the same key share one connection
 * attempt. A failed attempt is evicted so the next caller tries again.</p>
 */
public class ConnectionCache {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionCache.class);

    private final Supplier<RpcClient> clientFactory;
    private final ConcurrentMap<String, CompletableFuture<RpcClient>> clients = new ConcurrentHashMap<>();

    public ConnectionCache(Supplier<RpcClient> clientFactory) {
        this.clientFactory = clientFactory;
    }

    static String key(Path projectRoot, int port) {
        return ProjectHash.canonical(projectRoot) + ":" + port;
    }

    /**
     * Returns the client for the project's worker, connecting on first use.
     *
     * @param workerInitialized whether an earlier connection already ran the
     *        handshake against this worker; if so, {@code initialize} is
     *        skipped
     */
    public CompletableFuture<RpcClient> get(Path projectRoot, int port, boolean workerInitialized) {
        String key = key(projectRoot, port);
        CompletableFuture<RpcClient> existing = clients.get(key);
        if (existing != null) {
            return existing;
        }
        CompletableFuture<RpcClient> attempt = new CompletableFuture<>();
        existing = clients.putIfAbsent(key, attempt);
        if (existing != null) {
            return existing;
        }

        RpcClient client = clientFactory.get();
        String rootUri = ProjectHash.canonical(projectRoot).toUri().toString();
        client.connect(port)
                .thenCompose(ignored -> workerInitialized ? client.attachInitialized() : client.initialize(rootUri))
                .whenComplete((ignored, error) -> {
                    if (error == null) {
                        logger.debug("Client for {} ready", key);
                        attempt.complete(client);
                    } else {
                        logger.debug("Connecting client for {} failed: {}", key, error.getMessage());
                        clients.remove(key, attempt);
                        client.close();
                        attempt.completeExceptionally(error);
                    }
                });
        return attempt;
    }

    public int size() {
        return clients.size();
    }

    /** Closes every cached client. Workers are left running. */
    public CompletableFuture<Void> closeAll() {
        List<CompletableFuture<?>> closing = new ArrayList<>();
        for (CompletableFuture<RpcClient> entry : clients.values()) {
            closing.add(entry.handle((client, error) -> client)
                    .thenCompose(client -> client == null ? CompletableFuture.completedFuture(null) : client.close()));
        }
        clients.clear();
        return CompletableFuture.allOf(closing.toArray(new CompletableFuture<?>[0]));
    }
}
