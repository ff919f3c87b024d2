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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tomaszrup.lspdaemon.DaemonSettings;
import com.tomaszrup.lspdaemon.Protocol;
import com.tomaszrup.lspdaemon.RequestTimeoutException;
import com.tomaszrup.lspdaemon.TransportException;
import org.eclipse.lsp4j.ClientCapabilities;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.PublishDiagnosticsCapabilities;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.TextDocumentClientCapabilities;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.json.MessageJsonHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Minimal LSP client speaking the framed JSON-RPC protocol over one proxy
 * connection.
 *
 * <p>The client is event driven. Socket reads and writes complete on the
 * channel group's threads and immediately hand their result to a
 * single-threaded event loop; every piece of mutable state (receive buffer,
 * pending requests, write queue, document versions) is touched only there.
 * Operations that wait (connect, requests, diagnostics) return
 * {@link CompletableFuture}s and never block a thread.</p>
 *
 * <p>Requests are correlated to responses by id only, so responses may
 * arrive in any order. Each request has a fixed timeout; when it fires only
 * that request fails. Diagnostics pushed by the worker are kept in a
 * {@link DiagnosticSet}.</p>
 */
public class RpcClient {

    private static final Logger logger = LoggerFactory.getLogger(RpcClient.class);

    private static final int READ_BUFFER_SIZE = 16 * 1024;

    /** lsp4j's configured Gson, for converting protocol types to and from trees. */
    private static final Gson GSON = new MessageJsonHandler(Collections.emptyMap()).getGson();

    /** Writes assembled envelopes; keeps explicit {@code null} results. */
    private static final Gson WIRE = new GsonBuilder().serializeNulls().create();

    private final ScheduledExecutorService eventLoop;
    private final long requestTimeoutMs;
    private final long pollIntervalMs;
    private final String languageId;

    private final MessageFramer framer = new MessageFramer();
    private final Map<Integer, PendingRequest> pending = new HashMap<>();
    private final DiagnosticSet diagnostics = new DiagnosticSet();
    private final Map<String, Integer> documentVersions = new HashMap<>();
    private final Deque<ByteBuffer> writeQueue = new ArrayDeque<>();
    private boolean writing;
    private int nextId = 1;
    private AsynchronousSocketChannel channel;
    private volatile RpcClientState state = RpcClientState.DISCONNECTED;

    public RpcClient(ScheduledExecutorService eventLoop, long requestTimeoutMs, long pollIntervalMs,
            String languageId) {
        this.eventLoop = eventLoop;
        this.requestTimeoutMs = requestTimeoutMs;
        this.pollIntervalMs = pollIntervalMs;
        this.languageId = languageId;
    }

    public RpcClient(ScheduledExecutorService eventLoop, DaemonSettings settings) {
        this(eventLoop, settings.getRequestTimeoutMs(), settings.getPollIntervalMs(), settings.getLanguageId());
    }

    public RpcClientState getState() {
        return state;
    }

    public DiagnosticSet getDiagnosticSet() {
        return diagnostics;
    }

    // ---- Connection ----

    /**
     * Opens the connection to the proxy listening on the loopback port.
     * Fails with {@link TransportException} if the connection is refused.
     */
    public CompletableFuture<Void> connect(int port) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        eventLoop.execute(() -> {
            if (state != RpcClientState.DISCONNECTED) {
                result.completeExceptionally(new IllegalStateException("Client is " + state));
                return;
            }
            try {
                channel = AsynchronousSocketChannel.open();
            } catch (IOException e) {
                result.completeExceptionally(new TransportException("Cannot open socket: " + e.getMessage(), e));
                return;
            }
            InetSocketAddress address = new InetSocketAddress(InetAddress.getLoopbackAddress(), port);
            channel.connect(address, null, new CompletionHandler<Void, Void>() {
                @Override
                public void completed(Void ignored, Void attachment) {
                    onLoop(() -> {
                        state = RpcClientState.CONNECTED;
                        logger.debug("Connected to daemon on port {}", port);
                        readNext();
                        result.complete(null);
                    });
                }

                @Override
                public void failed(Throwable exc, Void attachment) {
                    onLoop(() -> {
                        closeChannel();
                        result.completeExceptionally(new TransportException(
                                "Cannot connect to daemon on port " + port + ": " + exc.getMessage(), exc));
                    });
                }
            });
        });
        return result;
    }

    /**
     * Performs the handshake: the {@code initialize} request, then the
     * {@code initialized} notification once it has been answered.
     */
    public CompletableFuture<Void> initialize(String rootUri) {
        InitializeParams params = new InitializeParams();
        params.setProcessId((int) ProcessHandle.current().pid());
        params.setRootUri(rootUri);
        PublishDiagnosticsCapabilities publishDiagnostics = new PublishDiagnosticsCapabilities();
        publishDiagnostics.setRelatedInformation(true);
        TextDocumentClientCapabilities textDocument = new TextDocumentClientCapabilities();
        textDocument.setPublishDiagnostics(publishDiagnostics);
        ClientCapabilities capabilities = new ClientCapabilities();
        capabilities.setTextDocument(textDocument);
        params.setCapabilities(capabilities);

        return request(Protocol.REQUEST_INITIALIZE, params).thenAccept(result -> {
            notify(Protocol.NOTIFICATION_INITIALIZED, new InitializedParams());
            state = RpcClientState.INITIALIZED;
            logger.debug("Handshake complete for {}", rootUri);
        });
    }

    /**
     * Marks the connection usable for documents without a handshake, for a
     * worker that an earlier connection already initialized.
     */
    public CompletableFuture<Void> attachInitialized() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        eventLoop.execute(() -> {
            if (state != RpcClientState.CONNECTED) {
                result.completeExceptionally(new IllegalStateException("Client is " + state));
                return;
            }
            state = RpcClientState.INITIALIZED;
            result.complete(null);
        });
        return result;
    }

    /**
     * Closes the connection. Requests still waiting fail with a
     * {@link TransportException}; the worker keeps running.
     */
    public CompletableFuture<Void> close() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        eventLoop.execute(() -> {
            shutdown(new TransportException("Connection closed"));
            result.complete(null);
        });
        return result;
    }

    // ---- Messaging ----

    /**
     * Sends a request with a fresh id. The future completes with the
     * response's {@code result} ({@link JsonNull} when absent), or fails with
     * {@link RpcErrorException}, {@link RequestTimeoutException} or
     * {@link TransportException}.
     */
    public CompletableFuture<JsonElement> request(String method, Object params) {
        CompletableFuture<JsonElement> future = new CompletableFuture<>();
        eventLoop.execute(() -> {
            if (state == RpcClientState.DISCONNECTED || state == RpcClientState.CLOSED) {
                future.completeExceptionally(new TransportException("Cannot send " + method + ", client is " + state));
                return;
            }
            int id = nextId++;
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(requestTimeoutMs);
            PendingRequest request = new PendingRequest(id, method, deadline, future);
            request.setTimeout(eventLoop.schedule(() -> expire(id), requestTimeoutMs, TimeUnit.MILLISECONDS));
            pending.put(id, request);

            JsonObject message = envelope(method, params);
            message.addProperty("id", id);
            send(message);
        });
        return future;
    }

    /** Sends a notification; there is no response. */
    public void notify(String method, Object params) {
        eventLoop.execute(() -> sendNotification(method, params));
    }

    /** Number of requests still waiting for a response. */
    public CompletableFuture<Integer> pendingRequestCount() {
        return CompletableFuture.supplyAsync(pending::size, eventLoop);
    }

    // ---- Documents ----

    /** Announces a document's full content ({@code textDocument/didOpen}, version 1). */
    public void openDocument(String uri, String text) {
        requireInitialized();
        eventLoop.execute(() -> sendOpen(uri, text));
    }

    /**
     * Replaces a document's content wholesale ({@code textDocument/didChange}
     * with a single full-text change).
     */
    public void changeDocument(String uri, String text, int version) {
        requireInitialized();
        eventLoop.execute(() -> sendChange(uri, text, version));
    }

    /**
     * Opens the document on first use and sends a full-text change with the
     * next version afterwards. Before a change the URI's cached diagnostics
     * are dropped so that a following wait sees the worker's fresh push.
     */
    public CompletableFuture<Void> syncDocument(String uri, String text) {
        requireInitialized();
        CompletableFuture<Void> result = new CompletableFuture<>();
        eventLoop.execute(() -> {
            Integer version = documentVersions.get(uri);
            if (version == null) {
                sendOpen(uri, text);
            } else {
                diagnostics.clear(uri);
                sendChange(uri, text, version + 1);
            }
            result.complete(null);
        });
        return result;
    }

    /** Current diagnostics for the URI, empty if none were pushed. */
    public List<Diagnostic> getDiagnostics(String uri) {
        return diagnostics.get(uri).orElse(Collections.emptyList());
    }

    /**
     * Waits until diagnostics for the URI have been pushed, checking at the
     * poll interval. Completes with an empty list when the timeout passes
     * first; that means nothing was observed in time, not that the document
     * is clean.
     */
    public CompletableFuture<List<Diagnostic>> awaitDiagnostics(String uri, long timeoutMs) {
        CompletableFuture<List<Diagnostic>> result = new CompletableFuture<>();
        eventLoop.execute(() -> {
            if (diagnostics.contains(uri)) {
                result.complete(getDiagnostics(uri));
                return;
            }
            AtomicReference<ScheduledFuture<?>> poll = new AtomicReference<>();
            ScheduledFuture<?> deadline = eventLoop.schedule(() -> {
                if (result.complete(Collections.emptyList())) {
                    logger.debug("No diagnostics for {} within {}ms", uri, timeoutMs);
                }
                ScheduledFuture<?> p = poll.get();
                if (p != null) {
                    p.cancel(false);
                }
            }, timeoutMs, TimeUnit.MILLISECONDS);
            poll.set(eventLoop.scheduleAtFixedRate(() -> {
                if (diagnostics.contains(uri) && result.complete(getDiagnostics(uri))) {
                    deadline.cancel(false);
                }
                if (result.isDone()) {
                    poll.get().cancel(false);
                }
            }, pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS));
        });
        return result;
    }

    // ---- Event loop internals ----

    /**
     * Hands an I/O completion to the event loop. Completions that arrive
     * after the loop has been shut down are dropped.
     */
    private void onLoop(Runnable task) {
        try {
            eventLoop.execute(task);
        } catch (RejectedExecutionException e) {
            logger.debug("Event loop gone, dropping I/O completion (client {})", state);
        }
    }

    private void requireInitialized() {
        if (state != RpcClientState.INITIALIZED) {
            throw new IllegalStateException("Client must be initialized before document sync, state is " + state);
        }
    }

    private void sendNotification(String method, Object params) {
        if (state == RpcClientState.DISCONNECTED || state == RpcClientState.CLOSED) {
            logger.debug("Dropping {} notification, client is {}", method, state);
            return;
        }
        send(envelope(method, params));
    }

    private void sendOpen(String uri, String text) {
        documentVersions.put(uri, 1);
        sendNotification(Protocol.NOTIFICATION_DID_OPEN,
                new DidOpenTextDocumentParams(new TextDocumentItem(uri, languageId, 1, text)));
    }

    private void sendChange(String uri, String text, int version) {
        documentVersions.put(uri, version);
        sendNotification(Protocol.NOTIFICATION_DID_CHANGE, new DidChangeTextDocumentParams(
                new VersionedTextDocumentIdentifier(uri, version),
                Collections.singletonList(new TextDocumentContentChangeEvent(text))));
    }

    private static JsonObject envelope(String method, Object params) {
        JsonObject message = new JsonObject();
        message.addProperty("jsonrpc", Protocol.JSONRPC_VERSION);
        message.addProperty("method", method);
        if (params != null) {
            message.add("params", params instanceof JsonElement ? (JsonElement) params : GSON.toJsonTree(params));
        }
        return message;
    }

    private void expire(int id) {
        PendingRequest request = pending.remove(id);
        if (request != null) {
            logger.warn("Request {} ({}) timed out after {}ms", id, request.getMethod(), requestTimeoutMs);
            request.reject(new RequestTimeoutException(id, request.getMethod(), requestTimeoutMs));
        }
    }

    private void send(JsonObject message) {
        writeQueue.add(ByteBuffer.wrap(MessageFramer.encode(WIRE.toJson(message))));
        if (!writing) {
            writeNext();
        }
    }

    private void writeNext() {
        ByteBuffer next = writeQueue.peek();
        if (next == null || state == RpcClientState.CLOSED) {
            writing = false;
            return;
        }
        writing = true;
        channel.write(next, null, new CompletionHandler<Integer, Void>() {
            @Override
            public void completed(Integer written, Void attachment) {
                onLoop(() -> {
                    if (!next.hasRemaining()) {
                        writeQueue.poll();
                    }
                    writeNext();
                });
            }

            @Override
            public void failed(Throwable exc, Void attachment) {
                onLoop(() -> shutdown(new TransportException(
                        "Write to daemon failed: " + exc.getMessage(), exc)));
            }
        });
    }

    private void readNext() {
        ByteBuffer buffer = ByteBuffer.allocate(READ_BUFFER_SIZE);
        channel.read(buffer, null, new CompletionHandler<Integer, Void>() {
            @Override
            public void completed(Integer read, Void attachment) {
                onLoop(() -> onRead(buffer, read));
            }

            @Override
            public void failed(Throwable exc, Void attachment) {
                onLoop(() -> shutdown(new TransportException(
                        "Connection to daemon lost: " + exc.getMessage(), exc)));
            }
        });
    }

    private void onRead(ByteBuffer buffer, int read) {
        if (state == RpcClientState.CLOSED) {
            return;
        }
        if (read < 0) {
            shutdown(new TransportException("Daemon closed the connection"));
            return;
        }
        buffer.flip();
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        for (String payload : framer.append(bytes)) {
            dispatch(payload);
        }
        readNext();
    }

    void dispatch(String payload) {
        JsonObject message;
        try {
            JsonElement parsed = JsonParser.parseString(payload);
            if (!parsed.isJsonObject()) {
                logger.debug("Ignoring non-object message: {}", payload);
                return;
            }
            message = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            logger.debug("Ignoring unparseable message: {}", e.getMessage());
            return;
        }

        boolean hasMethod = message.has("method") && message.get("method").isJsonPrimitive();
        if (message.has("id") && !hasMethod) {
            handleResponse(message);
        } else if (hasMethod && message.has("id")) {
            handleServerRequest(message);
        } else if (hasMethod) {
            handleNotification(message);
        } else {
            logger.debug("Ignoring message without id or method");
        }
    }

    private void handleResponse(JsonObject message) {
        JsonElement idElement = message.get("id");
        if (!idElement.isJsonPrimitive() || !idElement.getAsJsonPrimitive().isNumber()) {
            logger.debug("Ignoring response with non-numeric id {}", idElement);
            return;
        }
        int id = idElement.getAsInt();
        PendingRequest request = pending.remove(id);
        if (request == null) {
            logger.debug("Ignoring response for unknown or expired request {}", id);
            return;
        }
        JsonElement error = message.get("error");
        if (error != null && !error.isJsonNull()) {
            request.reject(RpcErrorException.fromJson(request.getMethod(), error));
        } else {
            JsonElement result = message.get("result");
            request.resolve(result == null ? JsonNull.INSTANCE : result);
        }
    }

    private void handleNotification(JsonObject message) {
        String method = message.get("method").getAsString();
        if (!Protocol.NOTIFICATION_PUBLISH_DIAGNOSTICS.equals(method)) {
            logger.trace("Ignoring notification {}", method);
            return;
        }
        PublishDiagnosticsParams params;
        try {
            params = GSON.fromJson(message.get("params"), PublishDiagnosticsParams.class);
        } catch (JsonParseException e) {
            logger.debug("Ignoring malformed diagnostics push: {}", e.getMessage());
            return;
        }
        if (params == null || params.getUri() == null) {
            return;
        }
        List<Diagnostic> pushed = params.getDiagnostics() == null ? new ArrayList<>() : params.getDiagnostics();
        diagnostics.replace(params.getUri(), pushed);
        logger.debug("Received {} diagnostics for {}", pushed.size(), params.getUri());
    }

    /**
     * Answers requests the worker sends to the client so it never waits on
     * them. {@code workspace/configuration} gets one {@code null} per item,
     * everything else a {@code null} result.
     */
    private void handleServerRequest(JsonObject message) {
        String method = message.get("method").getAsString();
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", Protocol.JSONRPC_VERSION);
        response.add("id", message.get("id"));
        if (Protocol.REQUEST_WORKSPACE_CONFIGURATION.equals(method)) {
            JsonArray items = new JsonArray();
            JsonElement params = message.get("params");
            if (params != null && params.isJsonObject() && params.getAsJsonObject().has("items")
                    && params.getAsJsonObject().get("items").isJsonArray()) {
                int count = params.getAsJsonObject().getAsJsonArray("items").size();
                for (int i = 0; i < count; i++) {
                    items.add(JsonNull.INSTANCE);
                }
            }
            response.add("result", items);
        } else {
            response.add("result", JsonNull.INSTANCE);
        }
        logger.trace("Answering server request {}", method);
        send(response);
    }

    private void shutdown(TransportException reason) {
        if (state == RpcClientState.CLOSED) {
            return;
        }
        RpcClientState previous = state;
        state = RpcClientState.CLOSED;
        closeChannel();
        writeQueue.clear();
        writing = false;
        if (!pending.isEmpty()) {
            logger.debug("Failing {} pending requests: {}", pending.size(), reason.getMessage());
            List<PendingRequest> failed = new ArrayList<>(pending.values());
            pending.clear();
            for (PendingRequest request : failed) {
                request.reject(reason);
            }
        }
        logger.debug("Client closed (was {}): {}", previous, reason.getMessage());
    }

    private void closeChannel() {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            logger.debug("Error closing channel: {}", e.getMessage());
        }
    }
}
