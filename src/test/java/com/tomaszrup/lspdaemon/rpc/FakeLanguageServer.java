package com.tomaszrup.lspdaemon.rpc;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Scripted peer for {@link RpcClient} tests: accepts one connection on a
 * loopback port, records every framed message the client sends and writes
 * whatever the test tells it to.
 */
class FakeLanguageServer implements Closeable {

    private final ServerSocket serverSocket;
    private final BlockingQueue<JsonObject> received = new LinkedBlockingQueue<>();
    private final Thread acceptThread;
    private volatile Socket socket;

    FakeLanguageServer() throws IOException {
        serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        acceptThread = new Thread(this::serve, "fake-language-server");
        acceptThread.setDaemon(true);
        acceptThread.start();
    }

    int getPort() {
        return serverSocket.getLocalPort();
    }

    private void serve() {
        try {
            socket = serverSocket.accept();
            InputStream in = socket.getInputStream();
            MessageFramer framer = new MessageFramer();
            byte[] buffer = new byte[4096];
            int read;
            while ((read = in.read(buffer)) != -1) {
                for (String payload : framer.append(buffer, 0, read)) {
                    received.add(JsonParser.parseString(payload).getAsJsonObject());
                }
            }
        } catch (IOException e) {
            // connection closed by the test
        }
    }

    /** Next message from the client, failing the test after a few seconds. */
    JsonObject take() throws InterruptedException {
        JsonObject message = received.poll(5, TimeUnit.SECONDS);
        if (message == null) {
            throw new AssertionError("client sent nothing within 5s");
        }
        return message;
    }

    /** Next message, or {@code null} if none arrives in the given time. */
    JsonObject poll(long millis) throws InterruptedException {
        return received.poll(millis, TimeUnit.MILLISECONDS);
    }

    synchronized void send(String json) throws IOException {
        long deadline = System.currentTimeMillis() + 5000;
        while (socket == null && System.currentTimeMillis() < deadline) {
            Thread.onSpinWait();
        }
        OutputStream out = socket.getOutputStream();
        out.write(MessageFramer.encode(json));
        out.flush();
    }

    void respond(int id, String resultJson) throws IOException {
        send("{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":" + resultJson + "}");
    }

    void publishDiagnostics(String uri, String diagnosticsJson) throws IOException {
        send("{\"jsonrpc\":\"2.0\",\"method\":\"textDocument/publishDiagnostics\",\"params\":{\"uri\":\""
                + uri + "\",\"diagnostics\":" + diagnosticsJson + "}}");
    }

    /** Drops the client connection without closing the listener. */
    void disconnect() throws IOException {
        Socket current = socket;
        if (current != null) {
            current.close();
        }
    }

    @Override
    public void close() throws IOException {
        disconnect();
        serverSocket.close();
    }
}
