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
package com.tomaszrup.lspdaemon;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tomaszrup.lspdaemon.rpc.MessageFramer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A tiny language server used as the worker in tests. It speaks framed
 * JSON-RPC on stdio and reports one error for every document whose text
 * contains {@link #MARKER}.
 *
 * <ul>
 *   <li>{@code initialize} is answered and counted</li>
 *   <li>{@code stub/stats} returns the number of initialize requests and
 *       opened documents</li>
 *   <li>{@code textDocument/didOpen} and {@code didChange} publish
 *       diagnostics for the document</li>
 *   <li>{@code stub/exit} terminates with exit code 3</li>
 * </ul>
 *
 * Started with {@code --fail-fast} it exits with code 7 right away.
 */
public final class StubWorker {

    public static final String MARKER = "STUB_ERROR";
    public static final String MESSAGE = "stub error";

    private static final OutputStream OUT = System.out;

    private static int initializeCount;
    private static int openCount;

    private StubWorker() {
    }

    /** Command line that starts this class in a fresh JVM on the test class path. */
    public static List<String> command(String... args) {
        List<String> command = new ArrayList<>();
        command.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(StubWorker.class.getName());
        command.addAll(Arrays.asList(args));
        return command;
    }

    public static void main(String[] args) throws IOException {
        // keep stdout for frames only
        System.setOut(new PrintStream(System.err, true));
        System.err.println("stub worker started in " + Paths.get("").toAbsolutePath());
        if (Arrays.asList(args).contains("--fail-fast")) {
            System.exit(7);
        }

        InputStream in = System.in;
        MessageFramer framer = new MessageFramer();
        byte[] buffer = new byte[8192];
        int read;
        while ((read = in.read(buffer)) != -1) {
            for (String payload : framer.append(buffer, 0, read)) {
                handle(JsonParser.parseString(payload).getAsJsonObject());
            }
        }
        System.err.println("stub worker stdin closed");
    }

    private static void handle(JsonObject message) throws IOException {
        String method = message.has("method") ? message.get("method").getAsString() : null;
        if (method == null) {
            return;
        }
        JsonElement id = message.get("id");
        JsonObject params = message.has("params") && message.get("params").isJsonObject()
                ? message.getAsJsonObject("params") : new JsonObject();
        switch (method) {
            case "initialize": {
                initializeCount++;
                JsonObject result = new JsonObject();
                result.add("capabilities", new JsonObject());
                respond(id, result);
                break;
            }
            case "stub/stats": {
                JsonObject result = new JsonObject();
                result.addProperty("initializeCount", initializeCount);
                result.addProperty("openCount", openCount);
                respond(id, result);
                break;
            }
            case "textDocument/didOpen": {
                openCount++;
                JsonObject document = params.getAsJsonObject("textDocument");
                publish(document.get("uri").getAsString(), document.get("text").getAsString());
                break;
            }
            case "textDocument/didChange": {
                String uri = params.getAsJsonObject("textDocument").get("uri").getAsString();
                JsonArray changes = params.getAsJsonArray("contentChanges");
                publish(uri, changes.get(changes.size() - 1).getAsJsonObject().get("text").getAsString());
                break;
            }
            case "stub/exit":
                System.exit(3);
                break;
            default:
                if (id != null) {
                    respond(id, JsonNull.INSTANCE);
                }
        }
    }

    private static void publish(String uri, String text) throws IOException {
        JsonArray diagnostics = new JsonArray();
        String[] lines = text.split("\n", -1);
        for (int line = 0; line < lines.length; line++) {
            int column = lines[line].indexOf(MARKER);
            if (column >= 0) {
                diagnostics.add(diagnostic(line, column));
            }
        }
        JsonObject params = new JsonObject();
        params.addProperty("uri", uri);
        params.add("diagnostics", diagnostics);
        JsonObject notification = new JsonObject();
        notification.addProperty("jsonrpc", "2.0");
        notification.addProperty("method", "textDocument/publishDiagnostics");
        notification.add("params", params);
        write(notification);
    }

    private static JsonObject diagnostic(int line, int column) {
        JsonObject start = new JsonObject();
        start.addProperty("line", line);
        start.addProperty("character", column);
        JsonObject end = new JsonObject();
        end.addProperty("line", line);
        end.addProperty("character", column + MARKER.length());
        JsonObject range = new JsonObject();
        range.add("start", start);
        range.add("end", end);
        JsonObject diagnostic = new JsonObject();
        diagnostic.add("range", range);
        diagnostic.addProperty("severity", 1);
        diagnostic.addProperty("source", "stub");
        diagnostic.addProperty("message", MESSAGE);
        return diagnostic;
    }

    private static void respond(JsonElement id, JsonElement result) throws IOException {
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", "2.0");
        response.add("id", id);
        response.add("result", result);
        write(response);
    }

    private static void write(JsonObject message) throws IOException {
        synchronized (OUT) {
            OUT.write(MessageFramer.encode(message.toString()));
            OUT.flush();
        }
    }
}
