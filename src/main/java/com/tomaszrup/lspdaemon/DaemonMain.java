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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.tomaszrup.lspdaemon.state.DaemonRecord;
import org.eclipse.lsp4j.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command line entry point.
 *
 * <pre>
 *   query  &lt;projectRoot&gt; &lt;file&gt;   print the file's diagnostics
 *   serve  &lt;projectRoot&gt;          start and host the project's worker
 *   status &lt;projectRoot&gt;          print the live daemon record
 *   stop   &lt;projectRoot&gt;          terminate the project's worker
 * </pre>
 *
 * Exit status is 0 on success, 1 when the daemon layer fails and 2 on a
 * usage error.
 */
public class DaemonMain {

    private static final Logger logger = LoggerFactory.getLogger(DaemonMain.class);

    static final String LOG_LEVEL_PROPERTY = "lspdaemon.logLevel";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final DaemonSettings settings;
    private final PrintStream out;
    private final PrintStream err;

    DaemonMain(DaemonSettings settings, PrintStream out, PrintStream err) {
        this.settings = settings;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            System.err.println("[FATAL] Uncaught exception on thread " + thread.getName());
            throwable.printStackTrace(System.err);
            logger.error("Uncaught exception on thread {}: {}",
                    thread.getName(), throwable.getMessage(), throwable);
        });
        String logLevel = System.getProperty(LOG_LEVEL_PROPERTY);
        if (logLevel != null) {
            applyLogLevel(logLevel);
        }
        int status = new DaemonMain(DaemonSettings.fromSystem(), System.out, System.err).run(args);
        System.exit(status);
    }

    int run(String[] args) {
        if (args.length < 2) {
            return usage(null);
        }
        String command = args[0];
        Path projectRoot = Paths.get(args[1]).toAbsolutePath().normalize();
        try {
            switch (command) {
                case "query":
                    if (args.length != 3) {
                        return usage("query needs a project root and a file");
                    }
                    return query(projectRoot, Paths.get(args[2]).toAbsolutePath().normalize());
                case "serve":
                    return serve(projectRoot);
                case "status":
                    return status(projectRoot);
                case "stop":
                    return stop(projectRoot);
                default:
                    return usage("unknown command '" + command + "'");
            }
        } catch (DaemonException e) {
            return fail(e);
        }
    }

    private int query(Path projectRoot, Path file) {
        try (DaemonManager manager = new DaemonManager(settings)) {
            int port = new DaemonLauncher(settings, manager.getStateStore()).ensureDaemon(projectRoot);
            long timeout = settings.getRequestTimeoutMs() + settings.getDiagnosticsTimeoutMs();
            List<Diagnostic> diagnostics;
            try {
                diagnostics = manager.queryDiagnostics(port, file, projectRoot).get(timeout, TimeUnit.MILLISECONDS);
            } catch (ExecutionException | CompletionException e) {
                return fail(e.getCause() != null ? e.getCause() : e);
            } catch (TimeoutException e) {
                return fail(new RequestTimeoutException(0, "query", timeout));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return fail(e);
            }
            if (!diagnostics.isEmpty()) {
                out.println(DiagnosticFormatter.format(diagnostics));
            }
            return EXIT_OK;
        }
    }

    /**
     * Starts the worker in this JVM and blocks until it exits. Returns right
     * away when another process already hosts a live worker.
     */
    private int serve(Path projectRoot) {
        DaemonManager manager = new DaemonManager(settings);
        int port = manager.ensureWorker(projectRoot);
        out.println(port);
        out.flush();
        if (!manager.isHostingWorkers()) {
            logger.info("Worker for {} is hosted elsewhere on port {}", projectRoot, port);
            manager.close();
            return EXIT_OK;
        }
        try {
            manager.awaitHostedWorkers().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Daemon host interrupted");
        } catch (ExecutionException e) {
            logger.error("Daemon host terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
        logger.info("Worker for {} exited, daemon host shutting down", projectRoot);
        manager.close();
        return EXIT_OK;
    }

    private int status(Path projectRoot) {
        try (DaemonManager manager = new DaemonManager(settings)) {
            Optional<DaemonRecord> record = manager.status(projectRoot);
            out.println(record.map(GSON::toJson).orElse("not running"));
            return EXIT_OK;
        }
    }

    private int stop(Path projectRoot) {
        try (DaemonManager manager = new DaemonManager(settings)) {
            out.println(manager.stop(projectRoot) ? "stopped" : "not running");
            return EXIT_OK;
        }
    }

    private int usage(String problem) {
        if (problem != null) {
            err.println("error: " + problem);
        }
        err.println("usage: lsp-daemon query <projectRoot> <file>");
        err.println("       lsp-daemon serve|status|stop <projectRoot>");
        return EXIT_USAGE;
    }

    private int fail(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        logger.debug("Command failed", cause);
        err.println("error: " + cause.getMessage());
        return EXIT_FAILURE;
    }

    /**
     * Set the Logback root logger level from a string value. Accepted values
     * (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE. Invalid values are
     * ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(level);
        } catch (Exception e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
        }
    }
}
