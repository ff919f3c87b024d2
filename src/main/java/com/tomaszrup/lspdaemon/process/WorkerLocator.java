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
package com.tomaszrup.lspdaemon.process;

import com.tomaszrup.lspdaemon.WorkerNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Finds the analyzer executable.
 *
 * <p>Resolution order: an explicitly configured command line; a
 * {@code nix build} of {@code nixpkgs#<name>} when nix is installed; the
 * first executable {@code <name>} on {@code PATH}.</p>
 */
public class WorkerLocator {

    private static final Logger logger = LoggerFactory.getLogger(WorkerLocator.class);

    private static final long NIX_TIMEOUT_SECONDS = 120;

    private final String workerName;
    private final List<String> configuredCommand;
    private final Map<String, String> environment;

    public WorkerLocator(String workerName, List<String> configuredCommand) {
        this(workerName, configuredCommand, System.getenv());
    }

    WorkerLocator(String workerName, List<String> configuredCommand, Map<String, String> environment) {
        this.workerName = workerName;
        this.configuredCommand = configuredCommand == null ? Collections.emptyList() : configuredCommand;
        this.environment = environment;
    }

    /**
     * @return the command line that starts the worker
     * @throws WorkerNotFoundException when no candidate exists
     */
    public List<String> locate() {
        if (!configuredCommand.isEmpty()) {
            logger.debug("Using configured worker command {}", configuredCommand);
            return configuredCommand;
        }
        Optional<Path> nix = findOnPath("nix").flatMap(this::buildWithNix);
        if (nix.isPresent()) {
            return List.of(nix.get().toString());
        }
        Optional<Path> onPath = findOnPath(workerName);
        if (onPath.isPresent()) {
            return List.of(onPath.get().toString());
        }
        throw new WorkerNotFoundException(workerName + " not found (checked configuration, nix and PATH)");
    }

    Optional<Path> findOnPath(String executable) {
        String path = environment.get("PATH");
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate = Paths.get(dir, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Optional<Path> buildWithNix(Path nix) {
        ProcessBuilder pb = new ProcessBuilder(nix.toString(), "build", "--no-link", "--print-out-paths",
                "nixpkgs#" + workerName);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        try {
            Process process = pb.start();
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            }
            if (!process.waitFor(NIX_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                logger.warn("nix build of {} timed out", workerName);
                return Optional.empty();
            }
            if (process.exitValue() != 0 || output.isEmpty()) {
                logger.debug("nix build of {} failed with exit code {}", workerName, process.exitValue());
                return Optional.empty();
            }
            // one store path per line; the first one carries the binary
            String storePath = output.lines().findFirst().orElse(output);
            Path binary = Paths.get(storePath, "bin", workerName);
            return Files.isExecutable(binary) ? Optional.of(binary) : Optional.empty();
        } catch (IOException e) {
            logger.debug("nix unavailable: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}
