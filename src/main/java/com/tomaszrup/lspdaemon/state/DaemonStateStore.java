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
package com.tomaszrup.lspdaemon.state;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.function.LongPredicate;

/**
 * On-disk registry of running workers, one JSON file per project.
 *
 * <p>Files live in a well-known directory and are named
 * {@code <prefix>-<hash>.json} after {@link ProjectHash#hex(Path)}, so every
 * invocation finds the same file for the same project without any index.
 * A record counts as live only while its {@code pid} refers to a running
 * process; stale and unreadable files are deleted when they are looked up.</p>
 *
 * <p>Writes go to a temp file that is atomically renamed over the target,
 * so readers never observe a half-written record.</p>
 */
public class DaemonStateStore {

    private static final Logger logger = LoggerFactory.getLogger(DaemonStateStore.class);

    private static final Gson GSON = new GsonBuilder().create();

    private final Path stateDir;
    private final String prefix;
    private final LongPredicate processAlive;

    public DaemonStateStore(Path stateDir, String prefix) {
        this(stateDir, prefix, DaemonStateStore::isProcessAlive);
    }

    DaemonStateStore(Path stateDir, String prefix, LongPredicate processAlive) {
        this.stateDir = stateDir;
        this.prefix = prefix;
        this.processAlive = processAlive;
    }

    public static boolean isProcessAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    /**
     * Returns the live record for the project. A record whose process is
     * gone, or a file that cannot be parsed, is deleted and reported as
     * absent.
     */
    public Optional<DaemonRecord> lookup(Path projectRoot) {
        Path stateFile = getStateFile(projectRoot);
        if (!Files.isRegularFile(stateFile)) {
            return Optional.empty();
        }
        DaemonRecord record;
        try (Reader reader = Files.newBufferedReader(stateFile, StandardCharsets.UTF_8)) {
            record = GSON.fromJson(reader, DaemonRecord.class);
        } catch (IOException | JsonParseException e) {
            logger.info("Discarding unreadable state file {}: {}", stateFile, e.getMessage());
            deleteQuietly(stateFile);
            return Optional.empty();
        }
        if (record == null || record.isIncomplete()) {
            logger.info("Discarding incomplete state file {}", stateFile);
            deleteQuietly(stateFile);
            return Optional.empty();
        }
        if (!processAlive.test(record.getPid())) {
            logger.info("Worker pid {} for {} is gone, removing stale state", record.getPid(), projectRoot);
            // a worker started since the read may already own the file
            removeIfOwnedBy(projectRoot, record.getPid());
            return Optional.empty();
        }
        return Optional.of(record);
    }

    /**
     * Writes the record for its project, creating the state directory first.
     */
    public void persist(DaemonRecord record) throws IOException {
        Path stateFile = getStateFile(record.getProjectPath());
        Files.createDirectories(stateDir);
        Path tmp = stateFile.resolveSibling(stateFile.getFileName() + "." + ProcessHandle.current().pid() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            GSON.toJson(record, writer);
        }
        Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Persisted {} to {}", record, stateFile);
    }

    /**
     * Rewrites the live record with {@code initialized=true}. No-op when the
     * project has no live record.
     */
    public void markInitialized(Path projectRoot) throws IOException {
        Optional<DaemonRecord> record = lookup(projectRoot);
        if (record.isPresent() && !record.get().isInitialized()) {
            persist(record.get().withInitialized(true));
        }
    }

    /** Deletes the project's state file; a missing file is not an error. */
    public void remove(Path projectRoot) {
        Path stateFile = getStateFile(projectRoot);
        if (deleteQuietly(stateFile)) {
            logger.info("Removed state file {}", stateFile);
        }
    }

    /**
     * Deletes the project's state file only if it still describes the given
     * worker. A worker that exits late must not remove the record of the
     * worker that replaced it.
     */
    public void removeIfOwnedBy(Path projectRoot, long pid) {
        Path stateFile = getStateFile(projectRoot);
        if (!Files.isRegularFile(stateFile)) {
            return;
        }
        try (Reader reader = Files.newBufferedReader(stateFile, StandardCharsets.UTF_8)) {
            DaemonRecord record = GSON.fromJson(reader, DaemonRecord.class);
            if (record != null && record.getPid() != pid) {
                logger.debug("State file {} belongs to pid {}, keeping it", stateFile, record.getPid());
                return;
            }
        } catch (IOException | JsonParseException e) {
            logger.debug("Unreadable state file {} during cleanup: {}", stateFile, e.getMessage());
        }
        remove(projectRoot);
    }

    public Path getStateFile(Path projectRoot) {
        return stateDir.resolve(prefix + "-" + ProjectHash.hex(projectRoot) + ".json");
    }

    /** Where the worker's stderr is appended; next to its state file. */
    public Path getStderrLog(Path projectRoot) {
        return stateDir.resolve(prefix + "-" + ProjectHash.hex(projectRoot) + ".stderr.log");
    }

    /** Lock file held while a worker for the project is being started. */
    public Path getStartLock(Path projectRoot) {
        return stateDir.resolve(prefix + "-" + ProjectHash.hex(projectRoot) + ".lock");
    }

    /** Where a detached hosting JVM writes its own log output. */
    public Path getHostLog(Path projectRoot) {
        return stateDir.resolve(prefix + "-" + ProjectHash.hex(projectRoot) + ".host.log");
    }

    public Path getStateDir() {
        return stateDir;
    }

    private static boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete state file {}: {}", file, e.getMessage());
            return false;
        }
    }
}
