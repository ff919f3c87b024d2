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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Persisted description of a running worker. Field names are the JSON keys
 * of the state file.
 */
public final class DaemonRecord {

    private long pid;
    private int port;
    private String projectPath;
    private long startedAt;
    private boolean initialized;

    /** For Gson. */
    DaemonRecord() {
    }

    public DaemonRecord(long pid, int port, Path projectRoot, long startedAt, boolean initialized) {
        this.pid = pid;
        this.port = port;
        this.projectPath = ProjectHash.canonical(projectRoot).toString();
        this.startedAt = startedAt;
        this.initialized = initialized;
    }

    public long getPid() {
        return pid;
    }

    public int getPort() {
        return port;
    }

    public Path getProjectPath() {
        return Paths.get(projectPath);
    }

    public long getStartedAt() {
        return startedAt;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public DaemonRecord withInitialized(boolean value) {
        return new DaemonRecord(pid, port, getProjectPath(), startedAt, value);
    }

    /** Whether the fields Gson left unset make this record unusable. */
    boolean isIncomplete() {
        return pid <= 0 || port <= 0 || port > 65535 || projectPath == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DaemonRecord)) {
            return false;
        }
        DaemonRecord that = (DaemonRecord) o;
        return pid == that.pid && port == that.port && startedAt == that.startedAt
                && initialized == that.initialized && Objects.equals(projectPath, that.projectPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pid, port, projectPath, startedAt, initialized);
    }

    @Override
    public String toString() {
        return "DaemonRecord{pid=" + pid + ", port=" + port + ", projectPath=" + projectPath
                + ", startedAt=" + startedAt + ", initialized=" + initialized + "}";
    }
}
