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
package com.tomaszrup.lspdaemon.process;

import com.tomaszrup.lspdaemon.WorkerNotFoundException;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkerLocatorTests {

    @TempDir
    Path tempDir;

    private Path executable(Path dir, String name) throws IOException {
        Files.createDirectories(dir);
        Path file = Files.write(dir.resolve(name), "#!/bin/sh\n".getBytes());
        Assumptions.assumeTrue(file.toFile().setExecutable(true), "cannot mark file executable");
        return file;
    }

    @Test
    void configuredCommandWins() {
        List<String> command = Arrays.asList("/opt/analyzer", "--stdio");
        WorkerLocator locator = new WorkerLocator("rust-analyzer", command, Collections.emptyMap());

        assertEquals(command, locator.locate());
    }

    @Test
    void findsExecutableOnPath() throws IOException {
        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");
        Files.createDirectories(first);
        Path binary = executable(second, "fake-analyzer");
        String path = first + File.pathSeparator + second;

        WorkerLocator locator = new WorkerLocator("fake-analyzer", null, Map.of("PATH", path));

        assertEquals(List.of(binary.toString()), locator.locate());
    }

    @Test
    void missingExecutableFails() {
        WorkerLocator locator = new WorkerLocator("fake-analyzer", Collections.emptyList(),
                Map.of("PATH", tempDir.toString()));

        WorkerNotFoundException e = assertThrows(WorkerNotFoundException.class, locator::locate);
        assertTrue(e.getMessage().contains("fake-analyzer"));
    }

    @Test
    void emptyPathFindsNothing() {
        WorkerLocator locator = new WorkerLocator("fake-analyzer", null, Collections.emptyMap());

        assertFalse(locator.findOnPath("fake-analyzer").isPresent());
    }

    @Test
    void nonExecutableFileIsIgnored() throws IOException {
        Files.write(tempDir.resolve("fake-analyzer"), "data".getBytes());
        WorkerLocator locator = new WorkerLocator("fake-analyzer", null, Map.of("PATH", tempDir.toString()));

        assertFalse(locator.findOnPath("fake-analyzer").isPresent());
    }
}
