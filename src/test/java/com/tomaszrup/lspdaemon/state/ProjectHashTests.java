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
package com.tomaszrup.lspdaemon.state;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class ProjectHashTests {

    @Test
    void hexIsEightLowercaseHexCharacters() {
        String hex = ProjectHash.hex(Paths.get("/home/user/project"));
        assertEquals(8, hex.length());
        assertTrue(hex.matches("[0-9a-f]{8}"), hex);
    }

    @Test
    void hexMatchesSha256Prefix() {
        // sha256("abc") = ba7816bf8f01cfea...
        assertEquals("ba7816bf", ProjectHash.hex("abc"));
    }

    @Test
    void equivalentPathsShareAHash() {
        Path plain = Paths.get("/work/project");
        Path dotted = Paths.get("/work/./other/../project");
        assertEquals(ProjectHash.hex(plain), ProjectHash.hex(dotted));
    }

    @Test
    void distinctProjectsUsuallyDiffer() {
        assertNotEquals(ProjectHash.hex(Paths.get("/work/a")), ProjectHash.hex(Paths.get("/work/b")));
    }

    @Test
    void numericIsTheHexValue() {
        Path root = Paths.get("/work/project");
        assertEquals(Long.parseLong(ProjectHash.hex(root), 16), ProjectHash.numeric(root));
        assertTrue(ProjectHash.numeric(root) >= 0);
    }
}
