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

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Stable short identity of a project, derived from its absolute path.
 *
 * <p>The hex form names the state file; the numeric form seeds the port
 * search. Both depend only on the path string, so independent invocations
 * agree on them.</p>
 */
public final class ProjectHash {

    /** Number of hex characters kept from the SHA-256 digest. */
    static final int HEX_LENGTH = 8;

    private ProjectHash() {
    }

    /** Absolute, normalized form used as the project identity everywhere. */
    public static Path canonical(Path projectRoot) {
        return projectRoot.toAbsolutePath().normalize();
    }

    public static String hex(Path projectRoot) {
        return hex(canonical(projectRoot).toString());
    }

    public static String hex(String projectIdentity) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(projectIdentity.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(HEX_LENGTH);
            for (int i = 0; i < HEX_LENGTH / 2; i++) {
                sb.append(String.format("%02x", hash[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** The hex hash read as an unsigned number, always non-negative. */
    public static long numeric(Path projectRoot) {
        return Long.parseLong(hex(projectRoot), 16);
    }
}
