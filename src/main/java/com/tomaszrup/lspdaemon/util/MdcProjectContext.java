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
package com.tomaszrup.lspdaemon.util;

import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.Map;

/**
 * Manages the SLF4J MDC key {@code "project"} so that every log line of a
 * daemon, proxy session or client carries the project it belongs to.
 *
 * <p>The label is the project directory name followed by the short state
 * hash (e.g. {@code my-crate@1a2b3c4d}), which is also the suffix of the
 * project's state file and therefore easy to correlate.</p>
 *
 * <pre>{@code
 * MdcProjectContext.setProject(projectRoot, hash);
 * try {
 *     // ... log calls include [my-crate@1a2b3c4d]
 * } finally {
 *     MdcProjectContext.clear();
 * }
 * }</pre>
 */
public final class MdcProjectContext {

    /** MDC key used in the logback pattern via {@code %X{project}}. */
    public static final String MDC_KEY = "project";

    private MdcProjectContext() {
        // utility class
    }

    /**
     * Sets the MDC {@code "project"} key for the current thread.
     *
     * @param projectRoot the project root, may be {@code null}
     * @param hash        the project's short hash, may be {@code null}
     */
    public static void setProject(Path projectRoot, String hash) {
        MDC.put(MDC_KEY, label(projectRoot, hash));
    }

    static String label(Path projectRoot, String hash) {
        if (projectRoot == null) {
            return "default";
        }
        Path fileName = projectRoot.getFileName();
        String name = fileName != null ? fileName.toString() : projectRoot.toString();
        return hash == null ? name : name + "@" + hash;
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * Returns a snapshot of the current thread's MDC context map.
     *
     * @return the current MDC context map, or null if empty
     */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * Restores a previously captured MDC context map on the current thread.
     *
     * @param contextMap the context map to restore (may be null)
     */
    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Wraps a {@link Runnable} so that the caller's MDC context is restored
     * on the executing thread, and the executing thread's own context is put
     * back afterwards.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                task.run();
            } finally {
                restore(previousContext);
            }
        };
    }
}
