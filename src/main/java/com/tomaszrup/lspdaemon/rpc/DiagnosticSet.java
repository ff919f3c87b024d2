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
package com.tomaszrup.lspdaemon.rpc;

import org.eclipse.lsp4j.Diagnostic;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest diagnostics per document URI, exactly as the worker last pushed
 * them. A push replaces the whole entry for its URI.
 *
 * <p>Written only from the client's event loop; lists are stored
 * as immutable copies so readers on other threads see consistent snapshots.</p>
 */
public class DiagnosticSet {

    private final Map<String, List<Diagnostic>> byUri = new ConcurrentHashMap<>();

    void replace(String uri, List<Diagnostic> diagnostics) {
        byUri.put(uri, diagnostics == null ? Collections.emptyList() : List.copyOf(diagnostics));
    }

    void clear(String uri) {
        byUri.remove(uri);
    }

    /** Empty when no push has been received for the URI. */
    public Optional<List<Diagnostic>> get(String uri) {
        return Optional.ofNullable(byUri.get(uri));
    }

    public boolean contains(String uri) {
        return byUri.containsKey(uri);
    }

    public int size() {
        return byUri.size();
    }
}
