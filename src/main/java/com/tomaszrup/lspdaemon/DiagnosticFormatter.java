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

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders diagnostics one per line as {@code severity[line:col]: message}
 * with 1-based positions.
 */
public final class DiagnosticFormatter {

    private DiagnosticFormatter() {
    }

    public static String format(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(DiagnosticFormatter::format).collect(Collectors.joining("\n"));
    }

    public static String format(Diagnostic diagnostic) {
        Position start = diagnostic.getRange() != null ? diagnostic.getRange().getStart() : null;
        int line = start != null ? start.getLine() + 1 : 1;
        int column = start != null ? start.getCharacter() + 1 : 1;
        return severityName(diagnostic.getSeverity()) + "[" + line + ":" + column + "]: " + diagnostic.getMessage();
    }

    /** Errors and warnings are named; every other severity, or none, is {@code info}. */
    static String severityName(DiagnosticSeverity severity) {
        if (severity == DiagnosticSeverity.Error) {
            return "error";
        }
        if (severity == DiagnosticSeverity.Warning) {
            return "warning";
        }
        return "info";
    }
}
