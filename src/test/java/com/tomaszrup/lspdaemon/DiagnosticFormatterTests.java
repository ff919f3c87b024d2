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
package com.tomaszrup.lspdaemon;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticFormatterTests {

    private static Diagnostic diagnostic(int line, int column, DiagnosticSeverity severity, String message) {
        Diagnostic diagnostic = new Diagnostic(new Range(new Position(line, column), new Position(line, column + 1)),
                message);
        diagnostic.setSeverity(severity);
        return diagnostic;
    }

    @Test
    void positionsAreOneBased() {
        assertEquals("error[3:5]: mismatched types",
                DiagnosticFormatter.format(diagnostic(2, 4, DiagnosticSeverity.Error, "mismatched types")));
    }

    @Test
    void severityNames() {
        assertEquals("warning", DiagnosticFormatter.severityName(DiagnosticSeverity.Warning));
        assertEquals("info", DiagnosticFormatter.severityName(DiagnosticSeverity.Information));
        assertEquals("info", DiagnosticFormatter.severityName(DiagnosticSeverity.Hint));
        assertEquals("info", DiagnosticFormatter.severityName(null));
    }

    @Test
    void missingSeverityIsInfo() {
        assertEquals("info[1:1]: consider removing this",
                DiagnosticFormatter.format(diagnostic(0, 0, null, "consider removing this")));
    }

    @Test
    void oneLinePerDiagnostic() {
        String text = DiagnosticFormatter.format(Arrays.asList(
                diagnostic(0, 0, DiagnosticSeverity.Warning, "unused variable"),
                diagnostic(9, 1, DiagnosticSeverity.Error, "cannot find value")));

        assertEquals("warning[1:1]: unused variable\nerror[10:2]: cannot find value", text);
    }

    @Test
    void emptyListIsEmptyText() {
        assertEquals("", DiagnosticFormatter.format(Collections.emptyList()));
    }
}
