package org.gentlyos.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects diagnostics for one transpilation. Not thread-safe; each call owns its own engine.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records a diagnostic.
     *
     * @param kind    The category.
     * @param message The description.
     */
    public void report(Diagnostic.Kind kind, String message) {
        diagnostics.add(new Diagnostic(kind, message));
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns whether at least one diagnostic of the given kind was reported.
     */
    public boolean has(Diagnostic.Kind kind) {
        return diagnostics.stream().anyMatch(d -> d.kind() == kind);
    }

    /**
     * Returns the recorded diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
