package org.gentlyos.compiler.frontend.lowering;

import org.gentlyos.compiler.config.TranspilerOptions;
import org.gentlyos.compiler.diagnostics.Diagnostic;
import org.gentlyos.compiler.diagnostics.DiagnosticsEngine;
import org.gentlyos.compiler.frontend.types.ConstraintTransforms;
import org.gentlyos.compiler.model.MoveField;
import org.gentlyos.compiler.model.MoveFunction;
import org.gentlyos.compiler.model.MoveParam;
import org.gentlyos.compiler.model.MoveStatement;
import org.gentlyos.compiler.model.MoveStruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Mutable accumulator for a single transpilation: the structs, functions and dependencies of
 * the module being built, the assert error-code counter and the queue of constraints waiting
 * for the next function.
 *
 * <p>One instance is created per transpile call and never shared, so independent calls can
 * run concurrently without locking.
 */
public class TranspileContext {

    private static final Logger LOG = LoggerFactory.getLogger(TranspileContext.class);

    private final TranspilerOptions options;
    private final DiagnosticsEngine diagnostics;
    private final String moduleName;
    private final List<MoveStruct> structs = new ArrayList<>();
    private final List<MoveFunction> functions = new ArrayList<>();
    private final List<String> dependencies = new ArrayList<>();
    private final Deque<String> pendingConstraints = new ArrayDeque<>();
    private long errorCodeCounter = 0;

    /**
     * @param options     The transpiler settings.
     * @param diagnostics The engine collecting degraded-input diagnostics.
     * @param moduleName  The snake_case module name.
     */
    public TranspileContext(TranspilerOptions options, DiagnosticsEngine diagnostics, String moduleName) {
        this.options = Objects.requireNonNull(options, "options");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
    }

    public TranspilerOptions options() {
        return options;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public String moduleName() {
        return moduleName;
    }

    /**
     * Returns the next unused assert error code. Codes start at 1 and never repeat.
     */
    public long nextErrorCode() {
        return ++errorCodeCounter;
    }

    /**
     * Builds an assert for a rule, consuming the next error code.
     *
     * @param rule The constraint rule text.
     * @return The assert statement.
     */
    public MoveStatement.Assert assertFor(String rule) {
        String condition = ConstraintTransforms.constraintToCondition(rule, options.negatedConstraints());
        return new MoveStatement.Assert(condition, nextErrorCode());
    }

    /**
     * Returns the implicit {@code &mut TxContext} parameter.
     */
    public MoveParam contextParam() {
        return MoveParam.mutableRef(options.contextParamName(), options.contextParamType());
    }

    /**
     * Returns the event type name for a checkpoint hash: the configured prefix followed by the
     * first characters of the hash, counted in code points.
     *
     * @param hash The checkpoint hash.
     * @return The event struct name.
     */
    public String eventTypeName(String hash) {
        int codePoints = Math.min(hash.codePointCount(0, hash.length()), options.eventHashPrefixLength());
        return options.eventNamePrefix() + hash.substring(0, hash.offsetByCodePoints(0, codePoints));
    }

    /**
     * Registers a dependency name; duplicates are ignored and first-seen order is kept.
     */
    public void addDependency(String dependency) {
        if (!dependencies.contains(dependency)) {
            dependencies.add(dependency);
        }
    }

    public void addStruct(MoveStruct struct) {
        structs.add(struct);
    }

    /**
     * Appends a field to the most recently defined struct.
     *
     * @param field The field.
     * @return {@code false} if no struct has been defined yet and the field was not added.
     */
    public boolean appendFieldToLastStruct(MoveField field) {
        if (structs.isEmpty()) {
            return false;
        }
        int last = structs.size() - 1;
        structs.set(last, structs.get(last).withField(field));
        return true;
    }

    public void addFunction(MoveFunction function) {
        functions.add(function);
    }

    /**
     * Queues a rule until the next function is defined.
     */
    public void enqueueConstraint(String rule) {
        pendingConstraints.addLast(rule);
    }

    /**
     * Drains the queued constraints into asserts placed at the front of the function body,
     * in queue order, each consuming the next error code.
     *
     * @param function The freshly built function.
     * @return The function with the asserts prepended, or the same function if nothing was queued.
     */
    public MoveFunction injectPendingConstraints(MoveFunction function) {
        if (pendingConstraints.isEmpty()) {
            return function;
        }
        List<MoveStatement> asserts = new ArrayList<>(pendingConstraints.size());
        while (!pendingConstraints.isEmpty()) {
            asserts.add(assertFor(pendingConstraints.removeFirst()));
        }
        return function.withLeadingStatements(asserts);
    }

    /**
     * Drops any constraints still queued at the end of the module, recording a diagnostic.
     */
    public void discardPendingConstraints() {
        if (pendingConstraints.isEmpty()) {
            return;
        }
        LOG.debug("Discarding {} constraint(s) not followed by a function in module '{}'",
                pendingConstraints.size(), moduleName);
        diagnostics.report(Diagnostic.Kind.DISCARDED_CONSTRAINTS,
                pendingConstraints.size() + " constraint(s) had no following function: " + pendingConstraints);
        pendingConstraints.clear();
    }

    public int pendingConstraintCount() {
        return pendingConstraints.size();
    }

    public List<MoveStruct> structs() {
        return Collections.unmodifiableList(structs);
    }

    public List<MoveFunction> functions() {
        return Collections.unmodifiableList(functions);
    }

    public List<String> dependencies() {
        return Collections.unmodifiableList(dependencies);
    }
}
