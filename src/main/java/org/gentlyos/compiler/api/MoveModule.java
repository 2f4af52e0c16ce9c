package org.gentlyos.compiler.api;

import org.gentlyos.compiler.diagnostics.Diagnostic;
import org.gentlyos.compiler.model.MoveFunction;
import org.gentlyos.compiler.model.MoveStruct;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A generated Move module: its parts and the rendered source.
 *
 * @param name                 The snake_case module name.
 * @param source               The rendered Move source text.
 * @param structs              The structs in declaration order.
 * @param functions            The functions in declaration order.
 * @param dependencies         The dependency names, deduplicated, in first-seen order.
 * @param privilegedReferences Vault paths referenced by the input; non-empty means the module
 *                             needs privileged access to run.
 * @param diagnostics          Degraded input shapes met while generating the module.
 */
public record MoveModule(
        String name,
        String source,
        List<MoveStruct> structs,
        List<MoveFunction> functions,
        List<String> dependencies,
        List<String> privilegedReferences,
        List<Diagnostic> diagnostics
) {

    public MoveModule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        structs = List.copyOf(structs);
        functions = List.copyOf(functions);
        dependencies = List.copyOf(dependencies);
        privilegedReferences = List.copyOf(privilegedReferences);
        diagnostics = List.copyOf(diagnostics);
    }

    public Optional<MoveStruct> findStruct(String structName) {
        return structs.stream().filter(s -> s.name().equals(structName)).findFirst();
    }

    /**
     * Returns the first function with the given name. Names may repeat, for example when a
     * module has more than one {@code todo} stub.
     */
    public Optional<MoveFunction> findFunction(String functionName) {
        return functions.stream().filter(f -> f.name().equals(functionName)).findFirst();
    }

    public boolean requiresPrivilegedAccess() {
        return !privilegedReferences.isEmpty();
    }
}
