package org.gentlyos.compiler.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A Move function definition.
 *
 * @param name       The function name (snake_case).
 * @param visibility The visibility.
 * @param params     The parameters, in order.
 * @param returnType The return type, or null for functions without a result.
 * @param body       The statements, in order.
 */
public record MoveFunction(
        String name,
        MoveVisibility visibility,
        List<MoveParam> params,
        String returnType,
        List<MoveStatement> body
) {

    public MoveFunction {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(visibility, "visibility");
        params = List.copyOf(params);
        body = List.copyOf(body);
    }

    public Optional<String> optionalReturnType() {
        return Optional.ofNullable(returnType);
    }

    /**
     * Returns a copy of this function with the given statements placed before the existing body.
     *
     * @param leading The statements to prepend.
     * @return The new function.
     */
    public MoveFunction withLeadingStatements(List<MoveStatement> leading) {
        if (leading.isEmpty()) {
            return this;
        }
        List<MoveStatement> merged = new ArrayList<>(leading.size() + body.size());
        merged.addAll(leading);
        merged.addAll(body);
        return new MoveFunction(name, visibility, params, returnType, merged);
    }
}
