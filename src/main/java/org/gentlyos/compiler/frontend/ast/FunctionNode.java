package org.gentlyos.compiler.frontend.ast;

import java.util.List;
import java.util.Objects;

/**
 * Internal function definition ({@code cali NAME}).
 *
 * @param name    The function name.
 * @param params  The declared parameters, in order.
 * @param body    The statements of the function body.
 * @param returns Optional expression describing the returned value, may be null.
 */
public record FunctionNode(String name, List<Param> params, List<AstNode> body, AstNode returns)
        implements AstNode {

    public FunctionNode {
        Objects.requireNonNull(name, "name");
        params = List.copyOf(params);
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }

    /**
     * A declared function parameter.
     *
     * @param name The parameter name.
     * @param type The declared type, or null when the parameter is untyped.
     */
    public record Param(String name, CodieType type) {
        public Param {
            Objects.requireNonNull(name, "name");
        }
    }
}
