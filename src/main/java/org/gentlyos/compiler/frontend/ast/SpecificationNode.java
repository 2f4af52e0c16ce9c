package org.gentlyos.compiler.frontend.ast;

import java.util.List;

/**
 * Entry-point specification block ({@code pin}).
 *
 * @param name   Optional entry-point name, may be null.
 * @param fields The ordered field map of the block.
 */
public record SpecificationNode(String name, List<FieldEntry> fields) implements AstNode {

    public SpecificationNode {
        fields = List.copyOf(fields);
    }
}
