package org.gentlyos.compiler.frontend.ast;

import java.util.List;

/**
 * Object literal ({@code {key: value, ...}}).
 */
public record ObjectNode(List<FieldEntry> fields) implements AstNode {

    public ObjectNode {
        fields = List.copyOf(fields);
    }
}
