package org.gentlyos.compiler.api;

import org.gentlyos.compiler.frontend.ast.AstNode;

/**
 * Parses CODIE source text into a syntax tree.
 */
@FunctionalInterface
public interface CodieParser {

    /**
     * @param source CODIE source text.
     * @return The root of the syntax tree.
     * @throws CodieParseException if the source is not valid CODIE.
     */
    AstNode parse(String source) throws CodieParseException;
}
