package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.FetchNode;
import org.gentlyos.compiler.frontend.types.NameConventions;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers an external read to a borrow. Database and storage sources are borrowed mutably.
 * A source written with an {@code @} or {@code $} sigil also registers its root segment as a
 * module dependency.
 */
public class BorrowLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        FetchNode fetch = (FetchNode) node;
        String source = fetch.source();
        if (source.startsWith("@") || source.startsWith("$")) {
            lowerer.context().addDependency(dependencyRoot(source));
        }
        out.add(new MoveStatement.Borrow(
                NameConventions.toSnakeCase(fetch.target()),
                source,
                fetch.sourceKind().isMutableStorage()));
    }

    /**
     * Strips leading sigils and returns the first path segment: {@code @api/users} gives {@code api}.
     *
     * @param source The source path as written.
     * @return The dependency root name.
     */
    public static String dependencyRoot(String source) {
        int start = 0;
        while (start < source.length() && source.charAt(start) == '@') {
            start++;
        }
        while (start < source.length() && source.charAt(start) == '$') {
            start++;
        }
        String stripped = source.substring(start);
        int slash = stripped.indexOf('/');
        return slash < 0 ? stripped : stripped.substring(0, slash);
    }
}
