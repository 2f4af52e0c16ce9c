package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.ForeverLoopNode;
import org.gentlyos.compiler.frontend.ast.LoopNode;
import org.gentlyos.compiler.frontend.ast.TimesLoopNode;
import org.gentlyos.compiler.frontend.ast.WhileLoopNode;
import org.gentlyos.compiler.frontend.types.ExpressionConverter;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers the four loop forms to Move {@code while} and {@code loop} blocks. The loop body is
 * lowered recursively and inlined between raw opening and closing lines.
 * <ul>
 *   <li>{@code spin x IN xs}: indexed {@code while} over {@code vector::length(&xs)}</li>
 *   <li>{@code spin WHILE c}: {@code while (c)}</li>
 *   <li>{@code spin N TIMES}: counted {@code while (i < N)}</li>
 *   <li>{@code spin FOREVER}: {@code loop}</li>
 * </ul>
 */
public class LoopLowering implements IBodyLoweringHandler {

    private static final String INDEX_INIT = "let mut i = 0;\n";
    private static final String INDEX_STEP_AND_CLOSE = "    i = i + 1;\n}";
    private static final String CLOSE = "}";

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        if (node instanceof LoopNode loop) {
            String collection = ExpressionConverter.toMoveExpression(loop.collection());
            out.add(new MoveStatement.Raw("// spin " + loop.iterator() + " IN " + collection));
            out.add(new MoveStatement.Raw(INDEX_INIT + "while (i < vector::length(&" + collection + ")) {"));
            lowerer.lowerInto(loop.body(), out);
            out.add(new MoveStatement.Raw(INDEX_STEP_AND_CLOSE));
        } else if (node instanceof WhileLoopNode loop) {
            out.add(new MoveStatement.Raw("while (" + ExpressionConverter.toMoveExpression(loop.condition()) + ") {"));
            lowerer.lowerInto(loop.body(), out);
            out.add(new MoveStatement.Raw(CLOSE));
        } else if (node instanceof TimesLoopNode loop) {
            out.add(new MoveStatement.Raw(INDEX_INIT + "while (i < " + Long.toUnsignedString(loop.count()) + ") {"));
            lowerer.lowerInto(loop.body(), out);
            out.add(new MoveStatement.Raw(INDEX_STEP_AND_CLOSE));
        } else {
            out.add(new MoveStatement.Raw("loop {"));
            lowerer.lowerInto(((ForeverLoopNode) node).body(), out);
            out.add(new MoveStatement.Raw(CLOSE));
        }
    }
}
