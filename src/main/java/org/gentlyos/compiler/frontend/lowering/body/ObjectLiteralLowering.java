package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.FieldEntry;
import org.gentlyos.compiler.frontend.ast.ObjectNode;
import org.gentlyos.compiler.frontend.types.ExpressionConverter;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers an object literal statement to a brace-delimited field list, one field per line.
 */
public class ObjectLiteralLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        out.add(new MoveStatement.Raw("{"));
        for (FieldEntry field : ((ObjectNode) node).fields()) {
            out.add(new MoveStatement.Raw("    " + field.key() + ": "
                    + ExpressionConverter.toMoveExpression(field.value()) + ","));
        }
        out.add(new MoveStatement.Raw("}"));
    }
}
