package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.VariableNode;
import org.gentlyos.compiler.frontend.types.ExpressionConverter;
import org.gentlyos.compiler.frontend.types.MoveTypeMapper;
import org.gentlyos.compiler.frontend.types.NameConventions;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers a variable binding to a {@code let}. The type annotation is emitted only when the
 * binding declares one.
 */
public class LetLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        VariableNode variable = (VariableNode) node;
        String typeName = variable.typeHint() == null ? null : MoveTypeMapper.mapDeclaredType(variable.typeHint());
        out.add(new MoveStatement.Let(
                NameConventions.toSnakeCase(variable.name()),
                typeName,
                ExpressionConverter.toMoveExpression(variable.value())));
    }
}
