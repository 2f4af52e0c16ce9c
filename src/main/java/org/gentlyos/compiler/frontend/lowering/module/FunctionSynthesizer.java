package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.FieldEntry;
import org.gentlyos.compiler.frontend.ast.FunctionNode;
import org.gentlyos.compiler.frontend.ast.IdentifierNode;
import org.gentlyos.compiler.frontend.ast.LiteralNode;
import org.gentlyos.compiler.frontend.lowering.TranspileContext;
import org.gentlyos.compiler.frontend.lowering.body.BodyLowerer;
import org.gentlyos.compiler.frontend.types.ExpressionConverter;
import org.gentlyos.compiler.frontend.types.MoveTypeMapper;
import org.gentlyos.compiler.frontend.types.NameConventions;
import org.gentlyos.compiler.model.MoveFunction;
import org.gentlyos.compiler.model.MoveParam;
import org.gentlyos.compiler.model.MoveStatement;
import org.gentlyos.compiler.model.MoveTypes;
import org.gentlyos.compiler.model.MoveVisibility;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds Move functions from the two CODIE function shapes: a field map ({@code pin}) and an
 * explicit parameter list with a body ({@code cali}).
 * <p>
 * The two shapes place the implicit context parameter differently. A field-map function gets
 * it before every other parameter; a parameter-list function gets it after them, and only when
 * it is public.
 */
final class FunctionSynthesizer {

    private FunctionSynthesizer() {
    }

    /**
     * Builds a function from a field map. A field whose value is a bare type name becomes a
     * parameter, a literal becomes a {@code let}, and anything else becomes a placeholder comment.
     */
    static MoveFunction fromFields(TranspileContext context, String name, List<FieldEntry> fields,
                                   MoveVisibility visibility) {
        List<MoveParam> params = new ArrayList<>();
        List<MoveStatement> body = new ArrayList<>();
        if (visibility == MoveVisibility.PUBLIC_ENTRY) {
            params.add(context.contextParam());
        }
        for (FieldEntry field : fields) {
            AstNode value = field.value();
            if (value instanceof IdentifierNode typeName) {
                params.add(MoveParam.byValue(NameConventions.toSnakeCase(field.key()), typeName.name()));
            } else if (value instanceof LiteralNode literal) {
                body.add(new MoveStatement.Let(NameConventions.toSnakeCase(field.key()), null,
                        ExpressionConverter.formatLiteral(literal.literal())));
            } else {
                body.add(new MoveStatement.Comment(field.key() + ": <complex>"));
            }
        }
        return new MoveFunction(NameConventions.toSnakeCase(name), visibility, params, null, body);
    }

    /**
     * Builds a function from declared parameters and a body. Untyped parameters are {@code u64};
     * the return type is inferred from the return expression when there is one.
     */
    static MoveFunction fromBody(TranspileContext context, BodyLowerer lowerer, FunctionNode function,
                                 MoveVisibility visibility) {
        List<MoveParam> params = new ArrayList<>();
        for (FunctionNode.Param param : function.params()) {
            String typeName = param.type() != null ? MoveTypeMapper.mapDeclaredType(param.type()) : MoveTypes.U64;
            params.add(MoveParam.byValue(NameConventions.toSnakeCase(param.name()), typeName));
        }
        if (visibility == MoveVisibility.PUBLIC_ENTRY) {
            params.add(context.contextParam());
        }
        List<MoveStatement> body = lowerer.lower(function.body());
        String returnType = function.returns() != null ? MoveTypeMapper.inferType(function.returns()) : null;
        return new MoveFunction(NameConventions.toSnakeCase(function.name()), visibility, params, returnType, body);
    }
}
