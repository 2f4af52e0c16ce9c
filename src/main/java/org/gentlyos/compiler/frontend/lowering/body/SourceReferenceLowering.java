package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.SourceNode;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers a bare source reference to a comment. Vault references are flagged as needing
 * privileged access; others just note the external name.
 */
public class SourceReferenceLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        SourceNode source = (SourceNode) node;
        if (source.kind().requiresPrivilegedAccess()) {
            out.add(new MoveStatement.Comment("PTC REQUIRED: vault access $" + source.path()));
        } else {
            out.add(new MoveStatement.Comment("external: @" + source.path()));
        }
    }
}
