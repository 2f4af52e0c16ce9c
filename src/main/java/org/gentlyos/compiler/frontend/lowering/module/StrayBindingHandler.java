package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.diagnostics.Diagnostic;
import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.VariableNode;
import org.gentlyos.compiler.frontend.types.MoveTypeMapper;
import org.gentlyos.compiler.frontend.types.NameConventions;
import org.gentlyos.compiler.model.MoveField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A variable binding at module scope becomes a field of the most recently defined struct.
 * Before the first struct there is nothing to attach to and the binding is dropped.
 */
public class StrayBindingHandler implements IModuleLevelHandler {

    private static final Logger LOG = LoggerFactory.getLogger(StrayBindingHandler.class);

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        VariableNode variable = (VariableNode) node;
        if (!dispatcher.context().appendFieldToLastStruct(fieldOf(variable))) {
            LOG.debug("Dropping module-level binding '{}': no struct defined yet", variable.name());
            dispatcher.context().diagnostics().report(Diagnostic.Kind.STRAY_BINDING,
                    "Module-level binding '" + variable.name() + "' precedes every struct and was dropped");
        }
    }

    /**
     * Builds the struct field for a binding, typed from its declaration or else from its value.
     */
    static MoveField fieldOf(VariableNode variable) {
        String typeName = variable.typeHint() != null
                ? MoveTypeMapper.mapDeclaredType(variable.typeHint())
                : MoveTypeMapper.inferType(variable.value());
        return new MoveField(NameConventions.toSnakeCase(variable.name()), typeName);
    }
}
