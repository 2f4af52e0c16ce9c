package org.gentlyos.compiler.backend.render;

import org.gentlyos.compiler.config.TranspilerOptions;
import org.gentlyos.compiler.model.MoveAbility;
import org.gentlyos.compiler.model.MoveField;
import org.gentlyos.compiler.model.MoveFunction;
import org.gentlyos.compiler.model.MoveParam;
import org.gentlyos.compiler.model.MoveStatement;
import org.gentlyos.compiler.model.MoveStruct;
import org.gentlyos.compiler.model.MoveVisibility;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an assembled module into Move source text.
 * <p>
 * Output depends only on the arguments and the options: the same module always renders to the
 * same text. Members are indented four spaces and statements eight.
 */
public class MoveRenderer {

    private static final String MEMBER_INDENT = "    ";
    private static final String STATEMENT_INDENT = "        ";
    private static final String EMIT_FIELD_INDENT = "            ";

    private final TranspilerOptions options;

    /**
     * @param options Supplies the import set and nothing else.
     */
    public MoveRenderer(TranspilerOptions options) {
        this.options = options;
    }

    /**
     * Renders a complete module.
     *
     * @param moduleName   The module name, used as both address and module segment.
     * @param structs      The structs in declaration order.
     * @param functions    The functions in declaration order.
     * @param dependencies The dependency names in first-seen order.
     * @return The Move source, ending with a newline.
     */
    public String render(String moduleName, List<MoveStruct> structs, List<MoveFunction> functions,
                         List<String> dependencies) {
        StringBuilder out = new StringBuilder();
        out.append("module ").append(moduleName).append("::").append(moduleName).append("  {\n");
        for (String use : options.baseImports()) {
            appendUse(out, use);
        }
        if (structs.stream().anyMatch(MoveStruct::isEventLike)) {
            appendUse(out, options.eventImport());
        }
        for (String dependency : dependencies) {
            appendUse(out, dependency);
        }
        out.append('\n');

        for (MoveStruct struct : structs) {
            renderStruct(out, struct);
        }
        for (MoveFunction function : functions) {
            renderFunction(out, function);
        }
        out.append("}\n");
        return out.toString();
    }

    private static void appendUse(StringBuilder out, String path) {
        out.append(MEMBER_INDENT).append("use ").append(path).append(";\n");
    }

    private static void renderStruct(StringBuilder out, MoveStruct struct) {
        String abilities = struct.abilities().stream()
                .map(MoveAbility::keyword)
                .collect(Collectors.joining(", "));
        out.append(MEMBER_INDENT).append("struct ").append(struct.name())
                .append(" has ").append(abilities).append(" {\n");
        for (MoveField field : struct.fields()) {
            out.append(STATEMENT_INDENT).append(field.name()).append(": ").append(field.typeName()).append(",\n");
        }
        out.append(MEMBER_INDENT).append("}\n\n");
    }

    private static void renderFunction(StringBuilder out, MoveFunction function) {
        String params = function.params().stream()
                .map(MoveRenderer::renderParam)
                .collect(Collectors.joining(", "));
        String returnSuffix = function.optionalReturnType().map(type -> ": " + type).orElse("");
        out.append(MEMBER_INDENT).append(visibilityPrefix(function.visibility()))
                .append("fun ").append(function.name())
                .append('(').append(params).append(')').append(returnSuffix).append(" {\n");
        for (MoveStatement statement : function.body()) {
            renderStatement(out, statement);
        }
        out.append(MEMBER_INDENT).append("}\n\n");
    }

    static String visibilityPrefix(MoveVisibility visibility) {
        return switch (visibility) {
            case PUBLIC_ENTRY -> "public entry ";
            case PUBLIC_PACKAGE -> "public ";
            case INTERNAL -> "";
        };
    }

    static String renderParam(MoveParam param) {
        if (param.isMutRef()) {
            return param.name() + ": &mut " + param.typeName();
        }
        if (param.isRef()) {
            return param.name() + ": &" + param.typeName();
        }
        return param.name() + ": " + param.typeName();
    }

    private static void renderStatement(StringBuilder out, MoveStatement statement) {
        out.append(STATEMENT_INDENT);
        if (statement instanceof MoveStatement.Let let) {
            out.append("let ").append(let.name());
            if (let.typeName() != null) {
                out.append(": ").append(let.typeName());
            }
            out.append(" = ").append(let.value()).append(';');
        } else if (statement instanceof MoveStatement.Borrow borrow) {
            out.append("let ").append(borrow.name()).append(" = ")
                    .append(borrow.mutable() ? "&mut " : "&").append(borrow.source()).append(';');
        } else if (statement instanceof MoveStatement.Return ret) {
            out.append(ret.expression());
        } else if (statement instanceof MoveStatement.Emit emit) {
            renderEmit(out, emit);
        } else if (statement instanceof MoveStatement.Assert check) {
            out.append("assert!(").append(check.condition()).append(", ").append(check.errorCode()).append(");");
        } else if (statement instanceof MoveStatement.Transfer transfer) {
            out.append("transfer::transfer(").append(transfer.object()).append(", ")
                    .append(transfer.recipient()).append(");");
        } else if (statement instanceof MoveStatement.Comment comment) {
            out.append("// ").append(comment.text());
        } else if (statement instanceof MoveStatement.Raw raw) {
            out.append(raw.code());
        }
        out.append('\n');
    }

    private static void renderEmit(StringBuilder out, MoveStatement.Emit emit) {
        if (emit.fields().isEmpty()) {
            out.append("event::emit(").append(emit.eventType()).append(" {});");
            return;
        }
        out.append("event::emit(").append(emit.eventType()).append(" {\n");
        for (MoveStatement.EmitField field : emit.fields()) {
            out.append(EMIT_FIELD_INDENT).append(field.name()).append(": ").append(field.value()).append(",\n");
        }
        out.append(STATEMENT_INDENT).append("});");
    }
}
