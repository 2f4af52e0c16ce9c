package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.config.TranspilerOptions;
import org.gentlyos.compiler.diagnostics.Diagnostic;
import org.gentlyos.compiler.diagnostics.DiagnosticsEngine;
import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.BinaryOpNode;
import org.gentlyos.compiler.frontend.ast.BreakNode;
import org.gentlyos.compiler.frontend.ast.CallNode;
import org.gentlyos.compiler.frontend.ast.CheckpointNode;
import org.gentlyos.compiler.frontend.ast.CodieType;
import org.gentlyos.compiler.frontend.ast.CommentNode;
import org.gentlyos.compiler.frontend.ast.ConditionalNode;
import org.gentlyos.compiler.frontend.ast.ConstraintNode;
import org.gentlyos.compiler.frontend.ast.EmptyNode;
import org.gentlyos.compiler.frontend.ast.FetchNode;
import org.gentlyos.compiler.frontend.ast.FieldEntry;
import org.gentlyos.compiler.frontend.ast.FlexibleNode;
import org.gentlyos.compiler.frontend.ast.ForeverLoopNode;
import org.gentlyos.compiler.frontend.ast.FunctionNode;
import org.gentlyos.compiler.frontend.ast.GoalNode;
import org.gentlyos.compiler.frontend.ast.IdentifierNode;
import org.gentlyos.compiler.frontend.ast.ImmutableNode;
import org.gentlyos.compiler.frontend.ast.IncompleteNode;
import org.gentlyos.compiler.frontend.ast.ListNode;
import org.gentlyos.compiler.frontend.ast.LiteralNode;
import org.gentlyos.compiler.frontend.ast.LoopNode;
import org.gentlyos.compiler.frontend.ast.ObjectNode;
import org.gentlyos.compiler.frontend.ast.ProgramNode;
import org.gentlyos.compiler.frontend.ast.PropertyNode;
import org.gentlyos.compiler.frontend.ast.ReturnNode;
import org.gentlyos.compiler.frontend.ast.SourceKind;
import org.gentlyos.compiler.frontend.ast.SourceNode;
import org.gentlyos.compiler.frontend.ast.SpecificationNode;
import org.gentlyos.compiler.frontend.ast.TimesLoopNode;
import org.gentlyos.compiler.frontend.ast.VariableNode;
import org.gentlyos.compiler.frontend.ast.WhileLoopNode;
import org.gentlyos.compiler.frontend.lowering.TranspileContext;
import org.gentlyos.compiler.model.MoveStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the statement produced for each body construct.
 */
class BodyLowererTest {

    private DiagnosticsEngine diagnostics;
    private TranspileContext context;
    private BodyLowerer lowerer;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        context = new TranspileContext(TranspilerOptions.defaults(), diagnostics, "demo");
        lowerer = new BodyLowerer(context, BodyLoweringRegistry.initializeWithDefaults());
    }

    private List<MoveStatement> lower(AstNode... nodes) {
        return lowerer.lower(List.of(nodes));
    }

    @Test
    @Tag("unit")
    void variableBecomesLet() {
        assertThat(lower(
                new VariableNode("maxRetries", CodieType.Primitive.NUMBER, LiteralNode.ofNumber(3)),
                VariableNode.untyped("greeting", LiteralNode.ofString("hi"))))
                .containsExactly(
                        new MoveStatement.Let("max_retries", "u64", "3"),
                        new MoveStatement.Let("greeting", null, "b\"hi\""));
    }

    @Test
    @Tag("unit")
    void fetchBecomesBorrowAndRegistersDependency() {
        assertThat(lower(
                FetchNode.of("userRecord", "@database/users"),
                FetchNode.of("prices", "@api/prices"),
                FetchNode.of("local", "cache")))
                .containsExactly(
                        new MoveStatement.Borrow("user_record", "@database/users", true),
                        new MoveStatement.Borrow("prices", "@api/prices", false),
                        new MoveStatement.Borrow("local", "cache", false));
        assertThat(context.dependencies()).containsExactly("database", "api");
    }

    @Test
    @Tag("unit")
    void dependencyRootStripsSigilsAndPath() {
        assertThat(BorrowLowering.dependencyRoot("@api/users/42")).isEqualTo("api");
        assertThat(BorrowLowering.dependencyRoot("$vault")).isEqualTo("vault");
        assertThat(BorrowLowering.dependencyRoot("plain")).isEqualTo("plain");
    }

    @Test
    @Tag("unit")
    void constraintsBecomeAssertsWithFreshCodes() {
        List<MoveStatement> statements = lower(
                new ImmutableNode("amount > 0"),
                new ConstraintNode(List.of(new ImmutableNode("NOT: overdraft"), new BreakNode())));

        assertThat(statements).containsExactly(
                new MoveStatement.Assert("amount > 0", 1),
                new MoveStatement.Assert("true /* NOT: overdraft */", 2),
                new MoveStatement.Raw("break"));
    }

    @Test
    @Tag("unit")
    void checkpointBecomesEmit() {
        assertThat(lower(new CheckpointNode("deadbeefcafe")))
                .containsExactly(new MoveStatement.Emit("Event_deadbeef",
                        List.of(new MoveStatement.EmitField("hash", "b\"deadbeefcafe\""))));
    }

    @Test
    @Tag("unit")
    void goalAndReturnBecomeReturn() {
        assertThat(lower(new GoalNode(new IdentifierNode("result")), new ReturnNode(LiteralNode.ofBool(true))))
                .containsExactly(new MoveStatement.Return("result"), new MoveStatement.Return("true"));
    }

    @Test
    @Tag("unit")
    void collectionLoopIteratesByIndex() {
        LoopNode loop = new LoopNode("item", new IdentifierNode("items"), List.of(new CallNode("process", List.of())));

        assertThat(lower(loop)).containsExactly(
                new MoveStatement.Raw("// spin item IN items"),
                new MoveStatement.Raw("let mut i = 0;\nwhile (i < vector::length(&items)) {"),
                new MoveStatement.Raw("process();"),
                new MoveStatement.Raw("    i = i + 1;\n}"));
    }

    @Test
    @Tag("unit")
    void otherLoopFormsWrapTheirBody() {
        assertThat(lower(new WhileLoopNode(new IdentifierNode("running"), List.of(new BreakNode()))))
                .containsExactly(
                        new MoveStatement.Raw("while (running) {"),
                        new MoveStatement.Raw("break"),
                        new MoveStatement.Raw("}"));
        assertThat(lower(new TimesLoopNode(3, List.of())))
                .containsExactly(
                        new MoveStatement.Raw("let mut i = 0;\nwhile (i < 3) {"),
                        new MoveStatement.Raw("    i = i + 1;\n}"));
        assertThat(lower(new ForeverLoopNode(List.of())))
                .containsExactly(new MoveStatement.Raw("loop {"), new MoveStatement.Raw("}"));
    }

    @Test
    @Tag("unit")
    void timesLoopCountIsRenderedUnsigned() {
        assertThat(lower(new TimesLoopNode(-1, List.of())))
                .first()
                .isEqualTo(new MoveStatement.Raw("let mut i = 0;\nwhile (i < 18446744073709551615) {"));
    }

    @Test
    @Tag("unit")
    void conditionalWrapsThenBranch() {
        ConditionalNode conditional = new ConditionalNode(
                new BinaryOpNode(new IdentifierNode("balance"), ">", LiteralNode.ofNumber(0)),
                new CallNode("withdraw", List.of(new IdentifierNode("amount"))));

        assertThat(lower(conditional)).containsExactly(
                new MoveStatement.Raw("if ((balance > 0)) {"),
                new MoveStatement.Raw("withdraw(amount);"),
                new MoveStatement.Raw("}"));
    }

    @Test
    @Tag("unit")
    void sourceReferencesBecomeComments() {
        assertThat(lower(
                new SourceNode(SourceKind.VAULT, "keys/master", List.of()),
                new SourceNode(SourceKind.API, "prices", List.of())))
                .containsExactly(
                        new MoveStatement.Comment("PTC REQUIRED: vault access $keys/master"),
                        new MoveStatement.Comment("external: @prices"));
    }

    @Test
    @Tag("unit")
    void incompleteFallsBackFromCommentToHash() {
        assertThat(lower(
                IncompleteNode.withComment("wire up payments"),
                new IncompleteNode("h123", null),
                new IncompleteNode(null, null)))
                .containsExactly(
                        new MoveStatement.Comment("TODO: wire up payments"),
                        new MoveStatement.Comment("TODO: h123"),
                        new MoveStatement.Comment("TODO: incomplete"));
    }

    @Test
    @Tag("unit")
    void flexibleInstantiationBecomesStructLiteral() {
        FlexibleNode flexible = new FlexibleNode("TempCache", List.of(
                VariableNode.untyped("ttl", LiteralNode.ofNumber(60)),
                new IdentifierNode("ignored")));

        assertThat(lower(flexible)).containsExactly(
                new MoveStatement.Raw("let temp_cache = TempCache {"),
                new MoveStatement.Raw("    ttl: 60,"),
                new MoveStatement.Raw("};"));
        assertThat(lower(new FlexibleNode(null, List.of())))
                .containsExactly(new MoveStatement.Raw("let data = Data {"), new MoveStatement.Raw("};"));
    }

    @Test
    @Tag("unit")
    void nestedSpecificationBecomesDelegatedCall() {
        SpecificationNode spec = new SpecificationNode("sendFunds", List.of(
                new FieldEntry("to", new IdentifierNode("recipient")),
                new FieldEntry("amount", LiteralNode.ofNumber(5))));

        assertThat(lower(spec, new SpecificationNode(null, List.of())))
                .containsExactly(new MoveStatement.Raw("send_funds(recipient, 5);"), new MoveStatement.Raw("spec();"));
    }

    @Test
    @Tag("unit")
    void nestedProgramAndFunctionAreInlined() {
        ProgramNode program = new ProgramNode("Inner", List.of(new BreakNode()));
        FunctionNode function = new FunctionNode("helper", List.of(), List.of(new CallNode("log", List.of())), null);

        assertThat(lower(program, function)).containsExactly(
                new MoveStatement.Raw("break"),
                new MoveStatement.Comment("inline: helper"),
                new MoveStatement.Raw("log();"));
    }

    @Test
    @Tag("unit")
    void expressionsBecomeRawStatements() {
        assertThat(lower(
                new IdentifierNode("totalAmount"),
                LiteralNode.ofNumber(7),
                new BinaryOpNode(new IdentifierNode("a"), "+", new IdentifierNode("b")),
                new PropertyNode(new IdentifierNode("user"), "name")))
                .containsExactly(
                        new MoveStatement.Raw("total_amount"),
                        new MoveStatement.Raw("7"),
                        new MoveStatement.Raw("a + b"),
                        new MoveStatement.Raw("user.name"));
    }

    @Test
    @Tag("unit")
    void objectLiteralBecomesFieldList() {
        ObjectNode object = new ObjectNode(List.of(new FieldEntry("ttl", LiteralNode.ofNumber(60))));

        assertThat(lower(object)).containsExactly(
                new MoveStatement.Raw("{"),
                new MoveStatement.Raw("    ttl: 60,"),
                new MoveStatement.Raw("}"));
    }

    @Test
    @Tag("unit")
    void ignoredKindsProduceNothing() {
        assertThat(lower(new EmptyNode(), new CommentNode("note"), new ListNode(List.of(LiteralNode.ofNumber(1)))))
                .isEmpty();
        assertThat(diagnostics.hasDiagnostics()).isFalse();
    }

    @Test
    @Tag("unit")
    void kindWithoutHandlerBecomesCommentAndIsReported() {
        BodyLowerer bare = new BodyLowerer(context, new BodyLoweringRegistry());

        assertThat(bare.lower(List.of(new BreakNode())))
                .containsExactly(new MoveStatement.Comment("unsupported: BreakNode"));
        assertThat(diagnostics.has(Diagnostic.Kind.UNSUPPORTED_NODE)).isTrue();
    }
}
