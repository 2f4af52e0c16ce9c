package org.gentlyos.compiler.api;

import org.gentlyos.compiler.config.TranspilerOptions;
import org.gentlyos.compiler.diagnostics.Diagnostic;
import org.gentlyos.compiler.frontend.ast.FetchNode;
import org.gentlyos.compiler.frontend.ast.ImmutableNode;
import org.gentlyos.compiler.frontend.ast.LiteralNode;
import org.gentlyos.compiler.frontend.ast.ProgramNode;
import org.gentlyos.compiler.frontend.ast.VariableNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CodieMoveTranspilerTest {

    private static final ProgramNode TEST_PROGRAM = new ProgramNode("TEST", List.of());

    @Mock
    private CodieParser parser;
    @Mock
    private GlyphRehydrator rehydrator;
    @Mock
    private HashRegistry hashRegistry;

    private CodieMoveTranspiler transpiler;

    @BeforeEach
    void setUp() {
        transpiler = new CodieMoveTranspiler(TranspilerOptions.defaults(), parser, rehydrator, hashRegistry);
    }

    @Test
    @Tag("unit")
    void transpilesSyntaxTreeDirectly() {
        MoveModule module = transpiler.codieToMove(new ProgramNode("LOGIN", List.of(new ImmutableNode("AuthToken"))));

        assertThat(module.name()).isEqualTo("login");
        assertThat(module.findStruct("AuthToken")).isPresent();
        assertThat(module.diagnostics()).isEmpty();
        verifyNoInteractions(parser, rehydrator, hashRegistry);
    }

    @Test
    @Tag("unit")
    void sourceIsParsedThenTranspiled() throws Exception {
        when(parser.parse("pug TEST")).thenReturn(TEST_PROGRAM);

        MoveModule module = transpiler.sourceToMove("pug TEST");

        assertThat(module.name()).isEqualTo("test");
        assertThat(module.source()).startsWith("module test::test  {");
    }

    @Test
    @Tag("unit")
    void parseFailureIsWrappedWithContext() throws Exception {
        CodieParseException failure = new CodieParseException("unexpected token 'xyz' at 1:4");
        when(parser.parse("pug xyz xyz")).thenThrow(failure);

        assertThatThrownBy(() -> transpiler.sourceToMove("pug xyz xyz"))
                .isInstanceOf(TranspileException.class)
                .hasMessage("CODIE parse error: unexpected token 'xyz' at 1:4")
                .hasCause(failure);
    }

    @Test
    @Tag("unit")
    void glyphIsRehydratedThenParsed() throws Exception {
        when(rehydrator.rehydrate("~T")).thenReturn("pug TEST");
        when(parser.parse("pug TEST")).thenReturn(TEST_PROGRAM);

        assertThat(transpiler.glyphToMove("~T").name()).isEqualTo("test");
        verify(rehydrator).rehydrate("~T");
    }

    @Test
    @Tag("unit")
    void hashIsResolvedThenParsed() throws Exception {
        when(hashRegistry.lookup("abc123")).thenReturn(Optional.of("pug TEST"));
        when(parser.parse("pug TEST")).thenReturn(TEST_PROGRAM);

        assertThat(transpiler.hashToMove("abc123").name()).isEqualTo("test");
    }

    @Test
    @Tag("unit")
    void unknownHashFails() {
        when(hashRegistry.lookup("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> transpiler.hashToMove("missing"))
                .isInstanceOf(TranspileException.class)
                .hasMessage("CODIE hash missing not found in registry");
        verifyNoInteractions(parser);
    }

    @Test
    @Tag("unit")
    void missingModuleDefinitionFails() throws Exception {
        when(parser.parse("elf x = 1")).thenReturn(VariableNode.untyped("x", LiteralNode.ofNumber(1)));

        assertThatThrownBy(() -> transpiler.sourceToMove("elf x = 1"))
                .isInstanceOf(TranspileException.class)
                .hasMessageContaining("pug");
    }

    @Test
    @Tag("unit")
    void missingCollaboratorIsReported() {
        CodieMoveTranspiler treesOnly = new CodieMoveTranspiler(TranspilerOptions.defaults());

        assertThatThrownBy(() -> treesOnly.sourceToMove("pug TEST"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CodieParser");
        assertThatThrownBy(() -> treesOnly.glyphToMove("g"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GlyphRehydrator");
        assertThatThrownBy(() -> treesOnly.hashToMove("h"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("HashRegistry");
    }

    @Test
    @Tag("unit")
    void nullInputIsRejected() {
        assertThatThrownBy(() -> transpiler.codieToMove(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> transpiler.sourceToMove(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @Tag("unit")
    void moduleExposesPrivilegedReferencesAndDiagnostics() {
        ProgramNode program = new ProgramNode("KEYS", List.of(
                VariableNode.untyped("early", LiteralNode.ofNumber(1)),
                FetchNode.of("master", "$keys/master")));

        MoveModule module = transpiler.codieToMove(program);

        assertThat(module.requiresPrivilegedAccess()).isTrue();
        assertThat(module.privilegedReferences()).containsExactly("$keys/master");
        assertThat(module.diagnostics()).extracting(Diagnostic::kind).containsExactly(Diagnostic.Kind.STRAY_BINDING);
    }
}
