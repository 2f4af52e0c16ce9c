package org.gentlyos.compiler.api;

import org.gentlyos.compiler.ModuleTranspiler;
import org.gentlyos.compiler.config.TranspilerOptions;
import org.gentlyos.compiler.diagnostics.Diagnostic;
import org.gentlyos.compiler.frontend.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the CODIE to Move transpiler.
 * <p>
 * Accepts CODIE in four forms: a parsed syntax tree, source text, a compressed glyph string,
 * or a content hash. Each form is reduced to the previous one through the external
 * collaborators given at construction, then transpiled. Collaborators are optional; calling
 * an entry point whose collaborator is missing raises {@link IllegalStateException}.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public class CodieMoveTranspiler {

    private static final Logger LOG = LoggerFactory.getLogger(CodieMoveTranspiler.class);

    private final ModuleTranspiler transpiler;
    private final CodieParser parser;
    private final GlyphRehydrator rehydrator;
    private final HashRegistry hashRegistry;

    /**
     * Creates a transpiler that accepts syntax trees only.
     *
     * @param options The transpiler settings.
     */
    public CodieMoveTranspiler(TranspilerOptions options) {
        this(options, null, null, null);
    }

    /**
     * @param options      The transpiler settings.
     * @param parser       Parser for source text, may be null.
     * @param rehydrator   Expander for glyph strings, may be null.
     * @param hashRegistry Lookup for content hashes, may be null.
     */
    public CodieMoveTranspiler(TranspilerOptions options, CodieParser parser,
                               GlyphRehydrator rehydrator, HashRegistry hashRegistry) {
        this.transpiler = new ModuleTranspiler(options);
        this.parser = parser;
        this.rehydrator = rehydrator;
        this.hashRegistry = hashRegistry;
    }

    /**
     * Transpiles a parsed CODIE syntax tree.
     *
     * @param ast The root of the tree.
     * @return The generated module.
     * @throws TranspileException if the tree contains no module definition.
     */
    public MoveModule codieToMove(AstNode ast) {
        Objects.requireNonNull(ast, "ast");
        MoveModule module = transpiler.transpile(ast);
        LOG.info("Transpiled CODIE module '{}': {} struct(s), {} function(s), {} dependency(ies)",
                module.name(), module.structs().size(), module.functions().size(), module.dependencies().size());
        for (Diagnostic diagnostic : module.diagnostics()) {
            LOG.warn("Module '{}': {}", module.name(), diagnostic);
        }
        if (module.requiresPrivilegedAccess()) {
            LOG.warn("Module '{}' reads vault paths {} and needs privileged access",
                    module.name(), module.privilegedReferences());
        }
        return module;
    }

    /**
     * Parses and transpiles CODIE source text.
     *
     * @param source The CODIE source.
     * @return The generated module.
     * @throws TranspileException if the source does not parse or defines no module.
     */
    public MoveModule sourceToMove(String source) {
        Objects.requireNonNull(source, "source");
        AstNode ast;
        try {
            ast = require(parser, "CodieParser").parse(source);
        } catch (CodieParseException e) {
            throw new TranspileException("CODIE parse error: " + e.getMessage(), e);
        }
        return codieToMove(ast);
    }

    /**
     * Expands a compressed glyph string, then parses and transpiles the result.
     *
     * @param glyph The compressed CODIE.
     * @return The generated module.
     */
    public MoveModule glyphToMove(String glyph) {
        Objects.requireNonNull(glyph, "glyph");
        return sourceToMove(require(rehydrator, "GlyphRehydrator").rehydrate(glyph));
    }

    /**
     * Resolves a content hash to CODIE source, then parses and transpiles it.
     *
     * @param hash The content hash.
     * @return The generated module.
     * @throws TranspileException if the hash is not registered.
     */
    public MoveModule hashToMove(String hash) {
        Objects.requireNonNull(hash, "hash");
        String source = require(hashRegistry, "HashRegistry").lookup(hash)
                .orElseThrow(() -> new TranspileException("CODIE hash " + hash + " not found in registry"));
        return sourceToMove(source);
    }

    private static <T> T require(T collaborator, String name) {
        if (collaborator == null) {
            throw new IllegalStateException(name + " not configured for this transpiler");
        }
        return collaborator;
    }
}
