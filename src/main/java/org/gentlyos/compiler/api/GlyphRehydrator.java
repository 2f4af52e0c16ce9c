package org.gentlyos.compiler.api;

/**
 * Expands a compressed glyph string back into CODIE source text.
 */
@FunctionalInterface
public interface GlyphRehydrator {

    String rehydrate(String glyph);
}
