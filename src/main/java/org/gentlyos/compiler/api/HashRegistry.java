package org.gentlyos.compiler.api;

import java.util.Optional;

/**
 * Content-addressed store of CODIE sources.
 */
@FunctionalInterface
public interface HashRegistry {

    /**
     * @param hash The content hash.
     * @return The source registered under the hash, or empty if unknown.
     */
    Optional<String> lookup(String hash);
}
