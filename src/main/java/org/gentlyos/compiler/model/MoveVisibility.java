package org.gentlyos.compiler.model;

/**
 * Move function visibility.
 */
public enum MoveVisibility {
    /** Transaction entry point, {@code public entry}. */
    PUBLIC_ENTRY,
    /** Composable public function, {@code public}. */
    PUBLIC_PACKAGE,
    /** Module-private function. */
    INTERNAL
}
