package org.gentlyos.compiler.model;

/**
 * Move type names used by the generated code.
 */
public final class MoveTypes {

    public static final String U64 = "u64";
    public static final String BOOL = "bool";
    public static final String BYTES = "vector<u8>";
    public static final String ADDRESS = "address";
    public static final String OBJECT_ID = "ID";
    public static final String UID = "UID";
    public static final String COIN = "Coin<SUI>";

    private MoveTypes() {
    }

    /**
     * Wraps an element type in a Move vector type.
     */
    public static String vectorOf(String elementType) {
        return "vector<" + elementType + ">";
    }
}
