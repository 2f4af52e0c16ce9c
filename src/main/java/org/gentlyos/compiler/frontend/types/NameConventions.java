package org.gentlyos.compiler.frontend.types;

/**
 * Case conversion between CODIE names and Move naming conventions.
 */
public final class NameConventions {

    private NameConventions() {
    }

    /**
     * Converts a name to snake_case.
     * <p>
     * An underscore is inserted before an uppercase letter when the previous character is not
     * uppercase, or when the letter is followed by a lowercase one. A run of capitals therefore
     * stays together while its last capital starts the next word: {@code HTTPServer} becomes
     * {@code http_server}. Spaces and hyphens become underscores.
     *
     * @param name The name to convert.
     * @return The snake_case form.
     */
    public static String toSnakeCase(String name) {
        StringBuilder result = new StringBuilder(name.length() + 4);
        int length = name.length();
        for (int i = 0; i < length; i++) {
            char c = name.charAt(i);
            if (i > 0 && Character.isUpperCase(c)) {
                boolean prevUpper = Character.isUpperCase(name.charAt(i - 1));
                boolean nextLower = i + 1 < length && Character.isLowerCase(name.charAt(i + 1));
                if (!prevUpper || nextLower) {
                    result.append('_');
                }
            }
            result.append(Character.toLowerCase(c));
        }
        return result.toString().replace(' ', '_').replace('-', '_');
    }

    /**
     * Converts a name to PascalCase by normalizing it to snake_case first and capitalizing
     * each non-empty word.
     *
     * @param name The name to convert.
     * @return The PascalCase form.
     */
    public static String toPascalCase(String name) {
        StringBuilder result = new StringBuilder(name.length());
        for (String word : toSnakeCase(name).split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            result.append(Character.toUpperCase(word.charAt(0))).append(word, 1, word.length());
        }
        return result.toString();
    }
}
