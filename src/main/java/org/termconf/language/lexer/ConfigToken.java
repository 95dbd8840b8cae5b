package org.termconf.language.lexer;

/**
 * Represents a single token produced by a {@link TokenScanner}.
 *
 * @param type The type of the token.
 * @param text The text of the token. For quoted words this is the unescaped content.
 * @param line The 1-based line on which the token starts.
 * @param column The 1-based column at which the token starts.
 * @param error The lexical error recognised for this token, or {@code null} if it is well formed.
 */
public record ConfigToken(
        ConfigTokenType type,
        String text,
        int line,
        int column,
        String error
) {

    /**
     * Creates a well formed token.
     * @param type The token type.
     * @param text The token text.
     * @param line The 1-based line.
     * @param column The 1-based column.
     */
    public ConfigToken(ConfigTokenType type, String text, int line, int column) {
        this(type, text, line, column, null);
    }

    /**
     * @return true if the scanner attached a lexical error to this token.
     */
    public boolean hasError() {
        return error != null;
    }
}
