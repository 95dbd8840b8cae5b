package org.termconf.language.lexer;

/**
 * Defines the different types of tokens that a {@link TokenScanner} can produce.
 */
public enum ConfigTokenType {
    /** A plain or quoted word, such as a command name or an argument. */
    WORD("Word"),
    /** An option switch beginning with "--". */
    OPTION("Option"),
    /** A run of blanks between tokens. */
    WHITE_SPACE("WhiteSpace"),
    /** A comment running from '#' to the end of the line. */
    COMMENT("Comment"),
    /** A newline or ';', ending a command. */
    TERMINATOR("Terminator"),
    /** Represents the end of the input. */
    EOF("EOF"),
    /** Malformed input; the token carries the lexical error. */
    INVALID("Invalid");

    private final String displayName;

    ConfigTokenType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the name used for this type in diagnostics.
     * @return The display name, e.g. "Word".
     */
    public String displayName() {
        return displayName;
    }
}
