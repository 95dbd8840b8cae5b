package org.termconf.language.lexer;

import java.io.IOException;

/**
 * A pull-based source of tokens consumed by the parser.
 * <p>
 * Implementations report malformed input as {@link ConfigTokenType#INVALID} tokens carrying an
 * error and keep going; an {@link IOException} means the input itself is broken.
 * Once the end of input is reached every further call returns an {@link ConfigTokenType#EOF} token.
 */
public interface TokenScanner {

    /**
     * Produces the next token.
     * @return The next token, never {@code null}.
     * @throws IOException If the underlying input cannot be read.
     */
    ConfigToken scan() throws IOException;
}
