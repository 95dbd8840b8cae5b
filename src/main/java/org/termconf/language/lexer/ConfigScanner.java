package org.termconf.language.lexer;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * The scanner for the command language. It converts a character stream into a sequence of
 * {@link ConfigToken}s, one token per call to {@link #scan()}.
 * <p>
 * Whitespace and comments are returned as tokens as well; it is up to the parser to skip them.
 */
public class ConfigScanner implements TokenScanner {

    private static final int UNREAD = -2;
    private static final int END = -1;

    private final Reader reader;
    private int lookahead = UNREAD;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a new scanner reading from the given reader.
     * @param reader The character source. The scanner does not close it.
     */
    public ConfigScanner(Reader reader) {
        this.reader = reader;
    }

    /**
     * Creates a new scanner over an in-memory string.
     * @param source The source text.
     * @return A scanner over {@code source}.
     */
    public static ConfigScanner of(String source) {
        return new ConfigScanner(new StringReader(source));
    }

    @Override
    public ConfigToken scan() throws IOException {
        int startLine = line;
        int startColumn = column;
        int c = peek();

        if (c == END) {
            return new ConfigToken(ConfigTokenType.EOF, "", startLine, startColumn);
        }

        switch (c) {
            case '\n', ';':
                advance();
                return new ConfigToken(ConfigTokenType.TERMINATOR, String.valueOf((char) c), startLine, startColumn);
            case '#':
                return comment(startLine, startColumn);
            case '"':
                return quotedWord(startLine, startColumn);
            default:
                if (isBlank(c)) {
                    return whiteSpace(startLine, startColumn);
                }
                return word(startLine, startColumn);
        }
    }

    private ConfigToken whiteSpace(int startLine, int startColumn) throws IOException {
        StringBuilder text = new StringBuilder();
        while (isBlank(peek())) {
            text.append((char) advance());
        }
        return new ConfigToken(ConfigTokenType.WHITE_SPACE, text.toString(), startLine, startColumn);
    }

    private ConfigToken comment(int startLine, int startColumn) throws IOException {
        StringBuilder text = new StringBuilder();
        while (peek() != '\n' && peek() != END) {
            text.append((char) advance());
        }
        return new ConfigToken(ConfigTokenType.COMMENT, text.toString(), startLine, startColumn);
    }

    private ConfigToken word(int startLine, int startColumn) throws IOException {
        StringBuilder text = new StringBuilder();
        while (!isSeparator(peek())) {
            int c = advance();
            if (c == '\\') {
                // A line break cannot be escaped; the word ends before it.
                if (peek() == END || peek() == '\n') {
                    text.append('\\');
                    return new ConfigToken(ConfigTokenType.INVALID, text.toString(), startLine, startColumn,
                            "Incomplete escape sequence");
                }
                c = advance();
            }
            text.append((char) c);
        }

        String value = text.toString();
        ConfigTokenType type = value.startsWith("--") && value.length() > 2
                ? ConfigTokenType.OPTION
                : ConfigTokenType.WORD;
        return new ConfigToken(type, value, startLine, startColumn);
    }

    private ConfigToken quotedWord(int startLine, int startColumn) throws IOException {
        StringBuilder raw = new StringBuilder();
        StringBuilder value = new StringBuilder();
        String error = null;

        raw.append((char) advance()); // opening quote

        while (true) {
            int c = peek();
            if (c == END || c == '\n') {
                return new ConfigToken(ConfigTokenType.INVALID, raw.toString(), startLine, startColumn,
                        "Unterminated string");
            }
            raw.append((char) advance());

            if (c == '"') {
                break;
            }

            if (c == '\\') {
                int escaped = peek();
                if (escaped == END || escaped == '\n') {
                    continue;
                }
                raw.append((char) advance());
                switch (escaped) {
                    case '"', '\\' -> value.append((char) escaped);
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    default -> {
                        if (error == null) {
                            error = "Invalid escape sequence \"\\" + (char) escaped + "\"";
                        }
                    }
                }
            } else {
                value.append((char) c);
            }
        }

        if (error != null) {
            return new ConfigToken(ConfigTokenType.INVALID, raw.toString(), startLine, startColumn, error);
        }
        return new ConfigToken(ConfigTokenType.WORD, value.toString(), startLine, startColumn);
    }

    private int peek() throws IOException {
        if (lookahead == UNREAD) {
            lookahead = reader.read();
        }
        return lookahead;
    }

    private int advance() throws IOException {
        int c = peek();
        lookahead = UNREAD;
        if (c == '\n') {
            line++;
            column = 1;
        } else if (c != END) {
            column++;
        }
        return c;
    }

    private static boolean isBlank(int c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f';
    }

    private static boolean isSeparator(int c) {
        return c == END || c == '\n' || c == ';' || isBlank(c);
    }
}
