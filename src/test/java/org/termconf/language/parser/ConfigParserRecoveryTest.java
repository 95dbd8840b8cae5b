package org.termconf.language.parser;

import org.termconf.language.diagnostics.ConfigErrorCode;
import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.lexer.ConfigTokenType;
import org.termconf.language.lexer.TokenScanner;
import org.termconf.language.parser.ast.QuitCommand;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests how the {@link ConfigParser} behaves when its token source fails or hands it tokens
 * that a {@link org.termconf.language.lexer.ConfigScanner} would not normally produce.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
public class ConfigParserRecoveryTest {

    @Mock
    private TokenScanner scanner;

    private static ConfigToken word(String text, int line, int column) {
        return new ConfigToken(ConfigTokenType.WORD, text, line, column);
    }

    /**
     * Verifies that a read failure is reported as a fatal error and that the parser makes no
     * attempt to skip ahead.
     */
    @Test
    void testReadFailureIsFatal() throws IOException {
        // Arrange
        when(scanner.scan()).thenThrow(new IOException("Read failed"));
        ConfigParser parser = new ConfigParser(scanner, "cfg");

        // Act
        ParseResult result = parser.parseNext();

        // Assert
        assertThat(result.command()).isNull();
        assertThat(result.error().code()).isEqualTo(ConfigErrorCode.SCANNER_FAILURE);
        assertThat(result.error().message()).isEqualTo("cfg: Read failed");
        assertThat(result.error().isFatal()).isTrue();
        assertThat(result.error().cause()).hasMessage("Read failed");
        verify(scanner, times(1)).scan();
    }

    @Test
    void testReadFailureInsideCommand() throws IOException {
        when(scanner.scan())
                .thenReturn(word("set", 1, 1))
                .thenThrow(new IOException("Connection reset"));
        ConfigParser parser = new ConfigParser(scanner, "");

        ParseResult result = parser.parseNext();

        assertThat(result.error().code()).isEqualTo(ConfigErrorCode.SCANNER_FAILURE);
        assertThat(result.error().message()).isEqualTo("Connection reset");
        verify(scanner, times(2)).scan();
    }

    /**
     * A read failure while skipping a bad command is not reported by that call; the following
     * call runs into it and reports it.
     */
    @Test
    void testReadFailureDuringRecoveryIsReportedByNextCall() throws IOException {
        when(scanner.scan())
                .thenReturn(word("bogus", 1, 1))
                .thenThrow(new IOException("Read failed"));
        ConfigParser parser = new ConfigParser(scanner, "cfg");

        ParseResult first = parser.parseNext();
        ParseResult second = parser.parseNext();

        assertThat(first.error().code()).isEqualTo(ConfigErrorCode.INVALID_COMMAND);
        assertThat(first.error().message()).isEqualTo("cfg:1:1 Invalid command \"bogus\"");
        assertThat(second.error().code()).isEqualTo(ConfigErrorCode.SCANNER_FAILURE);
    }

    /**
     * Verifies that any token carrying a lexical error aborts a variable arity command, not
     * only tokens of type INVALID.
     */
    @Test
    void testErroneousWordInArguments() throws IOException {
        when(scanner.scan()).thenReturn(
                word("addview", 1, 1),
                new ConfigToken(ConfigTokenType.WHITE_SPACE, " ", 1, 8),
                new ConfigToken(ConfigTokenType.WORD, "x", 1, 9, "bad byte"),
                new ConfigToken(ConfigTokenType.TERMINATOR, "\n", 1, 10),
                word("q", 2, 1),
                new ConfigToken(ConfigTokenType.EOF, "", 2, 2));
        ConfigParser parser = new ConfigParser(scanner, "cfg");

        ParseResult first = parser.parseNext();
        ParseResult second = parser.parseNext();
        ParseResult third = parser.parseNext();

        assertThat(first.error().code()).isEqualTo(ConfigErrorCode.SYNTAX_ERROR);
        assertThat(first.error().message()).isEqualTo("cfg:1:9 Syntax Error: bad byte");
        assertThat(second.command()).isEqualTo(new QuitCommand());
        assertThat(third.endOfInput()).isTrue();
    }
}
