package org.termconf.language.diagnostics;

import org.termconf.language.lexer.ConfigToken;
import org.termconf.language.lexer.ConfigTokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link ConfigErrorFormatter} and {@link DiagnosticsEngine}.
 */
@Tag("unit")
public class ConfigErrorFormatterTest {

    private final ConfigToken token = new ConfigToken(ConfigTokenType.WORD, "bogus", 3, 7);

    @Test
    void testFormatWithLabel() {
        assertThat(ConfigErrorFormatter.format("grvrc", token, "Invalid command \"%s\"", token.text()))
                .isEqualTo("grvrc:3:7 Invalid command \"bogus\"");
    }

    @Test
    void testFormatWithoutLabel() {
        assertThat(ConfigErrorFormatter.format("", token, "Unexpected EOF")).isEqualTo("Unexpected EOF");
        assertThat(ConfigErrorFormatter.format(null, token, "Unexpected EOF")).isEqualTo("Unexpected EOF");
    }

    /**
     * Verifies that the lexical error of a token is appended to the message.
     */
    @Test
    void testFormatAppendsTokenError() {
        ConfigToken invalid = new ConfigToken(ConfigTokenType.INVALID, "\"abc", 1, 5, "Unterminated string");

        assertThat(ConfigErrorFormatter.format("f", invalid, "Syntax Error"))
                .isEqualTo("f:1:5 Syntax Error: Unterminated string");
    }

    @Test
    void testErrorCarriesPosition() {
        ConfigError error = ConfigErrorFormatter.error(ConfigErrorCode.INVALID_COMMAND, "grvrc", token,
                "Invalid command \"%s\"", token.text());

        assertThat(error.code()).isEqualTo(ConfigErrorCode.INVALID_COMMAND);
        assertThat(error.sourceLabel()).isEqualTo("grvrc");
        assertThat(error.line()).isEqualTo(3);
        assertThat(error.column()).isEqualTo(7);
        assertThat(error.cause()).isNull();
        assertThat(error.isFatal()).isFalse();
        assertThat(error).hasToString("grvrc:3:7 Invalid command \"bogus\"");
    }

    @Test
    void testScannerFailure() {
        IOException cause = new IOException("Stream closed");

        ConfigError labelled = ConfigErrorFormatter.scannerFailure("grvrc", cause);
        ConfigError unlabelled = ConfigErrorFormatter.scannerFailure(null, new IOException());

        assertThat(labelled.message()).isEqualTo("grvrc: Stream closed");
        assertThat(labelled.isFatal()).isTrue();
        assertThat(labelled.cause()).isSameAs(cause);
        assertThat(labelled.line()).isZero();
        assertThat(unlabelled.message()).isEqualTo("IOException");
        assertThat(unlabelled.sourceLabel()).isEmpty();
    }

    @Test
    void testDiagnosticsEngine() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        assertThat(diagnostics.hasErrors()).isFalse();

        diagnostics.report(ConfigErrorFormatter.error(ConfigErrorCode.UNEXPECTED_EOF, "", token, "Unexpected EOF"));
        diagnostics.report(ConfigErrorFormatter.scannerFailure("", new IOException("gone")));

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.hasFatalError()).isTrue();
        assertThat(diagnostics.errorCount()).isEqualTo(2);
        assertThat(diagnostics.summary()).isEqualTo("Unexpected EOF\ngone");
        assertThat(diagnostics.getErrors()).extracting(ConfigError::code)
                .containsExactly(ConfigErrorCode.UNEXPECTED_EOF, ConfigErrorCode.SCANNER_FAILURE);
    }
}
