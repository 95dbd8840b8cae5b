package org.termconf.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.charset.Charset;

/**
 * Settings for reading command sources, taken from the {@code termconf} block of the configuration.
 *
 * @param maxErrors The number of errors after which reading a source stops; 0 for no limit.
 * @param charset The character set of command files.
 * @param promptSourceLabel The label used for errors in interactively typed commands.
 */
public record LoaderSettings(int maxErrors, Charset charset, String promptSourceLabel) {

    private static final String MAX_ERRORS_PATH = "termconf.loader.max-errors";
    private static final String CHARSET_PATH = "termconf.loader.charset";
    private static final String PROMPT_LABEL_PATH = "termconf.prompt.source-label";

    public LoaderSettings {
        if (maxErrors < 0) {
            throw new IllegalArgumentException("max-errors must not be negative: " + maxErrors);
        }
    }

    /**
     * Reads the settings from a resolved configuration.
     * @param config The configuration; must contain the defaults from {@code reference.conf}.
     * @return The settings.
     */
    public static LoaderSettings fromConfig(Config config) {
        return new LoaderSettings(
                config.getInt(MAX_ERRORS_PATH),
                Charset.forName(config.getString(CHARSET_PATH)),
                config.getString(PROMPT_LABEL_PATH));
    }

    /**
     * @return The settings defined by {@code reference.conf}.
     */
    public static LoaderSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }
}
