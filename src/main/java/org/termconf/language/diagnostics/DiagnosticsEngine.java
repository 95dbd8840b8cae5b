package org.termconf.language.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the errors reported while reading a whole source.
 * <p>
 * This decouples error reporting from the loop that drives the parser.
 */
public class DiagnosticsEngine {

    private final List<ConfigError> errors = new ArrayList<>();

    /**
     * Reports an error.
     * @param error The error.
     */
    public void report(ConfigError error) {
        errors.add(error);
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return {@code true} if a reported error made the source unreadable.
     */
    public boolean hasFatalError() {
        return errors.stream().anyMatch(ConfigError::isFatal);
    }

    /**
     * @return The number of reported errors.
     */
    public int errorCount() {
        return errors.size();
    }

    /**
     * Returns an unmodifiable view of all reported errors, in reporting order.
     * @return The errors.
     */
    public List<ConfigError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Returns all reported errors as a single string, one per line.
     * @return The summary.
     */
    public String summary() {
        return errors.stream()
                .map(ConfigError::message)
                .collect(Collectors.joining("\n"));
    }
}
