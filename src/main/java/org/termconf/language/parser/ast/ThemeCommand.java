package org.termconf.language.parser.ast;

import org.termconf.language.lexer.ConfigToken;

/**
 * Sets the colours of a component on a theme. Any field may be {@code null} if the
 * corresponding switch was not supplied.
 *
 * @param name The theme name.
 * @param component The themed component.
 * @param bgcolor The background colour.
 * @param fgcolor The foreground colour.
 */
public record ThemeCommand(
        ConfigToken name,
        ConfigToken component,
        ConfigToken bgcolor,
        ConfigToken fgcolor
) implements ConfigCommand {
    @Override
    public <R> R accept(ConfigCommandVisitor<R> visitor) {
        return visitor.visitTheme(this);
    }
}
