package org.termconf.language.parser.ast;

/**
 * A visitor over the closed set of {@link ConfigCommand}s.
 * @param <R> The result type.
 */
public interface ConfigCommandVisitor<R> {
    R visitSet(SetCommand command);
    R visitTheme(ThemeCommand command);
    R visitMap(MapCommand command);
    R visitUnmap(UnmapCommand command);
    R visitQuit(QuitCommand command);
    R visitNewTab(NewTabCommand command);
    R visitRemoveTab(RemoveTabCommand command);
    R visitAddView(AddViewCommand command);
    R visitSplitView(SplitViewCommand command);
}
