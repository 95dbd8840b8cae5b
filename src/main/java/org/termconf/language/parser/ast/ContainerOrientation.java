package org.termconf.language.parser.ast;

/**
 * The orientation in which a split lays out its child views.
 */
public enum ContainerOrientation {
    /** Chosen by the view container based on the available space. */
    DYNAMIC,
    /** Child views are stacked on top of each other. */
    HORIZONTAL,
    /** Child views are placed side by side. */
    VERTICAL
}
