package com.example.playtimecrawler.record;

/**
 * The seven playstyle slots a completion-time table can fill, in output column order.
 */
public enum PlaystyleKey {
    MAIN_STORY("main_story"),
    MAIN_PLUS_SIDES("main_plus_sides"),
    COMPLETIONIST("completionist"),
    ALL_STYLES("all_styles"),
    SINGLE_PLAYER("single_player"),
    CO_OP("co_op"),
    VERSUS("versus");

    private final String column;

    PlaystyleKey(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public String polledColumn() {
        return column + "_polled";
    }

    /**
     * Keys that only the newer layouts report separately from the four core styles.
     */
    public boolean isExtra() {
        return this == SINGLE_PLAYER || this == CO_OP || this == VERSUS;
    }
}
