package de.mirkosertic.pwstrength.matcher;

/**
 * Keyboard layouts known to the {@link SpatialMatcher}.
 *
 * <p>Each row lists the keys from left to right as cells of the unshifted and shifted character.
 * Leading blanks encode the horizontal offset of the row. Slanted layouts shift every row half a key
 * to the right, so each key has six neighbours; aligned layouts (keypads) form a grid with eight.</p>
 */
public enum KeyboardLayout {

    QWERTY("qwerty", true,
            "`~ 1! 2@ 3# 4$ 5% 6^ 7& 8* 9( 0) -_ =+\n"
                    + "    qQ wW eE rR tT yY uU iI oO pP [{ ]} \\|\n"
                    + "     aA sS dD fF gG hH jJ kK lL ;: '\"\n"
                    + "      zZ xX cC vV bB nN mM ,< .> /?\n"),

    DVORAK("dvorak", true,
            "`~ 1! 2@ 3# 4$ 5% 6^ 7& 8* 9( 0) [{ ]}\n"
                    + "    '\" ,< .> pP yY fF gG cC rR lL /? =+ \\|\n"
                    + "     aA oO eE uU iI dD hH tT nN sS -_\n"
                    + "      ;: qQ jJ kK xX bB mM wW vV zZ\n"),

    KEYPAD("keypad", false,
            "  / * -\n"
                    + "7 8 9 +\n"
                    + "4 5 6\n"
                    + "1 2 3\n"
                    + "  0 .\n"),

    MAC_KEYPAD("mac_keypad", false,
            "  = / *\n"
                    + "7 8 9 -\n"
                    + "4 5 6 +\n"
                    + "1 2 3\n"
                    + "  0 .\n");

    private final String graphName;
    private final boolean slanted;
    private final String layout;

    KeyboardLayout(final String graphName, final boolean slanted, final String layout) {
        this.graphName = graphName;
        this.slanted = slanted;
        this.layout = layout;
    }

    public String graphName() {
        return graphName;
    }

    public boolean slanted() {
        return slanted;
    }

    public String layout() {
        return layout;
    }

    public SpatialGraph buildGraph() {
        return SpatialGraph.build(graphName, layout, slanted);
    }
}
