package org.konoko.compiler.isa;

/**
 * The eight primitive instructions of the language.
 * <p>
 * The declaration order is significant: the compact run length of an
 * instruction is its position in this enumeration, starting at one.
 */
public enum Instruction {
    /** Moves the data pointer one cell to the right, wrapping at the end of the tape. */
    MOVE_RIGHT("犬の子"),
    /** Moves the data pointer one cell to the left. */
    MOVE_LEFT("狐の子"),
    /** Adds one to the current cell. */
    INCREMENT("猫の子"),
    /** Subtracts one from the current cell. */
    DECREMENT("狸の子"),
    /** Opens a loop that runs while the current cell is non-zero. */
    LOOP_START("熊の子"),
    /** Closes the innermost open loop. */
    LOOP_END("虎の子"),
    /** Writes the current cell as a character. */
    OUTPUT("鳩の子"),
    /** Reads an integer into the current cell. */
    INPUT("兎の子");

    /** The glyph that introduces every instruction in compact notation. */
    public static final char COMPACT_MARKER = '。';
    /** The glyph repeated {@link #runLength()} times after the marker. */
    public static final char COMPACT_UNIT = 'ニ';

    private final String naturalSymbol;

    Instruction(String naturalSymbol) {
        this.naturalSymbol = naturalSymbol;
    }

    /**
     * Returns the canonical natural-notation spelling of this instruction.
     * @return The multi-glyph symbol.
     */
    public String naturalSymbol() {
        return naturalSymbol;
    }

    /**
     * Returns the number of unit glyphs that encode this instruction in compact notation.
     * @return A value between 1 and 8.
     */
    public int runLength() {
        return ordinal() + 1;
    }

    /**
     * Returns whether this instruction opens or closes a loop.
     * @return {@code true} for {@link #LOOP_START} and {@link #LOOP_END}.
     */
    public boolean isLoopMarker() {
        return this == LOOP_START || this == LOOP_END;
    }
}
