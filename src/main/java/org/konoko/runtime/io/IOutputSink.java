package org.konoko.runtime.io;

/**
 * The destination of values written by output instructions.
 */
public interface IOutputSink {

    /**
     * Writes one value as a character.
     * @param value The cell value, interpreted as a Unicode code point.
     */
    void write(long value);

    /**
     * Converts a cell value to the text that represents it.
     * Values that are not valid code points become U+FFFD.
     *
     * @param value The cell value.
     * @return The character(s) for the value.
     */
    static String toText(long value) {
        if (value < 0 || value > Character.MAX_CODE_POINT) {
            return "\uFFFD";
        }
        return new String(Character.toChars((int) value));
    }
}
