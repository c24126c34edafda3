package org.konoko.runtime.io;

import org.konoko.runtime.CellOverflowException;
import org.konoko.runtime.InputExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Reads one integer per line from a character stream.
 * Blank lines are skipped; a line that is not an integer is logged and skipped.
 * An integer too large for a cell is a fault, not a skipped line.
 */
public class LineInputProvider implements IInputProvider {

    private static final Logger LOG = LoggerFactory.getLogger(LineInputProvider.class);

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private final BufferedReader reader;

    public LineInputProvider(Reader reader) {
        this.reader = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
    }

    /**
     * @return A provider reading from standard input as UTF-8.
     */
    public static LineInputProvider fromStdin() {
        return new LineInputProvider(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    @Override
    public long readLong() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                if (INTEGER.matcher(trimmed).matches()) {
                    throw new CellOverflowException("Input value " + trimmed + " does not fit in a 64-bit cell", e);
                }
                LOG.warn("Ignoring input line that is not an integer: '{}'", trimmed);
            }
        }
        throw new InputExhaustedException();
    }
}
