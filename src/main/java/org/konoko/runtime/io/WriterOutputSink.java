package org.konoko.runtime.io;

import java.io.PrintWriter;

/**
 * Writes each value straight to a console writer and flushes, so output appears as the program runs.
 */
public class WriterOutputSink implements IOutputSink {

    private final PrintWriter out;

    public WriterOutputSink(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void write(long value) {
        out.print(IOutputSink.toText(value));
        out.flush();
    }
}
