package org.konoko.runtime.io;

/**
 * Keeps everything written in memory.
 */
public class CollectingOutputSink implements IOutputSink {

    private final StringBuilder text = new StringBuilder();

    @Override
    public void write(long value) {
        text.append(IOutputSink.toText(value));
    }

    public String getText() {
        return text.toString();
    }
}
