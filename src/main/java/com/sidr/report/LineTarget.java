package com.sidr.report;

import java.io.IOException;
import java.io.Writer;

/**
 * Destination of report lines. Standard output is shared by every report of a run, so
 * each line is written and flushed under the target's lock.
 */
final class LineTarget {
    private final Writer writer;
    private final Object lock;
    private final boolean closeWriter;

    private LineTarget(Writer writer, Object lock, boolean closeWriter) {
        this.writer = writer;
        this.lock = lock;
        this.closeWriter = closeWriter;
    }

    static LineTarget owned(Writer writer) {
        return new LineTarget(writer, writer, true);
    }

    static LineTarget shared(Writer writer, Object lock) {
        return new LineTarget(writer, lock, false);
    }

    void writeLine(String line) throws IOException {
        synchronized (lock) {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        }
    }

    void close() throws IOException {
        synchronized (lock) {
            if (closeWriter) {
                writer.close();
            } else {
                writer.flush();
            }
        }
    }
}
