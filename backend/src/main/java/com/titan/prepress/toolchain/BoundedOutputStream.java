package com.titan.prepress.toolchain;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Captures process output up to a fixed number of bytes and silently drops the rest.
 */
class BoundedOutputStream extends OutputStream {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final int limit;
    private boolean truncated;

    BoundedOutputStream(int limit) {
        this.limit = limit;
    }

    @Override
    public synchronized void write(int b) {
        if (buffer.size() < limit) {
            buffer.write(b);
        } else {
            truncated = true;
        }
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) {
        int room = limit - buffer.size();
        if (len > room) {
            truncated = true;
        }
        if (room > 0) {
            buffer.write(b, off, Math.min(len, room));
        }
    }

    synchronized byte[] toByteArray() {
        return buffer.toByteArray();
    }

    synchronized String asText() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    synchronized boolean isTruncated() {
        return truncated;
    }
}
