package com.example.doctalk.stream;

import com.example.doctalk.exception.AnswerStreamException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Pull-based reader over an answer byte stream.
 * <p>
 * Yields {@link AnswerEvent.TextDelta}s as text becomes final and one
 * {@link AnswerEvent.Completed} at the end. A read failure closes the stream and surfaces as
 * {@link AnswerStreamException} from {@link #hasNext()} or {@link #next()}.
 */
public class StreamDemultiplexer implements Iterator<AnswerEvent>, Closeable {

    private static final int DEFAULT_BUFFER_SIZE = 8192;

    private final InputStream in;
    private final SourcesFrameDecoder decoder;
    private final byte[] buffer;
    private final Deque<AnswerEvent> ready = new ArrayDeque<>();
    private boolean exhausted;
    private boolean closed;

    public StreamDemultiplexer(InputStream in, ObjectMapper objectMapper) {
        this(in, objectMapper, DEFAULT_BUFFER_SIZE);
    }

    public StreamDemultiplexer(InputStream in, ObjectMapper objectMapper, int bufferSize) {
        this.in = in;
        this.decoder = new SourcesFrameDecoder(objectMapper);
        this.buffer = new byte[bufferSize];
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !exhausted) {
            readOnce();
        }
        return !ready.isEmpty();
    }

    @Override
    public AnswerEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.poll();
    }

    private void readOnce() {
        int n;
        try {
            n = in.read(buffer);
        } catch (IOException e) {
            closeQuietly();
            exhausted = true;
            throw new AnswerStreamException("Connection lost while receiving the answer.", e);
        }

        if (n < 0) {
            String tail = decoder.finish();
            if (!tail.isEmpty()) {
                ready.add(new AnswerEvent.TextDelta(tail));
            }
            ready.add(new AnswerEvent.Completed(decoder.answerText(), decoder.citations()));
            exhausted = true;
            closeQuietly();
            return;
        }

        String delta = decoder.feed(buffer, 0, n);
        if (!delta.isEmpty()) {
            ready.add(new AnswerEvent.TextDelta(delta));
        }
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            exhausted = true;
            in.close();
        }
    }

    private void closeQuietly() {
        try {
            close();
        } catch (IOException ignored) {
            // the read already failed or finished, nothing left to release
        }
    }
}
