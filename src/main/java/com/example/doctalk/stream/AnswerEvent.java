package com.example.doctalk.stream;

import com.example.doctalk.model.Citation;

import java.util.List;

/**
 * What a client pulls from a {@link StreamDemultiplexer}.
 */
public interface AnswerEvent {

    /**
     * Answer text that is final and can be rendered.
     */
    record TextDelta(String text) implements AnswerEvent {
    }

    /**
     * Last event of a stream that was read to the end.
     *
     * @param answer    full answer text, framing removed
     * @param citations parsed sources, empty when absent or malformed
     */
    record Completed(String answer, List<Citation> citations) implements AnswerEvent {
    }
}
