package com.example.doctalk.client;

import com.example.doctalk.model.ChatMessage;
import com.example.doctalk.model.Citation;
import com.example.doctalk.stream.AnswerEvent;
import com.example.doctalk.stream.StreamDemultiplexer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChatTranscriptTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void consume_completeAnswer_recordsTextAndCitations() {
        ChatTranscript transcript = new ChatTranscript();
        transcript.addUserMessage("What is in the lease?");
        List<AnswerEvent> events = List.of(
                new AnswerEvent.TextDelta("Five-year "),
                new AnswerEvent.TextDelta("term [lease.pdf]."),
                new AnswerEvent.Completed("Five-year term [lease.pdf].",
                        List.of(new Citation("lease.pdf", "88.0", "The term is five years"))));

        boolean ok = transcript.consume(events.iterator());

        assertThat(ok).isTrue();
        assertThat(transcript.messages()).containsExactly(
                ChatMessage.user("What is in the lease?"),
                ChatMessage.assistant("Five-year term [lease.pdf]."));
        assertThat(transcript.lastCitations()).hasSize(1);
        assertThat(transcript.errorMessage()).isNull();
    }

    @Test
    void consume_connectionDropsMidAnswer_removesPlaceholder() {
        ChatTranscript transcript = new ChatTranscript();
        transcript.addUserMessage("Summarize everything");
        InputStream dropping = new SequenceInputStream(
                new ByteArrayInputStream("Partial answ".getBytes(StandardCharsets.UTF_8)),
                new InputStream() {
                    @Override
                    public int read() throws IOException {
                        throw new IOException("connection reset");
                    }
                });

        boolean ok = transcript.consume(new StreamDemultiplexer(dropping, objectMapper));

        assertThat(ok).isFalse();
        assertThat(transcript.messages()).containsExactly(ChatMessage.user("Summarize everything"));
        assertThat(transcript.errorMessage()).isEqualTo("Connection lost while receiving the answer.");
    }

    @Test
    void consume_emptyAnswer_removesPlaceholder() {
        ChatTranscript transcript = new ChatTranscript();
        transcript.addUserMessage("hello");

        boolean ok = transcript.consume(new StreamDemultiplexer(new ByteArrayInputStream(new byte[0]), objectMapper));

        assertThat(ok).isFalse();
        assertThat(transcript.messages()).hasSize(1);
        assertThat(transcript.errorMessage()).isEqualTo("No response received.");
    }
}
