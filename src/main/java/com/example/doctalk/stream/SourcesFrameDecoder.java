package com.example.doctalk.stream;

import com.example.doctalk.model.Citation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.example.doctalk.stream.StreamMultiplexer.SOURCES_SENTINEL;

/**
 * Incremental decoder for the answer framing written by {@link StreamMultiplexer}.
 * <p>
 * Reads may split anywhere, inside a UTF-8 sequence or inside the sentinel. Text is released
 * as soon as it can no longer turn out to be the start of the sentinel; a trailing partial
 * match is held back until the next read decides it. Not thread-safe.
 */
public class SourcesFrameDecoder {

    private static final Logger log = LoggerFactory.getLogger(SourcesFrameDecoder.class);

    private static final TypeReference<List<Citation>> CITATIONS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final CharsetDecoder charsetDecoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);

    private byte[] carry = new byte[0];
    private final StringBuilder held = new StringBuilder();
    private final StringBuilder answer = new StringBuilder();
    private final StringBuilder payload = new StringBuilder();
    private boolean sentinelSeen;
    private boolean finished;
    private List<Citation> citations = List.of();

    public SourcesFrameDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return answer text released by this read, possibly empty
     */
    public String feed(byte[] bytes, int offset, int length) {
        if (finished) {
            throw new IllegalStateException("Decoder already finished");
        }
        return accept(decode(bytes, offset, length, false));
    }

    /**
     * Signal end of stream and parse the sources payload, if any.
     *
     * @return answer text released by the end of stream, possibly empty
     */
    public String finish() {
        if (finished) {
            return "";
        }
        String released = accept(decode(new byte[0], 0, 0, true));
        if (!sentinelSeen) {
            released += held;
            answer.append(held);
            held.setLength(0);
        } else {
            citations = parseCitations(payload.toString());
        }
        finished = true;
        return released;
    }

    public String answerText() {
        return answer.toString();
    }

    public List<Citation> citations() {
        return citations;
    }

    public boolean isSentinelSeen() {
        return sentinelSeen;
    }

    private String decode(byte[] bytes, int offset, int length, boolean endOfInput) {
        ByteBuffer in = ByteBuffer.allocate(carry.length + length);
        in.put(carry).put(bytes, offset, length).flip();

        CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
        charsetDecoder.decode(in, out, endOfInput);
        if (endOfInput) {
            charsetDecoder.flush(out);
        }

        carry = new byte[in.remaining()];
        in.get(carry);
        out.flip();
        return out.toString();
    }

    private String accept(String chars) {
        if (chars.isEmpty()) {
            return "";
        }
        if (sentinelSeen) {
            payload.append(chars);
            return "";
        }

        held.append(chars);
        int idx = held.indexOf(SOURCES_SENTINEL);
        if (idx >= 0) {
            String text = held.substring(0, idx);
            payload.append(held, idx + SOURCES_SENTINEL.length(), held.length());
            held.setLength(0);
            sentinelSeen = true;
            answer.append(text);
            return text;
        }

        int keep = partialSentinelLength(held);
        String ready = held.substring(0, held.length() - keep);
        held.delete(0, held.length() - keep);
        answer.append(ready);
        return ready;
    }

    /**
     * Length of the longest suffix of {@code buffer} that is a proper prefix of the sentinel.
     */
    static int partialSentinelLength(CharSequence buffer) {
        int max = Math.min(buffer.length(), SOURCES_SENTINEL.length() - 1);
        for (int n = max; n > 0; n--) {
            boolean match = true;
            int start = buffer.length() - n;
            for (int i = 0; i < n; i++) {
                if (buffer.charAt(start + i) != SOURCES_SENTINEL.charAt(i)) {
                    match = false;
                    break;
                }
            }
            if (match) {
                return n;
            }
        }
        return 0;
    }

    private List<Citation> parseCitations(String json) {
        if (json.isBlank()) {
            return List.of();
        }
        try {
            List<Citation> parsed = objectMapper.readValue(json, CITATIONS);
            return parsed == null ? List.of() : List.copyOf(parsed);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse sources payload, showing answer without citations: {}", e.getOriginalMessage());
            return List.of();
        }
    }
}
