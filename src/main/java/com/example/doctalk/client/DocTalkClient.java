package com.example.doctalk.client;

import com.example.doctalk.model.ChatMessage;
import com.example.doctalk.model.ChatRequest;
import com.example.doctalk.stream.StreamDemultiplexer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Client for the chat endpoint. The answer is returned as a pull-based event stream; callers must
 * drain or close it.
 */
public class DocTalkClient {

    private static final Logger log = LoggerFactory.getLogger(DocTalkClient.class);

    static final String DEFAULT_USER_HEADER = "X-User-Id";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String userHeader;
    private final String userId;

    public DocTalkClient(RestClient restClient, ObjectMapper objectMapper, String userId) {
        this(restClient, objectMapper, DEFAULT_USER_HEADER, userId);
    }

    /**
     * @param userHeader header carrying the user id; must match the server's {@code app.identity.header}
     */
    public DocTalkClient(RestClient restClient, ObjectMapper objectMapper, String userHeader, String userId) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.userHeader = userHeader;
        this.userId = userId;
    }

    public static DocTalkClient create(String baseUrl, String userId) {
        return new DocTalkClient(RestClient.create(baseUrl), new ObjectMapper(), userId);
    }

    /**
     * @throws ChatRequestRejectedException when the server answers with an error status
     */
    public StreamDemultiplexer chat(List<ChatMessage> messages) {
        return restClient.post()
                .uri("/api/chat")
                .header(userHeader, userId)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_PLAIN, MediaType.APPLICATION_JSON)
                .body(new ChatRequest(messages))
                .exchange((request, response) -> {
                    if (response.getStatusCode().isError()) {
                        try (response) {
                            throw new ChatRequestRejectedException(
                                    response.getStatusCode().value(), errorMessage(response));
                        }
                    }
                    return new StreamDemultiplexer(new ResponseClosingStream(response), objectMapper);
                }, false);
    }

    private String errorMessage(ClientHttpResponse response) throws IOException {
        try {
            JsonNode body = objectMapper.readTree(response.getBody());
            if (body != null && body.hasNonNull("error")) {
                return body.get("error").asText();
            }
        } catch (IOException e) {
            log.warn("Unreadable error body from chat endpoint: {}", e.getMessage());
        }
        return "Request failed with status " + response.getStatusCode().value();
    }

    /**
     * Releases the HTTP response along with its body.
     */
    private static final class ResponseClosingStream extends FilterInputStream {

        private final ClientHttpResponse response;

        ResponseClosingStream(ClientHttpResponse response) throws IOException {
            super(response.getBody());
            this.response = response;
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } finally {
                response.close();
            }
        }
    }
}
