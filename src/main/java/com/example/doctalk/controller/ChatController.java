package com.example.doctalk.controller;

import com.example.doctalk.config.ChatProperties;
import com.example.doctalk.model.ChatAnswer;
import com.example.doctalk.model.ChatRequest;
import com.example.doctalk.service.ChatPipelineService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import reactor.core.Disposable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Tag(name = "chat")
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChatController {

    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final ChatPipelineService chatPipelineService;
    private final ChatProperties chatProperties;

    /**
     * Streams the answer as chunked plain text, followed by the sources block when there are citations.
     * Admission and validation errors are raised before the response starts and come back as JSON.
     */
    @PostMapping("/chat")
    public ResponseEntity<ResponseBodyEmitter> chat(
            @RequestHeader(value = CurrentUser.HEADER, required = false) String userHeader,
            @Valid @RequestBody ChatRequest request) {
        String userId = CurrentUser.require(userHeader);
        ChatAnswer answer = chatPipelineService.answer(userId, request.messages());

        ResponseBodyEmitter emitter = new ResponseBodyEmitter(chatProperties.getResponseTimeout().toMillis());

        Disposable subscription = answer.body().subscribe(
                chunk -> {
                    try {
                        emitter.send(chunk, TEXT_PLAIN_UTF8);
                    } catch (IOException e) {
                        // client went away; completing with the error disposes the upstream call
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return ResponseEntity.ok()
                .headers(RateLimitHeaders.of(answer.quota()))
                .contentType(TEXT_PLAIN_UTF8)
                .body(emitter);
    }
}
