package com.example.doctalk.controller;

import com.example.doctalk.model.RateDecision;
import com.example.doctalk.model.RateOperation;
import com.example.doctalk.service.RateGate;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Called by the ingestion front end before it accepts a file; counts one upload against the user's budget.
 */
@Tag(name = "uploads")
@RestController
@RequestMapping("/api/uploads")
@RequiredArgsConstructor
public class UploadAdmissionController {

    private final RateGate rateGate;

    @PostMapping("/admission")
    public ResponseEntity<Map<String, Object>> admit(
            @RequestHeader(value = CurrentUser.HEADER, required = false) String userHeader) {
        String userId = CurrentUser.require(userHeader);
        RateDecision decision = rateGate.require(userId, RateOperation.UPLOAD);
        return ResponseEntity.ok()
                .headers(RateLimitHeaders.of(decision))
                .body(Map.of(
                        "allowed", true,
                        "remaining", decision.remaining(),
                        "limit", decision.limit(),
                        "resetAt", decision.resetAt().toString()));
    }
}
