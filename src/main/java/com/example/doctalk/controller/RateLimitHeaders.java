package com.example.doctalk.controller;

import com.example.doctalk.model.RateDecision;
import org.springframework.http.HttpHeaders;

final class RateLimitHeaders {

    static final String LIMIT = "X-RateLimit-Limit";
    static final String REMAINING = "X-RateLimit-Remaining";

    private RateLimitHeaders() {
    }

    static HttpHeaders of(RateDecision decision) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(LIMIT, String.valueOf(decision.limit()));
        headers.set(REMAINING, String.valueOf(decision.remaining()));
        return headers;
    }
}
