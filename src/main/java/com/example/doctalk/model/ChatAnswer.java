package com.example.doctalk.model;

import reactor.core.publisher.Flux;

/**
 * An admitted chat request: the quota after admission and the framed answer body.
 * Nothing upstream runs until {@code body} is subscribed.
 */
public record ChatAnswer(
        RateDecision quota,
        Flux<String> body
) {
}
