package com.example.doctalk.model;

import java.time.Instant;

public record DocumentRef(
        String filename,
        Instant uploadedAt
) {
}
