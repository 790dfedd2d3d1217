package com.example.doctalk.model;

import jakarta.validation.constraints.NotBlank;

public record ModeUpdateRequest(
        @NotBlank(message = "mode is required") String mode
) {
}
