package com.example.doctalk.exception;

/**
 * Answer generation failed or exceeded its deadline mid-stream.
 */
public class GenerationException extends DocTalkException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
