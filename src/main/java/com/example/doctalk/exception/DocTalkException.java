package com.example.doctalk.exception;

/**
 * Root of the service's unchecked exceptions. Messages are safe to show to end users.
 */
public class DocTalkException extends RuntimeException {

    public DocTalkException(String message) {
        super(message);
    }

    public DocTalkException(String message, Throwable cause) {
        super(message, cause);
    }
}
