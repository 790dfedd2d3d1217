package com.example.doctalk.exception;

/**
 * Client side: the answer stream could not be read to the end.
 */
public class AnswerStreamException extends DocTalkException {

    public AnswerStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
