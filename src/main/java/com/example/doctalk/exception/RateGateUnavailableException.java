package com.example.doctalk.exception;

/**
 * The rate-limit counter store could not be reached. Requests are rejected rather than
 * admitted uncounted.
 */
public class RateGateUnavailableException extends DocTalkException {

    public RateGateUnavailableException(Throwable cause) {
        super("Service temporarily unavailable. Please try again shortly.", cause);
    }
}
