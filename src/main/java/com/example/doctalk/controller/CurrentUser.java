package com.example.doctalk.controller;

import com.example.doctalk.exception.UnauthenticatedException;

/**
 * The user id asserted by the upstream gateway.
 */
final class CurrentUser {

    static final String HEADER = "${app.identity.header:X-User-Id}";

    private CurrentUser() {
    }

    static String require(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            throw new UnauthenticatedException();
        }
        return headerValue.trim();
    }
}
