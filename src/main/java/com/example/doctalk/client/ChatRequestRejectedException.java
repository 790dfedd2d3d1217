package com.example.doctalk.client;

import com.example.doctalk.exception.DocTalkException;

/**
 * The server refused a chat request before streaming started (401, 429, 400, 503 ...).
 */
public class ChatRequestRejectedException extends DocTalkException {

    private final int status;

    public ChatRequestRejectedException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    public boolean isRateLimited() {
        return status == 429;
    }
}
