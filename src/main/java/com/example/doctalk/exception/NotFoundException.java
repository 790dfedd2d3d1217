package com.example.doctalk.exception;

public class NotFoundException extends DocTalkException {

    public NotFoundException(String message) {
        super(message);
    }
}
