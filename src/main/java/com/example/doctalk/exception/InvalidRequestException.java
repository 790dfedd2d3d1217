package com.example.doctalk.exception;

public class InvalidRequestException extends DocTalkException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
