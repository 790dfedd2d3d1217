package com.example.doctalk.exception;

public class UnauthenticatedException extends DocTalkException {

    public UnauthenticatedException() {
        super("Unauthorized");
    }
}
