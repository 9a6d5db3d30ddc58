package com.scanforge.application.transform.exception;

public class InvalidTransformRequestException extends RuntimeException {
    public InvalidTransformRequestException(String message) {
        super(message);
    }
}
