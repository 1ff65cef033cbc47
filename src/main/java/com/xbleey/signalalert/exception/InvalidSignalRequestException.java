package com.xbleey.signalalert.exception;

public class InvalidSignalRequestException extends RuntimeException {

    public InvalidSignalRequestException(String message) {
        super(message);
    }
}
