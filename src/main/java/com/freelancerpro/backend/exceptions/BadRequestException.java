package com.freelancerpro.backend.exceptions;

public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }

    public ErrorKind getKind() {
        return ErrorKind.INVALID_INPUT;
    }
}
