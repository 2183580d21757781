package com.freelancerpro.backend.exceptions;

/**
 * Machine readable failure kinds carried in the {@code code} field of error responses.
 */
public enum ErrorKind {
    INVALID_INPUT,
    NOT_FOUND,
    CONFLICT,
    UNAUTHORIZED,
    INSUFFICIENT_PROGRESS,
    INTERNAL_ERROR
}
