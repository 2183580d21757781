package com.freelancerpro.backend.exceptions;

import java.math.BigDecimal;

import lombok.Getter;

/**
 * Raised when a caller asks to take more out of a savings goal than it currently holds.
 */
@Getter
public class InsufficientProgressException extends BadRequestException {

    private final BigDecimal currentAmount;
    private final BigDecimal requestedAmount;

    public InsufficientProgressException(BigDecimal currentAmount, BigDecimal requestedAmount) {
        super("Cannot subtract more than current amount");
        this.currentAmount = currentAmount;
        this.requestedAmount = requestedAmount;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INSUFFICIENT_PROGRESS;
    }
}
