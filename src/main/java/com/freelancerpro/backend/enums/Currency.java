package com.freelancerpro.backend.enums;

public enum Currency {
    USD,
    EUR,
    GBP,
    CAD,
    AUD,
    JPY,
    INR
}
