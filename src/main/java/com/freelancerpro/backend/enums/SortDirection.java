package com.freelancerpro.backend.enums;

public enum SortDirection {
    ASC,
    DESC;

    // anything other than "asc" sorts descending
    public static SortDirection fromParam(String raw) {
        return raw != null && raw.trim().equalsIgnoreCase("asc") ? ASC : DESC;
    }
}
