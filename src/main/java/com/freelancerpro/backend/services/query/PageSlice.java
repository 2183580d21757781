package com.freelancerpro.backend.services.query;

import java.util.List;

public record PageSlice<T>(List<T> records, long total) {
}
