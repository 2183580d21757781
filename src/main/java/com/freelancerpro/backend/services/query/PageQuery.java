package com.freelancerpro.backend.services.query;

import com.freelancerpro.backend.enums.SortDirection;
import com.freelancerpro.backend.exceptions.BadRequestException;

/**
 * 1-based page request with an optional sort override.
 */
public record PageQuery(int page, int limit, String sortBy, SortDirection direction) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public PageQuery {
        if (page < 1) {
            throw new BadRequestException("page must be at least 1");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new BadRequestException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (direction == null) {
            direction = SortDirection.DESC;
        }
    }

    public static PageQuery of(Integer page, Integer limit, String sortBy, String sortOrder) {
        return new PageQuery(
                page == null ? DEFAULT_PAGE : page,
                limit == null ? DEFAULT_LIMIT : limit,
                sortBy,
                SortDirection.fromParam(sortOrder)
        );
    }

    public static PageQuery firstPage() {
        return new PageQuery(DEFAULT_PAGE, DEFAULT_LIMIT, null, SortDirection.DESC);
    }

    public long skip() {
        return (long) (page - 1) * limit;
    }

    public boolean hasSortOverride() {
        return sortBy != null && !sortBy.isBlank();
    }
}
