package com.freelancerpro.backend.services.pagination;

import java.util.List;
import java.util.function.Function;

import com.freelancerpro.backend.dto.PagedResult;
import com.freelancerpro.backend.dto.PaginationDTO;
import com.freelancerpro.backend.services.query.PageQuery;
import com.freelancerpro.backend.services.query.PageSlice;

public final class PaginationEngine {

    private PaginationEngine() {
    }

    public static PaginationDTO paginate(long total, int page, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        int pages = (int) ((total + limit - 1) / limit);
        return PaginationDTO.builder()
                .page(page)
                .limit(limit)
                .total(total)
                .pages(pages)
                .hasNext(page < pages)
                .hasPrev(page > 1)
                .build();
    }

    public static <T, R> PagedResult<R> toResult(PageSlice<T> slice, PageQuery query, Function<T, R> mapper) {
        List<R> records = slice.records().stream().map(mapper).toList();
        return new PagedResult<>(records, paginate(slice.total(), query.page(), query.limit()));
    }

    public static <R> PagedResult<R> toResult(List<R> records, long total, PageQuery query) {
        return new PagedResult<>(records, paginate(total, query.page(), query.limit()));
    }
}
