package com.freelancerpro.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaginationDTO {
    private int page;
    private int limit;
    private long total;
    private int pages;
    private boolean hasNext;
    private boolean hasPrev;
}
