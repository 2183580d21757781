package com.freelancerpro.backend.controllers;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.freelancerpro.backend.dto.ApiResponse;
import com.freelancerpro.backend.dto.PagedResult;
import com.freelancerpro.backend.dto.entry.IncomeCreateRequest;
import com.freelancerpro.backend.dto.entry.IncomeResponseDTO;
import com.freelancerpro.backend.dto.entry.IncomeUpdateRequest;
import com.freelancerpro.backend.dto.stats.EntryStatsDTO;
import com.freelancerpro.backend.dto.stats.ProjectBreakdownDTO;
import com.freelancerpro.backend.security.CurrentUserService;
import com.freelancerpro.backend.services.IncomeService;
import com.freelancerpro.backend.services.query.DateRange;
import com.freelancerpro.backend.services.query.PageQuery;
import com.freelancerpro.backend.services.query.RecordFilters;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;

@Validated
@RestController
@RequestMapping("/api/income")
@RequiredArgsConstructor
public class IncomeController {

    private final IncomeService incomeService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public ResponseEntity<ApiResponse<PagedResult<IncomeResponseDTO>>> list(
            @RequestParam(required = false) String projectId,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(PageQuery.MAX_LIMIT) int limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        PagedResult<IncomeResponseDTO> result = incomeService.list(
                userId,
                RecordFilters.forEntries(projectId, category),
                new DateRange(startDate, endDate),
                PageQuery.of(page, limit, sortBy, sortOrder));
        return ResponseEntity.ok(ApiResponse.success(result, "Income entries retrieved successfully"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<EntryStatsDTO>> stats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        EntryStatsDTO stats = incomeService.stats(userId, new DateRange(startDate, endDate));
        return ResponseEntity.ok(ApiResponse.success(stats, "Income statistics retrieved successfully"));
    }

    @GetMapping("/by-project")
    public ResponseEntity<ApiResponse<List<ProjectBreakdownDTO>>> byProject(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        List<ProjectBreakdownDTO> rows = incomeService.byProject(userId, new DateRange(startDate, endDate));
        return ResponseEntity.ok(ApiResponse.success(rows, "Income by project retrieved successfully"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<IncomeResponseDTO>> findById(@PathVariable String id) {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(ApiResponse.success(incomeService.get(userId, id), "Income entry retrieved successfully"));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<IncomeResponseDTO>> create(@Valid @RequestBody IncomeCreateRequest request) {
        UUID userId = currentUserService.requireCurrentUserId();
        IncomeResponseDTO created = incomeService.create(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Income entry created successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<IncomeResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody IncomeUpdateRequest request
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(
                ApiResponse.success(incomeService.update(userId, id, request), "Income entry updated successfully"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        UUID userId = currentUserService.requireCurrentUserId();
        incomeService.delete(userId, id);
        return ResponseEntity.ok(ApiResponse.success(null, "Income entry deleted successfully"));
    }
}
