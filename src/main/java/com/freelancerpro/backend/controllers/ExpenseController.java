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
import com.freelancerpro.backend.dto.entry.ExpenseCreateRequest;
import com.freelancerpro.backend.dto.entry.ExpenseResponseDTO;
import com.freelancerpro.backend.dto.entry.ExpenseUpdateRequest;
import com.freelancerpro.backend.dto.stats.EntryStatsDTO;
import com.freelancerpro.backend.dto.stats.ProjectBreakdownDTO;
import com.freelancerpro.backend.security.CurrentUserService;
import com.freelancerpro.backend.services.ExpenseService;
import com.freelancerpro.backend.services.query.DateRange;
import com.freelancerpro.backend.services.query.PageQuery;
import com.freelancerpro.backend.services.query.RecordFilters;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;

@Validated
@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
public class ExpenseController {

    private final ExpenseService expenseService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public ResponseEntity<ApiResponse<PagedResult<ExpenseResponseDTO>>> list(
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
        PagedResult<ExpenseResponseDTO> result = expenseService.list(
                userId,
                RecordFilters.forEntries(projectId, category),
                new DateRange(startDate, endDate),
                PageQuery.of(page, limit, sortBy, sortOrder));
        return ResponseEntity.ok(ApiResponse.success(result, "Expense entries retrieved successfully"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<EntryStatsDTO>> stats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        EntryStatsDTO stats = expenseService.stats(userId, new DateRange(startDate, endDate));
        return ResponseEntity.ok(ApiResponse.success(stats, "Expense statistics retrieved successfully"));
    }

    @GetMapping("/by-project")
    public ResponseEntity<ApiResponse<List<ProjectBreakdownDTO>>> byProject(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        List<ProjectBreakdownDTO> rows = expenseService.byProject(userId, new DateRange(startDate, endDate));
        return ResponseEntity.ok(ApiResponse.success(rows, "Expenses by project retrieved successfully"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ExpenseResponseDTO>> findById(@PathVariable String id) {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(ApiResponse.success(expenseService.get(userId, id), "Expense entry retrieved successfully"));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ExpenseResponseDTO>> create(@Valid @RequestBody ExpenseCreateRequest request) {
        UUID userId = currentUserService.requireCurrentUserId();
        ExpenseResponseDTO created = expenseService.create(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Expense entry created successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ExpenseResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody ExpenseUpdateRequest request
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(
                ApiResponse.success(expenseService.update(userId, id, request), "Expense entry updated successfully"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        UUID userId = currentUserService.requireCurrentUserId();
        expenseService.delete(userId, id);
        return ResponseEntity.ok(ApiResponse.success(null, "Expense entry deleted successfully"));
    }
}
