package com.freelancerpro.backend.controllers;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.freelancerpro.backend.dto.ApiResponse;
import com.freelancerpro.backend.dto.PagedResult;
import com.freelancerpro.backend.dto.savings.ProgressUpdateRequest;
import com.freelancerpro.backend.dto.savings.SavingsGoalCreateRequest;
import com.freelancerpro.backend.dto.savings.SavingsGoalResponseDTO;
import com.freelancerpro.backend.dto.savings.SavingsGoalUpdateRequest;
import com.freelancerpro.backend.dto.stats.SavingsStatsDTO;
import com.freelancerpro.backend.enums.ProgressAction;
import com.freelancerpro.backend.security.CurrentUserService;
import com.freelancerpro.backend.services.SavingsGoalService;
import com.freelancerpro.backend.services.query.PageQuery;
import com.freelancerpro.backend.services.query.RecordFilters;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;

@Validated
@RestController
@RequestMapping("/api/savings")
@RequiredArgsConstructor
public class SavingsGoalController {

    private final SavingsGoalService savingsGoalService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public ResponseEntity<ApiResponse<PagedResult<SavingsGoalResponseDTO>>> list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String priority,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(PageQuery.MAX_LIMIT) int limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        PagedResult<SavingsGoalResponseDTO> result = savingsGoalService.list(
                userId,
                new RecordFilters(null, category, status, priority),
                PageQuery.of(page, limit, sortBy, sortOrder));
        return ResponseEntity.ok(ApiResponse.success(result, "Savings goals retrieved successfully"));
    }

    @GetMapping("/active")
    public ResponseEntity<ApiResponse<List<SavingsGoalResponseDTO>>> active() {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(ApiResponse.success(
                savingsGoalService.listActive(userId), "Active savings goals retrieved successfully"));
    }

    @GetMapping("/completed")
    public ResponseEntity<ApiResponse<List<SavingsGoalResponseDTO>>> completed() {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(ApiResponse.success(
                savingsGoalService.listCompleted(userId), "Completed savings goals retrieved successfully"));
    }

    @GetMapping("/expiring-soon")
    public ResponseEntity<ApiResponse<List<SavingsGoalResponseDTO>>> expiringSoon(
            @RequestParam(defaultValue = "7")
            @Min(SavingsGoalService.MIN_EXPIRING_DAYS)
            @Max(SavingsGoalService.MAX_EXPIRING_DAYS) int days
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(ApiResponse.success(
                savingsGoalService.listExpiringSoon(userId, days),
                "Savings goals expiring in " + days + " days retrieved successfully"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<SavingsStatsDTO>> stats() {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(ApiResponse.success(
                savingsGoalService.stats(userId), "Savings goals statistics retrieved successfully"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<SavingsGoalResponseDTO>> findById(@PathVariable String id) {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(ApiResponse.success(
                savingsGoalService.get(userId, id), "Savings goal retrieved successfully"));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<SavingsGoalResponseDTO>> create(
            @Valid @RequestBody SavingsGoalCreateRequest request
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        SavingsGoalResponseDTO created = savingsGoalService.create(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Savings goal created successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<SavingsGoalResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody SavingsGoalUpdateRequest request
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(ApiResponse.success(
                savingsGoalService.update(userId, id, request), "Savings goal updated successfully"));
    }

    @PatchMapping("/{id}/progress")
    public ResponseEntity<ApiResponse<SavingsGoalResponseDTO>> updateProgress(
            @PathVariable String id,
            @Valid @RequestBody ProgressUpdateRequest request
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        SavingsGoalResponseDTO updated = savingsGoalService.updateProgress(userId, id, request);
        String verb = request.getAction() == ProgressAction.ADD ? "Added" : "Subtracted";
        return ResponseEntity.ok(ApiResponse.success(
                updated, "Savings goal progress updated successfully. " + verb + " " + request.getAmount()));
    }

    @PatchMapping("/{id}/complete")
    public ResponseEntity<ApiResponse<SavingsGoalResponseDTO>> complete(@PathVariable String id) {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(ApiResponse.success(
                savingsGoalService.markCompleted(userId, id), "Savings goal marked as completed"));
    }

    @PatchMapping("/{id}/reactivate")
    public ResponseEntity<ApiResponse<SavingsGoalResponseDTO>> reactivate(@PathVariable String id) {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(ApiResponse.success(
                savingsGoalService.reactivate(userId, id), "Savings goal reactivated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        UUID userId = currentUserService.requireCurrentUserId();
        savingsGoalService.delete(userId, id);
        return ResponseEntity.ok(ApiResponse.success(null, "Savings goal deleted successfully"));
    }
}
