package com.freelancerpro.backend.controllers;

import java.util.UUID;

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
import com.freelancerpro.backend.dto.project.ProjectCreateRequest;
import com.freelancerpro.backend.dto.project.ProjectResponseDTO;
import com.freelancerpro.backend.dto.project.ProjectStatsDTO;
import com.freelancerpro.backend.dto.project.ProjectUpdateRequest;
import com.freelancerpro.backend.security.CurrentUserService;
import com.freelancerpro.backend.services.ProjectService;
import com.freelancerpro.backend.services.query.PageQuery;
import com.freelancerpro.backend.services.query.RecordFilters;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;

@Validated
@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectService projectService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public ResponseEntity<ApiResponse<PagedResult<ProjectResponseDTO>>> list(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(PageQuery.MAX_LIMIT) int limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        PagedResult<ProjectResponseDTO> result = projectService.list(
                userId, RecordFilters.byStatus(status), PageQuery.of(page, limit, sortBy, sortOrder));
        return ResponseEntity.ok(ApiResponse.success(result, "Projects retrieved successfully"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<ProjectStatsDTO>> stats() {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(
                ApiResponse.success(projectService.stats(userId), "Project statistics retrieved successfully"));
    }

    @GetMapping("/status/{status}")
    public ResponseEntity<ApiResponse<PagedResult<ProjectResponseDTO>>> listByStatus(
            @PathVariable String status,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(PageQuery.MAX_LIMIT) int limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        PagedResult<ProjectResponseDTO> result = projectService.listByStatus(
                userId, status, PageQuery.of(page, limit, sortBy, sortOrder));
        return ResponseEntity.ok(ApiResponse.success(result, "Projects with status " + status + " retrieved successfully"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ProjectResponseDTO>> findById(@PathVariable String id) {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(ApiResponse.success(projectService.get(userId, id), "Project retrieved successfully"));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ProjectResponseDTO>> create(@Valid @RequestBody ProjectCreateRequest request) {
        UUID userId = currentUserService.requireCurrentUserId();
        ProjectResponseDTO created = projectService.create(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Project created successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ProjectResponseDTO>> update(
            @PathVariable String id,
            @Valid @RequestBody ProjectUpdateRequest request
    ) {
        UUID userId = currentUserService.requireCurrentUserId();
        return ResponseEntity.ok(
                ApiResponse.success(projectService.update(userId, id, request), "Project updated successfully"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        UUID userId = currentUserService.requireCurrentUserId();
        projectService.delete(userId, id);
        return ResponseEntity.ok(ApiResponse.success(null, "Project deleted successfully"));
    }
}
