package com.freelancerpro.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.freelancerpro.backend.dto.PagedResult;
import com.freelancerpro.backend.dto.project.ProjectCreateRequest;
import com.freelancerpro.backend.dto.project.ProjectRefDTO;
import com.freelancerpro.backend.dto.project.ProjectResponseDTO;
import com.freelancerpro.backend.dto.project.ProjectStatsDTO;
import com.freelancerpro.backend.dto.project.ProjectUpdateRequest;
import com.freelancerpro.backend.entities.Project;
import com.freelancerpro.backend.enums.ProjectStatus;
import com.freelancerpro.backend.exceptions.BadRequestException;
import com.freelancerpro.backend.exceptions.ResourceNotFoundException;
import com.freelancerpro.backend.services.pagination.PaginationEngine;
import com.freelancerpro.backend.services.query.PageQuery;
import com.freelancerpro.backend.services.query.PageSlice;
import com.freelancerpro.backend.services.query.RecordFilters;
import com.freelancerpro.backend.services.query.RecordQueries;
import com.freelancerpro.backend.services.query.ScopedQuery;
import com.freelancerpro.backend.services.query.ScopedRecordStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectService {

    private static final int MONEY_SCALE = 2;
    private static final BigDecimal DEFAULT_BUDGET_ALLOCATION = new BigDecimal("10");

    private final ScopedRecordStore<Project> projectStore;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PagedResult<ProjectResponseDTO> list(UUID userId, RecordFilters filters, PageQuery pageQuery) {
        ScopedQuery<Project> query = RecordQueries.projects().build(userId, filters);
        PageSlice<Project> slice = projectStore.page(query, pageQuery);
        log.info("Retrieved {} projects for user {}", slice.records().size(), userId);
        return PaginationEngine.toResult(slice, pageQuery, this::toDTO);
    }

    @Transactional(readOnly = true)
    public PagedResult<ProjectResponseDTO> listByStatus(UUID userId, String status, PageQuery pageQuery) {
        ProjectStatus parsed = ProjectStatus.find(status)
                .orElseThrow(() -> new BadRequestException("Invalid status. Must be one of: " + allowedStatuses()));
        return list(userId, RecordFilters.byStatus(parsed.getValue()), pageQuery);
    }

    @Transactional(readOnly = true)
    public ProjectResponseDTO get(UUID userId, String id) {
        return toDTO(projectStore.requireOwned(userId, id));
    }

    @Transactional
    @CacheEvict(cacheNames = "stats", allEntries = true)
    public ProjectResponseDTO create(UUID userId, ProjectCreateRequest request) {
        Project project = new Project();
        project.setUserId(userId);
        project.setName(request.getName().trim());
        project.setClientName(request.getClientName().trim());
        project.setExpectedPayment(request.getExpectedPayment());
        project.setStatus(request.getStatus() != null ? request.getStatus() : ProjectStatus.ACTIVE);
        project.setBudgetAllocation(request.getBudgetAllocation() != null
                ? request.getBudgetAllocation()
                : DEFAULT_BUDGET_ALLOCATION);
        project.setDescription(trimToNull(request.getDescription()));
        project.setCreatedDate(LocalDateTime.now(clock));

        Project saved = projectStore.save(project);
        log.info("Created project {} for user {}", saved.getId(), userId);
        return toDTO(saved);
    }

    @Transactional
    @CacheEvict(cacheNames = "stats", allEntries = true)
    public ProjectResponseDTO update(UUID userId, String id, ProjectUpdateRequest request) {
        Project project = projectStore.requireOwned(userId, id);

        if (request.getName() != null) {
            project.setName(requireText(request.getName(), "Project name"));
        }
        if (request.getClientName() != null) {
            project.setClientName(requireText(request.getClientName(), "Client name"));
        }
        if (request.getExpectedPayment() != null) {
            project.setExpectedPayment(request.getExpectedPayment());
        }
        if (request.getStatus() != null) {
            project.setStatus(request.getStatus());
        }
        if (request.getBudgetAllocation() != null) {
            project.setBudgetAllocation(request.getBudgetAllocation());
        }
        if (request.getDescription() != null) {
            project.setDescription(trimToNull(request.getDescription()));
        }

        Project saved = projectStore.save(project);
        log.info("Updated project {} for user {}", saved.getId(), userId);
        return toDTO(saved);
    }

    @Transactional
    @CacheEvict(cacheNames = "stats", allEntries = true)
    public void delete(UUID userId, String id) {
        Project project = projectStore.requireOwned(userId, id);
        projectStore.softDelete(project);
        log.info("Deleted project {} for user {}", project.getId(), userId);
    }

    @Transactional(readOnly = true)
    @Cacheable(cacheNames = "stats", key = "'projects:' + #userId")
    public ProjectStatsDTO stats(UUID userId) {
        List<Project> projects = projectStore.findAll(RecordQueries.projects().build(userId));

        Map<ProjectStatus, Long> byStatus = projects.stream()
                .collect(Collectors.groupingBy(Project::getStatus, Collectors.counting()));
        BigDecimal total = projects.stream()
                .map(Project::getExpectedPayment)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal average = projects.isEmpty()
                ? BigDecimal.ZERO.setScale(MONEY_SCALE)
                : total.divide(BigDecimal.valueOf(projects.size()), MONEY_SCALE, RoundingMode.HALF_UP);

        return ProjectStatsDTO.builder()
                .totalProjects(projects.size())
                .activeProjects(byStatus.getOrDefault(ProjectStatus.ACTIVE, 0L))
                .completedProjects(byStatus.getOrDefault(ProjectStatus.COMPLETED, 0L))
                .onHoldProjects(byStatus.getOrDefault(ProjectStatus.ON_HOLD, 0L))
                .totalExpectedPayment(total)
                .averageExpectedPayment(average)
                .build();
    }

    /**
     * Loads the caller's project an entry is about to reference.
     *
     * @throws ResourceNotFoundException when the project does not exist, is deleted or
     *                                   belongs to another user
     */
    public Project requireOwnedProject(UUID userId, UUID projectId) {
        return projectStore.requireOwned(userId, projectId);
    }

    /**
     * Name and client for each id the caller still owns, fetched in one query. Ids
     * of missing, deleted or foreign projects are simply absent from the result.
     */
    public Map<UUID, ProjectRefDTO> resolveProjectRefs(UUID userId, Collection<UUID> projectIds) {
        if (projectIds.isEmpty()) {
            return Map.of();
        }
        ScopedQuery<Project> query = RecordQueries.projects().withIds(userId, new HashSet<>(projectIds));
        return projectStore.findAll(query).stream()
                .collect(Collectors.toMap(Project::getId, this::toRef, (a, b) -> a));
    }

    public ProjectRefDTO toRef(Project project) {
        return ProjectRefDTO.builder()
                .name(project.getName())
                .clientName(project.getClientName())
                .build();
    }

    private ProjectResponseDTO toDTO(Project project) {
        return ProjectResponseDTO.builder()
                .id(project.getId().toString())
                .name(project.getName())
                .clientName(project.getClientName())
                .expectedPayment(project.getExpectedPayment())
                .status(project.getStatus())
                .budgetAllocation(project.getBudgetAllocation())
                .description(project.getDescription())
                .createdDate(project.getCreatedDate())
                .createdAt(project.getCreatedAt())
                .updatedAt(project.getUpdatedAt())
                .build();
    }

    private static String allowedStatuses() {
        return Arrays.stream(ProjectStatus.values())
                .map(ProjectStatus::getValue)
                .collect(Collectors.joining(", "));
    }

    static String requireText(String value, String field) {
        if (value.isBlank()) {
            throw new BadRequestException(field + " cannot be empty");
        }
        return value.trim();
    }

    static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
