package com.freelancerpro.backend.services;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.freelancerpro.backend.dto.PagedResult;
import com.freelancerpro.backend.dto.entry.IncomeCreateRequest;
import com.freelancerpro.backend.dto.entry.IncomeResponseDTO;
import com.freelancerpro.backend.dto.entry.IncomeUpdateRequest;
import com.freelancerpro.backend.dto.project.ProjectRefDTO;
import com.freelancerpro.backend.dto.stats.EntryStatsDTO;
import com.freelancerpro.backend.dto.stats.ProjectBreakdownDTO;
import com.freelancerpro.backend.entities.IncomeEntry;
import com.freelancerpro.backend.enums.IncomeCategory;
import com.freelancerpro.backend.services.aggregation.AggregationEngine;
import com.freelancerpro.backend.services.aggregation.EntryFact;
import com.freelancerpro.backend.services.pagination.PaginationEngine;
import com.freelancerpro.backend.services.query.DateRange;
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
public class IncomeService {

    private final ScopedRecordStore<IncomeEntry> incomeStore;
    private final ProjectService projectService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PagedResult<IncomeResponseDTO> list(UUID userId, RecordFilters filters, DateRange range, PageQuery pageQuery) {
        ScopedQuery<IncomeEntry> query = RecordQueries.incomeEntries().build(userId, filters, range);
        PageSlice<IncomeEntry> slice = incomeStore.page(query, pageQuery);

        Map<UUID, ProjectRefDTO> projects = projectService.resolveProjectRefs(userId, projectIds(slice.records()));
        log.info("Retrieved {} income entries for user {}", slice.records().size(), userId);
        return PaginationEngine.toResult(slice, pageQuery, entry -> toDTO(entry, projects.get(entry.getProjectId())));
    }

    @Transactional(readOnly = true)
    public IncomeResponseDTO get(UUID userId, String id) {
        IncomeEntry entry = incomeStore.requireOwned(userId, id);
        return toDTO(entry, projectService.resolveProjectRefs(userId, Set.of(entry.getProjectId()))
                .get(entry.getProjectId()));
    }

    @Transactional
    @CacheEvict(cacheNames = "stats", allEntries = true)
    public IncomeResponseDTO create(UUID userId, IncomeCreateRequest request) {
        ProjectRefDTO project = projectService.toRef(projectService.requireOwnedProject(userId, request.getProjectId()));

        IncomeEntry entry = new IncomeEntry();
        entry.setUserId(userId);
        entry.setProjectId(request.getProjectId());
        entry.setAmount(request.getAmount());
        entry.setDescription(request.getDescription().trim());
        entry.setDate(request.getDate() != null ? request.getDate() : LocalDateTime.now(clock));
        entry.setCategory(request.getCategory() != null ? request.getCategory() : IncomeCategory.PROJECT_PAYMENT);

        IncomeEntry saved = incomeStore.save(entry);
        log.info("Created income entry {} for user {}", saved.getId(), userId);
        return toDTO(saved, project);
    }

    @Transactional
    @CacheEvict(cacheNames = "stats", allEntries = true)
    public IncomeResponseDTO update(UUID userId, String id, IncomeUpdateRequest request) {
        IncomeEntry entry = incomeStore.requireOwned(userId, id);

        if (request.getProjectId() != null) {
            projectService.requireOwnedProject(userId, request.getProjectId());
            entry.setProjectId(request.getProjectId());
        }
        if (request.getAmount() != null) {
            entry.setAmount(request.getAmount());
        }
        if (request.getDescription() != null) {
            entry.setDescription(ProjectService.requireText(request.getDescription(), "Description"));
        }
        if (request.getDate() != null) {
            entry.setDate(request.getDate());
        }
        if (request.getCategory() != null) {
            entry.setCategory(request.getCategory());
        }

        IncomeEntry saved = incomeStore.save(entry);
        log.info("Updated income entry {} for user {}", saved.getId(), userId);
        return toDTO(saved, projectService.resolveProjectRefs(userId, Set.of(saved.getProjectId()))
                .get(saved.getProjectId()));
    }

    @Transactional
    @CacheEvict(cacheNames = "stats", allEntries = true)
    public void delete(UUID userId, String id) {
        IncomeEntry entry = incomeStore.requireOwned(userId, id);
        incomeStore.softDelete(entry);
        log.info("Deleted income entry {} for user {}", entry.getId(), userId);
    }

    @Transactional(readOnly = true)
    @Cacheable(cacheNames = "stats", key = "'income:' + #userId + ':' + #range")
    public EntryStatsDTO stats(UUID userId, DateRange range) {
        return AggregationEngine.stats(facts(userId, range));
    }

    @Transactional(readOnly = true)
    @Cacheable(cacheNames = "stats", key = "'income-by-project:' + #userId + ':' + #range")
    public List<ProjectBreakdownDTO> byProject(UUID userId, DateRange range) {
        List<EntryFact> facts = facts(userId, range);
        Set<UUID> ids = facts.stream().map(EntryFact::projectId).collect(Collectors.toSet());
        return AggregationEngine.byProject(facts, projectService.resolveProjectRefs(userId, ids));
    }

    @Transactional(readOnly = true)
    public List<EntryFact> facts(UUID userId, DateRange range) {
        ScopedQuery<IncomeEntry> query = RecordQueries.incomeEntries().build(userId, RecordFilters.none(), range);
        return incomeStore.findAll(query).stream().map(EntryFact::of).toList();
    }

    private static Set<UUID> projectIds(List<IncomeEntry> entries) {
        return entries.stream().map(IncomeEntry::getProjectId).collect(Collectors.toSet());
    }

    private IncomeResponseDTO toDTO(IncomeEntry entry, ProjectRefDTO project) {
        return IncomeResponseDTO.builder()
                .id(entry.getId().toString())
                .projectId(entry.getProjectId().toString())
                .project(project)
                .amount(entry.getAmount())
                .description(entry.getDescription())
                .date(entry.getDate())
                .category(entry.getCategory())
                .createdAt(entry.getCreatedAt())
                .updatedAt(entry.getUpdatedAt())
                .build();
    }
}
