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
import com.freelancerpro.backend.dto.entry.ExpenseCreateRequest;
import com.freelancerpro.backend.dto.entry.ExpenseResponseDTO;
import com.freelancerpro.backend.dto.entry.ExpenseUpdateRequest;
import com.freelancerpro.backend.dto.project.ProjectRefDTO;
import com.freelancerpro.backend.dto.stats.EntryStatsDTO;
import com.freelancerpro.backend.dto.stats.ProjectBreakdownDTO;
import com.freelancerpro.backend.entities.ExpenseEntry;
import com.freelancerpro.backend.enums.ExpenseCategory;
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
public class ExpenseService {

    private final ScopedRecordStore<ExpenseEntry> expenseStore;
    private final ProjectService projectService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PagedResult<ExpenseResponseDTO> list(UUID userId, RecordFilters filters, DateRange range, PageQuery pageQuery) {
        ScopedQuery<ExpenseEntry> query = RecordQueries.expenseEntries().build(userId, filters, range);
        PageSlice<ExpenseEntry> slice = expenseStore.page(query, pageQuery);

        Map<UUID, ProjectRefDTO> projects = projectService.resolveProjectRefs(userId, projectIds(slice.records()));
        log.info("Retrieved {} expense entries for user {}", slice.records().size(), userId);
        return PaginationEngine.toResult(slice, pageQuery, entry -> toDTO(entry, projects.get(entry.getProjectId())));
    }

    @Transactional(readOnly = true)
    public ExpenseResponseDTO get(UUID userId, String id) {
        ExpenseEntry entry = expenseStore.requireOwned(userId, id);
        return toDTO(entry, projectService.resolveProjectRefs(userId, Set.of(entry.getProjectId()))
                .get(entry.getProjectId()));
    }

    @Transactional
    @CacheEvict(cacheNames = "stats", allEntries = true)
    public ExpenseResponseDTO create(UUID userId, ExpenseCreateRequest request) {
        ProjectRefDTO project = projectService.toRef(projectService.requireOwnedProject(userId, request.getProjectId()));

        ExpenseEntry entry = new ExpenseEntry();
        entry.setUserId(userId);
        entry.setProjectId(request.getProjectId());
        entry.setAmount(request.getAmount());
        entry.setDescription(request.getDescription().trim());
        entry.setDate(request.getDate() != null ? request.getDate() : LocalDateTime.now(clock));
        entry.setCategory(request.getCategory() != null ? request.getCategory() : ExpenseCategory.OTHER);
        entry.setReceiptUrl(ProjectService.trimToNull(request.getReceiptUrl()));

        ExpenseEntry saved = expenseStore.save(entry);
        log.info("Created expense entry {} for user {}", saved.getId(), userId);
        return toDTO(saved, project);
    }

    @Transactional
    @CacheEvict(cacheNames = "stats", allEntries = true)
    public ExpenseResponseDTO update(UUID userId, String id, ExpenseUpdateRequest request) {
        ExpenseEntry entry = expenseStore.requireOwned(userId, id);

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
        if (request.getReceiptUrl() != null) {
            entry.setReceiptUrl(ProjectService.trimToNull(request.getReceiptUrl()));
        }

        ExpenseEntry saved = expenseStore.save(entry);
        log.info("Updated expense entry {} for user {}", saved.getId(), userId);
        return toDTO(saved, projectService.resolveProjectRefs(userId, Set.of(saved.getProjectId()))
                .get(saved.getProjectId()));
    }

    @Transactional
    @CacheEvict(cacheNames = "stats", allEntries = true)
    public void delete(UUID userId, String id) {
        ExpenseEntry entry = expenseStore.requireOwned(userId, id);
        expenseStore.softDelete(entry);
        log.info("Deleted expense entry {} for user {}", entry.getId(), userId);
    }

    @Transactional(readOnly = true)
    @Cacheable(cacheNames = "stats", key = "'expenses:' + #userId + ':' + #range")
    public EntryStatsDTO stats(UUID userId, DateRange range) {
        return AggregationEngine.stats(facts(userId, range));
    }

    @Transactional(readOnly = true)
    @Cacheable(cacheNames = "stats", key = "'expenses-by-project:' + #userId + ':' + #range")
    public List<ProjectBreakdownDTO> byProject(UUID userId, DateRange range) {
        List<EntryFact> facts = facts(userId, range);
        Set<UUID> ids = facts.stream().map(EntryFact::projectId).collect(Collectors.toSet());
        return AggregationEngine.byProject(facts, projectService.resolveProjectRefs(userId, ids));
    }

    @Transactional(readOnly = true)
    public List<EntryFact> facts(UUID userId, DateRange range) {
        ScopedQuery<ExpenseEntry> query = RecordQueries.expenseEntries().build(userId, RecordFilters.none(), range);
        return expenseStore.findAll(query).stream().map(EntryFact::of).toList();
    }

    private static Set<UUID> projectIds(List<ExpenseEntry> entries) {
        return entries.stream().map(ExpenseEntry::getProjectId).collect(Collectors.toSet());
    }

    private ExpenseResponseDTO toDTO(ExpenseEntry entry, ProjectRefDTO project) {
        return ExpenseResponseDTO.builder()
                .id(entry.getId().toString())
                .projectId(entry.getProjectId().toString())
                .project(project)
                .amount(entry.getAmount())
                .description(entry.getDescription())
                .date(entry.getDate())
                .category(entry.getCategory())
                .receiptUrl(entry.getReceiptUrl())
                .createdAt(entry.getCreatedAt())
                .updatedAt(entry.getUpdatedAt())
                .build();
    }
}
