package com.freelancerpro.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.freelancerpro.backend.dto.entry.ExpenseCreateRequest;
import com.freelancerpro.backend.dto.entry.ExpenseResponseDTO;
import com.freelancerpro.backend.dto.entry.ExpenseUpdateRequest;
import com.freelancerpro.backend.dto.project.ProjectRefDTO;
import com.freelancerpro.backend.entities.ExpenseEntry;
import com.freelancerpro.backend.entities.Project;
import com.freelancerpro.backend.enums.ExpenseCategory;
import com.freelancerpro.backend.exceptions.ResourceNotFoundException;
import com.freelancerpro.backend.services.query.ScopedRecordStore;

@ExtendWith(MockitoExtension.class)
class ExpenseServiceTest {

    @Mock
    private ScopedRecordStore<ExpenseEntry> expenseStore;

    @Mock
    private ProjectService projectService;

    private ExpenseService expenseService;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-07-20T15:00:00Z"), ZoneOffset.UTC);
        expenseService = new ExpenseService(expenseStore, projectService, clock);
    }

    private static ExpenseEntry existing(UUID projectId) {
        ExpenseEntry entry = new ExpenseEntry();
        entry.setId(UUID.randomUUID());
        entry.setProjectId(projectId);
        entry.setAmount(new BigDecimal("49.99"));
        entry.setDescription("Design tool");
        entry.setDate(LocalDateTime.of(2024, 7, 1, 9, 0));
        entry.setCategory(ExpenseCategory.SOFTWARE);
        entry.setReceiptUrl("https://receipts.example.com/1");
        return entry;
    }

    @Test
    void create_defaultsToOtherAndDropsBlankReceipt() {
        UUID projectId = UUID.randomUUID();
        Project project = new Project();
        project.setId(projectId);
        when(projectService.requireOwnedProject(userId, projectId)).thenReturn(project);
        when(projectService.toRef(project)).thenReturn(new ProjectRefDTO("Shop", "Corner Store"));
        when(expenseStore.save(any(ExpenseEntry.class))).thenAnswer(inv -> {
            ExpenseEntry saved = inv.getArgument(0);
            saved.setId(UUID.randomUUID());
            return saved;
        });
        ExpenseCreateRequest request = new ExpenseCreateRequest();
        request.setProjectId(projectId);
        request.setAmount(new BigDecimal("120.00"));
        request.setDescription("Stock photos");
        request.setReceiptUrl("  ");

        ExpenseResponseDTO created = expenseService.create(userId, request);

        assertEquals(ExpenseCategory.OTHER, created.getCategory());
        assertEquals(LocalDateTime.of(2024, 7, 20, 15, 0), created.getDate());
        assertNull(created.getReceiptUrl());
        assertEquals("Corner Store", created.getProject().getClientName());
    }

    @Test
    void update_movingToForeignProject_isNotFoundAndLeavesEntryUntouched() {
        UUID ownProject = UUID.randomUUID();
        UUID foreignProject = UUID.randomUUID();
        ExpenseEntry entry = existing(ownProject);
        when(expenseStore.requireOwned(userId, entry.getId().toString())).thenReturn(entry);
        when(projectService.requireOwnedProject(userId, foreignProject))
                .thenThrow(new ResourceNotFoundException("Project not found"));
        ExpenseUpdateRequest request = new ExpenseUpdateRequest();
        request.setProjectId(foreignProject);

        assertThrows(ResourceNotFoundException.class,
                () -> expenseService.update(userId, entry.getId().toString(), request));

        assertEquals(ownProject, entry.getProjectId());
        verify(expenseStore, never()).save(any());
    }

    @Test
    void update_changesOnlyProvidedFields() {
        UUID projectId = UUID.randomUUID();
        ExpenseEntry entry = existing(projectId);
        when(expenseStore.requireOwned(userId, entry.getId().toString())).thenReturn(entry);
        when(expenseStore.save(entry)).thenReturn(entry);
        when(projectService.resolveProjectRefs(eq(userId), anyCollection())).thenReturn(Map.of());
        ExpenseUpdateRequest request = new ExpenseUpdateRequest();
        request.setAmount(new BigDecimal("59.99"));

        ExpenseResponseDTO updated = expenseService.update(userId, entry.getId().toString(), request);

        assertEquals(new BigDecimal("59.99"), updated.getAmount());
        assertEquals(ExpenseCategory.SOFTWARE, updated.getCategory());
        assertEquals("https://receipts.example.com/1", updated.getReceiptUrl());
        assertNull(updated.getProject());
    }
}
