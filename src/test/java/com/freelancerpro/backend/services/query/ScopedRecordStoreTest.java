package com.freelancerpro.backend.services.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import com.freelancerpro.backend.entities.IncomeEntry;
import com.freelancerpro.backend.enums.SortDirection;
import com.freelancerpro.backend.exceptions.ResourceNotFoundException;
import com.freelancerpro.backend.repositories.IncomeEntryRepository;

@ExtendWith(MockitoExtension.class)
class ScopedRecordStoreTest {

    @Mock
    private IncomeEntryRepository repository;

    private ScopedRecordStore<IncomeEntry> store;

    private final UUID ownerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        store = new ScopedRecordStore<>(repository, IncomeEntry.class, "Income entry");
    }

    @Test
    void resolveSort_defaultsToNewestFirst() {
        Sort sort = store.resolveSort(PageQuery.firstPage());

        assertEquals(Sort.by(Sort.Direction.DESC, "createdAt"), sort);
    }

    @Test
    void resolveSort_acceptsInheritedAndOwnFields() {
        assertEquals(Sort.by(Sort.Direction.ASC, "amount"),
                store.resolveSort(new PageQuery(1, 10, "amount", SortDirection.ASC)));
        assertEquals(Sort.by(Sort.Direction.DESC, "category"),
                store.resolveSort(new PageQuery(1, 10, "category", SortDirection.DESC)));
    }

    @Test
    void resolveSort_unknownFieldFallsBackToDefault() {
        Sort sort = store.resolveSort(new PageQuery(1, 10, "password; drop table", SortDirection.ASC));

        assertEquals(ScopedRecordStore.DEFAULT_SORT, sort);
    }

    @Test
    void requireOwned_malformedId_isNotFoundWithoutTouchingTheDatabase() {
        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> store.requireOwned(ownerId, "not-a-uuid"));

        assertEquals("Income entry not found", ex.getMessage());
        verifyNoInteractions(repository);
    }

    @Test
    @SuppressWarnings("unchecked")
    void requireOwned_absentRecord_isNotFound() {
        when(repository.findOne(any(Specification.class))).thenReturn(java.util.Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> store.requireOwned(ownerId, UUID.randomUUID().toString()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void page_convertsOneBasedPageToZeroBasedRequest() {
        IncomeEntry entry = new IncomeEntry();
        when(repository.findAll(any(Specification.class), any(PageRequest.class)))
                .thenAnswer(inv -> new PageImpl<>(List.of(entry), inv.getArgument(1), 21));

        PageSlice<IncomeEntry> slice = store.page(
                RecordQueries.incomeEntries().build(ownerId), new PageQuery(3, 10, null, null));

        ArgumentCaptor<PageRequest> captor = ArgumentCaptor.forClass(PageRequest.class);
        verify(repository).findAll(any(Specification.class), captor.capture());
        assertEquals(2, captor.getValue().getPageNumber());
        assertEquals(10, captor.getValue().getPageSize());
        assertEquals(21, slice.total());
        assertEquals(1, slice.records().size());
    }

    @Test
    @SuppressWarnings("unchecked")
    void page_offsetBeyondIntRange_countsWithoutFetching() {
        when(repository.count(any(Specification.class))).thenReturn(4L);

        PageSlice<IncomeEntry> slice = store.page(
                RecordQueries.incomeEntries().build(ownerId), PageQuery.of(21_474_838, 100, null, null));

        assertTrue(slice.records().isEmpty());
        assertEquals(4, slice.total());
        verify(repository, never()).findAll(any(Specification.class), any(PageRequest.class));
    }

    @Test
    void softDelete_flipsActiveFlagAndSaves() {
        IncomeEntry entry = new IncomeEntry();
        assertTrue(entry.isActive());

        store.softDelete(entry);

        assertFalse(entry.isActive());
        verify(repository).save(entry);
        verify(repository, never()).delete(any(IncomeEntry.class));
    }
}
