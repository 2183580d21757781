package com.freelancerpro.backend.services.query;

/**
 * Raw, caller-supplied list filters. Values are matched against the entity's
 * closed enums by {@link RecordQueries}; anything unrecognised is dropped.
 */
public record RecordFilters(String projectId, String category, String status, String priority) {

    public static RecordFilters none() {
        return new RecordFilters(null, null, null, null);
    }

    public static RecordFilters forEntries(String projectId, String category) {
        return new RecordFilters(projectId, category, null, null);
    }

    public static RecordFilters byStatus(String status) {
        return new RecordFilters(null, null, status, null);
    }
}
