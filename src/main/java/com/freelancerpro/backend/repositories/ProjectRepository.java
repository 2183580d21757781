package com.freelancerpro.backend.repositories;

import com.freelancerpro.backend.entities.Project;

public interface ProjectRepository extends OwnedRecordRepository<Project> {
}
