package com.freelancerpro.backend.dto.project;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Project name and client embedded in entry responses and breakdown rows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectRefDTO {
    private String name;
    private String clientName;
}
