package com.ospicorp.labnotebook.project.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.LocalDate;

public record ProjectDto(
    Long id,
    String name,
    @JsonProperty("project_type") ProjectType projectType,
    @JsonProperty("expected_end_date") LocalDate expectedEndDate,
    ProjectStatus status,
    @JsonProperty("created_at") Instant createdAt
) {

  public static ProjectDto from(Project project) {
    return new ProjectDto(
        project.getId(),
        project.getName(),
        project.getProjectType(),
        project.getExpectedEndDate(),
        project.getStatus(),
        project.getCreatedAt());
  }
}
