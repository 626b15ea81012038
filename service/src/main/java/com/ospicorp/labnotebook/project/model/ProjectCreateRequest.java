package com.ospicorp.labnotebook.project.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

public record ProjectCreateRequest(
    @NotBlank @Size(max = 200) String name,
    @JsonProperty("project_type") ProjectType projectType,
    @JsonProperty("expected_end_date") LocalDate expectedEndDate,
    ProjectStatus status
) {}
