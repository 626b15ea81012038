package com.ospicorp.labnotebook.experiment.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;

public record ExperimentCreateRequest(
    @NotNull @JsonProperty("project_id") Long projectId,
    @NotBlank @Size(max = 200) String name,
    @NotBlank @Size(max = 80) String author,
    @NotBlank String purpose,
    List<@Valid MaterialLine> materials,
    @JsonProperty("result_values") Map<String, Object> resultValues
) {}
