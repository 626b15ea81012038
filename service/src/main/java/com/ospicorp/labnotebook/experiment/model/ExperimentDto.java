package com.ospicorp.labnotebook.experiment.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ExperimentDto(
    Long id,
    @JsonProperty("project_id") Long projectId,
    String name,
    String author,
    String purpose,
    List<MaterialLine> materials,
    @JsonProperty("result_values") Map<String, Object> resultValues,
    @JsonProperty("created_at") Instant createdAt
) {

  public static ExperimentDto from(Experiment experiment) {
    return new ExperimentDto(
        experiment.getId(),
        experiment.getProjectId(),
        experiment.getName(),
        experiment.getAuthor(),
        experiment.getPurpose(),
        experiment.getMaterials(),
        experiment.getResultValues(),
        experiment.getCreatedAt());
  }
}
