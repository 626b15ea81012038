package com.ospicorp.labnotebook.outputconfig.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record OutputConfigDto(
    Long id,
    @JsonProperty("project_id") Long projectId,
    @JsonProperty("included_keys") List<String> includedKeys,
    @JsonProperty("created_at") Instant createdAt
) {

  public static OutputConfigDto from(OutputConfig config) {
    return new OutputConfigDto(
        config.getId(),
        config.getProjectId(),
        config.getIncludedKeys(),
        config.getCreatedAt());
  }
}
