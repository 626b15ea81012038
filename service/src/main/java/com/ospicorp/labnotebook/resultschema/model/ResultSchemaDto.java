package com.ospicorp.labnotebook.resultschema.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.labnotebook.validation.ValueType;
import java.time.Instant;
import java.util.List;

public record ResultSchemaDto(
    Long id,
    @JsonProperty("project_id") Long projectId,
    String key,
    String label,
    @JsonProperty("value_type") ValueType valueType,
    String unit,
    String description,
    List<String> options,
    int order,
    @JsonProperty("created_at") Instant createdAt
) {

  public static ResultSchemaDto from(ResultSchema schema) {
    return new ResultSchemaDto(
        schema.getId(),
        schema.getProjectId(),
        schema.getFieldKey(),
        schema.getLabel(),
        schema.getValueType(),
        schema.getUnit(),
        schema.getDescription(),
        schema.getOptions(),
        schema.getDisplayOrder(),
        schema.getCreatedAt());
  }
}
