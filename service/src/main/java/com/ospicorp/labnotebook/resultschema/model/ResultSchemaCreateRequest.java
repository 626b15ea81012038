package com.ospicorp.labnotebook.resultschema.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.labnotebook.validation.ValueType;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;

public record ResultSchemaCreateRequest(
    @NotNull @JsonProperty("project_id") Long projectId,
    @NotBlank @Size(max = 80) @Pattern(regexp = "^[a-zA-Z0-9_\\-]+$") String key,
    @NotBlank @Size(max = 200) String label,
    @NotNull @JsonProperty("value_type") ValueType valueType,
    @Size(max = 40) String unit,
    @Size(max = 500) String description,
    List<@NotBlank String> options,
    Integer order
) {

  @JsonIgnore
  @AssertTrue(message = "options is required for categorical fields")
  public boolean isOptionsPresentForCategorical() {
    return valueType != ValueType.CATEGORICAL || (options != null && !options.isEmpty());
  }
}
