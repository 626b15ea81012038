package com.ospicorp.labnotebook.resultschema.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.labnotebook.validation.ValueType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Partial update. Null properties are left unchanged; the key and project are immutable.
 */
public record ResultSchemaUpdateRequest(
    @Size(min = 1, max = 200) String label,
    @JsonProperty("value_type") ValueType valueType,
    @Size(max = 40) String unit,
    @Size(max = 500) String description,
    List<@NotBlank String> options,
    Integer order
) {}
