package com.ospicorp.labnotebook.output.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.labnotebook.validation.ValueType;

public record ReportColumn(
    String key,
    String label,
    @JsonProperty("value_type") ValueType valueType,
    String unit
) {}
