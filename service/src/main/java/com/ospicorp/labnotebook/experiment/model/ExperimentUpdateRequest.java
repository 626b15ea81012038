package com.ospicorp.labnotebook.experiment.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;

/**
 * Partial update. Null properties are left unchanged; result values are re-validated only when
 * present.
 */
public record ExperimentUpdateRequest(
    @Size(min = 1, max = 200) String name,
    @Size(min = 1, max = 80) String author,
    @Size(min = 1) String purpose,
    List<@Valid MaterialLine> materials,
    @JsonProperty("result_values") Map<String, Object> resultValues
) {}
