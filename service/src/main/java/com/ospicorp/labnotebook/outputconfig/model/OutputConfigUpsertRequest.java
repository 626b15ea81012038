package com.ospicorp.labnotebook.outputconfig.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record OutputConfigUpsertRequest(
    @NotNull @JsonProperty("project_id") Long projectId,
    @JsonProperty("included_keys") List<String> includedKeys
) {}
