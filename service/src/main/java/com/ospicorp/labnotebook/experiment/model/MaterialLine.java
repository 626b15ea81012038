package com.ospicorp.labnotebook.experiment.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * One row of an experiment's formulation. A single amount is accepted and stored as a
 * one-element list.
 */
public record MaterialLine(
    @NotBlank @Size(max = 200) String name,
    @NotEmpty
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    List<@NotNull @Positive Double> amount,
    @NotNull MaterialUnit unit,
    @NotNull @DecimalMin("0") @DecimalMax("100") Double ratio
) {}
