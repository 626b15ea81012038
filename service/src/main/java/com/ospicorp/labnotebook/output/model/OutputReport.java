package com.ospicorp.labnotebook.output.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Table of the included result fields, one row per experiment, plus summary statistics for
 * the quantitative columns keyed by field key.
 */
public record OutputReport(
    @JsonProperty("project_id") Long projectId,
    List<ReportColumn> columns,
    List<Map<String, Object>> rows,
    Map<String, SummaryStatistics> statistics
) {}
