package com.ospicorp.labnotebook.output.model;

public record SummaryStatistics(
    int count,
    double min,
    double q1,
    double median,
    double q3,
    double max,
    double mean
) {}
