package com.ospicorp.labnotebook.output.service;

import com.ospicorp.labnotebook.experiment.model.ExperimentDto;
import com.ospicorp.labnotebook.experiment.service.ExperimentService;
import com.ospicorp.labnotebook.output.model.OutputReport;
import com.ospicorp.labnotebook.output.model.ReportColumn;
import com.ospicorp.labnotebook.output.model.SummaryStatistics;
import com.ospicorp.labnotebook.outputconfig.model.OutputConfigDto;
import com.ospicorp.labnotebook.outputconfig.service.OutputConfigService;
import com.ospicorp.labnotebook.project.service.ProjectService;
import com.ospicorp.labnotebook.resultschema.model.ResultSchemaDto;
import com.ospicorp.labnotebook.resultschema.service.ResultSchemaService;
import com.ospicorp.labnotebook.validation.NumericValues;
import com.ospicorp.labnotebook.validation.ValueType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds the project output view: the fields chosen in the output config, in schema order, one
 * row per experiment. Quantitative cells hold the mean of the recorded values, so repeated
 * measurements collapse into a single number.
 */
@Service
public class OutputReportService {
  // also listed in ResultSchemaService.RESERVED_KEYS
  static final String EXPERIMENT_ID = "experiment_id";
  static final String EXPERIMENT_NAME = "experiment_name";
  static final String AUTHOR = "author";

  private final ProjectService projectService;
  private final ResultSchemaService resultSchemaService;
  private final OutputConfigService outputConfigService;
  private final ExperimentService experimentService;

  public OutputReportService(ProjectService projectService,
      ResultSchemaService resultSchemaService,
      OutputConfigService outputConfigService,
      ExperimentService experimentService) {
    this.projectService = projectService;
    this.resultSchemaService = resultSchemaService;
    this.outputConfigService = outputConfigService;
    this.experimentService = experimentService;
  }

  @Transactional(readOnly = true)
  public OutputReport report(long projectId) {
    projectService.get(projectId);

    Set<String> included = new HashSet<>(outputConfigService.findByProject(projectId)
        .map(OutputConfigDto::includedKeys)
        .orElse(List.of()));
    List<ResultSchemaDto> fields = resultSchemaService.listByProject(projectId).stream()
        .filter(field -> included.contains(field.key()))
        .filter(field -> !ResultSchemaService.RESERVED_KEYS.contains(field.key()))
        .toList();
    List<ExperimentDto> experiments = experimentService.listByProject(projectId);

    List<ReportColumn> columns = fields.stream()
        .map(f -> new ReportColumn(f.key(), f.label(), f.valueType(), f.unit()))
        .toList();

    Map<String, List<Double>> means = new LinkedHashMap<>();
    List<Map<String, Object>> rows = new ArrayList<>(experiments.size());
    for (ExperimentDto experiment : experiments) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put(EXPERIMENT_ID, experiment.id());
      row.put(EXPERIMENT_NAME, experiment.name());
      row.put(AUTHOR, experiment.author());
      Map<String, Object> values = experiment.resultValues() == null ? Map.of() : experiment.resultValues();
      for (ResultSchemaDto field : fields) {
        Object raw = values.get(field.key());
        if (field.valueType() == ValueType.QUANTITATIVE) {
          OptionalDouble mean = Statistics.mean(NumericValues.collect(raw));
          row.put(field.key(), mean.isPresent() ? mean.getAsDouble() : null);
          if (mean.isPresent()) {
            means.computeIfAbsent(field.key(), k -> new ArrayList<>()).add(mean.getAsDouble());
          }
        } else {
          row.put(field.key(), raw == null || "".equals(raw) ? null : String.valueOf(raw));
        }
      }
      rows.add(row);
    }

    Map<String, SummaryStatistics> statistics = new LinkedHashMap<>();
    means.forEach((key, values) -> Statistics.summarize(values).ifPresent(s -> statistics.put(key, s)));

    return new OutputReport(projectId, columns, rows, statistics);
  }
}
