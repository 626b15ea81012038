package com.ospicorp.labnotebook.resultschema.service;

import com.ospicorp.labnotebook.project.service.ProjectService;
import com.ospicorp.labnotebook.resultschema.model.ResultSchema;
import com.ospicorp.labnotebook.resultschema.model.ResultSchemaCreateRequest;
import com.ospicorp.labnotebook.resultschema.model.ResultSchemaDto;
import com.ospicorp.labnotebook.resultschema.model.ResultSchemaUpdateRequest;
import com.ospicorp.labnotebook.resultschema.repository.ResultSchemaRepository;
import com.ospicorp.labnotebook.validation.ValueType;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Management of the per-project result fields. Changes take effect on the next experiment
 * write, since the validator always re-reads the rows.
 */
@Service
public class ResultSchemaService {
  private static final Logger log = LoggerFactory.getLogger(ResultSchemaService.class);
  static final String OPTIONS_REQUIRED = "options is required for categorical fields";
  static final String BLANK_OPTION = "options must not contain null or blank values";

  /** Leading columns of every output row; a result field may not shadow them. */
  public static final Set<String> RESERVED_KEYS = Set.of("experiment_id", "experiment_name", "author");

  private final ResultSchemaRepository resultSchemaRepository;
  private final ProjectService projectService;

  public ResultSchemaService(ResultSchemaRepository resultSchemaRepository,
      ProjectService projectService) {
    this.resultSchemaRepository = resultSchemaRepository;
    this.projectService = projectService;
  }

  @Transactional(readOnly = true)
  public List<ResultSchemaDto> listByProject(long projectId) {
    return resultSchemaRepository.findByProjectIdOrderByDisplayOrderAscIdAsc(projectId).stream()
        .map(ResultSchemaDto::from)
        .toList();
  }

  @Transactional
  public ResultSchemaDto create(ResultSchemaCreateRequest request) {
    projectService.requireExisting(request.projectId());
    if (RESERVED_KEYS.contains(request.key())) {
      throw new IllegalArgumentException("key " + request.key() + " is reserved");
    }
    requireOptions(request.valueType(), request.options());

    ResultSchema schema = new ResultSchema();
    schema.setProjectId(request.projectId());
    schema.setFieldKey(request.key());
    schema.setLabel(request.label());
    schema.setValueType(request.valueType());
    schema.setUnit(request.unit());
    schema.setDescription(request.description());
    schema.setOptions(request.options());
    schema.setDisplayOrder(request.order() != null ? request.order() : 0);

    ResultSchema saved = resultSchemaRepository.saveAndFlush(schema);
    log.info("Added result field {} ({}) to project {}", saved.getFieldKey(),
        saved.getValueType().code(), saved.getProjectId());
    return ResultSchemaDto.from(saved);
  }

  @Transactional
  public ResultSchemaDto update(long id, ResultSchemaUpdateRequest request) {
    ResultSchema schema = find(id);
    ValueType effectiveType = request.valueType() != null ? request.valueType() : schema.getValueType();
    List<String> effectiveOptions = request.options() != null ? request.options() : schema.getOptions();
    requireOptions(effectiveType, effectiveOptions);

    if (request.label() != null) {
      schema.setLabel(request.label());
    }
    if (request.valueType() != null) {
      schema.setValueType(request.valueType());
    }
    if (request.unit() != null) {
      schema.setUnit(request.unit());
    }
    if (request.description() != null) {
      schema.setDescription(request.description());
    }
    if (request.options() != null) {
      schema.setOptions(request.options());
    }
    if (request.order() != null) {
      schema.setDisplayOrder(request.order());
    }
    return ResultSchemaDto.from(resultSchemaRepository.saveAndFlush(schema));
  }

  @Transactional
  public void delete(long id) {
    ResultSchema schema = find(id);
    resultSchemaRepository.delete(schema);
    log.info("Removed result field {} from project {}", schema.getFieldKey(), schema.getProjectId());
  }

  private static void requireOptions(ValueType valueType, List<String> options) {
    if (valueType == ValueType.CATEGORICAL && (options == null || options.isEmpty())) {
      throw new IllegalArgumentException(OPTIONS_REQUIRED);
    }
    if (options != null && !options.stream().allMatch(StringUtils::hasText)) {
      throw new IllegalArgumentException(BLANK_OPTION);
    }
  }

  private ResultSchema find(long id) {
    return resultSchemaRepository.findById(id)
        .orElseThrow(() -> new NoSuchElementException("Result schema not found: " + id));
  }
}
