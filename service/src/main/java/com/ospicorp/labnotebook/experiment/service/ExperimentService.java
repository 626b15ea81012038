package com.ospicorp.labnotebook.experiment.service;

import com.ospicorp.labnotebook.experiment.model.Experiment;
import com.ospicorp.labnotebook.experiment.model.ExperimentCreateRequest;
import com.ospicorp.labnotebook.experiment.model.ExperimentDto;
import com.ospicorp.labnotebook.experiment.model.ExperimentUpdateRequest;
import com.ospicorp.labnotebook.experiment.repository.ExperimentRepository;
import com.ospicorp.labnotebook.project.service.ProjectService;
import com.ospicorp.labnotebook.validation.ResultValueValidationException;
import com.ospicorp.labnotebook.validation.ResultValueValidator;
import com.ospicorp.labnotebook.validation.SchemaIndex;
import com.ospicorp.labnotebook.validation.SchemaIndexLoader;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ExperimentService {
  private static final Logger log = LoggerFactory.getLogger(ExperimentService.class);

  private final ExperimentRepository experimentRepository;
  private final ProjectService projectService;
  private final SchemaIndexLoader schemaIndexLoader;
  private final ResultValueValidator validator;

  public ExperimentService(ExperimentRepository experimentRepository,
      ProjectService projectService,
      SchemaIndexLoader schemaIndexLoader,
      ResultValueValidator validator) {
    this.experimentRepository = experimentRepository;
    this.projectService = projectService;
    this.schemaIndexLoader = schemaIndexLoader;
    this.validator = validator;
  }

  @Transactional(readOnly = true)
  public List<ExperimentDto> listByProject(long projectId) {
    return experimentRepository.findByProjectIdOrderByCreatedAtDescIdDesc(projectId).stream()
        .map(ExperimentDto::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public ExperimentDto get(long id) {
    return ExperimentDto.from(find(id));
  }

  @Transactional
  public ExperimentDto create(ExperimentCreateRequest request) {
    long projectId = request.projectId();
    projectService.requireExisting(projectId);
    Map<String, Object> resultValues = validateResultValues(projectId, request.resultValues());

    Experiment experiment = new Experiment();
    experiment.setProjectId(projectId);
    experiment.setName(request.name());
    experiment.setAuthor(request.author());
    experiment.setPurpose(request.purpose());
    experiment.setMaterials(request.materials());
    experiment.setResultValues(resultValues);

    Experiment saved = experimentRepository.save(experiment);
    log.info("Created experiment {} in project {}", saved.getId(), projectId);
    return ExperimentDto.from(saved);
  }

  @Transactional
  public ExperimentDto update(long id, ExperimentUpdateRequest request) {
    Experiment experiment = find(id);
    Map<String, Object> resultValues = request.resultValues() == null
        ? null
        : validateResultValues(experiment.getProjectId(), request.resultValues());

    if (request.name() != null) {
      experiment.setName(request.name());
    }
    if (request.author() != null) {
      experiment.setAuthor(request.author());
    }
    if (request.purpose() != null) {
      experiment.setPurpose(request.purpose());
    }
    if (request.materials() != null) {
      experiment.setMaterials(request.materials());
    }
    if (resultValues != null) {
      experiment.setResultValues(resultValues);
    }
    return ExperimentDto.from(experimentRepository.save(experiment));
  }

  @Transactional
  public void delete(long id) {
    experimentRepository.delete(find(id));
    log.info("Deleted experiment {}", id);
  }

  private Map<String, Object> validateResultValues(long projectId, Map<String, Object> values) {
    SchemaIndex index = schemaIndexLoader.load(projectId);
    try {
      return validator.validate(index, values);
    } catch (ResultValueValidationException ex) {
      log.debug("Rejected result values for project {}: {}", projectId, ex.getMessage());
      throw ex;
    }
  }

  private Experiment find(long id) {
    return experimentRepository.findById(id)
        .orElseThrow(() -> new NoSuchElementException("Experiment not found: " + id));
  }
}
