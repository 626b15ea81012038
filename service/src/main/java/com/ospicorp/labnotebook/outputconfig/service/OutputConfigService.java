package com.ospicorp.labnotebook.outputconfig.service;

import com.ospicorp.labnotebook.outputconfig.model.OutputConfig;
import com.ospicorp.labnotebook.outputconfig.model.OutputConfigDto;
import com.ospicorp.labnotebook.outputconfig.model.OutputConfigUpsertRequest;
import com.ospicorp.labnotebook.outputconfig.repository.OutputConfigRepository;
import com.ospicorp.labnotebook.project.service.ProjectService;
import com.ospicorp.labnotebook.validation.SchemaIndex;
import com.ospicorp.labnotebook.validation.SchemaIndexLoader;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OutputConfigService {
  private static final Logger log = LoggerFactory.getLogger(OutputConfigService.class);

  private final OutputConfigRepository outputConfigRepository;
  private final ProjectService projectService;
  private final SchemaIndexLoader schemaIndexLoader;

  public OutputConfigService(OutputConfigRepository outputConfigRepository,
      ProjectService projectService,
      SchemaIndexLoader schemaIndexLoader) {
    this.outputConfigRepository = outputConfigRepository;
    this.projectService = projectService;
    this.schemaIndexLoader = schemaIndexLoader;
  }

  @Transactional(readOnly = true)
  public Optional<OutputConfigDto> findByProject(long projectId) {
    return outputConfigRepository.findByProjectId(projectId).map(OutputConfigDto::from);
  }

  /**
   * Creates or replaces the project's config. Keys the project schema does not define are
   * dropped; the remaining keys keep their first position.
   */
  @Transactional
  public OutputConfigDto upsert(OutputConfigUpsertRequest request) {
    long projectId = request.projectId();
    projectService.requireExisting(projectId);

    SchemaIndex index = schemaIndexLoader.load(projectId);
    List<String> requested = request.includedKeys() == null ? List.of() : request.includedKeys();
    LinkedHashSet<String> kept = new LinkedHashSet<>();
    for (String key : requested) {
      if (index.contains(key)) {
        kept.add(key);
      }
    }
    if (kept.size() < requested.size()) {
      log.debug("Dropped {} unknown or repeated output keys for project {}",
          requested.size() - kept.size(), projectId);
    }

    OutputConfig config = outputConfigRepository.findByProjectId(projectId)
        .orElseGet(() -> {
          OutputConfig created = new OutputConfig();
          created.setProjectId(projectId);
          return created;
        });
    config.setIncludedKeys(new ArrayList<>(kept));
    OutputConfig saved = outputConfigRepository.save(config);
    log.info("Saved output config for project {} with {} keys", projectId, kept.size());
    return OutputConfigDto.from(saved);
  }
}
