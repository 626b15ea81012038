package com.ospicorp.labnotebook.config;

import com.ospicorp.labnotebook.experiment.model.ExperimentCreateRequest;
import com.ospicorp.labnotebook.experiment.model.MaterialLine;
import com.ospicorp.labnotebook.experiment.model.MaterialUnit;
import com.ospicorp.labnotebook.experiment.service.ExperimentService;
import com.ospicorp.labnotebook.outputconfig.model.OutputConfigUpsertRequest;
import com.ospicorp.labnotebook.outputconfig.service.OutputConfigService;
import com.ospicorp.labnotebook.project.model.ProjectCreateRequest;
import com.ospicorp.labnotebook.project.model.ProjectDto;
import com.ospicorp.labnotebook.project.model.ProjectStatus;
import com.ospicorp.labnotebook.project.model.ProjectType;
import com.ospicorp.labnotebook.project.repository.ProjectRepository;
import com.ospicorp.labnotebook.project.service.ProjectService;
import com.ospicorp.labnotebook.resultschema.model.ResultSchemaCreateRequest;
import com.ospicorp.labnotebook.resultschema.service.ResultSchemaService;
import com.ospicorp.labnotebook.validation.ValueType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Loads the "Adhesive Optimization" demo project into an empty database. Everything goes
 * through the services, so the seeded result values are validated like any other submission.
 */
@Component
public class DatabaseSeeder implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(DatabaseSeeder.class);
  static final String DEMO_PROJECT = "Adhesive Optimization";

  private final ProjectRepository projectRepository;
  private final ProjectService projectService;
  private final ResultSchemaService resultSchemaService;
  private final OutputConfigService outputConfigService;
  private final ExperimentService experimentService;
  private final Environment environment;
  private final boolean seedEnabled;

  public DatabaseSeeder(ProjectRepository projectRepository,
      ProjectService projectService,
      ResultSchemaService resultSchemaService,
      OutputConfigService outputConfigService,
      ExperimentService experimentService,
      Environment environment,
      @Value("${eln.seed.enabled:true}") boolean seedEnabled) {
    this.projectRepository = projectRepository;
    this.projectService = projectService;
    this.resultSchemaService = resultSchemaService;
    this.outputConfigService = outputConfigService;
    this.experimentService = experimentService;
    this.environment = environment;
    this.seedEnabled = seedEnabled;
  }

  @Override
  public void run(String... args) {
    if (!seedEnabled) {
      log.info("Database seeding disabled via property eln.seed.enabled=false");
      return;
    }
    if (environment.acceptsProfiles(Profiles.of("prod"))) {
      log.info("Skipping database seeding because active profile includes prod");
      return;
    }
    long existing = projectRepository.count();
    if (existing > 0) {
      log.info("Database already contains {} projects; skipping seeding", existing);
      return;
    }
    seedDatabase();
  }

  void seedDatabase() {
    log.info("Seeding database with the {} demo project", DEMO_PROJECT);
    ProjectDto project = projectService.create(
        new ProjectCreateRequest(DEMO_PROJECT, ProjectType.REGULAR, null, ProjectStatus.ONGOING));
    long projectId = project.id();

    List<ResultSchemaCreateRequest> fields = List.of(
        new ResultSchemaCreateRequest(projectId, "viscosity_cps", "Viscosity (cps)",
            ValueType.QUANTITATIVE, "cps", "Brookfield @25C", null, 0),
        new ResultSchemaCreateRequest(projectId, "ph", "pH",
            ValueType.QUANTITATIVE, null, null, null, 1),
        new ResultSchemaCreateRequest(projectId, "peel_strength", "Peel strength (N/cm)",
            ValueType.QUANTITATIVE, "N/cm", null, null, 2),
        new ResultSchemaCreateRequest(projectId, "appearance", "Appearance",
            ValueType.CATEGORICAL, null, null, List.of("clear", "cloudy", "opaque"), 3),
        new ResultSchemaCreateRequest(projectId, "notes", "Notes",
            ValueType.QUALITATIVE, null, null, null, 4));
    List<String> keys = new ArrayList<>(fields.size());
    for (ResultSchemaCreateRequest field : fields) {
      keys.add(resultSchemaService.create(field).key());
    }
    outputConfigService.upsert(new OutputConfigUpsertRequest(projectId, keys));

    experimentService.create(batch(projectId, "Batch A", "alice", "Baseline adhesive viscosity tuning",
        1200, 60, 800, 40, 4200, 7.1, 11.2, "clear", "Looks stable"));
    experimentService.create(batch(projectId, "Batch B", "bob", "Increase solid content",
        1500, 62, 700, 38, 5100, 6.9, 12.4, "cloudy", "Slightly hazy"));
    experimentService.create(batch(projectId, "Batch C", "chris", "pH adjustment",
        1300, 58, 900, 42, 4600, 7.5, 10.9, "clear", "Better pH"));
    log.info("Seeded project {} with {} result fields and 3 experiments", projectId, keys.size());
  }

  private static ExperimentCreateRequest batch(long projectId, String name, String author, String purpose,
      double resinGrams, double resinRatio, double solventGrams, double solventRatio,
      double viscosity, double ph, double peelStrength, String appearance, String notes) {
    List<MaterialLine> materials = List.of(
        new MaterialLine("Resin", List.of(resinGrams), MaterialUnit.G, resinRatio),
        new MaterialLine("Solvent", List.of(solventGrams), MaterialUnit.G, solventRatio));
    Map<String, Object> results = new LinkedHashMap<>();
    results.put("viscosity_cps", viscosity);
    results.put("ph", ph);
    results.put("peel_strength", peelStrength);
    results.put("appearance", appearance);
    results.put("notes", notes);
    return new ExperimentCreateRequest(projectId, name, author, purpose, materials, results);
  }
}
