package com.ospicorp.labnotebook.project.service;

import com.ospicorp.labnotebook.project.model.Project;
import com.ospicorp.labnotebook.project.model.ProjectCreateRequest;
import com.ospicorp.labnotebook.project.model.ProjectDto;
import com.ospicorp.labnotebook.project.model.ProjectStatus;
import com.ospicorp.labnotebook.project.model.ProjectType;
import com.ospicorp.labnotebook.project.model.ProjectUpdateRequest;
import com.ospicorp.labnotebook.project.repository.ProjectRepository;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {
  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository projectRepository;

  public ProjectService(ProjectRepository projectRepository) {
    this.projectRepository = projectRepository;
  }

  @Transactional(readOnly = true)
  public List<ProjectDto> list() {
    return projectRepository.findAllByOrderByCreatedAtDescIdDesc().stream()
        .map(ProjectDto::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public ProjectDto get(long id) {
    return ProjectDto.from(find(id));
  }

  @Transactional
  public ProjectDto create(ProjectCreateRequest request) {
    Project project = new Project();
    project.setName(request.name().strip());
    project.setProjectType(request.projectType() != null ? request.projectType() : ProjectType.REGULAR);
    project.setExpectedEndDate(request.expectedEndDate());
    project.setStatus(request.status() != null ? request.status() : ProjectStatus.ONGOING);
    Project saved = projectRepository.saveAndFlush(project);
    log.info("Created project {} ({})", saved.getId(), saved.getName());
    return ProjectDto.from(saved);
  }

  @Transactional
  public ProjectDto update(long id, ProjectUpdateRequest request) {
    Project project = find(id);
    if (request.name() != null) {
      project.setName(request.name().strip());
    }
    if (request.projectType() != null) {
      project.setProjectType(request.projectType());
    }
    if (request.expectedEndDate() != null) {
      project.setExpectedEndDate(request.expectedEndDate());
    }
    if (request.status() != null) {
      project.setStatus(request.status());
    }
    return ProjectDto.from(projectRepository.saveAndFlush(project));
  }

  /**
   * Experiments, result fields and the output config go with the project (ON DELETE CASCADE).
   */
  @Transactional
  public void delete(long id) {
    Project project = find(id);
    projectRepository.delete(project);
    log.info("Deleted project {}", id);
  }

  /**
   * Guard for operations that take a project id in the request body.
   */
  @Transactional(readOnly = true)
  public void requireExisting(long id) {
    if (!projectRepository.existsById(id)) {
      throw new IllegalArgumentException("Invalid project_id");
    }
  }

  private Project find(long id) {
    return projectRepository.findById(id)
        .orElseThrow(() -> new NoSuchElementException("Project not found: " + id));
  }
}
