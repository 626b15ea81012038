package com.ospicorp.labnotebook.project.controller;

import com.ospicorp.labnotebook.project.model.ProjectCreateRequest;
import com.ospicorp.labnotebook.project.model.ProjectDto;
import com.ospicorp.labnotebook.project.model.ProjectUpdateRequest;
import com.ospicorp.labnotebook.project.service.ProjectService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects")
@Tag(name = "Projects")
public class ProjectController {
  private final ProjectService svc;

  public ProjectController(ProjectService svc) {
    this.svc = svc;
  }

  @GetMapping
  @Operation(summary = "List projects", description = "All projects, newest first.")
  public List<ProjectDto> list() {
    return svc.list();
  }

  @PostMapping
  @Operation(summary = "Create project")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Created project",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ProjectDto.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "409", description = "Duplicate project name",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ProjectDto create(@Valid @RequestBody ProjectCreateRequest request) {
    return svc.create(request);
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get project")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Project",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ProjectDto.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ProjectDto get(@PathVariable @Parameter(description = "Project id", example = "1") long id) {
    return svc.get(id);
  }

  @PatchMapping("/{id}")
  @Operation(summary = "Update project", description = "Only the properties present in the body change.")
  public ProjectDto update(@PathVariable long id, @Valid @RequestBody ProjectUpdateRequest request) {
    return svc.update(id, request);
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Delete project", description = "Also removes its experiments, result schemas and output config.")
  public Map<String, Object> delete(@PathVariable long id) {
    svc.delete(id);
    return Map.of("ok", true);
  }
}
