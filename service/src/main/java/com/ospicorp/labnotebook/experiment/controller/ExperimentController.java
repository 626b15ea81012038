package com.ospicorp.labnotebook.experiment.controller;

import com.ospicorp.labnotebook.experiment.model.ExperimentCreateRequest;
import com.ospicorp.labnotebook.experiment.model.ExperimentDto;
import com.ospicorp.labnotebook.experiment.model.ExperimentUpdateRequest;
import com.ospicorp.labnotebook.experiment.service.ExperimentService;
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
@RequestMapping("/api")
@Tag(name = "Experiments")
public class ExperimentController {
  private final ExperimentService svc;

  public ExperimentController(ExperimentService svc) {
    this.svc = svc;
  }

  @GetMapping("/projects/{projectId}/experiments")
  @Operation(summary = "List experiments of a project", description = "Newest first.")
  public List<ExperimentDto> list(@PathVariable
      @Parameter(description = "Project id", example = "1") long projectId) {
    return svc.listByProject(projectId);
  }

  @PostMapping("/experiments")
  @Operation(summary = "Create experiment",
      description = "Result values are checked against the project's result schemas and stored normalized.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Created experiment",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ExperimentDto.class))),
      @ApiResponse(responseCode = "400", description = "Invalid project or result values",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ExperimentDto create(@Valid @RequestBody ExperimentCreateRequest request) {
    return svc.create(request);
  }

  @GetMapping("/experiments/{id}")
  @Operation(summary = "Get experiment")
  public ExperimentDto get(@PathVariable long id) {
    return svc.get(id);
  }

  @PatchMapping("/experiments/{id}")
  @Operation(summary = "Update experiment",
      description = "Result values, when present, replace the stored ones after the same checks as on create.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Updated experiment",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ExperimentDto.class))),
      @ApiResponse(responseCode = "400", description = "Invalid result values",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ExperimentDto update(@PathVariable long id, @Valid @RequestBody ExperimentUpdateRequest request) {
    return svc.update(id, request);
  }

  @DeleteMapping("/experiments/{id}")
  @Operation(summary = "Delete experiment")
  public Map<String, Object> delete(@PathVariable long id) {
    svc.delete(id);
    return Map.of("ok", true);
  }
}
