package com.ospicorp.labnotebook.resultschema.controller;

import com.ospicorp.labnotebook.resultschema.model.ResultSchemaCreateRequest;
import com.ospicorp.labnotebook.resultschema.model.ResultSchemaDto;
import com.ospicorp.labnotebook.resultschema.model.ResultSchemaUpdateRequest;
import com.ospicorp.labnotebook.resultschema.service.ResultSchemaService;
import io.swagger.v3.oas.annotations.Operation;
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
@Tag(name = "Result schemas")
public class ResultSchemaController {
  private final ResultSchemaService svc;

  public ResultSchemaController(ResultSchemaService svc) {
    this.svc = svc;
  }

  @GetMapping("/projects/{projectId}/result-schemas")
  @Operation(summary = "List result fields of a project", description = "Ordered by order, then id.")
  public List<ResultSchemaDto> list(@PathVariable long projectId) {
    return svc.listByProject(projectId);
  }

  @PostMapping("/result-schemas")
  @Operation(summary = "Define a result field")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Created field",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ResultSchemaDto.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "409", description = "Key already defined for the project",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResultSchemaDto create(@Valid @RequestBody ResultSchemaCreateRequest request) {
    return svc.create(request);
  }

  @PatchMapping("/result-schemas/{id}")
  @Operation(summary = "Update a result field", description = "The key and project cannot change.")
  public ResultSchemaDto update(@PathVariable long id, @Valid @RequestBody ResultSchemaUpdateRequest request) {
    return svc.update(id, request);
  }

  @DeleteMapping("/result-schemas/{id}")
  @Operation(summary = "Delete a result field")
  public Map<String, Object> delete(@PathVariable long id) {
    svc.delete(id);
    return Map.of("ok", true);
  }
}
