package com.ospicorp.labnotebook.outputconfig.controller;

import com.ospicorp.labnotebook.outputconfig.model.OutputConfigDto;
import com.ospicorp.labnotebook.outputconfig.model.OutputConfigUpsertRequest;
import com.ospicorp.labnotebook.outputconfig.service.OutputConfigService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Output")
public class OutputConfigController {
  private final OutputConfigService svc;

  public OutputConfigController(OutputConfigService svc) {
    this.svc = svc;
  }

  @GetMapping("/projects/{projectId}/output-config")
  @Operation(summary = "Get output config", description = "Empty body when the project has none yet.")
  public ResponseEntity<OutputConfigDto> get(@PathVariable long projectId) {
    return svc.findByProject(projectId)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.ok().build());
  }

  @PutMapping("/output-config")
  @Operation(summary = "Create or replace output config",
      description = "Keys not defined for the project are dropped.")
  public OutputConfigDto upsert(@Valid @RequestBody OutputConfigUpsertRequest request) {
    return svc.upsert(request);
  }
}
