package com.ospicorp.labnotebook.web;

import io.swagger.v3.oas.annotations.Hidden;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Hidden
public class RootController {

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of("service", "lab-notebook", "status", "ok");
  }

  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("ok", true));
  }
}
