package com.ospicorp.loadshape.api;

import com.ospicorp.loadshape.series.service.ExclusionCalendars;
import io.swagger.v3.oas.annotations.Operation;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

  private final ExclusionCalendars calendars;

  public RootController(ExclusionCalendars calendars) {
    this.calendars = calendars;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of("service", "loadshape-service", "status", "ok");
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }

  @GetMapping("/v1/exclusion-calendars")
  @Operation(summary = "Names accepted in named_exclusions")
  public Map<String, List<String>> exclusionCalendars() {
    return Map.of("calendars", List.copyOf(calendars.names()));
  }
}
