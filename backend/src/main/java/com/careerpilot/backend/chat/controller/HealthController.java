package com.careerpilot.backend.chat.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("healthy", "API is running");
  }

  public record HealthResponse(String status, String message) {}
}
