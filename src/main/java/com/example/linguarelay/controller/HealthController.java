package com.example.linguarelay.controller;

import com.example.linguarelay.service.RoomStore;
import com.example.linguarelay.translation.TranslationGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final RoomStore store;
  private final TranslationGateway gateway;

  @Value("${spring.profiles.active:default}")
  private String activeProfile;

  public HealthController(RoomStore store, TranslationGateway gateway) {
    this.store = store;
    this.gateway = gateway;
  }

  /** Fast liveness check */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  /** Human-readable status */
  @GetMapping("/admin/health")
  public Map<String, Object> adminHealth() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("app", "ok");
    m.put("profile", activeProfile);
    m.put("rooms", store.size());
    m.put("translation", gateway.isProviderConfigured() ? "configured" : "placeholder");
    return m;
  }
}
