package com.example.linguarelay.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/** CORS for the control-plane endpoints (/api/**), same origin list as the WebSocket. */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

  private final List<String> originPatterns;

  public CorsConfig(@Value("${app.cors.allowed-origins:${app.websocket.allowed-origins:http://localhost:3000}}") String originsCsv) {
    this.originPatterns = OriginPatterns.fromCsv(originsCsv);
  }

  @Override
  public void addCorsMappings(@NonNull CorsRegistry registry) {
    registry.addMapping("/api/**")
            .allowedOriginPatterns(originPatterns.toArray(String[]::new))
            .allowedMethods("GET", "POST")
            .allowCredentials(true);
  }
}
