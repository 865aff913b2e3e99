package com.example.linguarelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties("app.relay")
public class RelayProperties {

  /** How long a dropped connection may take to come back before the user is removed. */
  private Duration shortGrace = Duration.ofSeconds(20);

  /** How long an empty room survives after its last user left. */
  private Duration longGrace = Duration.ofMinutes(5);

  /** Sweep period of the room janitor. */
  private Duration janitorPeriod = Duration.ofMinutes(30);

  /** Empty rooms idle for longer than this are reclaimed by the janitor. */
  private Duration idleThreshold = Duration.ofHours(1);

  // --- getters/setters ---

  public Duration getShortGrace() { return shortGrace; }
  public void setShortGrace(Duration shortGrace) { this.shortGrace = shortGrace; }

  public Duration getLongGrace() { return longGrace; }
  public void setLongGrace(Duration longGrace) { this.longGrace = longGrace; }

  public Duration getJanitorPeriod() { return janitorPeriod; }
  public void setJanitorPeriod(Duration janitorPeriod) { this.janitorPeriod = janitorPeriod; }

  public Duration getIdleThreshold() { return idleThreshold; }
  public void setIdleThreshold(Duration idleThreshold) { this.idleThreshold = idleThreshold; }
}
