package com.example.linguarelay.config;

import com.example.linguarelay.translation.GeminiTranslationProvider;
import com.example.linguarelay.translation.TranslationProvider;
import com.example.linguarelay.translation.UnconfiguredTranslationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared infrastructure: clock, presence timer thread, translation workers and the provider. */
@Configuration
public class RelayConfig {

  private static final Logger log = LoggerFactory.getLogger(RelayConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Single daemon thread for grace-period checks and the janitor sweep. */
  @Bean(destroyMethod = "shutdownNow")
  public ScheduledExecutorService presenceScheduler() {
    return Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "presence-grace");
      t.setDaemon(true);
      return t;
    });
  }

  /** Translation calls block on the network and on backoff; they run here, never on the timer thread. */
  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService translationExecutor(TranslationProperties props) {
    AtomicInteger n = new AtomicInteger();
    int threads = Math.max(1, props.getWorkerThreads());
    return Executors.newFixedThreadPool(threads, r -> {
      Thread t = new Thread(r, "translate-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Bean
  public TranslationProvider translationProvider(TranslationProperties props, RestTemplateBuilder builder) {
    var g = props.getGemini();
    if (g.getApiKey() == null || g.getApiKey().isBlank()) {
      log.warn("No Gemini API key (app.translation.gemini.api-key); utterances will be relayed with a placeholder");
      return new UnconfiguredTranslationProvider();
    }
    log.info("Translation via Gemini model={} baseUrl={}", g.getModel(), g.getBaseUrl());
    return new GeminiTranslationProvider(
        builder.setConnectTimeout(g.getConnectTimeout())
               .setReadTimeout(g.getReadTimeout())
               .build(),
        g);
  }
}
