package com.example.linguarelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties("app.translation")
public class TranslationProperties {

  /** Total attempts per utterance, including the first one. */
  private int maxAttempts = 3;

  /** Backoff after failed attempt n is n * baseDelay. */
  private Duration baseDelay = Duration.ofSeconds(1);

  /** Size of the translation worker pool. */
  private int workerThreads = 4;

  /** Gemini subsection */
  private Gemini gemini = new Gemini();

  // --- getters/setters ---

  public int getMaxAttempts() { return maxAttempts; }
  public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

  public Duration getBaseDelay() { return baseDelay; }
  public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }

  public int getWorkerThreads() { return workerThreads; }
  public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

  public Gemini getGemini() { return gemini; }
  public void setGemini(Gemini gemini) { this.gemini = gemini; }

  /** Mutable holder for Gemini REST options. */
  public static class Gemini {
    private String apiKey;
    private String model = "gemini-pro";
    private String baseUrl = "https://generativelanguage.googleapis.com";
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(20);

    // --- getters/setters ---

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
  }
}
