package com.example.linguarelay.translation;

import com.example.linguarelay.config.TranslationProperties;
import com.example.linguarelay.model.LanguagePair;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Retry wrapper around the translation provider, on a Resilience4j {@link Retry}.
 * - up to maxAttempts calls, waiting attempt * baseDelay after each failure
 * - never throws for provider failures: the last error becomes a "[Translation unavailable: ...]" placeholder
 * - stateless, safe to call from any number of threads
 */
@Service
public class TranslationGateway {

    private static final Logger log = LoggerFactory.getLogger(TranslationGateway.class);

    private final TranslationProvider provider;
    private final Executor executor;
    private final int maxAttempts;
    private final Retry retry;

    @Autowired
    public TranslationGateway(TranslationProvider provider,
                              @Qualifier("translationExecutor") Executor executor,
                              TranslationProperties props) {
        this(provider, executor, props.getMaxAttempts(), props.getBaseDelay());
    }

    public TranslationGateway(TranslationProvider provider, Executor executor, int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        this.provider = Objects.requireNonNull(provider, "provider");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.maxAttempts = maxAttempts;
        this.retry = Retry.of("translation", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(linearBackoff(Objects.requireNonNull(baseDelay, "baseDelay")))
                .build());
    }

    /** Wait before retry n (1-based) is n * baseDelay. */
    static IntervalFunction linearBackoff(Duration baseDelay) {
        long baseMs = Math.max(0L, baseDelay.toMillis());
        return attempt -> attempt * baseMs;
    }

    /** Blocking; runs retries and backoff on the calling thread. */
    public Translation translate(String text, LanguagePair languages) {
        if (!provider.isConfigured()) {
            return Translation.unavailable("No translation provider configured", 0);
        }

        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<Exception> lastFailure = new AtomicReference<>();
        CheckedSupplier<String> call = Retry.decorateCheckedSupplier(retry, () -> {
            int attempt = attempts.incrementAndGet();
            try {
                String out = provider.translate(text, languages);
                if (out == null) throw new IllegalStateException("Provider returned no text");
                return out;
            } catch (Exception e) {
                lastFailure.set(e);
                log.warn("Translation error (attempt {}/{}, {} -> {}): {}",
                        attempt, maxAttempts, languages.source(), languages.target(), describe(e));
                throw e;
            }
        });

        try {
            return Translation.ok(call.get().trim(), attempts.get());
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            Exception last = lastFailure.get();
            String reason = describe(last != null ? last : t);
            if (attempts.get() < maxAttempts) {
                // retries stop early only when the wait between attempts is interrupted
                Thread.currentThread().interrupt();
                log.warn("Translation backoff interrupted after attempt {}", attempts.get());
            }
            return Translation.unavailable(reason, attempts.get());
        }
    }

    /** Runs {@link #translate} on the translation executor. */
    public CompletableFuture<Translation> translateAsync(String text, LanguagePair languages) {
        return CompletableFuture.supplyAsync(() -> translate(text, languages), executor);
    }

    public boolean isProviderConfigured() {
        return provider.isConfigured();
    }

    private static String describe(Throwable e) {
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
    }
}
