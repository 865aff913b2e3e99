package com.example.linguarelay.translation;

import com.example.linguarelay.model.LanguagePair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TranslationGatewayTest {

    private static final LanguagePair EN_HI = new LanguagePair("English", "Hindi");
    private static final Executor DIRECT = Runnable::run;

    /** Fails the first {@code failures} calls, then answers. */
    private static final class FlakyProvider implements TranslationProvider {
        final AtomicInteger calls = new AtomicInteger();
        final List<LanguagePair> seen = new ArrayList<>();
        final int failures;

        FlakyProvider(int failures) { this.failures = failures; }

        @Override
        public synchronized String translate(String text, LanguagePair languages) throws Exception {
            seen.add(languages);
            if (calls.incrementAndGet() <= failures) throw new IOException("upstream 503 #" + calls.get());
            return "  नमस्ते  ";
        }
    }

    @Test
    void success_onFirstAttempt_isTrimmed() {
        FlakyProvider p = new FlakyProvider(0);
        Translation t = new TranslationGateway(p, DIRECT, 3, Duration.ZERO).translate("Hello", EN_HI);

        assertEquals("नमस्ते", t.text());
        assertFalse(t.degraded());
        assertEquals(1, t.attempts());
        assertEquals(List.of(EN_HI), p.seen);
    }

    @Test
    void recovers_afterTransientFailures() {
        FlakyProvider p = new FlakyProvider(2);
        Translation t = new TranslationGateway(p, DIRECT, 3, Duration.ZERO).translate("Hello", EN_HI);

        assertFalse(t.degraded());
        assertEquals(3, t.attempts());
        assertEquals(3, p.calls.get());
    }

    @Test
    @DisplayName("always failing provider: placeholder with the last error after exactly maxAttempts calls")
    void alwaysFailing_degradesToPlaceholder() {
        FlakyProvider p = new FlakyProvider(Integer.MAX_VALUE);
        Translation t = new TranslationGateway(p, DIRECT, 3, Duration.ZERO).translate("Hello", EN_HI);

        assertTrue(t.degraded());
        assertEquals(3, p.calls.get());
        assertEquals("[Translation unavailable: upstream 503 #3]", t.text());
    }

    @Test
    void errorWithoutMessage_usesExceptionType() {
        TranslationProvider p = (text, langs) -> { throw new IllegalStateException(); };
        Translation t = new TranslationGateway(p, DIRECT, 1, Duration.ZERO).translate("Hello", EN_HI);
        assertEquals("[Translation unavailable: IllegalStateException]", t.text());
    }

    @Test
    void nullResult_countsAsFailure() {
        TranslationProvider p = (text, langs) -> null;
        Translation t = new TranslationGateway(p, DIRECT, 2, Duration.ZERO).translate("Hello", EN_HI);
        assertTrue(t.degraded());
        assertEquals(2, t.attempts());
    }

    @Test
    void backoff_growsLinearlyWithAttempt() {
        FlakyProvider p = new FlakyProvider(Integer.MAX_VALUE);
        TranslationGateway g = new TranslationGateway(p, DIRECT, 3, Duration.ofMillis(40));

        long start = System.nanoTime();
        g.translate("Hello", EN_HI);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // 1*40 + 2*40; no sleep after the last attempt
        assertTrue(elapsedMs >= 120, "expected at least 120ms of backoff, got " + elapsedMs);
    }

    @Test
    void retryInterval_isLinearInAttemptNumber() {
        var interval = TranslationGateway.linearBackoff(Duration.ofSeconds(1));
        assertEquals(1000L, interval.apply(1));
        assertEquals(2000L, interval.apply(2));
        assertEquals(0L, TranslationGateway.linearBackoff(Duration.ZERO).apply(2));
    }

    @Test
    void interruptedBackoff_degradesImmediately_andKeepsInterruptFlag() {
        FlakyProvider p = new FlakyProvider(Integer.MAX_VALUE);
        TranslationGateway g = new TranslationGateway(p, DIRECT, 3, Duration.ofSeconds(30));

        Thread.currentThread().interrupt();
        try {
            Translation t = g.translate("Hello", EN_HI);
            assertTrue(t.degraded());
            assertEquals(1, p.calls.get());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted(); // clear for the next test
        }
    }

    @Test
    void unconfiguredProvider_shortCircuitsToPlaceholder() {
        TranslationGateway g = new TranslationGateway(new UnconfiguredTranslationProvider(), DIRECT, 3, Duration.ofSeconds(30));
        Translation t = g.translate("Hello", EN_HI);

        assertTrue(t.degraded());
        assertEquals(0, t.attempts());
        assertFalse(g.isProviderConfigured());
        assertTrue(t.text().startsWith("[Translation unavailable: "));
    }

    @Test
    void translateAsync_runsOnGivenExecutor() throws Exception {
        AtomicInteger submitted = new AtomicInteger();
        Executor counting = r -> { submitted.incrementAndGet(); r.run(); };
        TranslationGateway g = new TranslationGateway(new FlakyProvider(0), counting, 3, Duration.ZERO);

        Translation t = g.translateAsync("Hello", EN_HI).get(5, TimeUnit.SECONDS);
        assertEquals("नमस्ते", t.text());
        assertEquals(1, submitted.get());
    }

    @Test
    void rejectsNonPositiveAttempts() {
        assertThrows(IllegalArgumentException.class,
                () -> new TranslationGateway(new FlakyProvider(0), DIRECT, 0, Duration.ZERO));
    }
}
