package com.example.linguarelay.model;

import java.util.Objects;

/** Source and target language names as passed to the translation provider. */
public record LanguagePair(String source, String target) {
    public LanguagePair {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }
}
