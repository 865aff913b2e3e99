package com.example.linguarelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/** Which way a room translates. Wire values match what clients send on create-room. */
public enum TranslationDirection {

    EN_TO_HI("en-to-hi", new LanguagePair("English", "Hindi")),
    HI_TO_EN("hi-to-en", new LanguagePair("Hindi", "English"));

    private final String wireValue;
    private final LanguagePair languages;

    TranslationDirection(String wireValue, LanguagePair languages) {
        this.wireValue = wireValue;
        this.languages = languages;
    }

    @JsonValue
    public String wireValue() { return wireValue; }

    public LanguagePair languages() { return languages; }

    /** Accepts the wire value ("en-to-hi") or the constant name ("EN_TO_HI"). */
    public static Optional<TranslationDirection> parse(String s) {
        if (s == null || s.isBlank()) return Optional.empty();
        String t = s.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (TranslationDirection d : values()) {
            if (d.wireValue.equals(t)) return Optional.of(d);
        }
        return Optional.empty();
    }

    @JsonCreator
    public static TranslationDirection fromJson(String s) {
        return parse(s).orElseThrow(() -> new IllegalArgumentException("Unknown translation direction: " + s));
    }

    @Override
    public String toString() { return wireValue; }
}
