package io.github.treetags.profile;

/** A profile excluded from the run because it failed to load. */
public record ProfileError(String language, Throwable cause) {
    public String describe() {
        return "language " + language + " disabled: " + cause.getMessage();
    }
}
