package io.github.treetags.profile;

/** A grammar or tag query could not be loaded or compiled. */
public class ProfileLoadException extends Exception {
    private final String language;

    public ProfileLoadException(String language, String message) {
        super(language + ": " + message);
        this.language = language;
    }

    public ProfileLoadException(String language, String message, Throwable cause) {
        super(language + ": " + message, cause);
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }
}
