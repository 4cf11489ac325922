package io.github.treetags;

import io.github.treetags.dispatch.FileError;
import io.github.treetags.files.TagDestination;
import io.github.treetags.profile.ProfileError;
import java.util.List;

/** What a run produced and which files or languages it had to leave out. */
public record RunReport(
        TagDestination destination,
        int tagsWritten,
        int filesProcessed,
        int filesSkipped,
        List<FileError> fileErrors,
        List<ProfileError> profileErrors) {

    public boolean hasErrors() {
        return !fileErrors.isEmpty() || !profileErrors.isEmpty();
    }
}
