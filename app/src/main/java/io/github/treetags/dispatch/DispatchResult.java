package io.github.treetags.dispatch;

import io.github.treetags.tags.Tag;
import java.util.List;

/**
 * Outcome of the parallel phase.
 *
 * @param tags tags of every successfully processed file, grouped by file in input order
 * @param errors per-file failures, in input order
 * @param processed files that were parsed, whether or not they yielded tags
 * @param skipped files without a language profile
 */
public record DispatchResult(List<Tag> tags, List<FileError> errors, int processed, int skipped) {}
