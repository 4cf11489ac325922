package io.github.treetags.store;

import io.github.treetags.tags.Tag;
import io.github.treetags.tags.TagFile;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Append-mode reconciliation. Existing tags of a file being regenerated are dropped, whatever the outcome of
 * regenerating it; all other existing tags are kept untouched.
 */
public final class TagMerger {
    private static final Logger logger = LogManager.getLogger(TagMerger.class);

    private TagMerger() {}

    /** Existing tags that survive, in on-disk order. */
    public static List<Tag> partition(TagFile existing, Set<String> regeneratedFiles) {
        var kept = new ArrayList<Tag>(existing.tags().size());
        int discarded = 0;
        for (Tag tag : existing.tags()) {
            if (regeneratedFiles.contains(tag.file())) {
                discarded++;
            } else {
                kept.add(tag);
            }
        }
        logger.debug("Append: keeping {} existing tags, replacing {}", kept.size(), discarded);
        return kept;
    }

    public static TagStore merge(TagFile existing, Set<String> regeneratedFiles, List<Tag> produced) {
        var store = new TagStore();
        store.keep(partition(existing, regeneratedFiles));
        store.add(produced);
        return store;
    }
}
