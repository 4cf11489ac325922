package io.github.treetags.store;

import io.github.treetags.tags.Tag;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Tags of one run in merge order: tags kept from an existing file first, in their on-disk order, then the tags
 * produced by this run. Filled single-threaded after the workers have joined.
 */
public final class TagStore {
    private final List<Tag> kept = new ArrayList<>();
    private final List<Tag> produced = new ArrayList<>();

    public void keep(Collection<Tag> tags) {
        kept.addAll(tags);
    }

    public void add(Collection<Tag> tags) {
        produced.addAll(tags);
    }

    public List<Tag> tags() {
        var all = new ArrayList<Tag>(kept.size() + produced.size());
        all.addAll(kept);
        all.addAll(produced);
        return all;
    }

    public int keptCount() {
        return kept.size();
    }

    public int producedCount() {
        return produced.size();
    }

    public int size() {
        return kept.size() + produced.size();
    }
}
