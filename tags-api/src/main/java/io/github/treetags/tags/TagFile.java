package io.github.treetags.tags;

import com.google.common.collect.ImmutableList;

/** Parsed tag file: header plus tag lines in on-disk order. */
public record TagFile(TagFileHeader header, ImmutableList<Tag> tags) {}
