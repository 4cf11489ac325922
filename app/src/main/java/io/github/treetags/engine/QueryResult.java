package io.github.treetags.engine;

import java.util.List;
import org.treesitter.TSTree;

/**
 * Captures of one file in pre-order. Holds the tree so that the captured nodes remain usable while the result is
 * being normalized.
 */
public record QueryResult(SourceText source, List<CaptureMatch> captures, TSTree tree) {}
