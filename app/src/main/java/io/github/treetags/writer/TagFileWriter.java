package io.github.treetags.writer;

import io.github.treetags.tags.KindStyle;
import io.github.treetags.tags.Tag;
import io.github.treetags.tags.TagLines;
import io.github.treetags.tags.TagOrder;
import io.github.treetags.util.AtomicWrites;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Serializes a tag set: pseudo-tag header, then one line per tag, sorted byte-wise when requested. */
public final class TagFileWriter {
    private static final Logger logger = LogManager.getLogger(TagFileWriter.class);

    public static final String PROGRAM_NAME = "treetags";

    private final boolean sorted;
    private final KindStyle kindStyle;

    public TagFileWriter(boolean sorted, KindStyle kindStyle) {
        this.sorted = sorted;
        this.kindStyle = kindStyle;
    }

    private record Line(TagOrder.SortKey key, String text) {}

    public List<String> header() {
        return List.of(
                "!_TAG_FILE_FORMAT\t2\t/extended format; --format=1 will not append ;\" to lines/",
                "!_TAG_FILE_SORTED\t" + (sorted ? 1 : 0) + "\t/0=unsorted, 1=sorted, 2=foldcase/",
                "!_TAG_PROGRAM_NAME\t" + PROGRAM_NAME + "\t//");
    }

    /** Tag lines in output order, header excluded. */
    public List<String> lines(List<Tag> tags) {
        if (!sorted) {
            return tags.stream().map(t -> TagLines.format(t, kindStyle)).toList();
        }
        var lines = new ArrayList<Line>(tags.size());
        for (Tag tag : tags) {
            String text = TagLines.format(tag, kindStyle);
            lines.add(new Line(TagOrder.SortKey.of(tag, text), text));
        }
        lines.sort((a, b) -> a.key().compareTo(b.key()));
        return lines.stream().map(Line::text).toList();
    }

    public String render(List<Tag> tags) {
        var sb = new StringBuilder();
        for (String h : header()) {
            sb.append(h).append('\n');
        }
        for (String line : lines(tags)) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    /**
     * Writes the complete file content before replacing {@code destination}, so a failure leaves any previous file
     * intact.
     */
    public void write(List<Tag> tags, Path destination) throws IOException {
        byte[] content = render(tags).getBytes(StandardCharsets.UTF_8);
        AtomicWrites.atomicOverwrite(destination, content);
        logger.info("Wrote {} tags to {}", tags.size(), destination);
    }

    public void write(List<Tag> tags, OutputStream out) throws IOException {
        out.write(render(tags).getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
