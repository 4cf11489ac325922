package io.github.treetags.store;

import com.google.common.collect.ImmutableList;
import io.github.treetags.tags.Tag;
import io.github.treetags.tags.TagFile;
import io.github.treetags.tags.TagFileHeader;
import io.github.treetags.tags.TagLines;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Reads an existing tag file back into tags, validating it first. Every tag keeps its on-disk line so it can be
 * written back unchanged.
 */
public final class TagFileReader {
    private static final Logger logger = LogManager.getLogger(TagFileReader.class);

    public static final String PSEUDO_TAG_PREFIX = "!_";
    public static final String FORMAT_PSEUDO_TAG = "!_TAG_FILE_FORMAT";
    public static final String SORTED_PSEUDO_TAG = "!_TAG_FILE_SORTED";

    private TagFileReader() {}

    public static TagFile read(Path path) throws TagFileException {
        if (!Files.isRegularFile(path)) {
            throw new TagFileException(path, "tag file does not exist");
        }
        String content;
        try {
            content = StandardCharsets.UTF_8
                    .newDecoder()
                    .decode(ByteBuffer.wrap(Files.readAllBytes(path)))
                    .toString();
        } catch (NoSuchFileException e) {
            throw new TagFileException(path, "tag file does not exist", e);
        } catch (CharacterCodingException e) {
            throw new TagFileException(path, "tag file is not valid UTF-8", e);
        } catch (IOException e) {
            throw new TagFileException(path, "cannot read tag file: " + e.getMessage(), e);
        }
        return parse(path, content);
    }

    static TagFile parse(Path path, String content) throws TagFileException {
        // split on LF only; a CR before it stays part of the kept line
        List<String> lines = content.isEmpty() ? List.of() : Arrays.asList(content.split("\n", -1));
        if (lines.stream().allMatch(String::isEmpty)) {
            throw new TagFileException(path, "empty file has no tag header");
        }

        var pseudo = new ArrayList<String>();
        var tags = new ArrayList<Tag>();
        Integer format = null;
        Integer sorted = null;
        for (int i = 0; i < lines.size(); i++) {
            String raw = lines.get(i);
            String line = raw.endsWith("\r") ? raw.substring(0, raw.length() - 1) : raw;
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(PSEUDO_TAG_PREFIX)) {
                pseudo.add(line);
                if (line.startsWith(FORMAT_PSEUDO_TAG + "\t")) {
                    format = pseudoValue(path, line, i);
                    if (format != 1 && format != 2) {
                        throw new TagFileException(path, "unsupported tag file format " + format);
                    }
                } else if (line.startsWith(SORTED_PSEUDO_TAG + "\t")) {
                    sorted = pseudoValue(path, line, i);
                    if (sorted < 0 || sorted > 2) {
                        throw new TagFileException(path, "bad sort flag " + sorted + " on line " + (i + 1));
                    }
                }
                continue;
            }
            if (format == null) {
                throw new TagFileException(path, "missing " + FORMAT_PSEUDO_TAG + " header");
            }
            int lineNo = i + 1;
            Tag tag = TagLines.parse(line)
                    .orElseThrow(() -> new TagFileException(path, "corrupt tag on line " + lineNo));
            tags.add(raw.equals(line) ? tag : tag.withOriginalLine(raw));
        }
        if (format == null) {
            throw new TagFileException(path, "missing " + FORMAT_PSEUDO_TAG + " header");
        }
        logger.debug("Read {} existing tags from {}", tags.size(), path);
        return new TagFile(new TagFileHeader(format, sorted, ImmutableList.copyOf(pseudo)), ImmutableList.copyOf(tags));
    }

    private static int pseudoValue(Path path, String line, int index) throws TagFileException {
        String[] parts = line.split("\t", 3);
        @Nullable Integer value = parts.length >= 2 ? parseInt(parts[1]) : null;
        if (value == null) {
            throw new TagFileException(path, "malformed pseudo-tag on line " + (index + 1));
        }
        return value;
    }

    private static @Nullable Integer parseInt(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
