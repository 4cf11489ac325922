package io.github.treetags.normalize;

import io.github.treetags.config.KindFilter;
import io.github.treetags.engine.CaptureMatch;
import io.github.treetags.engine.CaptureNames;
import io.github.treetags.engine.QueryResult;
import io.github.treetags.engine.SourceText;
import io.github.treetags.profile.AddressMode;
import io.github.treetags.profile.BuiltInProfiles;
import io.github.treetags.profile.FieldRule;
import io.github.treetags.profile.Kind;
import io.github.treetags.profile.LanguageProfile;
import io.github.treetags.profile.TagRole;
import io.github.treetags.tags.Tag;
import io.github.treetags.tags.TagAddress;
import io.github.treetags.tags.TagScope;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Turns the captures of one file into tags: kind lookup, name resolution, scope chains and extension fields.
 *
 * <p>Scopes come from an explicit stack of open definitions. Captures arrive in pre-order, so a definition is seen
 * before everything nested in it; entries are popped once a capture no longer lies inside their byte range.
 *
 * <p>Instances hold no per-file state and may be shared by all workers.
 */
public final class TagNormalizer {
    private static final Logger logger = LogManager.getLogger(TagNormalizer.class);

    public static final String FILE_KIND = "F";
    public static final String FILE_KIND_NAME = "file";

    private final NormalizeOptions options;
    private final Map<LanguageProfile, KindFilter> kindFilters = new ConcurrentHashMap<>();

    public TagNormalizer(NormalizeOptions options) {
        this.options = options;
    }

    /** {@code nameLine} is the 0-based row of the name; addresses point there rather than at leading annotations. */
    private record Candidate(CaptureMatch capture, Kind kind, String name, int nameLine, int priority) {}

    private record ResolvedName(String text, int line) {}

    private record OpenScope(CaptureMatch capture, Kind kind, String qualifiedName) {}

    public List<Tag> normalize(QueryResult result, LanguageProfile profile, String tagFile) {
        var tags = new ArrayList<Tag>();
        if (options.extras().fileEntries()) {
            tags.add(fileEntry(tagFile));
        }

        List<Candidate> definitions = dedupe(candidates(result.captures(), profile));
        KindFilter filter = kindFilter(profile);
        AddressMode mode = options.addressOverride() != null ? options.addressOverride() : profile.addressMode();

        Deque<OpenScope> open = new ArrayDeque<>();
        for (Candidate c : definitions) {
            while (!open.isEmpty() && !open.peek().capture().encloses(c.capture())) {
                open.pop();
            }
            OpenScope parent = open.peek();

            Kind kind = c.kind();
            if (kind.memberKindCode() != null && parent != null && parent.kind().role() == TagRole.TYPE) {
                kind = profile.kinds().byCode(kind.memberKindCode()).orElse(kind);
            }
            String qualified = parent == null ? c.name() : parent.qualifiedName() + profile.scopeSeparator() + c.name();
            if (kind.role().opensScope()) {
                open.push(new OpenScope(c.capture(), kind, qualified));
            }
            // disabled kinds still scope their children
            if (!filter.isEnabled(kind)) {
                continue;
            }

            TagScope scope = parent == null
                    ? null
                    : new TagScope(parent.kind().code(), parent.kind().name(), parent.qualifiedName());
            var tag = new Tag(
                    c.name(),
                    tagFile,
                    address(result.source(), c.nameLine(), mode),
                    kind.code(),
                    kind.name(),
                    options.fields().scopeEnabled() ? scope : null,
                    fields(profile, c));
            tags.add(tag);
            if (options.extras().qualified() && parent != null) {
                tags.add(tag.withName(qualified));
            }
        }
        logger.trace("{}: {} definitions, {} tags", tagFile, definitions.size(), tags.size());
        return tags;
    }

    private List<Candidate> candidates(List<CaptureMatch> captures, LanguageProfile profile) {
        Map<Integer, CaptureMatch> names = new HashMap<>();
        for (CaptureMatch cm : captures) {
            if (cm.name().equals(CaptureNames.NAME)) {
                names.putIfAbsent(cm.matchId(), cm);
            }
        }

        var result = new ArrayList<Candidate>();
        for (CaptureMatch cm : captures) {
            if (!CaptureNames.isDefinition(cm.name())) {
                continue;
            }
            var kind = profile.kinds().lookup(cm.name());
            if (kind.isEmpty()) {
                logger.trace("No kind for capture {} in {}", cm.name(), profile.language());
                continue;
            }
            ResolvedName name = resolveName(cm, names.get(cm.matchId()));
            if (name == null) {
                continue;
            }
            result.add(new Candidate(cm, kind.get(), name.text(), name.line(), profile.kinds().priority(cm.name())));
        }
        return result;
    }

    /** One candidate per node range; the kind declared first wins, then the earliest capture. */
    private static List<Candidate> dedupe(List<Candidate> candidates) {
        var byRange = new LinkedHashMap<Long, Candidate>();
        for (Candidate c : candidates) {
            long key = ((long) c.capture().startByte() << 32) | (c.capture().endByte() & 0xFFFFFFFFL);
            byRange.merge(key, c, (existing, incoming) -> incoming.priority() < existing.priority() ? incoming : existing);
        }
        return List.copyOf(byRange.values());
    }

    private static @Nullable ResolvedName resolveName(CaptureMatch definition, @Nullable CaptureMatch nameCapture) {
        String name = null;
        int line = definition.startLine();
        if (nameCapture != null) {
            name = nameCapture.text();
            line = nameCapture.startLine();
        } else {
            TSNode nameNode = definition.node().getChildByFieldName("name");
            if (nameNode != null && !nameNode.isNull()) {
                name = definition.source().slice(nameNode.getStartByte(), nameNode.getEndByte());
                line = nameNode.getStartPoint().getRow();
            }
        }
        if (name == null) {
            return null;
        }
        name = name.strip();
        if (name.isEmpty() || name.equals("_") || name.indexOf('\t') >= 0 || name.indexOf('\n') >= 0) {
            return null;
        }
        return new ResolvedName(name, line);
    }

    private static TagAddress address(SourceText source, int line, AddressMode mode) {
        if (mode == AddressMode.LINE) {
            return new TagAddress.LineNumber(line + 1);
        }
        return TagAddress.searchPattern(source.line(line));
    }

    private Map<String, String> fields(LanguageProfile profile, Candidate c) {
        var fields = new LinkedHashMap<String, String>();
        for (FieldRule rule : profile.fieldRules()) {
            if (!rule.appliesTo(c.capture().name())
                    || !options.fields().isFieldEnabled(rule.key())
                    || fields.containsKey(rule.key())) {
                continue;
            }
            String value = FieldExtractor.extract(rule, c.capture(), c.name(), c.nameLine());
            if (value != null) {
                fields.put(rule.key(), value);
            }
        }
        return fields;
    }

    /** The extra entry naming the file itself. */
    public Tag fileEntry(String tagFile) {
        int slash = tagFile.lastIndexOf('/');
        String base = slash >= 0 && slash < tagFile.length() - 1 ? tagFile.substring(slash + 1) : tagFile;
        return new Tag(base, tagFile, new TagAddress.LineNumber(1), FILE_KIND, FILE_KIND_NAME, null, Map.of());
    }

    KindFilter kindFilter(LanguageProfile profile) {
        return kindFilters.computeIfAbsent(profile, p -> {
            String kindsOption = kindsOptionFor(p);
            return kindsOption == null ? KindFilter.defaults(p.kinds()) : KindFilter.parse(kindsOption, p.kinds());
        });
    }

    private @Nullable String kindsOptionFor(LanguageProfile profile) {
        for (var e : options.kindSpecs().entrySet()) {
            String key = e.getKey().trim().toLowerCase(Locale.ROOT);
            String canonical = BuiltInProfiles.forLanguage(key).map(d -> d.language()).orElse(key);
            if (canonical.equals(profile.language())) {
                return e.getValue();
            }
        }
        return null;
    }
}
