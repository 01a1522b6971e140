package com.obsidx.note;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.Link;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;

/**
 * Turns raw markdown into a {@link Note}. Extraction never fails on bad
 * input: an unreadable frontmatter block becomes an empty object.
 */
public class NoteExtractor {
    private static final Logger log = LoggerFactory.getLogger(NoteExtractor.class);

    static final String UNTITLED = "Untitled";
    private static final String DELIMITER = "---";
    private static final Pattern INLINE_TAG = Pattern.compile("(?m)(?:^|\\s)#([\\p{L}\\p{N}_/\\-]+)");
    private static final Pattern WIKILINK = Pattern.compile("\\[\\[([^\\[\\]]+)\\]\\]");

    private final Parser parser = Parser.builder().build();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public Note extract(VaultFile file, String collection) {
        return extract(file.absolutePath(), file.relativePath(), file.rawText(), file.mtime(), collection);
    }

    public Note extract(Path absolutePath, String relativePath, String rawText, long mtime, String collection) {
        String raw = rawText == null ? "" : rawText;
        FrontmatterSplit split = splitFrontmatter(raw);
        ObjectNode frontmatter = parseFrontmatter(split.yaml(), relativePath);
        String body = split.body();

        Set<String> tags = new LinkedHashSet<>(frontmatterTags(frontmatter));
        tags.addAll(inlineTags(body));

        List<String> headings = new ArrayList<>();
        Set<String> links = new LinkedHashSet<>();
        walk(parser.parse(body), headings, links);
        links.addAll(wikilinks(body));

        String title = headings.isEmpty() ? fallbackTitle(relativePath) : headings.get(0);
        return new Note(
                Note.idFor(absolutePath),
                relativePath,
                collection,
                title,
                new ArrayList<>(tags),
                headings,
                new ArrayList<>(links),
                frontmatter,
                body,
                mtime);
    }

    static FrontmatterSplit splitFrontmatter(String raw) {
        int firstEol = raw.indexOf('\n');
        if (firstEol < 0 || !raw.substring(0, firstEol).strip().equals(DELIMITER)) {
            return new FrontmatterSplit(null, raw);
        }
        int pos = firstEol + 1;
        while (pos <= raw.length()) {
            int eol = raw.indexOf('\n', pos);
            int lineEnd = eol < 0 ? raw.length() : eol;
            if (raw.substring(pos, lineEnd).strip().equals(DELIMITER)) {
                String yaml = raw.substring(firstEol + 1, pos);
                String body = eol < 0 ? "" : raw.substring(eol + 1);
                return new FrontmatterSplit(yaml, body);
            }
            if (eol < 0) {
                break;
            }
            pos = eol + 1;
        }
        return new FrontmatterSplit(null, raw);
    }

    private ObjectNode parseFrontmatter(String yaml, String relativePath) {
        if (yaml == null || yaml.isBlank()) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            JsonNode node = yamlMapper.readTree(yaml);
            if (node instanceof ObjectNode object) {
                return object;
            }
            log.debug("note.frontmatter.not-a-mapping path={}", relativePath);
        } catch (JsonProcessingException e) {
            log.warn("note.frontmatter.invalid path={} reason={}", relativePath, e.getOriginalMessage());
        }
        return JsonNodeFactory.instance.objectNode();
    }

    static List<String> frontmatterTags(ObjectNode frontmatter) {
        JsonNode tagsNode = frontmatter.get("tags");
        List<String> tags = new ArrayList<>();
        if (tagsNode == null) {
            return tags;
        }
        if (tagsNode.isTextual()) {
            addTag(tags, tagsNode.asText());
        } else if (tagsNode.isArray()) {
            for (JsonNode element : tagsNode) {
                if (element.isTextual()) {
                    addTag(tags, element.asText());
                }
            }
        }
        return tags;
    }

    private static void addTag(List<String> tags, String value) {
        String tag = value.strip();
        if (tag.startsWith("#")) {
            tag = tag.substring(1);
        }
        if (!tag.isEmpty()) {
            tags.add(tag);
        }
    }

    static List<String> inlineTags(String body) {
        List<String> tags = new ArrayList<>();
        Matcher matcher = INLINE_TAG.matcher(body);
        while (matcher.find()) {
            tags.add(matcher.group(1));
        }
        return tags;
    }

    static List<String> wikilinks(String body) {
        List<String> targets = new ArrayList<>();
        Matcher matcher = WIKILINK.matcher(body);
        while (matcher.find()) {
            String inner = matcher.group(1);
            int alias = inner.indexOf('|');
            String target = (alias >= 0 ? inner.substring(0, alias) : inner).strip();
            if (!target.isEmpty()) {
                targets.add(target);
            }
        }
        return targets;
    }

    private static void walk(Node parent, List<String> headings, Set<String> links) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNext()) {
            if (node instanceof Heading heading) {
                StringBuilder text = new StringBuilder();
                collectText(heading, text);
                String headingText = text.toString().strip();
                if (!headingText.isEmpty()) {
                    headings.add(headingText);
                }
            } else if (node instanceof Link link) {
                addLink(links, link.getUrl().toString());
            } else if (node instanceof AutoLink autoLink) {
                addLink(links, autoLink.getUrl().toString());
            }
            walk(node, headings, links);
        }
    }

    private static void collectText(Node parent, StringBuilder out) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNext()) {
            if (node instanceof Text) {
                out.append(node.getChars());
            } else if (node instanceof Code code) {
                out.append(code.getText());
            } else {
                collectText(node, out);
            }
        }
    }

    private static void addLink(Set<String> links, String destination) {
        String trimmed = destination.strip();
        if (!trimmed.isEmpty()) {
            links.add(trimmed);
        }
    }

    static String fallbackTitle(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return UNTITLED;
        }
        String fileName = relativePath.substring(relativePath.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        String stem = dot >= 0 ? fileName.substring(0, dot) : fileName;
        return stem.isBlank() ? UNTITLED : stem;
    }

    record FrontmatterSplit(String yaml, String body) {
    }
}
