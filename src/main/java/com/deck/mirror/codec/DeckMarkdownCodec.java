package com.deck.mirror.codec;

import com.deck.mirror.core.model.Card;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads and writes the flat text format of a deck file.
 *
 * <p>A deck file is a sequence of three-part blocks separated by delimiter lines:</p>
 * <pre>
 * ---
 * card_id: AbCdEfGh
 * tags: ["python", "basics"]
 * archived: true
 * ---
 * What is Python?
 * ---
 * A programming language
 * </pre>
 *
 * <p>{@code tags} and {@code archived} are only written when they carry information.
 * Between blocks, sections that are empty or start with a heading marker ({@code #})
 * are skipped. Inside a card an empty section is an empty question or answer, and a
 * heading section is still skipped so hand-written files can carry headings.</p>
 *
 * <p>Card text that would read as structure is escaped with a leading backslash: any
 * line that is a delimiter once trimmed, and a first line starting with {@code #}.
 * Lines already starting with backslashes followed by either form get one more, so
 * unescaping removes exactly one.</p>
 */
public class DeckMarkdownCodec {
    private static final Logger log = LoggerFactory.getLogger(DeckMarkdownCodec.class);

    public static final String DELIMITER = "---";

    private static final String CARD_ID = "card_id";
    private static final String TAGS = "tags";
    private static final String ARCHIVED = "archived";

    private static final char ESCAPE = '\\';
    private static final Pattern DELIMITER_LINE = Pattern.compile("\\s*\\\\*---\\s*");
    private static final Pattern HEADING_LINE = Pattern.compile("\\s*\\\\*#.*");

    private enum State {
        EXPECT_FRONTMATTER,
        EXPECT_QUESTION,
        EXPECT_ANSWER
    }

    private final ObjectMapper objectMapper;

    public DeckMarkdownCodec() {
        this(new ObjectMapper());
    }

    public DeckMarkdownCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses deck text into cards, in file order. Never returns null.
     */
    public List<Card> parse(String text) {
        List<Card> cards = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return cards;
        }

        State state = State.EXPECT_FRONTMATTER;
        Map<String, String> frontmatter = Map.of();
        String question = null;

        for (String section : splitSections(text)) {
            if (section.startsWith("#") || (section.isEmpty() && state == State.EXPECT_FRONTMATTER)) {
                continue;
            }
            switch (state) {
                case EXPECT_FRONTMATTER -> {
                    frontmatter = parseFrontmatter(section);
                    state = State.EXPECT_QUESTION;
                }
                case EXPECT_QUESTION -> {
                    question = unescape(section);
                    state = State.EXPECT_ANSWER;
                }
                case EXPECT_ANSWER -> {
                    cards.add(new Card(
                            parseCardId(frontmatter.get(CARD_ID)),
                            question,
                            unescape(section),
                            parseTags(frontmatter.get(TAGS)),
                            parseArchived(frontmatter.get(ARCHIVED))));
                    frontmatter = Map.of();
                    question = null;
                    state = State.EXPECT_FRONTMATTER;
                }
            }
        }

        if (state != State.EXPECT_FRONTMATTER) {
            log.debug("codec.trailing_block state={} ignored", state);
        }
        return cards;
    }

    /**
     * Serializes a single card to its text block (no trailing newline).
     */
    public String serialize(Card card) {
        StringBuilder sb = new StringBuilder();
        sb.append(DELIMITER).append('\n');
        sb.append(CARD_ID).append(": ").append(card.id() != null ? card.id() : "null").append('\n');
        if (!card.tags().isEmpty()) {
            sb.append(TAGS).append(": ").append(formatTags(card.tags())).append('\n');
        }
        if (card.archived()) {
            sb.append(ARCHIVED).append(": true").append('\n');
        }
        sb.append(DELIMITER).append('\n');
        sb.append(escape(card.question().strip())).append('\n');
        sb.append(DELIMITER).append('\n');
        sb.append(escape(card.answer().strip()));
        return sb.toString();
    }

    /**
     * Serializes a whole deck, one block per card, each followed by a newline.
     */
    public String serialize(List<Card> cards) {
        StringBuilder sb = new StringBuilder();
        for (Card card : cards) {
            sb.append(serialize(card)).append('\n');
        }
        return sb.toString();
    }

    private List<String> splitSections(String text) {
        List<String> sections = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : text.split("\\R", -1)) {
            if (line.strip().equals(DELIMITER)) {
                sections.add(current.toString().strip());
                current.setLength(0);
            } else {
                if (current.length() > 0) {
                    current.append('\n');
                }
                current.append(line);
            }
        }
        sections.add(current.toString().strip());
        return sections;
    }

    private static String escape(String text) {
        String[] lines = text.split("\\R", -1);
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            String line = lines[i];
            if (DELIMITER_LINE.matcher(line).matches() || (i == 0 && HEADING_LINE.matcher(line).matches())) {
                sb.append(ESCAPE);
            }
            sb.append(line);
        }
        return sb.toString();
    }

    private static String unescape(String section) {
        String[] lines = section.split("\n", -1);
        StringBuilder sb = new StringBuilder(section.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            String line = lines[i];
            if (!line.isEmpty() && line.charAt(0) == ESCAPE) {
                String rest = line.substring(1);
                if (DELIMITER_LINE.matcher(rest).matches() || (i == 0 && HEADING_LINE.matcher(rest).matches())) {
                    line = rest;
                }
            }
            sb.append(line);
        }
        return sb.toString();
    }

    private Map<String, String> parseFrontmatter(String section) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String line : section.split("\n")) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            values.put(line.substring(0, colon).strip(), line.substring(colon + 1).strip());
        }
        return values;
    }

    private String parseCardId(String value) {
        if (value == null) {
            return null;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.isEmpty() || lower.equals("null") || lower.equals("none")) {
            return null;
        }
        return value;
    }

    private Set<String> parseTags(String value) {
        Set<String> tags = new LinkedHashSet<>();
        if (value == null || value.isEmpty()) {
            return tags;
        }
        try {
            JsonNode node = objectMapper.readTree(value);
            if (node == null || !node.isArray()) {
                log.debug("codec.tags_not_array value={}", value);
                return tags;
            }
            for (JsonNode element : node) {
                if (element.isValueNode() && !element.isNull()) {
                    tags.add(element.asText());
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("codec.tags_malformed value={} error={}", value, e.getOriginalMessage());
            tags.clear();
        }
        return tags;
    }

    private boolean parseArchived(String value) {
        return value != null && value.equalsIgnoreCase("true");
    }

    private String formatTags(Set<String> tags) {
        List<String> quoted = new ArrayList<>(tags.size());
        for (String tag : tags) {
            try {
                quoted.add(objectMapper.writeValueAsString(tag));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot encode tag: " + tag, e);
            }
        }
        return "[" + String.join(", ", quoted) + "]";
    }
}
