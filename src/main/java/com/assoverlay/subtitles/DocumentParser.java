package com.assoverlay.subtitles;

import com.assoverlay.AppLogger;
import com.assoverlay.models.AssDocument;
import com.assoverlay.models.DialogueEvent;
import com.assoverlay.models.StyleDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the text of an ASS script into an {@link AssDocument}.
 * <p>
 * The parser never fails on content: unknown sections, unknown line prefixes and
 * unparseable fields are skipped or left absent. Short {@code Style:} and
 * {@code Dialogue:} rows yield null attributes for the missing fields.
 */
public class DocumentParser {

    public static final String STYLE_PREFIX = "Style:";
    public static final String DIALOGUE_PREFIX = "Dialogue:";
    public static final int STYLE_FIELD_COUNT = 23;
    public static final int DIALOGUE_FIXED_FIELD_COUNT = 9;

    private static final String COMMENT_PREFIX = ";";
    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final String FLAG_TRUE = "-1";
    private static final Pattern INFO_LINE = Pattern.compile("^([^:]+):\\s*(.*)$");

    public AssDocument parse(String content) {
        Session session = new Session();
        if (content != null) {
            for (String rawLine : content.split("\n", -1)) {
                session.accept(trimLine(rawLine));
            }
        }
        AssDocument document = new AssDocument(session.scriptInfo, session.styles, session.dialogues);
        log("Parsed script: " + document.getScriptInfo().size() + " info key(s), "
            + document.getStyles().size() + " style(s), "
            + document.getDialogues().size() + " dialogue(s), "
            + session.skipped + " line(s) skipped");
        return document;
    }

    /**
     * Parses the body of a {@code Style:} line (the part after the prefix).
     */
    public StyleDefinition parseStyle(String body) {
        String[] parts = body.split(",", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }
        return new StyleDefinition.Builder()
            .name(field(parts, 0))
            .fontName(field(parts, 1))
            .fontSize(AssNumbers.parseDecimal(field(parts, 2)))
            .primaryColor(ColorCodec.decode(field(parts, 3)))
            .secondaryColor(ColorCodec.decode(field(parts, 4)))
            .outlineColor(ColorCodec.decode(field(parts, 5)))
            .backColor(ColorCodec.decode(field(parts, 6)))
            .bold(FLAG_TRUE.equals(field(parts, 7)))
            .italic(FLAG_TRUE.equals(field(parts, 8)))
            .underline(FLAG_TRUE.equals(field(parts, 9)))
            .strikeout(FLAG_TRUE.equals(field(parts, 10)))
            .scaleX(AssNumbers.parseDecimal(field(parts, 11)))
            .scaleY(AssNumbers.parseDecimal(field(parts, 12)))
            .spacing(AssNumbers.parseDecimal(field(parts, 13)))
            .angle(AssNumbers.parseDecimal(field(parts, 14)))
            .borderStyle(AssNumbers.parseInteger(field(parts, 15)))
            .outline(AssNumbers.parseDecimal(field(parts, 16)))
            .shadow(AssNumbers.parseDecimal(field(parts, 17)))
            .alignment(AssNumbers.parseInteger(field(parts, 18)))
            .marginL(AssNumbers.parseInteger(field(parts, 19)))
            .marginR(AssNumbers.parseInteger(field(parts, 20)))
            .marginV(AssNumbers.parseInteger(field(parts, 21)))
            .encoding(AssNumbers.parseInteger(field(parts, 22)))
            .build();
    }

    /**
     * Parses the body of a {@code Dialogue:} line (the part after the prefix). Everything
     * after the ninth comma is the text, commas included.
     */
    public DialogueEvent parseDialogue(String body, int index) {
        String[] parts = body.split(",", -1);
        String text = parts.length > DIALOGUE_FIXED_FIELD_COUNT
            ? String.join(",", Arrays.copyOfRange(parts, DIALOGUE_FIXED_FIELD_COUNT, parts.length))
            : "";
        DecodedText decoded = OverrideTagDecoder.decode(text);
        return new DialogueEvent.Builder()
            .index(index)
            .layer(AssNumbers.parseInteger(trimmedField(parts, 0)))
            .start(TimeCodec.decode(trimmedField(parts, 1)))
            .end(TimeCodec.decode(trimmedField(parts, 2)))
            .style(trimmedField(parts, 3))
            .name(trimmedField(parts, 4))
            .marginL(AssNumbers.parseInteger(trimmedField(parts, 5)))
            .marginR(AssNumbers.parseInteger(trimmedField(parts, 6)))
            .marginV(AssNumbers.parseInteger(trimmedField(parts, 7)))
            .effect(trimmedField(parts, 8))
            .text(text)
            .displayText(decoded.getDisplayText())
            .overrides(decoded.getOverrides())
            .build();
    }

    private static String field(String[] parts, int index) {
        return index < parts.length ? parts[index] : null;
    }

    private static String trimmedField(String[] parts, int index) {
        String value = field(parts, index);
        return value != null ? value.trim() : null;
    }

    /**
     * Trims Unicode spaces and byte-order marks from both ends of a line.
     */
    static String trimLine(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && isBlankChar(line.charAt(start))) {
            start++;
        }
        while (end > start && isBlankChar(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(start, end);
    }

    private static boolean isBlankChar(char c) {
        return c == BYTE_ORDER_MARK || Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static boolean isSectionHeader(String line) {
        return line.length() >= 2 && line.startsWith("[") && line.endsWith("]");
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[DocumentParser] " + message);
        } else {
            System.out.println("[DocumentParser] " + message);
        }
    }

    /**
     * State of one parse run. Each state owns its own line rule.
     */
    private final class Session {
        private final Map<String, String> scriptInfo = new LinkedHashMap<>();
        private final Map<String, StyleDefinition> styles = new LinkedHashMap<>();
        private final List<DialogueEvent> dialogues = new ArrayList<>();
        private ParserState state = ParserState.NONE;
        private int skipped;

        void accept(String line) {
            if (isSectionHeader(line)) {
                state = ParserState.fromSectionName(line.substring(1, line.length() - 1));
                return;
            }
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                return;
            }
            boolean consumed;
            switch (state) {
                case SCRIPT_INFO:
                    consumed = acceptInfo(line);
                    break;
                case STYLES:
                    consumed = acceptStyle(line);
                    break;
                case EVENTS:
                    consumed = acceptDialogue(line);
                    break;
                default:
                    consumed = false;
                    break;
            }
            if (!consumed) {
                skipped++;
            }
        }

        private boolean acceptInfo(String line) {
            Matcher m = INFO_LINE.matcher(line);
            if (!m.matches()) {
                return false;
            }
            scriptInfo.put(m.group(1).trim(), m.group(2).trim());
            return true;
        }

        private boolean acceptStyle(String line) {
            if (!line.startsWith(STYLE_PREFIX)) {
                return false;
            }
            StyleDefinition style = parseStyle(line.substring(STYLE_PREFIX.length()));
            styles.put(style.getName(), style);
            return true;
        }

        private boolean acceptDialogue(String line) {
            if (!line.startsWith(DIALOGUE_PREFIX)) {
                return false;
            }
            dialogues.add(parseDialogue(line.substring(DIALOGUE_PREFIX.length()), dialogues.size()));
            return true;
        }
    }
}
