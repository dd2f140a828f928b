package com.assoverlay.subtitles;

import com.assoverlay.models.AssColor;
import com.assoverlay.models.AssDocument;
import com.assoverlay.models.DialogueEvent;
import com.assoverlay.models.FontStyle;
import com.assoverlay.models.FontWeight;
import com.assoverlay.models.StyleDefinition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DocumentParserTest {

    private final DocumentParser parser = new DocumentParser();

    @Test
    void parsesScriptInfo() {
        AssDocument document = parser.parse(AssFixtures.SAMPLE);
        assertEquals("Demo", document.getTitle());
        assertEquals("v4.00+", document.getScriptInfo("ScriptType"));
        assertEquals(1920, document.getPlayResX());
        assertEquals(1080, document.getPlayResY());
        assertEquals(4, document.getScriptInfo().size());
    }

    @Test
    void infoValueKeepsTextAfterFirstColon() {
        AssDocument document = parser.parse("[Script Info]\nOriginal Timing:  Studio: A \n");
        assertEquals("Studio: A", document.getScriptInfo("Original Timing"));
    }

    @Test
    void parsesAllStyleFieldsInOrder() {
        AssDocument document = parser.parse(AssFixtures.SAMPLE);
        assertEquals(2, document.getStyles().size());

        StyleDefinition style = document.getStyle("Default");
        assertNotNull(style);
        assertEquals("Default", style.getName());
        assertEquals("Arial", style.getFontName());
        assertEquals(48.0, style.getFontSize());
        assertEquals(AssColor.WHITE, style.getPrimaryColor());
        assertEquals(new AssColor(255, 0, 0, 1.0), style.getSecondaryColor());
        assertEquals(new AssColor(0, 0, 0, 1.0), style.getOutlineColor());
        assertEquals(new AssColor(0, 0, 0, 0.5), style.getBackColor());
        assertTrue(style.isBold());
        assertFalse(style.isItalic());
        assertFalse(style.isUnderline());
        assertFalse(style.isStrikeout());
        assertEquals(100.0, style.getScaleX());
        assertEquals(100.0, style.getScaleY());
        assertEquals(0.0, style.getSpacing());
        assertEquals(0.0, style.getAngle());
        assertEquals(1, style.getBorderStyle());
        assertEquals(2.0, style.getOutline());
        assertEquals(1.0, style.getShadow());
        assertEquals(2, style.getAlignment());
        assertEquals(10, style.getMarginL());
        assertEquals(20, style.getMarginR());
        assertEquals(30, style.getMarginV());
        assertEquals(1, style.getEncoding());
    }

    @Test
    void shortStyleRowLeavesMissingFieldsAbsent() {
        String text = "[V4+ Styles]\n"
            + "Style: Short,Arial,20,&H00FFFFFF,&H00FFFFFF,&H00000000,&H00000000,0,0,0,0,100,100,0,0,1,2,2,2,10\n";
        AssDocument document = assertDoesNotThrow(() -> parser.parse(text));
        StyleDefinition style = document.getStyle("Short");
        assertNotNull(style);
        assertEquals(10, style.getMarginL());
        assertNull(style.getMarginR());
        assertNull(style.getMarginV());
        assertNull(style.getEncoding());
    }

    @Test
    void veryShortStyleRowStillParses() {
        StyleDefinition style = parser.parse("[V4 Styles]\nStyle: Bare\n").getStyle("Bare");
        assertNotNull(style);
        assertNull(style.getFontName());
        assertNull(style.getFontSize());
        assertEquals(AssColor.WHITE, style.getPrimaryColor());
        assertFalse(style.isBold());
    }

    @Test
    void laterStyleWithSameNameWins() {
        String text = "[V4+ Styles]\n"
            + "Style: Dup,Arial,20,&H00FFFFFF,&H00FFFFFF,&H00000000,&H00000000,0,0,0,0,100,100,0,0,1,2,2,2,10,10,10,1\n"
            + "Style: Dup,Times,30,&H00FFFFFF,&H00FFFFFF,&H00000000,&H00000000,0,0,0,0,100,100,0,0,1,2,2,8,10,10,10,1\n";
        AssDocument document = parser.parse(text);
        assertEquals(1, document.getStyles().size());
        assertEquals("Times", document.getStyle("Dup").getFontName());
        assertEquals(8, document.getStyle("Dup").getAlignment());
    }

    @Test
    void unparseableNumericFieldsAreAbsent() {
        StyleDefinition style = parser.parse("[V4+ Styles]\nStyle: Odd,Arial,big,&H00FFFFFF,x,y,z,1,0,0,0,wide\n").getStyle("Odd");
        assertNull(style.getFontSize());
        assertNull(style.getScaleX());
        assertEquals(AssColor.WHITE, style.getSecondaryColor());
        assertFalse(style.isBold());
    }

    @Test
    void dialogueTextKeepsCommas() {
        DialogueEvent dialogue = parser.parse(AssFixtures.SAMPLE).getDialogues().get(0);
        assertEquals("Hello, world, again", dialogue.getText());
        assertEquals("Hello, world, again", dialogue.getDisplayText());
    }

    @Test
    void parsesDialogueFields() {
        AssDocument document = parser.parse(AssFixtures.SAMPLE);
        assertEquals(3, document.getDialogues().size());

        DialogueEvent first = document.getDialogues().get(0);
        assertEquals(0, first.getIndex());
        assertEquals(0, first.getLayer());
        assertEquals(1_000, first.getStart());
        assertEquals(3_500, first.getEnd());
        assertEquals("Default", first.getStyle());
        assertEquals("Alice", first.getName());
        assertEquals(0, first.getMarginL());
        assertEquals("", first.getEffect());
        assertTrue(first.getOverrides().isEmpty());

        DialogueEvent second = document.getDialogues().get(1);
        assertEquals(1, second.getIndex());
        assertEquals(1, second.getLayer());
        assertEquals("Sign", second.getStyle());
        assertEquals(50, second.getMarginV());
        assertEquals("{\\an9\\b1}Top {\\i1}line", second.getText());
        assertEquals("Top line", second.getDisplayText());
        assertEquals(9, second.getOverrides().getAlignment());
        assertEquals(FontWeight.BOLD, second.getOverrides().getFontWeight());
        assertEquals(FontStyle.ITALIC, second.getOverrides().getFontStyle());
    }

    @Test
    void commentEventsAndFormatLinesAreIgnored() {
        AssDocument document = parser.parse(AssFixtures.SAMPLE);
        for (DialogueEvent dialogue : document.getDialogues()) {
            assertNotEquals("not shown", dialogue.getText());
        }
        assertNull(document.getStyle("Format"));
    }

    @Test
    void shortDialogueRowHasEmptyText() {
        DialogueEvent dialogue = parser.parse("[Events]\nDialogue: 0,0:00:01.00\n").getDialogues().get(0);
        assertEquals(1_000, dialogue.getStart());
        assertEquals(0, dialogue.getEnd());
        assertNull(dialogue.getStyle());
        assertEquals("", dialogue.getText());
        assertEquals("", dialogue.getDisplayText());
    }

    @Test
    void malformedTimesBecomeZero() {
        DialogueEvent dialogue = parser.parse("[Events]\nDialogue: 0,0:0:01.00,bad,Default,,0,0,0,,x\n").getDialogues().get(0);
        assertEquals(0, dialogue.getStart());
        assertEquals(0, dialogue.getEnd());
    }

    @Test
    void linesOutsideKnownSectionsAreIgnored() {
        String text = "Title: Before any section\n"
            + "[Fonts]\n"
            + "Dialogue: 0,0:00:01.00,0:00:02.00,Default,,0,0,0,,lost\n"
            + "[Events]\n"
            + "Style: Default,Arial,20\n"
            + "Dialogue: 0,0:00:01.00,0:00:02.00,Default,,0,0,0,,kept\n";
        AssDocument document = parser.parse(text);
        assertTrue(document.getScriptInfo().isEmpty());
        assertTrue(document.getStyles().isEmpty());
        assertEquals(1, document.getDialogues().size());
        assertEquals("kept", document.getDialogues().get(0).getText());
    }

    @Test
    void handlesWindowsLineEndingsAndIndentation() {
        String text = "[Script Info]\r\n  Title: Indented  \r\n\r\n   [Events]  \r\n"
            + "\tDialogue: 0,0:00:01.00,0:00:02.00,Default,,0,0,0,,crlf\r\n";
        AssDocument document = parser.parse(text);
        assertEquals("Indented", document.getTitle());
        assertEquals("crlf", document.getDialogues().get(0).getText());
    }

    @Test
    void leadingByteOrderMarkKeepsFirstSection() {
        String text = "\uFEFF[Script Info]\nTitle: Demo\n[Events]\n"
            + "Dialogue: 0,0:00:01.00,0:00:02.00,Default,,0,0,0,,hi\n";
        AssDocument document = parser.parse(text);
        assertEquals("Demo", document.getTitle());
        assertEquals(1, document.getScriptInfo().size());
        assertEquals(1, document.getDialogues().size());
    }

    @Test
    void nonAsciiSpacesAroundLinesAreTrimmed() {
        String text = "\u00A0[Script Info]\u3000\n\u2003Title: Spaced\u00A0\n";
        assertEquals("Spaced", parser.parse(text).getTitle());
    }

    @Test
    void trimLineKeepsInnerCharacters() {
        assertEquals("a \uFEFF b", DocumentParser.trimLine("\uFEFF a \uFEFF b\u00A0\r"));
        assertEquals("", DocumentParser.trimLine("\uFEFF"));
    }

    @Test
    void commentLinesAreSkippedInEverySection() {
        AssDocument document = parser.parse("[Events]\n;Dialogue: 0,0:00:01.00,0:00:02.00,Default,,0,0,0,,hidden\n");
        assertTrue(document.getDialogues().isEmpty());
    }

    @Test
    void nullOrEmptyInputGivesEmptyDocument() {
        assertTrue(parser.parse(null).getDialogues().isEmpty());
        AssDocument empty = parser.parse("");
        assertTrue(empty.getScriptInfo().isEmpty());
        assertTrue(empty.getStyles().isEmpty());
        assertTrue(empty.getDialogues().isEmpty());
    }

    @Test
    void parsingIsDeterministic() {
        AssDocument a = parser.parse(AssFixtures.SAMPLE);
        AssDocument b = parser.parse(AssFixtures.SAMPLE);
        assertEquals(a.getScriptInfo(), b.getScriptInfo());
        assertEquals(a.getStyles().keySet(), b.getStyles().keySet());
        assertEquals(a.getDialogues().size(), b.getDialogues().size());
        for (int i = 0; i < a.getDialogues().size(); i++) {
            assertEquals(a.getDialogues().get(i).getText(), b.getDialogues().get(i).getText());
            assertEquals(a.getDialogues().get(i).getDisplayText(), b.getDialogues().get(i).getDisplayText());
            assertEquals(a.getDialogues().get(i).getStart(), b.getDialogues().get(i).getStart());
        }
    }

    @Test
    void documentCollectionsAreReadOnly() {
        AssDocument document = parser.parse(AssFixtures.SAMPLE);
        assertThrows(UnsupportedOperationException.class, () -> document.getDialogues().clear());
        assertThrows(UnsupportedOperationException.class, () -> document.getStyles().clear());
        assertThrows(UnsupportedOperationException.class, () -> document.getScriptInfo().put("k", "v"));
    }
}
