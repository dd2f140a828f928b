package com.assoverlay.subtitles;

import com.assoverlay.models.AssColor;
import com.assoverlay.models.AssDocument;
import com.assoverlay.models.DialogueEvent;
import com.assoverlay.models.FontStyle;
import com.assoverlay.models.FontWeight;
import com.assoverlay.models.HorizontalAnchor;
import com.assoverlay.models.OverrideSet;
import com.assoverlay.models.Point;
import com.assoverlay.models.Position;
import com.assoverlay.models.ResolvedStyle;
import com.assoverlay.models.StyleDefinition;
import com.assoverlay.models.TextAlign;
import com.assoverlay.models.TextDecoration;
import com.assoverlay.models.TextStyle;
import com.assoverlay.models.VerticalAnchor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StyleResolverTest {

    private final StyleResolver resolver = new StyleResolver();

    private static StyleDefinition.Builder style(String name, int alignment) {
        return new StyleDefinition.Builder()
            .name(name)
            .fontName("Arial")
            .fontSize(40.0)
            .alignment(alignment)
            .marginL(11)
            .marginR(22)
            .marginV(33);
    }

    private static AssDocument documentWith(StyleDefinition style, DialogueEvent dialogue) {
        return new AssDocument(null, Map.of(style.getName(), style), List.of(dialogue));
    }

    private static DialogueEvent line(String styleName, OverrideSet overrides) {
        return new DialogueEvent.Builder()
            .style(styleName)
            .marginL(0)
            .marginR(0)
            .marginV(0)
            .text("x")
            .overrides(overrides)
            .build();
    }

    @Test
    void topLeftAlignment() {
        DialogueEvent dialogue = line("S", OverrideSet.EMPTY);
        ResolvedStyle resolved = resolver.resolve(documentWith(style("S", 7).build(), dialogue), dialogue);
        Position position = resolved.getPosition();
        assertFalse(position.isAbsolute());
        assertEquals(VerticalAnchor.TOP, position.getVertical());
        assertEquals(HorizontalAnchor.LEFT, position.getHorizontal());
        assertEquals(33, position.getTop());
        assertEquals(11, position.getLeft());
        assertNull(position.getBottom());
        assertNull(position.getRight());
        assertEquals(0.0, position.getOffsetX());
        assertEquals(0.0, position.getOffsetY());
        assertEquals(TextAlign.LEFT, resolved.getTextStyle().getTextAlign());
    }

    @Test
    void middleCenterAlignmentCompensatesByHalfTheFontSize() {
        DialogueEvent dialogue = line("S", OverrideSet.EMPTY);
        ResolvedStyle resolved = resolver.resolve(documentWith(style("S", 5).build(), dialogue), dialogue);
        Position position = resolved.getPosition();
        assertEquals(VerticalAnchor.MIDDLE, position.getVertical());
        assertEquals(HorizontalAnchor.CENTER, position.getHorizontal());
        assertEquals(-20.0, position.getOffsetY());
        assertEquals(StyleResolver.CENTER_OFFSET_X, position.getOffsetX());
        assertNull(position.getTop());
        assertNull(position.getBottom());
        assertNull(position.getLeft());
        assertNull(position.getRight());
        assertEquals(TextAlign.CENTER, resolved.getTextStyle().getTextAlign());
    }

    @Test
    void middleOffsetUsesOverriddenFontSize() {
        DialogueEvent dialogue = line("S", new OverrideSet.Builder().fontSize(60).build());
        ResolvedStyle resolved = resolver.resolve(documentWith(style("S", 4).build(), dialogue), dialogue);
        assertEquals(60.0, resolved.getTextStyle().getFontSize());
        assertEquals(-30.0, resolved.getPosition().getOffsetY());
    }

    @Test
    void bottomRightAlignment() {
        DialogueEvent dialogue = line("S", OverrideSet.EMPTY);
        ResolvedStyle resolved = resolver.resolve(documentWith(style("S", 3).build(), dialogue), dialogue);
        Position position = resolved.getPosition();
        assertEquals(VerticalAnchor.BOTTOM, position.getVertical());
        assertEquals(HorizontalAnchor.RIGHT, position.getHorizontal());
        assertEquals(33, position.getBottom());
        assertEquals(22, position.getRight());
        assertEquals(TextAlign.RIGHT, resolved.getTextStyle().getTextAlign());
    }

    @Test
    void explicitPositionAlwaysWins() {
        for (int alignment = 1; alignment <= 9; alignment++) {
            DialogueEvent dialogue = line("S", new OverrideSet.Builder()
                .alignment(alignment)
                .position(new Point(320, 240))
                .build());
            Position position = resolver.resolve(documentWith(style("S", 5).build(), dialogue), dialogue).getPosition();
            assertEquals(Position.absolute(320, 240), position, "alignment " + alignment);
            assertTrue(position.isAbsolute());
            assertEquals(320, position.getLeft());
            assertEquals(240, position.getTop());
            assertNull(position.getRight());
            assertNull(position.getBottom());
            assertNull(position.getVertical());
        }
    }

    @Test
    void alignmentOverrideBeatsStyleAlignment() {
        DialogueEvent dialogue = line("S", new OverrideSet.Builder().alignment(8).build());
        Position position = resolver.resolve(documentWith(style("S", 1).build(), dialogue), dialogue).getPosition();
        assertEquals(VerticalAnchor.TOP, position.getVertical());
        assertEquals(HorizontalAnchor.CENTER, position.getHorizontal());
    }

    @Test
    void zeroAlignmentFallsThrough() {
        DialogueEvent dialogue = line("S", new OverrideSet.Builder().alignment(0).build());
        Position position = resolver.resolve(documentWith(style("S", 0).build(), dialogue), dialogue).getPosition();
        assertEquals(VerticalAnchor.BOTTOM, position.getVertical());
        assertEquals(HorizontalAnchor.CENTER, position.getHorizontal());
    }

    @Test
    void zeroOverrideFallsBackToStyleAlignment() {
        DialogueEvent dialogue = line("S", new OverrideSet.Builder().alignment(0).build());
        Position position = resolver.resolve(documentWith(style("S", 9).build(), dialogue), dialogue).getPosition();
        assertEquals(VerticalAnchor.TOP, position.getVertical());
        assertEquals(HorizontalAnchor.RIGHT, position.getHorizontal());
    }

    @Test
    void alignmentAboveNineUsesTheGridRules() {
        DialogueEvent dialogue = line("Nope", new OverrideSet.Builder().alignment(10).build());
        ResolvedStyle resolved = resolver.resolve(AssDocument.empty(), dialogue);
        assertEquals(VerticalAnchor.TOP, resolved.getPosition().getVertical());
        assertEquals(HorizontalAnchor.LEFT, resolved.getPosition().getHorizontal());
        assertEquals(StyleResolver.DEFAULT_MARGIN, resolved.getPosition().getTop());
        assertEquals(TextAlign.LEFT, resolved.getTextStyle().getTextAlign());
    }

    @Test
    void styleAlignmentAboveNineIsKept() {
        DialogueEvent dialogue = line("S", OverrideSet.EMPTY);
        Position position = resolver.resolve(documentWith(style("S", 12).build(), dialogue), dialogue).getPosition();
        assertEquals(VerticalAnchor.TOP, position.getVertical());
        assertEquals(HorizontalAnchor.RIGHT, position.getHorizontal());
    }

    @Test
    void lineMarginsBeatStyleMargins() {
        DialogueEvent dialogue = new DialogueEvent.Builder()
            .style("S").marginL(5).marginR(6).marginV(7).text("x").build();
        Position position = resolver.resolve(documentWith(style("S", 7).build(), dialogue), dialogue).getPosition();
        assertEquals(7, position.getTop());
        assertEquals(5, position.getLeft());
    }

    @Test
    void explicitZeroStyleMarginIsKept() {
        StyleDefinition flush = style("S", 1).marginL(0).marginV(0).build();
        DialogueEvent dialogue = line("S", OverrideSet.EMPTY);
        Position position = resolver.resolve(documentWith(flush, dialogue), dialogue).getPosition();
        assertEquals(0, position.getBottom());
        assertEquals(0, position.getLeft());
    }

    @Test
    void absentMarginsFallBackToDefault() {
        StyleDefinition noMargins = new StyleDefinition.Builder().name("S").alignment(9).build();
        DialogueEvent dialogue = new DialogueEvent.Builder().style("S").text("x").build();
        Position position = resolver.resolve(documentWith(noMargins, dialogue), dialogue).getPosition();
        assertEquals(StyleResolver.DEFAULT_MARGIN, position.getTop());
        assertEquals(StyleResolver.DEFAULT_MARGIN, position.getRight());
    }

    @Test
    void unknownStyleUsesBuiltInDefaults() {
        DialogueEvent dialogue = line("Nope", OverrideSet.EMPTY);
        ResolvedStyle resolved = resolver.resolve(AssDocument.empty(), dialogue);
        TextStyle text = resolved.getTextStyle();
        assertNull(text.getFontFamily());
        assertEquals(AssColor.WHITE, text.getColor());
        assertEquals(StyleResolver.DEFAULT_FONT_SIZE, text.getFontSize());
        assertEquals(FontWeight.NORMAL, text.getFontWeight());
        assertEquals(FontStyle.NORMAL, text.getFontStyle());
        assertEquals(TextDecoration.NONE, text.getTextDecoration());
        assertEquals(0.0, text.getLetterSpacing());
        assertEquals(AssColor.SHADOW_DEFAULT, text.getShadowColor());
        assertEquals(0.0, text.getShadowRadius());

        Position position = resolved.getPosition();
        assertEquals(VerticalAnchor.BOTTOM, position.getVertical());
        assertEquals(HorizontalAnchor.CENTER, position.getHorizontal());
        assertEquals(StyleResolver.DEFAULT_MARGIN, position.getBottom());
    }

    @Test
    void partialOverridesKeepTheRestOfTheStyle() {
        StyleDefinition base = style("S", 2)
            .italic(true)
            .underline(true)
            .primaryColor(new AssColor(10, 20, 30, 1.0))
            .build();
        DialogueEvent dialogue = line("S", new OverrideSet.Builder().fontWeight(FontWeight.BOLD).build());
        TextStyle text = resolver.resolve(documentWith(base, dialogue), dialogue).getTextStyle();
        assertEquals(FontWeight.BOLD, text.getFontWeight());
        assertEquals(FontStyle.ITALIC, text.getFontStyle());
        assertEquals(TextDecoration.UNDERLINE, text.getTextDecoration());
        assertEquals(new AssColor(10, 20, 30, 1.0), text.getColor());
        assertEquals(40.0, text.getFontSize());
        assertEquals("Arial", text.getFontFamily());
    }

    @Test
    void overridesReplaceStyleAttributes() {
        StyleDefinition base = style("S", 2).bold(true).italic(true).underline(true).build();
        DialogueEvent dialogue = line("S", new OverrideSet.Builder()
            .fontWeight(FontWeight.NORMAL)
            .fontStyle(FontStyle.NORMAL)
            .textDecoration(TextDecoration.NONE)
            .fontSize(18)
            .color(new AssColor(255, 0, 0, 1.0))
            .build());
        TextStyle text = resolver.resolve(documentWith(base, dialogue), dialogue).getTextStyle();
        assertEquals(FontWeight.NORMAL, text.getFontWeight());
        assertEquals(FontStyle.NORMAL, text.getFontStyle());
        assertEquals(TextDecoration.NONE, text.getTextDecoration());
        assertEquals(18.0, text.getFontSize());
        assertEquals(new AssColor(255, 0, 0, 1.0), text.getColor());
    }

    @Test
    void resolvesParsedSample() {
        AssDocument document = new DocumentParser().parse(AssFixtures.SAMPLE);

        ResolvedStyle first = resolver.resolve(document, document.getDialogues().get(0));
        assertEquals(48.0, first.getTextStyle().getFontSize());
        assertEquals(FontWeight.BOLD, first.getTextStyle().getFontWeight());
        assertEquals(VerticalAnchor.BOTTOM, first.getPosition().getVertical());
        assertEquals(30, first.getPosition().getBottom());

        ResolvedStyle sign = resolver.resolve(document, document.getDialogues().get(1));
        TextStyle text = sign.getTextStyle();
        assertEquals("Verdana", text.getFontFamily());
        assertEquals(new AssColor(255, 255, 0, 1.0), text.getColor());
        assertEquals(FontWeight.BOLD, text.getFontWeight());
        assertEquals(FontStyle.ITALIC, text.getFontStyle());
        assertEquals(TextDecoration.UNDERLINE, text.getTextDecoration());
        assertEquals(1.5, text.getLetterSpacing());
        assertEquals(2.0, text.getShadowRadius());
        assertEquals(new AssColor(16, 16, 16, 1.0), text.getShadowColor());
        assertEquals(TextAlign.RIGHT, text.getTextAlign());
        assertEquals(VerticalAnchor.TOP, sign.getPosition().getVertical());
        assertEquals(50, sign.getPosition().getTop());
        assertEquals(25, sign.getPosition().getRight());

        ResolvedStyle placed = resolver.resolve(document, document.getDialogues().get(2));
        assertEquals(Position.absolute(100, 200), placed.getPosition());
        assertEquals(StyleResolver.DEFAULT_FONT_SIZE, placed.getTextStyle().getFontSize());
    }

    @Test
    void resolvingTwiceGivesTheSameResult() {
        AssDocument document = new DocumentParser().parse(AssFixtures.SAMPLE);
        for (DialogueEvent dialogue : document.getDialogues()) {
            assertEquals(resolver.resolve(document, dialogue), resolver.resolve(document, dialogue));
        }
    }

    @Test
    void requiresDocumentAndDialogue() {
        DialogueEvent dialogue = line("S", OverrideSet.EMPTY);
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(null, dialogue));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(AssDocument.empty(), null));
    }
}
