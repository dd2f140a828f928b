package com.assoverlay.subtitles;

/**
 * Section the parser is currently reading. Sections it does not know (Fonts, Graphics,
 * Aegisub Project Garbage, ...) map to {@link #NONE}, whose lines are ignored.
 */
public enum ParserState {
    NONE,
    SCRIPT_INFO,
    STYLES,
    EVENTS;

    public static ParserState fromSectionName(String sectionName) {
        if (sectionName == null) {
            return NONE;
        }
        switch (sectionName) {
            case "Script Info":
                return SCRIPT_INFO;
            case "V4+ Styles":
            case "V4 Styles":
                return STYLES;
            case "Events":
                return EVENTS;
            default:
                return NONE;
        }
    }
}
