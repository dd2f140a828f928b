package com.assoverlay.subtitles;

import com.assoverlay.models.OverrideSet;

/**
 * Dialogue text with its override blocks removed, plus the overrides they carried.
 */
public final class DecodedText {
    private final String displayText;
    private final OverrideSet overrides;

    public DecodedText(String displayText, OverrideSet overrides) {
        this.displayText = displayText;
        this.overrides = overrides;
    }

    public String getDisplayText() {
        return displayText;
    }

    public OverrideSet getOverrides() {
        return overrides;
    }
}
