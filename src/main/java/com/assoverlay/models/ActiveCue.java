package com.assoverlay.models;

/**
 * A dialogue line visible at the requested timestamp, paired with its resolved style.
 */
public class ActiveCue {
    private final DialogueEvent dialogue;
    private final ResolvedStyle style;

    public ActiveCue(DialogueEvent dialogue, ResolvedStyle style) {
        this.dialogue = dialogue;
        this.style = style;
    }

    public DialogueEvent getDialogue() { return dialogue; }
    public ResolvedStyle getStyle() { return style; }
}
