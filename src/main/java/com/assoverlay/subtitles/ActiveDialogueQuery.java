package com.assoverlay.subtitles;

import com.assoverlay.models.AssDocument;
import com.assoverlay.models.DialogueEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the dialogue lines visible at a timestamp by scanning every line.
 * Both ends of a line's interval are inclusive; results keep source order.
 *
 * @see DialogueTimeline for the indexed equivalent
 */
public final class ActiveDialogueQuery {

    private ActiveDialogueQuery() {
    }

    public static List<DialogueEvent> query(AssDocument document, long timestampMs) {
        if (document == null) {
            throw new IllegalArgumentException("Document is required");
        }
        List<DialogueEvent> active = new ArrayList<>();
        for (DialogueEvent dialogue : document.getDialogues()) {
            if (dialogue.isActiveAt(timestampMs)) {
                active.add(dialogue);
            }
        }
        return active;
    }
}
