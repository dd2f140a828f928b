package com.assoverlay;

import com.assoverlay.models.ActiveCue;
import com.assoverlay.models.AssDocument;
import com.assoverlay.models.DialogueEvent;
import com.assoverlay.subtitles.DialogueTimeline;
import com.assoverlay.subtitles.StyleResolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers the host player's per-frame question: which lines are on screen at this
 * timestamp, and how should each one look.
 */
public class PlaybackService {

    private final SubtitleStore store;
    private final StyleResolver resolver;

    public PlaybackService(SubtitleStore store) {
        this(store, new StyleResolver());
    }

    public PlaybackService(SubtitleStore store, StyleResolver resolver) {
        this.store = store;
        this.resolver = resolver;
    }

    public List<ActiveCue> activeCues(String id, long timestampMs) {
        DialogueTimeline timeline = store.getTimeline(id).orElseThrow(() -> new SubtitleNotFoundException(id));
        AssDocument document = timeline.getDocument();
        List<ActiveCue> cues = new ArrayList<>();
        for (DialogueEvent dialogue : timeline.activeAt(timestampMs)) {
            cues.add(new ActiveCue(dialogue, resolver.resolve(document, dialogue)));
        }
        return cues;
    }
}
