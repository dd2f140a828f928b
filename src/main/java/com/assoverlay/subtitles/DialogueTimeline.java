package com.assoverlay.subtitles;

import com.assoverlay.models.AssDocument;
import com.assoverlay.models.DialogueEvent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Start-ordered index over a document's dialogue lines for per-frame lookups.
 * <p>
 * Lines are sorted by start time, and {@code maxEnd[i]} holds the latest end time among
 * the first {@code i + 1} sorted lines. A lookup binary-searches the last line starting at
 * or before the timestamp and walks backwards until no earlier line can still be on screen.
 * Results match {@link ActiveDialogueQuery#query} exactly, including source order.
 */
public final class DialogueTimeline {

    private final AssDocument document;
    private final List<DialogueEvent> dialogues;
    private final int[] order;
    private final long[] starts;
    private final long[] maxEnd;

    public DialogueTimeline(AssDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("Document is required");
        }
        this.document = document;
        this.dialogues = document.getDialogues();
        Integer[] sorted = new Integer[dialogues.size()];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = i;
        }
        Arrays.sort(sorted, Comparator.<Integer>comparingLong(i -> dialogues.get(i).getStart())
            .thenComparingInt(i -> i));

        this.order = new int[sorted.length];
        this.starts = new long[sorted.length];
        this.maxEnd = new long[sorted.length];
        long runningMax = Long.MIN_VALUE;
        for (int i = 0; i < sorted.length; i++) {
            DialogueEvent dialogue = dialogues.get(sorted[i]);
            order[i] = sorted[i];
            starts[i] = dialogue.getStart();
            runningMax = Math.max(runningMax, dialogue.getEnd());
            maxEnd[i] = runningMax;
        }
    }

    public AssDocument getDocument() {
        return document;
    }

    public int size() {
        return order.length;
    }

    public List<DialogueEvent> activeAt(long timestampMs) {
        List<Integer> hits = new ArrayList<>();
        for (int i = lastStartingAtOrBefore(timestampMs); i >= 0 && maxEnd[i] >= timestampMs; i--) {
            if (dialogues.get(order[i]).getEnd() >= timestampMs) {
                hits.add(order[i]);
            }
        }
        hits.sort(Comparator.naturalOrder());
        List<DialogueEvent> active = new ArrayList<>(hits.size());
        for (int position : hits) {
            active.add(dialogues.get(position));
        }
        return active;
    }

    private int lastStartingAtOrBefore(long timestampMs) {
        int lo = 0;
        int hi = starts.length - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (starts[mid] <= timestampMs) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return found;
    }
}
