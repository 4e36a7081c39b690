package com.vidnyan.swivel.domain.rule;

import com.vidnyan.swivel.domain.exception.CorrectionRuleException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * The edits one rule wants to make against a snapshot, plus the region it claims.
 * Two patches whose claimed regions touch are never applied in the same round.
 */
public record SourcePatch(String ruleId, TextSpan claimedSpan, List<TextEdit> edits) {

    public SourcePatch {
        edits = List.copyOf(edits);
        if (edits.isEmpty()) {
            throw new CorrectionRuleException(ruleId, "patch without edits");
        }
        for (TextEdit edit : edits) {
            if (!claimedSpan.contains(edit.span())) {
                throw new CorrectionRuleException(ruleId, "edit " + edit.span() + " outside claimed " + claimedSpan);
            }
        }
        List<TextEdit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt(e -> e.span().start()));
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).span().start() < ordered.get(i - 1).span().end()) {
                throw new CorrectionRuleException(ruleId, "overlapping edits");
            }
        }
    }

    public boolean conflictsWith(SourcePatch other) {
        return claimedSpan.touches(other.claimedSpan);
    }

    /**
     * Apply the edits of several non-conflicting patches to the same snapshot.
     * Edits are applied back to front so earlier offsets stay valid.
     */
    public static String applyAll(String snapshot, Collection<SourcePatch> patches) {
        List<TextEdit> edits = new ArrayList<>();
        patches.forEach(patch -> edits.addAll(patch.edits()));
        // back to front; among edits at the same offset the later one goes first so list order survives
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < edits.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingInt((Integer i) -> edits.get(i).span().start())
                .thenComparingInt(i -> edits.get(i).span().end())
                .thenComparingInt(i -> i)
                .reversed());
        StringBuilder text = new StringBuilder(snapshot);
        for (int index : order) {
            TextEdit edit = edits.get(index);
            if (edit.span().end() > text.length()) {
                throw new IllegalStateException("Edit " + edit.span() + " beyond snapshot of " + snapshot.length());
            }
            text.replace(edit.span().start(), edit.span().end(), edit.replacement());
        }
        return text.toString();
    }
}
