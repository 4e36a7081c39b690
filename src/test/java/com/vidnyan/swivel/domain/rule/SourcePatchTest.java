package com.vidnyan.swivel.domain.rule;

import com.vidnyan.swivel.domain.exception.CorrectionRuleException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourcePatchTest {

    @Test
    void applyAll_ShouldApplyEditsAgainstOriginalOffsets() {
        String source = "0123456789";
        SourcePatch first = new SourcePatch("a", new TextSpan(0, 3),
                List.of(TextEdit.delete(0, 2), TextEdit.insert(3, "X")));
        SourcePatch second = new SourcePatch("b", new TextSpan(6, 8), List.of(new TextEdit(new TextSpan(6, 8), "YY")));

        String patched = SourcePatch.applyAll(source, List.of(second, first));

        assertEquals("2X345YY89", patched);
    }

    @Test
    void applyAll_ShouldKeepListOrderForInsertionsAtSameOffset() {
        SourcePatch patch = new SourcePatch("a", TextSpan.at(1),
                List.of(TextEdit.insert(1, "A"), TextEdit.insert(1, "B")));

        assertEquals("xABy", SourcePatch.applyAll("xy", List.of(patch)));
    }

    @Test
    void conflictsWith_ShouldTreatTouchingSpansAsConflicts() {
        SourcePatch removal = new SourcePatch("remove", new TextSpan(10, 20), List.of(TextEdit.delete(10, 20)));
        SourcePatch adjacent = new SourcePatch("insert", TextSpan.at(20), List.of(TextEdit.insert(20, "x")));
        SourcePatch distant = new SourcePatch("other", new TextSpan(30, 31), List.of(TextEdit.delete(30, 31)));

        assertTrue(removal.conflictsWith(adjacent));
        assertFalse(removal.conflictsWith(distant));
    }

    @Test
    void constructor_ShouldRejectUnusablePatches() {
        assertThrows(CorrectionRuleException.class, () -> new SourcePatch("empty", TextSpan.at(0), List.of()));
        assertThrows(CorrectionRuleException.class, () -> new SourcePatch("outside", new TextSpan(0, 2),
                List.of(TextEdit.delete(1, 5))));
        assertThrows(CorrectionRuleException.class, () -> new SourcePatch("overlap", new TextSpan(0, 10),
                List.of(TextEdit.delete(0, 5), TextEdit.delete(3, 7))));
    }
}
