package com.docsearch.core;

import com.docsearch.dto.EngineResponse;
import com.docsearch.dto.ReplaceResult;
import com.docsearch.dto.Status;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public final class TextReplacerTest {

    @Test
    void replacesEveryNormalizedMatchVerbatim() {
        ReplaceResult r = SearchEngine.replace("The cat, the CAT. Cats?", "cat", "Dog!").payload();

        assertEquals("The Dog! the Dog! Cats?", r.modifiedText());
        assertEquals(2, r.occurrencesReplaced());
    }

    @Test
    void keepsOriginalWhitespace() {
        ReplaceResult r = SearchEngine.replace("  old\tnew old\n\nold  ", "OLD", "x").payload();

        assertEquals("  x\tnew x\n\nx  ", r.modifiedText());
        assertEquals(3, r.occurrencesReplaced());
    }

    @Test
    void noMatchLeavesTextUnchanged() {
        String text = "nothing to see here";
        ReplaceResult r = SearchEngine.replace(text, "cat", "dog").payload();

        assertEquals(text, r.modifiedText());
        assertEquals(0, r.occurrencesReplaced());
    }

    @Test
    void doesNotTouchTheIndex() {
        SearchEngine engine = new SearchEngine();
        engine.index("a.txt", "cat cat");

        SearchEngine.replace("cat cat", "cat", "dog");

        assertEquals(2, engine.searchKeyword("cat").payload().totalOccurrences());
        assertEquals(0, engine.searchKeyword("dog").payload().totalOccurrences());
    }

    @Test
    void missingInputsAreValidationErrors() {
        assertEquals(Status.VALIDATION_ERROR, SearchEngine.replace("", "a", "b").status());
        assertEquals(Status.VALIDATION_ERROR, SearchEngine.replace("\u00A0", "cat", "b").status());
        assertEquals(Status.VALIDATION_ERROR, SearchEngine.replace("text", null, "b").status());
        assertEquals(Status.VALIDATION_ERROR, SearchEngine.replace("text", "text", null).status());
    }

    @Test
    void emptyReplacementDeletesMatches() {
        ReplaceResult r = SearchEngine.replace("the cat sat", "cat", "").payload();

        assertEquals("the  sat", r.modifiedText());
        assertEquals(1, r.occurrencesReplaced());
    }

    @Test
    void findWithoutTwoLettersMatchesNothing() {
        EngineResponse<ReplaceResult> resp = SearchEngine.replace("a b c", "a", "z");

        assertEquals(Status.OK, resp.status());
        assertEquals("a b c", resp.payload().modifiedText());
        assertEquals(0, resp.payload().occurrencesReplaced());
    }

    @Test
    void unicodeSpacesSeparateWords() {
        ReplaceResult r = SearchEngine.replace("cat\u2003cat\u00A0dog", "cat", "fox").payload();

        assertEquals("fox\u2003fox\u00A0dog", r.modifiedText());
        assertEquals(2, r.occurrencesReplaced());
    }
}
