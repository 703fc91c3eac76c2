package io.coachflow.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplyCanonicalizerTest {

    @Test
    void canonicalizeShouldTrimLowercaseAndStripPunctuation() {
        assertEquals("let's do it", ReplyCanonicalizer.canonicalize("  Let's   DO it!! "));
        assertEquals("", ReplyCanonicalizer.canonicalize(null));
    }

    @Test
    void singleCharacterOptionsShouldMatchExactly() {
        assertTrue(ReplyCanonicalizer.matches("1", "1"));
        assertFalse(ReplyCanonicalizer.matches("15 mins", "1"));
    }

    @Test
    void phraseOptionsShouldMatchAsWholeWords() {
        assertTrue(ReplyCanonicalizer.matches(ReplyCanonicalizer.canonicalize("Ok, done now."), "done"));
        assertFalse(ReplyCanonicalizer.matches("undone", "done"));
        assertFalse(ReplyCanonicalizer.matches("not yet", "no"));
    }
}
