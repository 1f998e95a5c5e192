package me.golemcore.engine.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextChunkerTest {

    @Test
    void shouldAlternateWordsAndWhitespace() {
        assertEquals(List.of("Hello", " ", "big", "\n\n", "world"), TextChunker.chunks("Hello big\n\nworld"));
    }

    @Test
    void shouldKeepLeadingAndTrailingWhitespace() {
        String text = "  padded text \t";

        assertEquals(text, String.join("", TextChunker.chunks(text)));
    }

    @Test
    void shouldReturnNoChunksForEmptyInput() {
        assertTrue(TextChunker.chunks("").isEmpty());
        assertTrue(TextChunker.chunks(null).isEmpty());
    }
}
