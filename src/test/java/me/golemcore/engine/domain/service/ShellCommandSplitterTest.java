package me.golemcore.engine.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShellCommandSplitterTest {

    @Test
    void shouldSplitOnWhitespace() {
        assertEquals(List.of("python", "-m", "mlx_lm.server", "--port", "12345"),
                ShellCommandSplitter.split("  python -m   mlx_lm.server\t--port 12345 "));
    }

    @Test
    void shouldGroupQuotedArguments() {
        assertEquals(List.of("sh", "-c", "echo hello world", "it's"),
                ShellCommandSplitter.split("sh -c 'echo hello world' \"it's\""));
    }

    @Test
    void shouldKeepBackslashLiteralInsideSingleQuotes() {
        assertEquals(List.of("a\\b"), ShellCommandSplitter.split("'a\\b'"));
    }

    @Test
    void shouldEscapeNextCharacterOutsideSingleQuotes() {
        assertEquals(List.of("hello world", "say\"hi\""),
                ShellCommandSplitter.split("hello\\ world \"say\\\"hi\\\"\""));
    }

    @Test
    void shouldKeepEmptyQuotedArgument() {
        assertEquals(List.of("cmd", "", "x"), ShellCommandSplitter.split("cmd '' x"));
    }

    @Test
    void shouldReturnEmptyListForBlankOrNull() {
        assertTrue(ShellCommandSplitter.split("   ").isEmpty());
        assertTrue(ShellCommandSplitter.split(null).isEmpty());
    }

    @Test
    void shouldRejectUnterminatedQuote() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> ShellCommandSplitter.split("echo 'oops"));
        assertTrue(error.getMessage().contains("Unterminated quote"));
    }

    @Test
    void shouldRejectTrailingBackslash() {
        assertThrows(IllegalArgumentException.class, () -> ShellCommandSplitter.split("echo \\"));
    }
}
