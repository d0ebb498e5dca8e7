package org.netpreserve.sweeper.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ShellCommandDeserializerTest {
    @Test
    public void split() throws IOException {
        assertEquals(List.of("--lang=ja", "--user-agent=Mozilla/5.0 (X11)", "--x="),
                ShellCommandDeserializer.split("  --lang=ja \"--user-agent=Mozilla/5.0 (X11)\" '--x='"));
        assertEquals(List.of("", "a"), ShellCommandDeserializer.split("'' a"));
        assertEquals(List.of(), ShellCommandDeserializer.split("   "));
        assertThrows(IOException.class, () -> ShellCommandDeserializer.split("--a 'oops"));
    }
}
