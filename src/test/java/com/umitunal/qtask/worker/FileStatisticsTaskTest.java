package com.umitunal.qtask.worker;

import com.umitunal.qtask.core.DecodeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class FileStatisticsTaskTest {

    private final FileStatisticsTask task = new FileStatisticsTask();

    @Test
    @DisplayName("Should count line separators and characters")
    void testThreeLines() {
        // When
        Map<String, Long> stats = task.apply("a\nb\nc".getBytes(UTF_8));

        // Then
        assertThat(stats).containsExactly(
                entry(FileStatisticsTask.LINES, 2L),
                entry(FileStatisticsTask.CHARACTERS, 5L));
    }

    @Test
    @DisplayName("A trailing newline counts as a line separator")
    void testTrailingNewline() {
        Map<String, Long> stats = task.apply("one\ntwo\n".getBytes(UTF_8));

        assertThat(stats).containsEntry(FileStatisticsTask.LINES, 2L)
                .containsEntry(FileStatisticsTask.CHARACTERS, 8L);
    }

    @Test
    @DisplayName("Empty content has no lines and no characters")
    void testEmpty() {
        Map<String, Long> stats = task.apply(new byte[0]);

        assertThat(stats).containsEntry(FileStatisticsTask.LINES, 0L)
                .containsEntry(FileStatisticsTask.CHARACTERS, 0L);
    }

    @Test
    @DisplayName("Characters are counted as code points, not bytes or UTF-16 units")
    void testMultibyte() {
        // Given - 2-byte, 3-byte and 4-byte (surrogate pair) characters
        String text = "é€😀\n";

        // When
        Map<String, Long> stats = task.apply(text.getBytes(UTF_8));

        // Then
        assertThat(stats).containsEntry(FileStatisticsTask.CHARACTERS, 4L)
                .containsEntry(FileStatisticsTask.LINES, 1L);
    }

    @Test
    @DisplayName("A carriage return alone is not a line separator")
    void testCarriageReturn() {
        Map<String, Long> stats = task.apply("a\r\nb\rc".getBytes(UTF_8));

        assertThat(stats).containsEntry(FileStatisticsTask.LINES, 1L)
                .containsEntry(FileStatisticsTask.CHARACTERS, 6L);
    }

    @Test
    @DisplayName("Invalid UTF-8 should be reported, not replaced")
    void testInvalidUtf8() {
        byte[] content = {(byte) 0xC3, (byte) 0x28};

        assertThatThrownBy(() -> task.apply(content))
                .isInstanceOf(DecodeException.class)
                .hasMessage("Content is not valid UTF-8");
    }

    @Test
    @DisplayName("A truncated multibyte sequence is invalid")
    void testTruncatedSequence() {
        byte[] content = {'o', 'k', (byte) 0xE2, (byte) 0x82};

        assertThatThrownBy(() -> task.apply(content)).isInstanceOf(DecodeException.class);
    }
}
