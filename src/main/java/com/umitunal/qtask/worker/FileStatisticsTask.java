package com.umitunal.qtask.worker;

import com.umitunal.qtask.core.DecodeException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Simple statistics over a text file: line separators and characters.
 */
public class FileStatisticsTask implements TaskFunction {
    public static final String NAME = "file.statistics";

    public static final String LINES = "lines";
    public static final String CHARACTERS = "characters";

    @Override
    public Map<String, Long> apply(byte[] content) {
        String text = decodeUtf8(content);

        Map<String, Long> statistics = new LinkedHashMap<>();
        statistics.put(LINES, text.chars().filter(c -> c == '\n').count());
        statistics.put(CHARACTERS, (long) text.codePointCount(0, text.length()));
        return statistics;
    }

    // Malformed input is reported, not replaced
    static String decodeUtf8(byte[] content) {
        try {
            return UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Content is not valid UTF-8", e);
        }
    }
}
