package com.umitunal.qtask.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON codec using Jackson. Broker messages always travel in this format;
 * result records use it unless Kryo is configured.
 *
 * @param <T> the stored type
 */
public class JsonCodec<T> implements RecordCodec<T> {
    // ObjectMapper is thread safe once configured
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Class<T> type;

    public JsonCodec(Class<T> type) {
        this.type = type;
    }

    /**
     * The mapper shared by every JSON codec. Fields added to a record later
     * are ignored by older readers.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    @Override
    public byte[] encode(T value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + type.getSimpleName() + " as JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable " + type.getSimpleName() + " record", e);
        }
    }

    @Override
    public Class<T> getType() {
        return type;
    }
}
