package com.umitunal.qtask.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * Compact binary codec using Kryo.
 * <p>
 * Every class that can appear in a record is registered under a fixed id, in
 * the given order, so records written by one process stay readable by the
 * next. Append new classes at the end of the list; never reorder it.
 * Kryo instances are not thread safe, so each thread gets its own.
 *
 * @param <T> the stored type
 */
public class KryoCodec<T> implements RecordCodec<T> {
    // Kryo reserves the low ids for its built-in registrations
    static final int FIRST_REGISTRATION_ID = 100;

    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    /**
     * @param type the stored type, registered first
     * @param fieldTypes further classes reachable from the stored type
     */
    public KryoCodec(Class<T> type, List<Class<?>> fieldTypes) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(() -> {
            Kryo kryo = new Kryo();
            kryo.setRegistrationRequired(true);
            kryo.setReferences(false);

            int id = FIRST_REGISTRATION_ID;
            kryo.register(type, id++);
            for (Class<?> fieldType : fieldTypes) {
                kryo.register(fieldType, id++);
            }
            return kryo;
        });
    }

    @Override
    public byte[] encode(T value) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryoThreadLocal.get().writeObject(output, value);
            output.flush();
            return baos.toByteArray();
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try (Input input = new Input(bytes)) {
            return kryoThreadLocal.get().readObject(input, type);
        } catch (KryoException e) {
            throw new IllegalStateException("Unreadable " + type.getSimpleName() + " record", e);
        }
    }

    @Override
    public Class<T> getType() {
        return type;
    }
}
