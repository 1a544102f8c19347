package com.umitunal.qtask.serialization;

import com.umitunal.qtask.core.DecodeException;

/**
 * Reversible encoding of binary content into text that any text-based
 * transport can carry.
 */
public interface TransportCodec {

    /**
     * Encode content to transport-safe text.
     */
    String encode(byte[] content);

    /**
     * Exact inverse of {@link #encode(byte[])}.
     *
     * @throws DecodeException if the text was not produced by this codec
     */
    byte[] decode(String text) throws DecodeException;
}
