package com.umitunal.qtask.serialization;

import com.umitunal.qtask.core.DecodeException;

import java.util.Base64;

/**
 * URL-safe base64 ({@code A-Z a-z 0-9 - _}, {@code =} padding).
 * The output contains no control characters and can be embedded in a URL.
 */
public class UrlSafeBase64Codec implements TransportCodec {
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    @Override
    public String encode(byte[] content) {
        return ENCODER.encodeToString(content);
    }

    @Override
    public byte[] decode(String text) {
        if (text == null) {
            throw new DecodeException("Payload is missing");
        }
        // The JDK decoder accepts unpadded input; the encoder never produces it
        if (text.length() % 4 != 0) {
            throw new DecodeException("Payload is not valid URL-safe base64: missing padding");
        }
        try {
            return DECODER.decode(text);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Payload is not valid URL-safe base64: " + e.getMessage(), e);
        }
    }
}
