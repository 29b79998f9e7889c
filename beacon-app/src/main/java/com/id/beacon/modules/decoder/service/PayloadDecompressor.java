package com.id.beacon.modules.decoder.service;

import com.id.beacon.modules.ingest.exceptions.MalformedPayloadException;
import org.springframework.stereotype.Service;
import org.xerial.snappy.Snappy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Unwraps transport envelopes (base64 body encoding, then {@code Content-Encoding}) before the payload
 * reaches any dialect decoder.
 */
@Service
public class PayloadDecompressor {

    public static final String SNAPPY = "snappy";
    public static final String GZIP = "gzip";
    public static final String IDENTITY = "identity";
    public static final String BASE64 = "base64";

    public byte[] unwrapBase64(byte[] payload, String bodyEncoding) {
        if (bodyEncoding == null || bodyEncoding.isBlank()) {
            return payload;
        }
        if (!BASE64.equals(bodyEncoding.trim().toLowerCase(Locale.ROOT))) {
            throw new MalformedPayloadException("Unsupported body encoding '%s'".formatted(bodyEncoding));
        }
        try {
            String text = new String(payload, StandardCharsets.US_ASCII).replaceAll("\\s+", "");
            return Base64.getDecoder().decode(text);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Body is not valid base64", e);
        }
    }

    public byte[] decompress(byte[] payload, String contentEncoding) {
        if (contentEncoding == null || contentEncoding.isBlank()) {
            return payload;
        }
        String encoding = contentEncoding.trim().toLowerCase(Locale.ROOT);
        try {
            return switch (encoding) {
                case IDENTITY -> payload;
                case SNAPPY -> Snappy.uncompress(payload);
                case GZIP -> gunzip(payload);
                default -> throw new MalformedPayloadException("Unsupported content encoding '%s'".formatted(contentEncoding));
            };
        } catch (IOException e) {
            throw new MalformedPayloadException("Corrupt %s payload".formatted(encoding), e);
        }
    }

    private static byte[] gunzip(byte[] payload) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(payload))) {
            return in.readAllBytes();
        }
    }
}
