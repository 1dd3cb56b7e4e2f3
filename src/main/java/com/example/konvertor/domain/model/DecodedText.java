package com.example.konvertor.domain.model;

import java.nio.charset.Charset;

/**
 * Text decoded from raw bytes along with the charset that decoded it.
 */
public record DecodedText(
        String text,
        Charset charset
) {
}
