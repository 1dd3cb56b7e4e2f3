package com.example.konvertor.infrastructure.csv;

import com.example.konvertor.domain.model.DecodedText;
import com.example.konvertor.infrastructure.exception.EncodingUndetectableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Infrastructure service that decodes uploaded bytes by trying a fixed list of charsets.
 * Accounting exports come either as UTF-8 (often with a BOM) or in the Central European Windows code page.
 */
@Service
public class CharsetResolver {

    private static final Logger log = LoggerFactory.getLogger(CharsetResolver.class);
    private static final List<Charset> CANDIDATES = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("windows-1250")
    );
    private static final char BOM = '\uFEFF';

    /**
     * Decodes the bytes with the first candidate charset that accepts them without errors.
     *
     * @param bytes raw file content
     * @return decoded text (without a leading BOM) and the charset used
     * @throws EncodingUndetectableException when no candidate decodes the input
     */
    public DecodedText decode(byte[] bytes) {
        for (Charset charset : CANDIDATES) {
            try {
                String text = strictDecoder(charset).decode(ByteBuffer.wrap(bytes)).toString();
                if (!text.isEmpty() && text.charAt(0) == BOM) {
                    text = text.substring(1);
                }
                log.debug("Decoded {} bytes as {}", bytes.length, charset.name());
                return new DecodedText(text, charset);
            } catch (CharacterCodingException ex) {
                log.debug("Input is not valid {}: {}", charset.name(), ex.getMessage());
            }
        }
        throw new EncodingUndetectableException(CANDIDATES.stream().map(Charset::name).toList());
    }

    private CharsetDecoder strictDecoder(Charset charset) {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }
}
