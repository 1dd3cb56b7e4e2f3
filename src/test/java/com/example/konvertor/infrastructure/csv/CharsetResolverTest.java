package com.example.konvertor.infrastructure.csv;

import com.example.konvertor.domain.model.DecodedText;
import com.example.konvertor.infrastructure.exception.EncodingUndetectableException;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CharsetResolverTest {

    private final CharsetResolver resolver = new CharsetResolver();

    @Test
    void decodeStripsUtf8ByteOrderMark() {
        byte[] body = "Názov;Účet MD".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[body.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(body, 0, bytes, 3, body.length);

        DecodedText decoded = resolver.decode(bytes);

        assertThat(decoded.text()).isEqualTo("Názov;Účet MD");
        assertThat(decoded.charset()).isEqualTo(StandardCharsets.UTF_8);
    }

    /**
     * Bytes that are not valid UTF-8 fall through to the Windows code page.
     */
    @Test
    void decodeFallsBackToWindows1250() {
        Charset cp1250 = Charset.forName("windows-1250");

        DecodedText decoded = resolver.decode("Činn.;Zák.".getBytes(cp1250));

        assertThat(decoded.text()).isEqualTo("Činn.;Zák.");
        assertThat(decoded.charset()).isEqualTo(cp1250);
    }

    @Test
    void decodeFailsWhenNoCandidateFits() {
        EncodingUndetectableException ex = assertThrows(EncodingUndetectableException.class,
                () -> resolver.decode(new byte[] {(byte) 0x81, (byte) 0x98}));

        assertThat(ex.getMessage()).contains("UTF-8", "windows-1250");
    }
}
