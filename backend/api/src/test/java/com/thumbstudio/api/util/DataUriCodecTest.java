package com.thumbstudio.api.util;

import com.thumbstudio.common.exception.ApiException;
import com.thumbstudio.common.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataUriCodecTest {

    private static final byte[] PAYLOAD = "thumbnail".getBytes(StandardCharsets.UTF_8);

    @Test
    void acceptsPlainBase64AndDataUri() {
        assertThat(DataUriCodec.decode("dGh1bWJuYWls")).isEqualTo(PAYLOAD);
        assertThat(DataUriCodec.decode("data:image/png;base64,dGh1bWJuYWls")).isEqualTo(PAYLOAD);
        assertThat(DataUriCodec.decode("  dGh1bW\r\nJuYWls  ")).isEqualTo(PAYLOAD);
    }

    @Test
    void encodesAsDataUri() {
        assertThat(DataUriCodec.encode(PAYLOAD, "image/jpeg")).isEqualTo("data:image/jpeg;base64,dGh1bWJuYWls");
    }

    @Test
    void rejectsMissingOrMalformedInput() {
        for (String bad : new String[]{null, "", "   ", "data:image/png;base64"}) {
            assertThatThrownBy(() -> DataUriCodec.decode(bad))
                    .isInstanceOf(ApiException.class)
                    .extracting(e -> ((ApiException) e).getErrorCode())
                    .isEqualTo(ErrorCode.IMAGE_DECODE_FAILED);
        }
    }
}
