package com.libragraph.filestore.core.upload;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.filestore.util.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class UploadOptionsDecoderTest {

    UploadOptionsDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new UploadOptionsDecoder();
        decoder.objectMapper = new ObjectMapper();
    }

    @Test
    void explicitFalseMakesFilesPublic() {
        ParseResult<UploadOptions> result = decoder.decode("{\"isPrivate\": false}");

        assertThat(result.isOk()).isTrue();
        assertThat(result.value().isPrivate()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"isPrivate\": true}",
            "{}",
            "{\"isPrivate\": \"false\"}",
            "{\"isPrivate\": 0}",
            "{\"isPrivate\": null}",
            "{\"other\": false}"
    })
    void anythingButLiteralFalseStaysPrivate(String json) {
        ParseResult<UploadOptions> result = decoder.decode(json);

        assertThat(result.isOk()).isTrue();
        assertThat(result.value().isPrivate()).isTrue();
    }

    @Test
    void missingOptionsUseDefaults() {
        assertThat(decoder.decode(null).value()).isEqualTo(UploadOptions.defaults());
        assertThat(decoder.decode("   ").value().isPrivate()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"{not json", "[false]", "false", "null"})
    void malformedOptionsAreAnError(String raw) {
        ParseResult<UploadOptions> result = decoder.decode(raw);

        assertThat(result.isOk()).isFalse();
        assertThat(result.error()).isNotBlank();
    }
}
