package com.schemaidentity.identity.hash;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

class HashFunctionsTest {

    @Test
    void testMd5OfEmptyInput() {
        assertThat(HashFunctions.md5Hex().hash(new byte[0])).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
    }

    @Test
    void testSha256OfEmptyInput() {
        assertThat(HashFunctions.sha256Hex().hash(new byte[0]))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void testMd5IsLowercaseHex() {
        String digest = HashFunctions.md5Hex().hash("{\"name\":\"Foo\"}".getBytes(StandardCharsets.UTF_8));

        assertThat(digest).hasSize(32).matches("[0-9a-f]+");
    }

    @Test
    void testByNameResolvesKnownFunctions() {
        assertThat(HashFunctions.byName("md5")).isSameAs(HashFunctions.md5Hex());
        assertThat(HashFunctions.byName("SHA-256")).isSameAs(HashFunctions.sha256Hex());
        assertThat(HashFunctions.byName(" sha256 ")).isSameAs(HashFunctions.sha256Hex());
    }

    @Test
    void testByNameRejectsUnknown() {
        assertThatThrownBy(() -> HashFunctions.byName("crc32"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("crc32");
    }

    @Test
    void testDigestHexRejectsMissingAlgorithm() {
        assertThatThrownBy(() -> HashFunctions.digestHex("NOPE-1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
