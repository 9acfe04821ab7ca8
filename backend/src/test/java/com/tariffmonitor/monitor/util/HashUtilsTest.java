package com.tariffmonitor.monitor.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashUtilsTest {

    @Test
    void sha256MatchesKnownDigest() {
        String digest = HashUtils.sha256Hex("abc".getBytes(StandardCharsets.UTF_8));
        assertThat(digest).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void emptyInputHasStableDigest() {
        assertThat(HashUtils.sha256Hex(new byte[0]))
            .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void singleByteDifferenceChangesDigest() {
        byte[] first = "tariff schedule rev 1".getBytes(StandardCharsets.UTF_8);
        byte[] second = "tariff schedule rev 2".getBytes(StandardCharsets.UTF_8);
        assertThat(HashUtils.sha256Hex(first)).isNotEqualTo(HashUtils.sha256Hex(second));
        assertThat(HashUtils.sha256Hex(first)).isEqualTo(HashUtils.sha256Hex(first.clone()));
    }

    @Test
    void nullIsRejected() {
        assertThatThrownBy(() -> HashUtils.sha256Hex(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
