package com.example.promptstudio.crypto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApiTokenHasher")
class ApiTokenHasherTest {

    @Test
    @DisplayName("generates prefixed random tokens")
    void newToken() {
        String token = ApiTokenHasher.newToken();

        assertThat(token).startsWith(ApiTokenHasher.TOKEN_PREFIX).hasSize(ApiTokenHasher.TOKEN_PREFIX.length() + 48);
        assertThat(ApiTokenHasher.newToken()).isNotEqualTo(token);
    }

    @Test
    @DisplayName("hashes with SHA-256 as lower-case hex")
    void hash() {
        assertThat(ApiTokenHasher.hash("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
}
