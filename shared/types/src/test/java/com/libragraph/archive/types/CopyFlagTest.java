package com.libragraph.archive.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CopyFlagTest {

    @Test
    void shouldMapStoredLetters() {
        assertThat(CopyFlag.fromCode("Y")).isEqualTo(CopyFlag.YES);
        assertThat(CopyFlag.fromCode("X")).isEqualTo(CopyFlag.CORRUPT);
        assertThat(CopyFlag.MAYBE.code()).isEqualTo("M");
    }

    @Test
    void shouldRejectUnknownLetters() {
        assertThatIllegalArgumentException().isThrownBy(() -> CopyFlag.fromCode("y"));
        assertThatIllegalArgumentException().isThrownBy(() -> CopyFlag.fromCode("YN"));
        assertThatIllegalArgumentException().isThrownBy(() -> CopyFlag.fromCode(null));
    }
}
