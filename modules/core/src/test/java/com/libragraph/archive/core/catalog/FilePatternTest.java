package com.libragraph.archive.core.catalog;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FilePatternTest {

    @Test
    void shouldCaptureGroupsWithUnderscoreNames() {
        var pattern = FilePattern.compile("(?P<chunk_number>[0-9]{8})_(?P<freq_number>[0-9]{4})\\.h5$");

        assertThat(pattern.match("00000000_0000.h5"))
                .contains(Map.of("chunk_number", "00000000", "freq_number", "0000"));
        assertThat(pattern.groupNames()).containsExactly("chunk_number", "freq_number");
    }

    @Test
    void shouldAcceptJavaStyleNamedGroups() {
        var pattern = FilePattern.compile("(?<date_str>[0-9]{8})\\.h5$");

        assertThat(pattern.match("20221106.h5")).contains(Map.of("date_str", "20221106"));
    }

    @Test
    void shouldAnchorAtStartOnly() {
        var pattern = FilePattern.compile("[0-9]{6}\\.h5");

        assertThat(pattern.match("000003.h5.lock")).isPresent();
        assertThat(pattern.match("x000003.h5")).isEmpty();
    }

    @Test
    void shouldHonourEndAnchor() {
        var pattern = FilePattern.compile("[0-9]{6}\\.h5$");

        assertThat(pattern.match("000003.h5.lock")).isEmpty();
    }

    @Test
    void shouldLeaveOutGroupsThatDidNotParticipate() {
        var pattern = FilePattern.compile("(?P<base>[a-z]+)(?P<suffix>_[0-9]+)?\\.log$");

        assertThat(pattern.match("acq.log")).contains(Map.of("base", "acq"));
    }

    @Test
    void shouldKeepUnnamedGroupsAndLookbehind() {
        var pattern = FilePattern.compile("(?P<date>(19|20)[0-9]{6})(?<!0000)\\.h5$");

        assertThat(pattern.match("20221106.h5")).contains(Map.of("date", "20221106"));
        assertThat(pattern.match("21221106.h5")).isEmpty();
    }

    @Test
    void shouldTranslateBackReference() {
        var pattern = FilePattern.compile("(?P<tag>[a-z]+)_(?P=tag)\\.txt$");

        assertThat(pattern.match("ab_ab.txt")).isPresent();
        assertThat(pattern.match("ab_cd.txt")).isEmpty();
    }

    @Test
    void shouldNotTreatEscapedParenAsGroup() {
        var pattern = FilePattern.compile("\\(?P<x>[a-z]\\)");

        assertThat(pattern.groupNames()).isEmpty();
    }

    @Test
    void shouldRejectInvalidPattern() {
        assertThatThrownBy(() -> FilePattern.compile("(?P<open>[0-9]+"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("(?P<open>[0-9]+");
    }

    @Test
    void shouldCompareBySource() {
        assertThat(FilePattern.compile("[0-9]{8}\\.h5$")).isEqualTo(FilePattern.compile("[0-9]{8}\\.h5$"));
    }
}
