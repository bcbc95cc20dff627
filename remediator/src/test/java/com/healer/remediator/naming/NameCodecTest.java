package com.healer.remediator.naming;

import com.healer.remediator.config.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NameCodecTest {

    NameCodec codec = new NameCodec(20);

    @Test
    void build_joinsNonEmptySegments() {
        Identifier id = codec.build("fix", "", "abc", "", "1");

        assertThat(id.value()).isEqualTo("fix-abc-1");
        assertThat(id.truncated()).isFalse();
    }

    @Test
    void buildBounded_shortName_isUnchanged() {
        Identifier id = codec.buildBounded("fix", "pod", "x1");

        assertThat(id.value()).isEqualTo("fix-pod-x1");
        assertThat(id.truncated()).isFalse();
    }

    @Test
    void truncate_shortensOnlyTheVariableSegment() {
        Identifier id = codec.buildBounded("fix", "a-very-long-variable-part", "x1");

        assertThat(id.length()).isLessThanOrEqualTo(20);
        assertThat(id.value()).startsWith("fix-").endsWith("-x1");
        assertThat(id.variable()).isEqualTo("a-very-long");
        assertThat(id.truncated()).isTrue();
        assertThat(id.hardTruncated()).isFalse();
    }

    @Test
    void truncate_cutAtSeparator_stripsDanglingSeparator() {
        // room for the variable is 12 chars: "aaaaaaaaaaa-" would leave a trailing '-'
        Identifier id = codec.buildBounded("p", "aaaaaaaaaaa-bbbbbbbb", "s1");

        assertThat(id.value()).doesNotContain("--");
        assertThat(id.variable()).doesNotEndWith("-");
        assertThat(id.value()).endsWith("-s1");
    }

    @Test
    void truncate_noRoomForVariable_dropsItWithItsSeparator() {
        Identifier id = new NameCodec(10).buildBounded("prefix", "variable", "abc");

        assertThat(id.value()).isEqualTo("prefix-abc");
        assertThat(id.variable()).isEmpty();
        assertThat(id.hardTruncated()).isFalse();
    }

    @Test
    void truncate_fixedSegmentsTooLong_hardTruncates() {
        Identifier id = new NameCodec(8).buildBounded("prefix-long", "v", "s");

        assertThat(id.value()).isEqualTo("prefix");
        assertThat(id.hardTruncated()).isTrue();
    }

    @Test
    void truncate_isIdempotent() {
        Identifier once  = codec.buildBounded("fix", "something-rather-long-here", "z9");
        Identifier twice = codec.truncate(once);

        assertThat(twice.value()).isEqualTo(once.value());
    }

    @Test
    void truncate_variableOnly_usesTheWholeLimit() {
        Identifier id = codec.truncate(codec.build("", "abcdefghij"), 5);

        assertThat(id.value()).isEqualTo("abcde");
    }

    @Test
    void truncate_staysWithinEveryLimit_andKeepsFixedSegments() {
        List<Identifier> shapes = List.of(
                codec.build("heal-remediation", "variable-segment-x", "a7", "abc"),
                codec.build("", "only-variable-here"),
                codec.build("prefix", "var"),
                codec.build("", "var", "s1", "s2"),
                codec.build("p", "", "suffix"));

        for (Identifier full : shapes) {
            String suffixes = String.join("-", full.suffixes().stream().filter(s -> !s.isEmpty()).toList());
            for (int maxLen = 1; maxLen <= 80; maxLen++) {
                Identifier id = codec.truncate(full, maxLen);
                String label = full.value() + " @ " + maxLen;

                assertThat(id.length()).as(label).isLessThanOrEqualTo(maxLen);
                assertThat(id.value()).as(label).doesNotEndWith("-");
                if (id.hardTruncated()) {
                    assertThat(full.value()).as(label).startsWith(id.value());
                } else {
                    assertThat(id.value()).as(label).startsWith(full.prefix()).endsWith(suffixes);
                }
            }
        }
    }

    @Test
    void nonPositiveLimit_isRejected() {
        assertThatThrownBy(() -> new NameCodec(0))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> codec.truncate(codec.build("a", "b"), -1))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
