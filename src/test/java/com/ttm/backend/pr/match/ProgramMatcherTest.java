package com.ttm.backend.pr.match;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgramMatcherTest {

    private final ProgramMatcher matcher = new ProgramMatcher();
    private final List<String> program = List.of("dumbbell bench press", "chinup", "goblet squat");

    @Test
    void exact_match_is_not_fuzzy() {
        MatchResult r = matcher.match("dumbbell bench press", program);
        assertThat(r.canonical()).isEqualTo("dumbbell bench press");
        assertThat(r.score()).isEqualTo(100);
        assertThat(r.usedFuzzy()).isFalse();
        assertThat(r.band()).isEqualTo(MatchBand.EXACT);
    }

    @Test
    void near_spelling_snaps_to_program() {
        MatchResult r = matcher.match("dumbell bentch press", program);
        assertThat(r.canonical()).isEqualTo("dumbbell bench press");
        assertThat(r.score()).isGreaterThanOrEqualTo(85);
        assertThat(r.usedFuzzy()).isTrue();
        assertThat(r.band()).isEqualTo(MatchBand.FUZZY);
    }

    @Test
    void resolve_normalizes_first() {
        MatchResult r = matcher.resolve("db bench", 85d, program);
        assertThat(r.canonical()).isEqualTo("dumbbell bench press");
        assertThat(r.band()).isEqualTo(MatchBand.EXACT);
    }

    @Test
    void tie_goes_to_first_listed() {
        // 兩者都 93 分
        MatchResult r1 = matcher.match("dumbbell row x", List.of("dumbbell row a", "dumbbell row b"));
        MatchResult r2 = matcher.match("dumbbell row x", List.of("dumbbell row b", "dumbbell row a"));
        assertThat(r1.canonical()).isEqualTo("dumbbell row a");
        assertThat(r2.canonical()).isEqualTo("dumbbell row b");
        assertThat(r1.score()).isEqualTo(r2.score()).isEqualTo(93);
    }

    @Test
    void near_miss_keeps_input() {
        // 72 分：介於 70 與 85 之間
        MatchResult r = matcher.match("dumbbell row x", List.of("barbell row"));
        assertThat(r.canonical()).isEqualTo("dumbbell row x");
        assertThat(r.score()).isEqualTo(72);
        assertThat(r.usedFuzzy()).isFalse();
        assertThat(r.band()).isEqualTo(MatchBand.NEAR_MISS);
    }

    @Test
    void unrelated_keeps_input() {
        MatchResult r = matcher.match("hammer curl", program);
        assertThat(r.canonical()).isEqualTo("hammer curl");
        assertThat(r.score()).isLessThan(70);
        assertThat(r.usedFuzzy()).isFalse();
        assertThat(r.band()).isEqualTo(MatchBand.UNRELATED);
    }

    @Test
    void empty_program_passes_through() {
        MatchResult r = matcher.match("hammer curl", List.of());
        assertThat(r.canonical()).isEqualTo("hammer curl");
        assertThat(r.score()).isZero();
        assertThat(r.band()).isEqualTo(MatchBand.NO_CANDIDATES);

        assertThat(matcher.match("hammer curl", null).band()).isEqualTo(MatchBand.NO_CANDIDATES);
    }

    @Test
    void empty_input_is_empty() {
        assertThat(matcher.match("", program).isEmpty()).isTrue();
        assertThat(matcher.resolve("* coach note", null, program).band()).isEqualTo(MatchBand.EMPTY);
    }

    @Test
    void explicit_threshold() {
        MatchResult r = matcher.match("dumbbell row x", List.of("barbell row"), 70);
        assertThat(r.canonical()).isEqualTo("barbell row");
        assertThat(r.usedFuzzy()).isTrue();
    }

    @Test
    void invalid_thresholds_rejected() {
        assertThatThrownBy(() -> new ProgramMatcher(101, 70)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProgramMatcher(85, 90)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> matcher.match("x", program, 101)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> matcher.match("x", program, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static final String ALPHA33 = "abcdefghijklmnopqrstuvwxyzabcdefg";
    private static final String ALPHA20 = "abcdefghijklmnopqrst";

    @Test
    void just_below_threshold_is_not_fuzzy_even_if_it_rounds_to_85() {
        // LCS 28 / (33 + 33) → 84.85
        String input = ALPHA33.substring(0, 28) + "12345";
        MatchResult r = matcher.match(input, List.of(ALPHA33));
        assertThat(r.canonical()).isEqualTo(input);
        assertThat(r.score()).isEqualTo(85);
        assertThat(r.usedFuzzy()).isFalse();
        assertThat(r.band()).isEqualTo(MatchBand.NEAR_MISS);
    }

    @Test
    void exactly_at_threshold_is_fuzzy() {
        // LCS 17 / (20 + 20) → 85.0
        String input = ALPHA20.substring(0, 17) + "123";
        MatchResult r = matcher.match(input, List.of(ALPHA20));
        assertThat(r.canonical()).isEqualTo(ALPHA20);
        assertThat(r.score()).isEqualTo(85);
        assertThat(r.usedFuzzy()).isTrue();
        assertThat(r.band()).isEqualTo(MatchBand.FUZZY);
    }

    @Test
    void near_miss_floor_uses_raw_score() {
        // LCS 14 / 40 → 70.0
        MatchResult at = matcher.match(ALPHA20.substring(0, 14) + "123456", List.of(ALPHA20));
        assertThat(at.band()).isEqualTo(MatchBand.NEAR_MISS);
        assertThat(at.score()).isEqualTo(70);

        // LCS 23 / 66 → 69.70
        MatchResult below = matcher.match(ALPHA33.substring(0, 23) + "0123456789", List.of(ALPHA33));
        assertThat(below.band()).isEqualTo(MatchBand.UNRELATED);
        assertThat(below.score()).isEqualTo(70);
        assertThat(below.usedFuzzy()).isFalse();
    }

    @Test
    void higher_raw_score_wins_when_both_round_the_same() {
        // 前者 85.71、後者 86.49，四捨五入都是 86
        String a = ALPHA20.substring(0, 15);
        String b = ALPHA20.substring(0, 16) + "Z";
        MatchResult r = matcher.match(ALPHA20, List.of(a, b));
        assertThat(r.canonical()).isEqualTo(b);
        assertThat(r.score()).isEqualTo(86);
        assertThat(r.usedFuzzy()).isTrue();
    }

    @Test
    void null_only_program_has_no_candidates() {
        MatchResult r = matcher.match("hammer curl", java.util.Arrays.asList((String) null));
        assertThat(r.band()).isEqualTo(MatchBand.NO_CANDIDATES);
        assertThat(r.canonical()).isEqualTo("hammer curl");
    }
}
