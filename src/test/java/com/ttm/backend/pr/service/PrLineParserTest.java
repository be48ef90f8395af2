package com.ttm.backend.pr.service;

import com.ttm.backend.pr.match.MatchBand;
import com.ttm.backend.pr.model.ParsedPr;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PrLineParserTest {

    private final PrLineParser strict = new PrLineParser();
    private final PrLineParser permissive = new PrLineParser(ParserSettings.defaults().withMode(ParseMode.PERMISSIVE));

    @Test
    void db_bench_resolves_to_program_name() {
        ParsedPr pr = strict.parse("db bench 85/12", List.of("dumbbell bench press")).orElseThrow();

        assertThat(pr.rawExercise()).isEqualTo("db bench");
        assertThat(pr.canonicalExercise()).isEqualTo("dumbbell bench press");
        assertThat(pr.weight()).isEqualTo(85.0);
        assertThat(pr.reps()).isEqualTo(12);
        assertThat(pr.estimatedOneRepMax()).isCloseTo(119.0, within(1e-9));
        assertThat(pr.matchScore()).isEqualTo(100);
        assertThat(pr.usedFuzzy()).isFalse();
    }

    @Test
    void bodyweight_has_zero_one_rep_max() {
        ParsedPr pr = strict.parse("chinup BW/8", List.of("chinup")).orElseThrow();

        assertThat(pr.canonicalExercise()).isEqualTo("chinup");
        assertThat(pr.weight()).isEqualTo(0.0);
        assertThat(pr.reps()).isEqualTo(8);
        assertThat(pr.estimatedOneRepMax()).isEqualTo(0.0);
        assertThat(pr.isBodyweight()).isTrue();
    }

    @Test
    void skullcrushers_become_tricep_extension() {
        ParsedPr pr = strict.parse("skullcrushers 85/12", List.of("tricep extension")).orElseThrow();
        assertThat(pr.canonicalExercise()).isEqualTo("tricep extension");
    }

    @Test
    void squat_uses_weight_and_survives_empty_program() {
        ParsedPr pr = strict.parse("squat 225/5", List.of()).orElseThrow();
        assertThat(pr.canonicalExercise()).isEqualTo("barbell back squat");
        assertThat(pr.matchScore()).isZero();
        assertThat(pr.usedFuzzy()).isFalse();
    }

    @Test
    void typo_snaps_to_program_with_fuzzy() {
        ParsedPr pr = strict.parse("lat pulldwn 60/10", List.of("lat pulldown", "barbell row")).orElseThrow();
        assertThat(pr.canonicalExercise()).isEqualTo("lat pulldown");
        assertThat(pr.rawExercise()).isEqualTo("lat pulldwn");
        assertThat(pr.matchScore()).isEqualTo(96);
        assertThat(pr.usedFuzzy()).isTrue();
        assertThat(pr.matchBand()).isEqualTo(MatchBand.FUZZY);
    }

    @Test
    void spacing_decimal_and_last_suffix() {
        assertThat(strict.parse("bench 100 / 5", List.of()).map(ParsedPr::reps)).contains(5);
        assertThat(strict.parse("db curl 22.5/10", List.of()).map(ParsedPr::weight)).contains(22.5);

        ParsedPr pr = strict.parse("bench 5/5 100/5", List.of()).orElseThrow();
        assertThat(pr.rawExercise()).isEqualTo("bench 5/5");
        assertThat(pr.weight()).isEqualTo(100.0);
    }

    @Test
    void rejects_unparseable_and_comments() {
        assertThat(strict.parse("not a valid line", List.of("chinup"))).isEmpty();
        assertThat(strict.parse("* note", List.of("chinup"))).isEmpty();
        assertThat(strict.parse("＊ note 100/5", List.of())).isEmpty();
        assertThat(permissive.parse("＊ bench 100x5", List.of())).isEmpty();
        assertThat(strict.parse("", List.of())).isEmpty();
        assertThat(strict.parse(null, List.of())).isEmpty();
        // STRICT 不收 x
        assertThat(strict.parse("bench 225x5", List.of())).isEmpty();
    }

    @Test
    void bounds_are_inclusive() {
        assertThat(strict.parse("deadlift 315/2", List.of())).isEmpty();
        assertThat(strict.parse("bench 100/51", List.of())).isEmpty();
        assertThat(strict.parse("bench 1000.5/5", List.of())).isEmpty();

        assertThat(strict.parse("bench 100/3", List.of())).isPresent();
        assertThat(strict.parse("bench 100/50", List.of())).isPresent();
        assertThat(strict.parse("bench 1000/3", List.of())).isPresent();
    }

    @Test
    void huge_numbers_are_rejected_without_throwing() {
        assertThat(strict.parse("bench 100/99999999999999", List.of())).isEmpty();
    }

    @Test
    void legacy_formula_is_selectable() {
        PrLineParser legacy = new PrLineParser(ParserSettings.defaults().withFormula(OneRepMaxFormula.LEGACY_LINEAR));
        ParsedPr pr = legacy.parse("bench 100/10", List.of()).orElseThrow();
        assertThat(pr.estimatedOneRepMax()).isCloseTo(133.3, within(1e-9));
    }

    @Test
    void permissive_accepts_loose_formats() {
        Optional<ParsedPr> x = permissive.parse("New PR! bench 225 lbs x 5 reps", List.of("bench press"));
        assertThat(x).isPresent();
        assertThat(x.get().canonicalExercise()).isEqualTo("bench press");
        assertThat(x.get().weight()).isEqualTo(225.0);
        assertThat(x.get().reps()).isEqualTo(5);

        ParsedPr reversed = permissive.parse("5x225 squat", List.of()).orElseThrow();
        assertThat(reversed.canonicalExercise()).isEqualTo("barbell back squat");
        assertThat(reversed.reps()).isEqualTo(5);

        assertThat(permissive.parse("bench 100 - 5", List.of()).map(ParsedPr::reps)).contains(5);
        assertThat(permissive.parse("squat: 100/5", List.of()).map(ParsedPr::canonicalExercise)).contains("barbell back squat");
        assertThat(permissive.parse("bench 100 5", List.of()).map(ParsedPr::weight)).contains(100.0);
        assertThat(permissive.parse("db bench 85/12", List.of()).map(ParsedPr::canonicalExercise)).contains("dumbbell bench press");
    }

    @Test
    void permissive_still_applies_bounds_and_comments() {
        assertThat(permissive.parse("deadlift 315 x 2", List.of())).isEmpty();
        assertThat(permissive.parse("* bench 100x5", List.of())).isEmpty();
    }

    @Test
    void parse_all_reads_each_line_in_order() {
        String msg = """
                bench 100/5
                * coach: nice
                squat 140/3
                garbage here
                """;
        List<ParsedPr> prs = strict.parseAll(msg, List.of("bench press"));
        assertThat(prs).extracting(ParsedPr::canonicalExercise)
                .containsExactly("bench press", "barbell back squat");
        assertThat(strict.parseAll("   ", List.of())).isEmpty();
        assertThat(strict.parseAll("nothing\nat all", List.of())).isEmpty();
    }

    @Test
    void parse_weight_tokens() {
        assertThat(PrLineParser.parseWeight("BW")).isEqualTo(0d);
        assertThat(PrLineParser.parseWeight("bodyweight")).isEqualTo(0d);
        assertThat(PrLineParser.parseWeight("62.5")).isEqualTo(62.5);
    }
}
