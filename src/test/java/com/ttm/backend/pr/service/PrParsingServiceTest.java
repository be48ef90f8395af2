package com.ttm.backend.pr.service;

import com.ttm.backend.pr.match.MatchBand;
import com.ttm.backend.pr.model.ParsedPr;
import com.ttm.backend.pr.program.ProgramApiException;
import com.ttm.backend.pr.program.ProgramExerciseProvider;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PrParsingServiceTest {

    private final ProgramExerciseProvider programs = mock(ProgramExerciseProvider.class);
    private final PrParseTelemetry telemetry = mock(PrParseTelemetry.class);
    private final PrParsingService svc = new PrParsingService(new PrLineParser(), programs, telemetry);

    @Test
    void inline_program_wins_over_user_lookup() {
        Optional<ParsedPr> pr = svc.parse("db bench 85/12", 5L, List.of("dumbbell bench press"));

        assertThat(pr).isPresent();
        verifyNoInteractions(programs);
        verify(telemetry).ok(eq(5L), eq("dumbbell bench press"), eq(100), eq(MatchBand.EXACT), eq(false), anyLong());
    }

    @Test
    void user_program_is_fetched_every_time() {
        when(programs.programExercises(5L)).thenReturn(List.of("chinup"));

        svc.parse("chinup BW/8", 5L, null);
        svc.parse("chinup BW/10", 5L, null);

        verify(programs, times(2)).programExercises(5L);
    }

    @Test
    void no_user_no_program_means_empty_candidates() {
        ParsedPr pr = svc.parse("squat 225/5", null, null).orElseThrow();

        assertThat(pr.canonicalExercise()).isEqualTo("barbell back squat");
        verify(telemetry).ok(isNull(), eq("barbell back squat"), eq(0), eq(MatchBand.NO_CANDIDATES), eq(false), anyLong());
    }

    @Test
    void near_miss_is_reported() {
        // dumbbell row x vs barbell row = 72
        svc.parse("dumbbell row x 30/10", null, List.of("barbell row"));

        verify(telemetry).nearMiss(isNull(), eq("dumbbell row x"), eq("dumbbell row x"), eq(72));
    }

    @Test
    void band_comes_from_the_matcher() {
        // 課表只有 null：比對器判定 NO_CANDIDATES，telemetry 要一致
        ParsedPr pr = svc.parse("hammer curl 30/10", null, Arrays.asList((String) null)).orElseThrow();

        assertThat(pr.matchBand()).isEqualTo(MatchBand.NO_CANDIDATES);
        verify(telemetry).ok(isNull(), eq("hammer curl"), eq(0), eq(MatchBand.NO_CANDIDATES), eq(false), anyLong());
    }

    @Test
    void not_found_is_reported() {
        assertThat(svc.parse("deadlift 315/2", 1L, List.of())).isEmpty();
        verify(telemetry).notFound(eq(1L), eq(0), anyLong());
    }

    @Test
    void program_failure_propagates() {
        when(programs.programExercises(9L)).thenThrow(new ProgramApiException(500, "PROGRAM_API_HTTP_500", null));

        assertThatThrownBy(() -> svc.parseAll("bench 100/5", 9L, null))
                .isInstanceOf(ProgramApiException.class);
        verify(telemetry).programFail(9L, 500, "PROGRAM_API_HTTP_500");
    }

    @Test
    void normalize_delegates() {
        assertThat(svc.normalize("squat", 0d)).isEqualTo("bodyweight squat");
    }
}
