package com.ttm.backend.pr.service;

import com.ttm.backend.pr.match.MatchBand;
import com.ttm.backend.pr.model.ParsedPr;
import com.ttm.backend.pr.nlp.ExerciseNormalizer;
import com.ttm.backend.pr.program.ProgramApiException;
import com.ttm.backend.pr.program.ProgramExerciseProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * HTTP 入口用的 PR 解析流程：
 * 1) 呼叫端有帶 programExercises → 直接用
 * 2) 沒帶但有 userId → 向課表 API 取（每次都取，不快取；課表可能剛改）
 * 3) 都沒有 → 空課表（名稱只做正規化）
 */
@Slf4j
@Service
public class PrParsingService {

    private final PrLineParser parser;
    private final ProgramExerciseProvider programs;
    private final PrParseTelemetry telemetry;

    public PrParsingService(PrLineParser parser, ProgramExerciseProvider programs, PrParseTelemetry telemetry) {
        this.parser = parser;
        this.programs = programs;
        this.telemetry = telemetry;
    }

    public Optional<ParsedPr> parse(String message, Long userId, List<String> programExercises) {
        long t0 = System.nanoTime();
        List<String> program = resolveProgram(userId, programExercises);

        Optional<ParsedPr> pr = parser.parse(message, program);
        long ms = (System.nanoTime() - t0) / 1_000_000;
        if (pr.isPresent()) {
            report(userId, pr.get(), ms);
        } else {
            telemetry.notFound(userId, program.size(), ms);
        }
        return pr;
    }

    public List<ParsedPr> parseAll(String message, Long userId, List<String> programExercises) {
        long t0 = System.nanoTime();
        List<String> program = resolveProgram(userId, programExercises);

        List<ParsedPr> prs = parser.parseAll(message, program);
        long ms = (System.nanoTime() - t0) / 1_000_000;
        if (prs.isEmpty()) {
            telemetry.notFound(userId, program.size(), ms);
        }
        for (ParsedPr pr : prs) {
            report(userId, pr, ms);
        }
        return prs;
    }

    public String normalize(String name, Double weight) {
        return ExerciseNormalizer.normalize(name, weight);
    }

    private List<String> resolveProgram(Long userId, List<String> programExercises) {
        if (programExercises != null) return programExercises;
        if (userId == null) return List.of();
        try {
            return programs.programExercises(userId);
        } catch (ProgramApiException e) {
            telemetry.programFail(userId, e.getStatus(), e.getMessage());
            throw e;
        }
    }

    private void report(Long userId, ParsedPr pr, long ms) {
        MatchBand band = pr.matchBand();
        telemetry.ok(userId, pr.canonicalExercise(), pr.matchScore(), band, pr.usedFuzzy(), ms);
        if (band == MatchBand.NEAR_MISS) {
            telemetry.nearMiss(userId, pr.rawExercise(), pr.canonicalExercise(), pr.matchScore());
        }
    }
}
