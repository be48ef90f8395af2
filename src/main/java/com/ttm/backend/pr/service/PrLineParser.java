package com.ttm.backend.pr.service;

import com.ttm.backend.pr.match.MatchResult;
import com.ttm.backend.pr.match.ProgramMatcher;
import com.ttm.backend.pr.model.ParsedPr;
import com.ttm.backend.pr.nlp.ExerciseTextNorm;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PR 行解析器：「動作 重量/次數」→ ParsedPr。
 * - 以 * 開頭（教練註解）→ empty
 * - bw → 0；重量不在 [0, maxWeight] 或次數不在 [minReps, maxReps] → empty
 * - 動作名稱交給 ProgramMatcher.resolve（正規化 + 課表比對，同分取課表較前者）
 * 無法解析一律回 empty，不丟例外；呼叫端看到 empty 就不記錄。
 */
@Slf4j
public final class PrLineParser {

    private static final Pattern P_LINES = Pattern.compile("\\R");

    // PERMISSIVE 前處理：口語填充詞、單位、reps 字樣
    private static final Pattern P_FILLER =
            Pattern.compile("\\b(?:new pr|pr|hit|got|did|at|for|with|just|finally|crushed)\\b");
    private static final Pattern P_REP_WORDS = Pattern.compile("\\b(?:reps?|repetitions?)\\b");
    private static final Pattern P_UNITS = Pattern.compile("(?<=\\d)\\s*(?:lbs?|pounds?|kgs?|kilos?)\\b|\\b(?:lbs?|pounds?|kgs?|kilos?)\\b");
    private static final Pattern P_NON_WORD = Pattern.compile("[^\\w\\s]");
    private static final Pattern P_SPACES = Pattern.compile("\\s+");

    private final ParserSettings settings;
    private final ProgramMatcher matcher;

    public PrLineParser() {
        this(ParserSettings.defaults());
    }

    public PrLineParser(ParserSettings settings) {
        this.settings = settings == null ? ParserSettings.defaults() : settings;
        this.matcher = new ProgramMatcher(this.settings.fuzzyThreshold(), this.settings.nearMissFloor());
    }

    public ParserSettings settings() {
        return settings;
    }

    /** 解析單一 PR 行；programExercises 順序即同分優先順序 */
    public Optional<ParsedPr> parse(String message, List<String> programExercises) {
        if (message == null) return Optional.empty();
        String line = message.strip();
        if (line.isEmpty() || ExerciseTextNorm.isComment(line)) return Optional.empty();

        String text = settings.mode() == ParseMode.PERMISSIVE ? permissiveCleanup(line) : line;

        for (PrLinePattern p : settings.mode().patterns()) {
            Matcher m = p.pattern().matcher(text);
            if (!m.find()) continue;

            Optional<ParsedPr> pr = toParsedPr(p, m, programExercises);
            if (pr.isPresent()) return pr;
        }
        return Optional.empty();
    }

    /**
     * 一則訊息可能有多行 PR：逐行解析；
     * 若沒有任何一行成功且訊息不只一行，再把整段當一行試一次。
     */
    public List<ParsedPr> parseAll(String message, List<String> programExercises) {
        if (message == null || message.isBlank()) return List.of();

        String[] lines = P_LINES.split(message.strip());
        List<ParsedPr> out = new ArrayList<>();
        for (String l : lines) {
            parse(l, programExercises).ifPresent(out::add);
        }
        if (out.isEmpty() && lines.length > 1) {
            parse(message, programExercises).ifPresent(out::add);
        }
        return List.copyOf(out);
    }

    private Optional<ParsedPr> toParsedPr(PrLinePattern p, Matcher m, List<String> programExercises) {
        String rawExercise = m.group(p.exerciseGroup()).strip();
        if (settings.mode() == ParseMode.PERMISSIVE) {
            rawExercise = P_SPACES.matcher(P_NON_WORD.matcher(rawExercise).replaceAll("")).replaceAll(" ").strip();
        }
        if (rawExercise.isEmpty()) return Optional.empty();

        double weight;
        int reps;
        try {
            weight = parseWeight(m.group(p.weightGroup()));
            reps = Integer.parseInt(m.group(p.repsGroup()));
        } catch (NumberFormatException e) {
            log.debug("pr_line number overflow pattern={} weight='{}' reps='{}'",
                    p, m.group(p.weightGroup()), m.group(p.repsGroup()));
            return Optional.empty();
        }

        if (weight < 0 || weight > settings.maxWeight()) {
            log.debug("pr_line rejected weight={} pattern={}", weight, p);
            return Optional.empty();
        }
        if (reps < settings.minReps() || reps > settings.maxReps()) {
            log.debug("pr_line rejected reps={} pattern={}", reps, p);
            return Optional.empty();
        }

        MatchResult match = matcher.resolve(rawExercise, weight, programExercises);
        if (match.isEmpty()) return Optional.empty();

        double e1rm = OneRepMaxCalculator.estimate(weight, reps, settings.formula());
        return Optional.of(new ParsedPr(
                rawExercise,
                match.canonical(),
                weight,
                reps,
                e1rm,
                match.score(),
                match.usedFuzzy(),
                match.band()
        ));
    }

    static double parseWeight(String token) {
        String t = token.strip().toLowerCase(Locale.ROOT);
        if (t.equals("bw") || t.equals("bodyweight")) return 0d;
        return Double.parseDouble(t);
    }

    private static String permissiveCleanup(String line) {
        String t = line.toLowerCase(Locale.ROOT);
        t = P_FILLER.matcher(t).replaceAll(" ");
        t = P_REP_WORDS.matcher(t).replaceAll("");
        t = P_UNITS.matcher(t).replaceAll("");
        return P_SPACES.matcher(t).replaceAll(" ").strip();
    }
}
