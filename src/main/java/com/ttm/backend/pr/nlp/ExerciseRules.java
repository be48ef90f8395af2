package com.ttm.backend.pr.nlp;

import java.util.List;
import java.util.regex.Pattern;

import static com.ttm.backend.pr.nlp.RewriteRule.of;

/**
 * 動作名稱改寫規則表（依序套用，後面的規則依賴前面已展開的縮寫）。
 * 輸入一律已經 ExerciseTextNorm.clean：小寫、無句點逗號、連字號已轉空白。
 *
 * 順序：typo → 冠詞 → 縮寫 → 器材同義詞 → 複合字 → 複數 → 修飾詞
 *      → 補 press → 去尾註 → 動作家族
 */
public final class ExerciseRules {
    private ExerciseRules() {}

    /* ---------- guard 用的 pattern ---------- */

    private static final Pattern P_OVERHAND_CONTEXT =
            Pattern.compile("\\b(?:pull ?downs?|pull ?ups?|rows?|curls?)\\b");
    private static final Pattern P_CHIN_PULL =
            Pattern.compile("\\b(?:chin ?ups?|pull ?ups?)\\b");
    private static final Pattern P_PRESS = Pattern.compile("\\bpress\\b");
    private static final Pattern P_BENCH = Pattern.compile("\\bbench\\b");
    private static final Pattern P_BENCH_NOT_PRESS =
            Pattern.compile("\\bbench (?:dips?|rows?|stepups?|jumps?|hops?|supported)\\b");
    private static final Pattern P_TRICEP = Pattern.compile("\\btricep\\b");
    private static final Pattern P_NON_TRICEP_EXTENSION =
            Pattern.compile("\\b(?:leg|back|hip|hyper|reverse)\\b");

    private static final String DEG = " ?(?:degrees?\\b|deg\\b|°)";
    private static final String LOW_DEG = "(?:10|15|20|25|30)" + DEG;
    private static final String MID_DEG = "(?:35|40|45|50)" + DEG;
    private static final String HIGH_DEG = "(?:55|60|65|70|75|80)" + DEG;

    /* ---------- 2) typo ---------- */
    static final RuleStage TYPOS = new RuleStage("typos", List.of(
            of("typo-weighted", "\\bweighte\\b", "weighted"),
            of("typo-ex-bar", "\\bex bar\\b", "ez bar"),
            of("typo-dumbbell", "\\b(?:dumbell|dumbel|dumbbel|dumb bell)(s?)\\b", "dumbbell$1"),
            of("typo-barbell", "\\b(?:barbel|bar bell)(s?)\\b", "barbell$1"),
            of("typo-kettlebell", "\\b(?:kettle bell|kettelbell|kettlebel)(s?)\\b", "kettlebell$1"),
            of("typo-military", "\\b(?:militery|millitary|miltary|militairy)\\b", "military"),
            of("typo-romanian", "\\b(?:romainian|romanain|romainan|rumanian)\\b", "romanian"),
            of("typo-deadlift", "\\b(?:dead lift|deadlfit|deadlit|dedlift)(s?)\\b", "deadlift$1"),
            of("typo-tricep", "\\b(?:tricept|triscep|tricpe)(s?)\\b", "tricep$1"),
            of("typo-bicep", "\\b(?:bicept|bicpe)(s?)\\b", "bicep$1"),
            of("typo-bench", "\\b(?:bentch|bech|bnech)\\b", "bench"),
            of("typo-bench-press", "\\bbenchpress(?:es)?\\b", "bench press"),
            of("typo-lateral", "\\b(?:latteral|latral)(s?)\\b", "lateral$1"),
            of("typo-squat", "\\b(?:sqaut|squt|sqat)(s?)\\b", "squat$1"),
            of("typo-shoulder", "\\b(?:sholder|shoudler)(s?)\\b", "shoulder$1"),
            of("typo-extension", "\\b(?:extention|extenstion)(s?)\\b", "extension$1"),
            of("typo-raise", "\\b(?:rasie|raize)(s?)\\b", "raise$1"),
            of("typo-pec-deck", "\\bpec (?:dec|dek)\\b", "pec deck"),
            // skull crusher = 躺姿 tricep extension
            of("typo-skullcrusher", "\\bskull ?crushers?\\b", "tricep extension")
    ));

    /* ---------- 3) 冠詞 ---------- */
    static final RuleStage ARTICLES = new RuleStage("articles", List.of(
            of("strip-the", "^(?:the )+", "")
    ));

    /* ---------- 4) 縮寫 ---------- */
    static final RuleStage ABBREVIATIONS = new RuleStage("abbreviations", List.of(
            // 器材
            of("abbr-db", "\\bdbs?\\b", "dumbbell"),
            of("abbr-bb", "\\bbb\\b", "barbell"),
            of("abbr-kb", "\\bkbs?\\b", "kettlebell"),
            of("abbr-mb", "\\bmb\\b", "medicine ball"),
            of("abbr-ez", "\\bez\\b(?! (?:curl )?bar\\b)", "ez bar")
                    .when((s, w) -> !s.contains("ez bar")),
            // 動作
            of("abbr-rdl", "\\brdls?\\b", "romanian deadlift"),
            of("abbr-sldl", "\\bsldls?\\b", "stiff leg deadlift"),
            of("abbr-dl", "\\bdls?\\b", "deadlift"),
            of("abbr-ohp", "\\bohp\\b", "overhead press"),
            of("abbr-bp", "\\bbp\\b", "bench press"),
            of("abbr-fs", "\\bfs\\b", "front squat"),
            of("abbr-bss", "\\bbss\\b", "bulgarian split squat"),
            of("abbr-bs", "\\bbs\\b", "back squat"),
            of("abbr-rfess", "\\brfess?\\b", "rear foot elevated split squat"),
            of("abbr-ghr", "\\bghr\\b", "glute ham raise"),
            of("abbr-rdf", "\\brdf\\b", "rear delt fly"),
            of("abbr-cs", "\\bcs\\b", "chest supported"),
            of("abbr-sa", "\\bsa\\b", "single arm"),
            of("abbr-sl", "\\bsl\\b", "single leg"),
            of("abbr-hspu", "\\bhspu\\b", "handstand pushup"),
            of("abbr-er", "\\ber\\b", "external rotation"),
            of("abbr-ext-rot", "\\bext rot(?:ation)?\\b", "external rotation"),
            of("abbr-ext", "\\bext\\b", "extension"),
            of("abbr-tri", "\\btris?\\b", "tricep"),
            // 單側
            of("abbr-single-arm", "\\b(?:one|1) arm(?:ed)?\\b", "single arm"),
            of("abbr-single-leg", "\\b(?:one|1) leg(?:ged)?\\b", "single leg"),
            // 握法
            of("grip-pronated", "\\bpronated\\b", "overhand"),
            of("grip-supinated", "\\bsupinated\\b", "underhand"),
            of("pos-supine", "\\bsupine\\b", "lying"),
            // OH：與 pulldown/pullup/row/curl 同時出現 → overhand，其餘 → overhead
            of("abbr-oh-overhand", "\\boh\\b", "overhand")
                    .when((s, w) -> P_OVERHAND_CONTEXT.matcher(s).find()),
            of("abbr-oh-overhead", "\\boh\\b", "overhead"),
            of("abbr-uh", "\\buh\\b", "underhand")
    ));

    /* ---------- 5) 器材同義詞 ---------- */
    static final RuleStage EQUIPMENT = new RuleStage("equipment", List.of(
            of("eq-suspension-trainer", "\\bsuspension trainer\\b", "trx"),
            of("eq-suspension", "\\bsuspension\\b", "trx"),
            of("eq-cables", "\\bcables\\b", "cable"),
            of("eq-ez-curl-bar", "\\b(?:ez curl bar|easy bar|ezbar)\\b", "ez bar"),
            of("eq-smith", "\\bsmith\\b(?! machine\\b)", "smith machine"),
            of("eq-hex-bar", "\\bhex bar\\b", "trap bar"),
            of("eq-toe-press", "\\btoe press\\b", "leg press calf raise"),
            of("eq-swiss-ball-leg-curl", "\\bswiss ball leg curl\\b", "stability ball leg curl"),
            of("eq-ball-leg-curl", "(?<!stability )\\bball leg curl\\b", "stability ball leg curl"),
            of("eq-slider-leg-curl", "\\b(?:gliding disk|gliding|towel) leg curl\\b", "slider leg curl"),
            of("eq-band-assist", "\\bband assist\\b", "band assisted"),
            of("eq-banded", "\\bbanded\\b", "band assisted")
                    .when((s, w) -> P_CHIN_PULL.matcher(s).find())
    ));

    /* ---------- 6) 複合字（單複數都處理） ---------- */
    static final RuleStage COMPOUNDS = new RuleStage("compounds", List.of(
            of("cw-face-pull", "\\bface pull(s?)\\b", "facepull$1"),
            of("cw-chin-up", "\\bchin up(s?)\\b", "chinup$1"),
            of("cw-pull", "\\bpull (up|down|over)(s?)\\b", "pull$1$2"),
            of("cw-push", "\\bpush (up|down)(s?)\\b", "push$1$2"),
            of("cw-sit-up", "\\bsit up(s?)\\b", "situp$1"),
            of("cw-step-up", "\\bstep up(s?)\\b", "stepup$1"),
            of("cw-roll-out", "\\broll out(s?)\\b", "rollout$1")
    ));

    /* ---------- 7) 複數 → 單數（dips 維持複數） ---------- */
    static final RuleStage PLURALS = new RuleStage("plurals", List.of(
            of("pl-common", "\\b(raise|extension|curl|row|squat|deadlift|lunge|shrug|pulldown|pushdown"
                    + "|chinup|pullup|pushup|situp|stepup|facepull|thrust|rollout|pullover|kickback"
                    + "|lateral|hang|swing|bridge|rotation|hyperextension|dumbbell|kettlebell)s\\b", "$1"),
            of("pl-press", "\\bpresses\\b", "press"),
            of("pl-crunch", "\\bcrunches\\b", "crunch"),
            of("pl-fly", "\\bfl(?:ies|yes|ys)\\b", "fly"),
            of("pl-tricep", "\\btriceps\\b", "tricep"),
            of("pl-bicep", "\\bbiceps\\b", "bicep"),
            of("pl-good-morning", "\\bgood mornings\\b", "good morning")
    ));

    /* ---------- 8) 修飾詞 / 位置 ---------- */
    static final RuleStage MODIFIERS = new RuleStage("modifiers", List.of(
            of("mod-pause-rep", "\\bpaused? reps?\\b", "paused"),
            of("mod-pause", "\\bpause\\b", "paused"),
            of("mod-body-weight", "\\bbody weight\\b", "bodyweight"),
            of("mod-bw", "\\bbw\\b", "bodyweight"),
            of("mod-position-first", "\\b(dumbbell|barbell) (seated|standing|incline|flat|decline)\\b", "$2 $1")
    ));

    /* ---------- 9) bench 補 press ---------- */
    static final RuleStage IMPLICIT_PRESS = new RuleStage("implicit-press", List.of(
            of("press-after-bench", "\\bbench\\b", "bench press")
                    .when((s, w) -> P_BENCH.matcher(s).find()
                            && !P_PRESS.matcher(s).find()
                            && !P_BENCH_NOT_PRESS.matcher(s).find())
    ));

    /* ---------- 10) 去尾註：tempo / 秒數 / each side / x3 ---------- */
    static final RuleStage TRAILING = new RuleStage("trailing", List.of(
            of("trail-annotations",
                    "(?:\\s+(?:x\\s*\\d+|\\d+\\s*x"
                            + "|(?:each|per)\\s+(?:side|arm|leg|hand)"
                            + "|(?:for\\s+)?\\d+\\s*(?:s|secs?|seconds?|mins?|minutes?)(?:\\s+holds?)?"
                            + "|\\d+(?:\\s+\\d+){2,3}"
                            + "|tempo))+$",
                    "")
    ));

    /* ---------- 11) 動作家族 ---------- */
    static final RuleStage FAMILIES = new RuleStage("families", List.of(
            // lateral raise
            of("lat-side-raise", "\\bside (?:lateral )?raise\\b", "lateral raise"),
            of("lat-lat-raise", "\\blat raise\\b", "lateral raise"),
            of("lat-add-raise", "\\blateral\\b(?! (?:raise|lunge|stepup|walk|shuffle|bound)\\b)", "lateral raise")
                    .when((s, w) -> !s.contains("raise")),

            // extension：leg/back/hip/hyper/reverse 以外才補 tricep
            of("ext-reverse-hyper", "\\breverse hyper ?extension\\b", "reverse hyper"),
            of("ext-hyperextension", "\\bhyper ?extension\\b", "back extension"),
            of("ext-hyper", "(?<!reverse )\\bhyper\\b(?! ?extension\\b)", "back extension"),
            of("ext-add-tricep", "\\bextension\\b", "tricep extension")
                    .when((s, w) -> !P_TRICEP.matcher(s).find()
                            && !P_NON_TRICEP_EXTENSION.matcher(s).find()),

            // curls
            of("curl-bare", "^curl$", "bicep curl"),
            of("curl-biceps", "\\bbiceps? curl\\b", "bicep curl"),
            of("curl-cable", "\\bcable curl\\b", "cable bicep curl"),
            of("curl-hamstring", "\\b(?:hamstring|ham) curl\\b", "leg curl"),

            // 胸推
            of("press-flat", "\\bflat ((?:dumbbell|barbell) )?bench press\\b", "$1bench press"),
            of("press-incline-decline", "\\b(incline|decline) ((?:dumbbell|barbell) )?press\\b", "$1 $2bench press"),
            // 肩推：overhead / shoulder / strict → military
            of("press-military", "\\b(?:shoulder|overhead|strict) press\\b", "military press"),

            // rows：dumbbell row 預設單手；bent dumbbell row 是雙手
            of("row-barbell-bent", "\\bbarbell bent(?: over)? row\\b", "barbell row"),
            of("row-bent-barbell", "\\bbent(?: over)? barbell row\\b", "barbell row"),
            of("row-dumbbell-bent", "\\bdumbbell bent(?: over)? row\\b", "bent over dumbbell row"),
            of("row-bent-dumbbell", "\\bbent dumbbell row\\b", "bent over dumbbell row"),
            of("row-bent", "(?<!dumbbell )\\bbent(?: over)? row\\b", "barbell row"),
            of("row-dumbbell-single", "^dumbbell row$", "single arm dumbbell row"),

            // pulldowns
            of("pd-bare", "^pulldown$", "lat pulldown"),
            of("pd-wide", "\\bwide(?: grip)? (?:lat )?pulldown\\b", "wide grip lat pulldown"),
            of("pd-close", "\\bclose(?: grip)? (?:lat )?pulldown\\b", "close grip lat pulldown"),

            // pullups / chinups
            of("pu-pulls", "\\bpulls\\b", "pullup"),
            of("pu-chins", "\\bchins\\b", "chinup"),

            // 深蹲：0 → 徒手；> 15 → 槓鈴背蹲；中間區間保留給 fuzzy
            of("squat-bodyweight", "^squat$", "bodyweight squat")
                    .when((s, w) -> w != null && w == 0d),
            of("squat-barbell", "^squat$", "barbell back squat")
                    .when((s, w) -> w != null && w > 15d),
            of("squat-goblet", "\\b(?:dumbbell|kettlebell) goblet squat\\b", "goblet squat"),
            of("squat-goblet-bare", "^goblet$", "goblet squat"),
            of("squat-bulgarian", "\\bbulgarian(?: split)?(?: squat)?\\b", "rear foot elevated split squat"),

            // deadlifts
            of("dl-bare", "^deadlift$", "conventional deadlift"),
            of("dl-sumo", "\\bsumo\\b(?! (?:deadlift|squat)\\b)", "sumo deadlift"),

            of("hip-thrust-barbell", "\\bbarbell hip thrust\\b", "hip thrust"),

            // dips 一律複數
            of("dip-parallel", "\\bparallel bar dips?\\b", "dips"),
            of("dip-plural", "\\bdip\\b", "dips"),

            of("facepull-equipment", "\\b(?:cable|rope) facepull\\b", "facepull"),

            // flies
            of("fly-flye", "\\bflye\\b", "fly"),
            of("fly-reverse-pec-deck", "\\breverse (?:pec deck|machine fly)\\b", "rear delt fly"),
            of("fly-pec-deck", "\\bpec deck(?: fly)?\\b", "machine fly"),
            of("fly-rear", "\\b(?:reverse|bent over|rear) fly\\b", "rear delt fly"),

            of("shrug-trap", "\\btrap shrug\\b", "shrug"),
            of("calf-standing", "^calf raise$", "standing calf raise"),

            // 腹
            of("ab-wheel", "\\bab wheel(?: rollout)?\\b", "ab rollout"),
            of("ab-rollout-bare", "^rollout$", "ab rollout"),

            of("hang-from-bar", "\\b(?:hang from (?:a |the )?bar|bar hang)\\b", "dead hang"),
            of("hang-bare", "^hang$", "dead hang"),

            // pushdowns：v bar / ez bar / 直槓 都視為預設
            of("pushdown-bare", "^pushdown$", "tricep pushdown"),
            of("pushdown-bar", "\\b(?:v bar|ez bar|straight bar|cable) pushdown\\b", "tricep pushdown"),
            of("pushdown-rope", "\\brope pushdown\\b", "rope tricep pushdown"),

            of("good-morning-barbell", "\\bbarbell good morning\\b", "good morning"),

            // pullovers
            of("pullover-bare", "^pullover$", "dumbbell pullover"),
            of("pullover-straight-arm", "\\bstraight arm (?:lat )?pulldown\\b", "cable pullover"),

            // 機械：「machine <動作>」
            of("machine-first", "\\b(chest press|leg press|military press|row|fly|lat pulldown|leg curl"
                    + "|leg extension|hack squat|calf raise|preacher curl) machine\\b", "machine $1"),

            of("external-rotation", "\\bext(?:ernal)? rot(?:ation)?\\b", "external rotation"),

            // 上斜角度（只對 press）：low / incline / high 三段
            of("incline-low", "\\b(?:low|" + LOW_DEG + ") incline\\b", "low incline")
                    .when((s, w) -> P_PRESS.matcher(s).find()),
            of("incline-low-after", "\\bincline " + LOW_DEG, "low incline")
                    .when((s, w) -> P_PRESS.matcher(s).find()),
            of("incline-high", "\\b(?:high|steep|" + HIGH_DEG + ") incline\\b", "high incline")
                    .when((s, w) -> P_PRESS.matcher(s).find()),
            of("incline-high-after", "\\bincline " + HIGH_DEG, "high incline")
                    .when((s, w) -> P_PRESS.matcher(s).find()),
            of("incline-standard", "\\b" + MID_DEG + " incline\\b", "incline")
                    .when((s, w) -> P_PRESS.matcher(s).find()),
            of("incline-standard-after", "\\bincline " + MID_DEG, "incline")
                    .when((s, w) -> P_PRESS.matcher(s).find())
    ));

    /** 完整流程（不含 clean / 去重 / trim，這三步由 ExerciseNormalizer 負責） */
    public static final List<RuleStage> PIPELINE = List.of(
            TYPOS,
            ARTICLES,
            ABBREVIATIONS,
            EQUIPMENT,
            COMPOUNDS,
            PLURALS,
            MODIFIERS,
            IMPLICIT_PRESS,
            TRAILING,
            FAMILIES
    );
}
