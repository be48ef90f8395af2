package com.ttm.backend.pr.nlp;

import java.util.List;

/** 一組依序套用的改寫規則（規則順序即套用順序） */
public record RuleStage(String name, List<RewriteRule> rules) {

    public RuleStage {
        rules = List.copyOf(rules);
    }

    public String apply(String text, Double weight) {
        String s = text;
        for (RewriteRule r : rules) {
            s = r.apply(s, weight);
        }
        return s;
    }
}
