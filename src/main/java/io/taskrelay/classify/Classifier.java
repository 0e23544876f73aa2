package io.taskrelay.classify;

import io.taskrelay.model.WorkType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Maps a task description to a work type and base priority. First matching rule wins.
 */
public final class Classifier {
    public static final Classification FALLBACK = new Classification(WorkType.DEVELOPMENT, 50);

    private final List<ClassificationRule> rules;
    private final List<Pattern> compiled;

    public Classifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules == null ? List.of() : rules);
        List<Pattern> patterns = new ArrayList<>(this.rules.size());
        for (ClassificationRule rule : this.rules) {
            patterns.add(rule.compile());
        }
        this.compiled = List.copyOf(patterns);
    }

    public static Classifier withDefaultRules() {
        return new Classifier(defaultRules());
    }

    public static List<ClassificationRule> defaultRules() {
        return List.of(
                new ClassificationRule("(deploy|release|ship|roll ?out|rollback)\\b", WorkType.DEPLOYMENT, 80),
                new ClassificationRule("(hotfix|urgent|fix)\\b", WorkType.DEVELOPMENT, 70),
                new ClassificationRule("(review|audit|inspect)\\b", WorkType.REVIEW, 60),
                new ClassificationRule("(test|verify|qa)\\b", WorkType.TEST, 55),
                new ClassificationRule("(monitor|watch|health ?check|check status)\\b", WorkType.MONITORING, 40)
        );
    }

    public Classification classify(String description) {
        if (description == null) {
            return FALLBACK;
        }
        String text = description.strip();
        for (int i = 0; i < compiled.size(); i++) {
            if (compiled.get(i).matcher(text).find()) {
                ClassificationRule rule = rules.get(i);
                return new Classification(rule.workType(), rule.basePriority());
            }
        }
        return FALLBACK;
    }

    public List<ClassificationRule> rules() {
        return rules;
    }
}
