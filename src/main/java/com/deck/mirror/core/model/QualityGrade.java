package com.deck.mirror.core.model;

/**
 * Quality grade of a single card.
 *
 * @param score     integer score, always within [0, 10]
 * @param reasoning model explanation or a diagnostic message
 * @param failed    true when the grading request itself failed; failed grades are never cached
 */
public record QualityGrade(int score, String reasoning, boolean failed) {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 10;
    public static final int NEUTRAL_SCORE = 5;

    public QualityGrade {
        score = clamp(score);
        reasoning = reasoning != null ? reasoning : "";
    }

    public static QualityGrade of(int score, String reasoning) {
        return new QualityGrade(score, reasoning, false);
    }

    public static QualityGrade neutral(String reasoning) {
        return new QualityGrade(NEUTRAL_SCORE, reasoning, false);
    }

    public static QualityGrade failure(String reasoning) {
        return new QualityGrade(NEUTRAL_SCORE, reasoning, true);
    }

    public static int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    public boolean isBelow(int threshold) {
        return !failed && score < threshold;
    }
}
