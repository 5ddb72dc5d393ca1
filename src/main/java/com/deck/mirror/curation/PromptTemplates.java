package com.deck.mirror.curation;

import com.deck.mirror.core.model.Card;

/**
 * Prompt templates for the curation pipelines. The full template text is folded
 * into every cache key, so editing a template invalidates its cached results.
 */
public final class PromptTemplates {

    public static final String CLASSIFY_PAIR = """
            Compare these two flashcards and classify their relationship:

            Card 1:
            Q: {question1}
            A: {answer1}

            Card 2:
            Q: {question2}
            A: {answer2}

            Classify as ONE of:
            - "duplicate": Same concept, essentially redundant (one should be removed)
            - "complementary": Related but covering different aspects/opposite scenarios (both should be kept)
            - "unclear": Cannot determine confidently

            Respond with EXACTLY this format:
            classification | reasoning (one line explanation)

            Example: complementary | Card 1 asks about increasing X, Card 2 about decreasing X - opposite scenarios of same concept""";

    public static final String GRADE_CARD = """
            Grade the quality of this flashcard for spaced-repetition study on a scale from 0 to 10.

            Q: {question}
            A: {answer}

            Consider:
            - Is the question clear and unambiguous?
            - Does it test exactly one fact or concept?
            - Is the answer correct, concise and complete?
            - Can it be answered from memory without the card's context?

            Respond in this exact format:
            SCORE: [integer 0-10]
            REASONING: [one or two sentences]""";

    public static final String IMPROVE_CARD = """
            Rewrite this flashcard so it is clear, atomic and easy to review.

            Q: {question}
            A: {answer}

            A reviewer scored it {score}/10: {reasoning}

            Keep the same fact or concept. Do not add unrelated material.

            Respond in this exact format:
            QUESTION: [improved question]
            ANSWER: [improved answer]""";

    private PromptTemplates() {
    }

    public static String classifyPair(String template, Card first, Card second) {
        return template
                .replace("{question1}", first.question())
                .replace("{answer1}", first.answer())
                .replace("{question2}", second.question())
                .replace("{answer2}", second.answer());
    }

    public static String gradeCard(String template, Card card) {
        return template
                .replace("{question}", card.question())
                .replace("{answer}", card.answer());
    }

    public static String improveCard(String template, Card card, int score, String reasoning) {
        return template
                .replace("{score}", Integer.toString(score))
                .replace("{reasoning}", reasoning)
                .replace("{question}", card.question())
                .replace("{answer}", card.answer());
    }
}
