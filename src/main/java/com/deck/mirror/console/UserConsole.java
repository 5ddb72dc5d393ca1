package com.deck.mirror.console;

/**
 * User-facing terminal output and prompts. Kept apart from logging, which goes to stderr.
 */
public interface UserConsole {

    void println(String line);

    default void println() {
        println("");
    }

    /**
     * Reads one line after showing the prompt.
     *
     * @return the trimmed line, or null at end of input
     */
    String prompt(String message);

    /**
     * Asks a yes/no question. Only {@code y} or {@code yes} (any case) confirms;
     * end of input declines.
     */
    default boolean confirm(String question) {
        String answer = prompt(question + " [y/N] ");
        return answer != null && (answer.equalsIgnoreCase("y") || answer.equalsIgnoreCase("yes"));
    }
}
