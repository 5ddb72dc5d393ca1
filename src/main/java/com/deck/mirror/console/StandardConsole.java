package com.deck.mirror.console;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Console backed by a reader and a print stream, usually stdin and stdout.
 */
public class StandardConsole implements UserConsole {

    private final BufferedReader in;
    private final PrintStream out;

    public StandardConsole() {
        this(System.in, System.out);
    }

    public StandardConsole(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public void println(String line) {
        out.println(line);
    }

    @Override
    public String prompt(String message) {
        out.print(message);
        out.flush();
        try {
            String line = in.readLine();
            return line == null ? null : line.strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read from console", e);
        }
    }
}
