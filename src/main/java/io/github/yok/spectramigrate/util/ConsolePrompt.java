package io.github.yok.spectramigrate.util;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Interactive console input used by the entry point: yes/no confirmation and password entry.
 *
 * <p>
 * Reads from the current {@link System#in}, so tests can replace the stream. When a real
 * {@link Console} is attached, passwords are read without echo.
 * </p>
 */
@Component
public class ConsolePrompt {

    // Stream the cached reader was built on
    private InputStream readerSource;
    // Reader shared by consecutive prompts so buffered input is not lost
    private BufferedReader reader;

    /**
     * Prints the question and returns whether the answer was {@code y} or {@code yes}
     * (case-insensitive). Empty input or end of stream counts as "no".
     *
     * @param question question text, without the trailing {@code (yes/no)}
     * @return {@code true} if the user confirmed
     * @throws IOException if reading standard input fails
     */
    public boolean confirm(String question) throws IOException {
        System.out.print(question + " (yes/no): ");
        System.out.flush();
        String line = reader().readLine();
        if (line == null) {
            return false;
        }
        String answer = line.trim().toLowerCase(Locale.ROOT);
        return "y".equals(answer) || "yes".equals(answer);
    }

    /**
     * Asks for a password. Uses {@link Console#readPassword} when available, standard input
     * otherwise.
     *
     * @param prompt prompt text
     * @return entered password, or an empty string on end of stream
     * @throws IOException if reading standard input fails
     */
    public String readPassword(String prompt) throws IOException {
        Console console = System.console();
        if (console != null) {
            char[] chars = console.readPassword("%s", prompt);
            return chars == null ? "" : new String(chars);
        }
        System.out.print(prompt);
        System.out.flush();
        String line = reader().readLine();
        return line == null ? "" : line;
    }

    private synchronized BufferedReader reader() {
        // Never closed: closing would close System.in
        if (reader == null || readerSource != System.in) {
            readerSource = System.in;
            reader = new BufferedReader(new InputStreamReader(readerSource, StandardCharsets.UTF_8));
        }
        return reader;
    }
}
