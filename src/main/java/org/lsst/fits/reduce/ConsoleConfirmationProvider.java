package org.lsst.fits.reduce;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Asks questions on the console and blocks until the operator answers.
 *
 * @author tonyj
 */
public class ConsoleConfirmationProvider implements ConfirmationProvider {

    private static final Logger LOG = Logger.getLogger(ConsoleConfirmationProvider.class.getName());
    private static final Map<String, Boolean> VALID = new HashMap<>();

    static {
        VALID.put("yes", true);
        VALID.put("ye", true);
        VALID.put("y", true);
        VALID.put("no", false);
        VALID.put("n", false);
    }

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationProvider() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleConfirmationProvider(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public boolean confirm(String question, boolean defaultAnswer) throws IOException {
        String prompt = defaultAnswer ? " [Y/n] " : " [y/N] ";
        for (;;) {
            out.println(question + prompt);
            String line = in.readLine();
            if (line == null) {
                LOG.log(Level.WARNING, "No answer available, assuming {0}", defaultAnswer ? "yes" : "no");
                return defaultAnswer;
            }
            String choice = line.trim().toLowerCase(Locale.ROOT);
            if (choice.isEmpty()) {
                return defaultAnswer;
            }
            Boolean answer = VALID.get(choice);
            if (answer != null) {
                return answer;
            }
            out.println("Please respond with 'yes' or 'no' (or 'y' or 'n').");
        }
    }
}
