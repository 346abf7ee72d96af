package org.lsst.fits.reduce;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import nom.tam.fits.FitsFactory;
import org.lsst.fits.reduce.preview.PreviewDisplay;

/**
 * Command line entry point.
 *
 * @author tonyj
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd, HH:mm:ss");

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        if (CommandLineParser.isHelpRequested(args)) {
            System.out.println(CommandLineParser.USAGE);
            return;
        }
        RunConfiguration config;
        try {
            config = new CommandLineParser().parse(args);
        } catch (CommandLineException x) {
            System.err.println(x.getMessage());
            System.err.println(CommandLineParser.USAGE);
            System.exit(2);
            return;
        }
        setVerbosity(config.getVerbosity());
        System.exit(run(config));
    }

    static int run(RunConfiguration config) throws InterruptedException {
        LOG.log(Level.INFO, "You are running stack-reducer version {0}.", version());
        LOG.log(Level.INFO, "Program started at {0}.", LocalDateTime.now().format(TIMESTAMP));
        LOG.log(Level.FINE, "{0}", config);
        FitsFactory.setUseHierarch(true);
        ConfirmationProvider confirmation = config.getFixedAnswer().isPresent()
                ? (config.getFixedAnswer().get() ? FixedConfirmationProvider.ASSUME_YES : FixedConfirmationProvider.ASSUME_NO)
                : new ConsoleConfirmationProvider();
        PreviewDisplay preview = PreviewDisplay.create(config.isPreview());
        List<LocationSummary> summaries = new Orchestrator(config, confirmation, preview).run();
        LOG.log(Level.INFO, "Program ended at {0}.", LocalDateTime.now().format(TIMESTAMP));
        return summaries.stream().anyMatch(s -> s.getStatus() == LocationSummary.Status.FAILED) ? 1 : 0;
    }

    static String version() {
        String version = Main.class.getPackage().getImplementationVersion();
        return version == null ? "development" : version;
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException x) {
            LOG.log(Level.WARNING, "Could not read logging configuration", x);
        }
    }

    static Level levelFor(int verbosity) {
        if (verbosity <= 0) {
            return Level.WARNING;
        } else if (verbosity == 1) {
            return Level.INFO;
        } else {
            return Level.FINE;
        }
    }

    private static void setVerbosity(int verbosity) {
        Level level = levelFor(verbosity);
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }
}
