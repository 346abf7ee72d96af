package org.lsst.fits.reduce;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.lsst.fits.reduce.input.ArchiveType;
import org.lsst.fits.reduce.io.FrameFormat;
import org.lsst.fits.reduce.reducer.ReducerSpec;

/**
 * Turns command line arguments into a {@link RunConfiguration}. Options
 * taking a list of values consume every following argument which is not
 * itself an option. Reducer options may be repeated and their reducers run in
 * command line order.
 *
 * @author tonyj
 */
public class CommandLineParser {

    private static final Logger LOG = Logger.getLogger(CommandLineParser.class.getName());
    private static final Pattern NUMBER = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: stack-reducer [options]",
            "  -inp, --inpaths <dir>...       input locations (default ./)",
            "  -outp, --outpath <dir>         output location (default: each input location)",
            "  -type, --filetype <type>       .tif .tiff .fits .fit .fts .zip .tar.gz (default .tif)",
            "  -sum, --sum                    sum of the images",
            "  -avg, --average                average of the images",
            "  -med, --median [n...]          median of n summed groups of images (default 3)",
            "  -dc2d, --decosmic2d [f...]     average of the lowest fraction f of intensities per pixel (default 0.9999)",
            "  -nan, --negative_to_nan        ignore negative pixel intensities (default)",
            "  -keepneg, --keep_negative      keep negative pixel intensities",
            "  -u, --uncertainty              also write the variance per pixel",
            "  -p, --preview                  show a preview of the reduced images (default)",
            "  -np, --no_preview              do not show a preview",
            "  -v, --verbose <level>          0 warnings only, 1 progress (default), 2 debug",
            "  -y, --yes                      answer yes to every question",
            "  -n, --no                       answer no to every question",
            "  -mask, --mask                  also write the valid pixel mask",
            "  -marker, --marker <token>      acquisition marker in frame names (default ct)",
            "  -par, --parallel               run the reducers concurrently",
            "  -h, --help                     show this help");

    private List<String> args;
    private int position;

    public static boolean isHelpRequested(String... args) {
        List<String> list = Arrays.asList(args);
        return list.contains("-h") || list.contains("--help");
    }

    /**
     * Parse a command line.
     *
     * @param arguments The arguments as passed to main
     * @return The run configuration
     * @throws CommandLineException If an argument is unknown or malformed
     */
    public RunConfiguration parse(String... arguments) {
        args = Arrays.asList(arguments);
        position = 0;
        RunConfiguration.Builder builder = RunConfiguration.builder();
        List<Function<Boolean, ReducerSpec>> reducers = new ArrayList<>();
        boolean uncertainty = false;
        while (position < args.size()) {
            String option = args.get(position++);
            switch (option) {
                case "-inp":
                case "--inpaths":
                    for (String value : values(option, true)) {
                        builder.inputLocation(Paths.get(value));
                    }
                    break;
                case "-outp":
                case "--outpath":
                    builder.outputLocation(Paths.get(value(option)));
                    break;
                case "-type":
                case "--filetype":
                    builder.fileType(fileType(value(option)));
                    break;
                case "-sum":
                case "--sum":
                    reducers.add(ReducerSpec::sum);
                    break;
                case "-avg":
                case "--average":
                    reducers.add(ReducerSpec::mean);
                    break;
                case "-med":
                case "--median":
                    List<String> groups = values(option, false);
                    if (groups.isEmpty()) {
                        LOG.log(Level.INFO, "Using the default value of {0} for median.", ReducerSpec.DEFAULT_GROUPS);
                        reducers.add(u -> ReducerSpec.groupedMedian(ReducerSpec.DEFAULT_GROUPS, u));
                    }
                    for (String value : groups) {
                        int n = parseInt(option, value);
                        reducers.add(u -> ReducerSpec.groupedMedian(n, u));
                    }
                    break;
                case "-dc2d":
                case "--decosmic2d":
                    List<String> fractions = values(option, false);
                    if (fractions.isEmpty()) {
                        LOG.log(Level.INFO, "Using the default value of {0} for decosmic2d.", ReducerSpec.DEFAULT_RETAIN_FRACTION);
                        reducers.add(u -> ReducerSpec.trimmedMean(ReducerSpec.DEFAULT_RETAIN_FRACTION, u));
                    }
                    for (String value : fractions) {
                        double f = parseDouble(option, value);
                        reducers.add(u -> ReducerSpec.trimmedMean(f, u));
                    }
                    break;
                case "-nan":
                case "--negative_to_nan":
                    builder.negativeToNaN(true);
                    break;
                case "-keepneg":
                case "--keep_negative":
                    builder.negativeToNaN(false);
                    break;
                case "-u":
                case "--uncertainty":
                    uncertainty = true;
                    break;
                case "-p":
                case "--preview":
                    builder.preview(true);
                    break;
                case "-np":
                case "--no_preview":
                    builder.preview(false);
                    break;
                case "-v":
                case "--verbose":
                    builder.verbosity(parseInt(option, value(option)));
                    break;
                case "-y":
                case "--yes":
                    builder.fixedAnswer(Boolean.TRUE);
                    break;
                case "-n":
                case "--no":
                    builder.fixedAnswer(Boolean.FALSE);
                    break;
                case "-mask":
                case "--mask":
                    builder.writeMask(true);
                    break;
                case "-marker":
                case "--marker":
                    builder.acquisitionMarker(value(option));
                    break;
                case "-par":
                case "--parallel":
                    builder.parallel(true);
                    break;
                default:
                    throw new CommandLineException("Unrecognized argument: " + option);
            }
        }
        if (reducers.isEmpty()) {
            throw new CommandLineException("No reducer selected, use at least one of -sum, -avg, -med or -dc2d");
        }
        for (Function<Boolean, ReducerSpec> reducer : reducers) {
            builder.reducer(reducer.apply(uncertainty));
        }
        return builder.build();
    }

    private String value(String option) {
        if (position >= args.size() || isOption(args.get(position))) {
            throw new CommandLineException("Option " + option + " requires a value");
        }
        return args.get(position++);
    }

    private List<String> values(String option, boolean required) {
        List<String> result = new ArrayList<>();
        while (position < args.size() && !isOption(args.get(position))) {
            result.add(args.get(position++));
        }
        if (required && result.isEmpty()) {
            throw new CommandLineException("Option " + option + " requires at least one value");
        }
        return result;
    }

    private static boolean isOption(String arg) {
        return arg.startsWith("-") && arg.length() > 1 && !NUMBER.matcher(arg).matches();
    }

    private static String fileType(String token) {
        if (!FrameFormat.forToken(token).isPresent() && !ArchiveType.forToken(token).isPresent()) {
            throw new CommandLineException("Unsupported file type: " + token);
        }
        return token.startsWith(".") ? token : "." + token;
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException x) {
            throw new CommandLineException("Option " + option + " expects an integer, got " + value, x);
        }
    }

    private static double parseDouble(String option, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException x) {
            throw new CommandLineException("Option " + option + " expects a number, got " + value, x);
        }
    }
}
