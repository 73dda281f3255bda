package at.sv.bruteforcer;

import at.sv.bruteforcer.search.OverlaySearchImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "color-bruteforcer", version = "1.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Finds an unknown, semitransparent overlay color.")
public final class ColorBruteforcer implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ColorBruteforcer.class);

    static final int NO_RESULTS_EXIT_CODE = 1;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--alpha-min", paramLabel = "<percent>",
            defaultValue = "${env:ALPHA_MIN:-1}",
            description = "The lowest opacity value to check. Default: ${DEFAULT-VALUE}")
    String alphaMinString;
    @Option(names = "--alpha-max", paramLabel = "<percent>",
            defaultValue = "${env:ALPHA_MAX:-99}",
            description = "The highest opacity value to check. Default: ${DEFAULT-VALUE}")
    String alphaMaxString;
    @Option(names = {"-d", "--distance"}, paramLabel = "<distance>",
            defaultValue = "${env:MAX_DISTANCE:-1.0}",
            description = "The maximum distance between two colors that will let a guess be considered a match. " +
                          "A distance below 1.0 is generally considered to be visually indistinguishable, " +
                          "while 2.1 is generally considered to be a barely noticeable difference. " +
                          "Default: ${DEFAULT-VALUE}")
    double maxDistance;
    @Option(names = {"-r", "--results"}, paramLabel = "<count>",
            defaultValue = "${env:MAX_RESULTS:-25}",
            description = "The maximum number of results to display. " +
                          "Supply zero or a negative value to see all results. Default: ${DEFAULT-VALUE}")
    int maxResults;
    @Option(names = "--base-colors", split = ",", paramLabel = "<color>",
            description = "Comma-separated six character hex codes for the base colors.")
    List<String> baseColors;
    @Option(names = "--target-colors", split = ",", paramLabel = "<color>",
            description = "Comma-separated six character hex codes for the target colors.")
    List<String> targetColors;
    @Option(names = "--threads", paramLabel = "<threads>",
            defaultValue = "${env:SEARCH_THREADS:-0}",
            description = "The number of threads used to search the color space. " +
                          "0 uses one thread per available processor. Default: ${DEFAULT-VALUE}")
    int threads;

    private final BufferedReader input;

    public ColorBruteforcer() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    public ColorBruteforcer(BufferedReader input) {
        this.input = input;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new ColorBruteforcer()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    /**
     * Reads the colors, searches all configured opacities and prints the best matches.
     *
     * @return 0 if matches were found, {@link #NO_RESULTS_EXIT_CODE} otherwise
     */
    @Override
    public Integer call() {
        MDC.put("context", "init");
        try {
            int alphaMin = parseAlpha(alphaMinString);
            int alphaMax = parseAlpha(alphaMaxString);
            assertConfigurationParameters(alphaMin, alphaMax);
            ColorPairs pairs = readColors();

            MDC.put("context", "search");
            LOG.debug("Searching {} color pairs with alpha [{},{}] and max distance {}", pairs.size(), alphaMin,
                    alphaMax, maxDistance);
            List<ColorResult> colorResults;
            try (OverlaySearchImpl search = createSearch()) {
                colorResults = new OverlayFinder(search, new LoggingProgressListener())
                        .find(pairs, alphaMin, alphaMax, maxDistance);
            }
            return printResults(colorResults);
        } finally {
            MDC.remove("context");
        }
    }

    private int parseAlpha(String value) {
        int alpha;
        try {
            alpha = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw fail("Cannot parse alpha \"" + value + "\" as an integer.");
        }
        if (alpha < AlphaGenerator.MIN_ALPHA || alpha > AlphaGenerator.MAX_ALPHA) {
            throw fail("The alphas to search must be between 1 and 99.");
        }
        return alpha;
    }

    private void assertConfigurationParameters(int alphaMin, int alphaMax) {
        if (alphaMin > alphaMax) {
            throw fail("--alpha-min must be less than or equal to --alpha-max.");
        }
        if (maxDistance < 0 || Double.isNaN(maxDistance)) {
            throw fail("--distance must be >= 0");
        }
        if (threads < 0) {
            throw fail("--threads must be >= 0");
        }
        if ((baseColors == null) != (targetColors == null)) {
            throw fail("--base-colors and --target-colors must be used together");
        }
    }

    private ColorPairs readColors() {
        try {
            if (baseColors != null) {
                return ColorInput.fromHexCodes(baseColors, targetColors);
            }
            return new ColorPrompt(input, getOut(), spec.commandLine().getErr()).readColors();
        } catch (InvalidColorFormat | MismatchedColors e) {
            throw fail(e.getMessage());
        }
    }

    private OverlaySearchImpl createSearch() {
        if (threads == 0) {
            return new OverlaySearchImpl();
        }
        return new OverlaySearchImpl(threads);
    }

    private int printResults(List<ColorResult> colorResults) {
        PrintWriter out = getOut();
        if (colorResults.isEmpty()) {
            out.println("No results found.");
            out.flush();
            return NO_RESULTS_EXIT_CODE;
        }
        ResultSelection selection = ResultSelection.select(colorResults, maxResults);
        out.println(selection.header());
        selection.results().forEach(out::println);
        out.flush();
        return 0;
    }

    private PrintWriter getOut() {
        return spec.commandLine().getOut();
    }

    private RuntimeException fail(String msg) {
        if (spec != null) {
            return new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        return new IllegalArgumentException(msg);
    }
}
