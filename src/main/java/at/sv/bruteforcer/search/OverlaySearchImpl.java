package at.sv.bruteforcer.search;

import at.sv.bruteforcer.ColorResult;
import at.sv.bruteforcer.color.ColorDistance;
import at.sv.bruteforcer.color.LabColor;
import at.sv.bruteforcer.color.LabConverter;
import at.sv.bruteforcer.color.LinearColor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.TimeUnit;

/**
 * Searches the full RGB cube on a fork-join pool. One task per red value, each scanning all green and blue values.
 */
@Slf4j
public final class OverlaySearchImpl implements OverlaySearch, AutoCloseable {

    private static final int CHANNEL_VALUES = 256;

    private final ForkJoinPool pool;

    public OverlaySearchImpl() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public OverlaySearchImpl(int parallelism) {
        this.pool = new ForkJoinPool(parallelism);
    }

    @Override
    public List<ColorResult> search(List<LinearColor> baseColors, List<LabColor> targetColors, double alpha,
                                    double maxDistance) {
        assertValidInput(baseColors, targetColors, alpha);
        long start = System.nanoTime();
        int alphaPercent = (int) Math.round(alpha * 100.0);

        List<ForkJoinTask<List<ColorResult>>> tasks = new ArrayList<>(CHANNEL_VALUES);
        for (int red = 0; red < CHANNEL_VALUES; red++) {
            tasks.add(pool.submit(new RedChannelScan(baseColors, targetColors, red, alpha, alphaPercent, maxDistance)));
        }
        List<ColorResult> results = new ArrayList<>();
        for (ForkJoinTask<List<ColorResult>> task : tasks) {
            results.addAll(task.join());
        }

        log.debug("Searched {}% in {} ms: {} matches", alphaPercent,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), results.size());
        return results;
    }

    private static void assertValidInput(List<LinearColor> baseColors, List<LabColor> targetColors, double alpha) {
        if (baseColors.isEmpty() || baseColors.size() != targetColors.size()) {
            throw new IllegalArgumentException("Expected the same non-zero number of base and target colors, got " +
                                               baseColors.size() + " and " + targetColors.size());
        }
        if (alpha <= 0.0 || alpha >= 1.0) {
            throw new IllegalArgumentException("Alpha must be within (0, 1), got " + alpha);
        }
    }

    /**
     * Tests the overlay against each pair in order. Returns null as soon as one pair exceeds the max distance.
     */
    static ColorResult findMatch(List<LinearColor> baseColors, List<LabColor> targetColors, LinearColor overlay,
                                 int red, int green, int blue, int alphaPercent, double maxDistance) {
        double distanceSum = 0.0;
        for (int i = 0; i < baseColors.size(); i++) {
            LabColor guess = LabConverter.toLab(overlay.over(baseColors.get(i)));
            double distance = ColorDistance.ciede2000(targetColors.get(i), guess);
            if (distance > maxDistance) {
                return null;
            }
            distanceSum += distance;
        }
        return new ColorResult(red, green, blue, alphaPercent, distanceSum / baseColors.size());
    }

    @Override
    public void close() {
        pool.shutdown();
    }

    private static final class RedChannelScan extends RecursiveTask<List<ColorResult>> {

        private final List<LinearColor> baseColors;
        private final List<LabColor> targetColors;
        private final int red;
        private final double alpha;
        private final int alphaPercent;
        private final double maxDistance;

        private RedChannelScan(List<LinearColor> baseColors, List<LabColor> targetColors, int red, double alpha,
                               int alphaPercent, double maxDistance) {
            this.baseColors = baseColors;
            this.targetColors = targetColors;
            this.red = red;
            this.alpha = alpha;
            this.alphaPercent = alphaPercent;
            this.maxDistance = maxDistance;
        }

        @Override
        protected List<ColorResult> compute() {
            List<ColorResult> matches = new ArrayList<>();
            for (int green = 0; green < CHANNEL_VALUES; green++) {
                for (int blue = 0; blue < CHANNEL_VALUES; blue++) {
                    LinearColor overlay = LinearColor.fromRgb(red, green, blue, alpha);
                    ColorResult match = findMatch(baseColors, targetColors, overlay, red, green, blue, alphaPercent,
                            maxDistance);
                    if (match != null) {
                        matches.add(match);
                    }
                }
            }
            return matches;
        }
    }
}
