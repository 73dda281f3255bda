package at.sv.bruteforcer;

import at.sv.bruteforcer.color.LabColor;
import at.sv.bruteforcer.search.OverlaySearch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Drives the {@link AlphaGenerator} and runs one full color space search per generated opacity.
 */
@Slf4j
@RequiredArgsConstructor
public final class OverlayFinder {

    private final OverlaySearch search;
    private final SearchProgressListener progressListener;

    public OverlayFinder(OverlaySearch search) {
        this(search, SearchProgressListener.NONE);
    }

    /**
     * @return all matches over all searched opacities, in no particular order. Empty if nothing matched.
     */
    public List<ColorResult> find(ColorPairs pairs, int alphaMin, int alphaMax, double maxDistance) {
        if (pairs.isEmpty()) {
            throw new IllegalArgumentException("At least one base and target color is required");
        }
        List<LabColor> targetColors = pairs.targetColorsAsLab();
        AlphaGenerator alphaGenerator = new AlphaGenerator(alphaMin, alphaMax);
        int total = alphaMax - alphaMin + 1;
        List<ColorResult> colorResults = new ArrayList<>();
        boolean hadResults = false;
        int searched = 0;

        OptionalInt alpha;
        while ((alpha = alphaGenerator.next(hadResults)).isPresent()) {
            List<ColorResult> alphaResults = search.search(pairs.baseColors(), targetColors,
                    alpha.getAsInt() / 100.0, maxDistance);
            hadResults = !alphaResults.isEmpty();
            colorResults.addAll(alphaResults);
            searched++;
            progressListener.onAlphaSearched(alpha.getAsInt(), alphaResults.size(), colorResults.size(), searched, total);
        }
        log.debug("Searched {} of {} opacities, {} matches", searched, total, colorResults.size());
        return colorResults;
    }
}
