package at.sv.bruteforcer;

import java.util.Comparator;
import java.util.List;

/**
 * The results to print, sorted from the most similar color, together with the header describing them.
 */
public record ResultSelection(String prefix, List<ColorResult> results) {

    public static ResultSelection select(List<ColorResult> colorResults, int maxResults) {
        List<ColorResult> sorted = colorResults.stream()
                                               .sorted(Comparator.comparingDouble(ColorResult::averageDistance))
                                               .toList();
        if (maxResults < 1 || sorted.size() <= maxResults) {
            return new ResultSelection("All results", sorted);
        }
        String prefix = maxResults > 1 ? "Top " + maxResults + " results" : "Top result";
        return new ResultSelection(prefix, sorted.subList(0, maxResults));
    }

    public String header() {
        return prefix + ", starting from the most similar color:";
    }
}
