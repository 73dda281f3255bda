package at.sv.bruteforcer.search;

import at.sv.bruteforcer.ColorResult;
import at.sv.bruteforcer.color.LabColor;
import at.sv.bruteforcer.color.LinearColor;

import java.util.List;

public interface OverlaySearch {
    /**
     * Tests every 8-bit RGB overlay color at the given opacity.
     *
     * @param baseColors   the colors below the overlay
     * @param targetColors the observed colors, one per base color
     * @param alpha        the opacity of the overlay in (0, 1)
     * @param maxDistance  the maximum CIEDE2000 distance allowed for every base/target pair
     * @return all overlay colors within the max distance for every pair, in no particular order
     */
    List<ColorResult> search(List<LinearColor> baseColors, List<LabColor> targetColors, double alpha,
                             double maxDistance);
}
