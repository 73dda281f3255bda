package at.sv.bruteforcer;

import at.sv.bruteforcer.color.LabColor;
import at.sv.bruteforcer.color.LabConverter;
import at.sv.bruteforcer.color.LinearColor;

import java.util.List;

/**
 * Base colors and their observed target colors, matched by index.
 */
public record ColorPairs(List<LinearColor> baseColors, List<LinearColor> targetColors) {

    public ColorPairs {
        if (baseColors.size() != targetColors.size()) {
            throw new MismatchedColors("The number of base colors and target colors must match.");
        }
        baseColors = List.copyOf(baseColors);
        targetColors = List.copyOf(targetColors);
    }

    public int size() {
        return baseColors.size();
    }

    public boolean isEmpty() {
        return baseColors.isEmpty();
    }

    public List<LabColor> targetColorsAsLab() {
        return targetColors.stream()
                           .map(LabConverter::toLab)
                           .toList();
    }
}
