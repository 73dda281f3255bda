package at.sv.bruteforcer;

import at.sv.bruteforcer.color.HexColorParser;

import java.util.List;

public final class ColorInput {

    private ColorInput() {
    }

    /**
     * Parses base and target colors given as hex codes. Surrounding whitespace, e.g. after a comma separator, is ignored.
     *
     * @throws MismatchedColors   if the number of base and target colors differs
     * @throws InvalidColorFormat if any color is not a six digit hex code
     */
    public static ColorPairs fromHexCodes(List<String> baseColors, List<String> targetColors) {
        if (baseColors.size() != targetColors.size()) {
            throw new MismatchedColors("The number of base colors and target colors must match.");
        }
        return new ColorPairs(HexColorParser.parseAll(trim(baseColors)), HexColorParser.parseAll(trim(targetColors)));
    }

    private static List<String> trim(List<String> colors) {
        return colors.stream()
                     .map(String::trim)
                     .toList();
    }
}
