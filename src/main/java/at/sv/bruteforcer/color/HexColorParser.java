package at.sv.bruteforcer.color;

import at.sv.bruteforcer.InvalidColorFormat;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HexColorParser {

    private static final Pattern COLOR_PATTERN = Pattern.compile("^#?([0-9a-fA-F]{2})([0-9a-fA-F]{2})([0-9a-fA-F]{2})$");

    private HexColorParser() {
    }

    public static boolean isValid(String input) {
        return input != null && COLOR_PATTERN.matcher(input).matches();
    }

    /**
     * Parses a six digit hex code (optionally prefixed with '#', case-insensitive) into an opaque linear color.
     * The channel values are mapped to [0, 1] without any gamma decoding.
     *
     * @throws InvalidColorFormat if the input is not a six digit hex code
     */
    public static LinearColor parse(String input) {
        if (input == null) {
            throw new InvalidColorFormat("The color null is not a valid six-character hex color code.");
        }
        Matcher matcher = COLOR_PATTERN.matcher(input);
        if (!matcher.matches()) {
            throw new InvalidColorFormat("The color " + input + " is not a valid six-character hex color code.");
        }
        return LinearColor.opaque(
                channel(matcher.group(1)),
                channel(matcher.group(2)),
                channel(matcher.group(3)));
    }

    public static List<LinearColor> parseAll(List<String> inputs) {
        return inputs.stream()
                     .map(HexColorParser::parse)
                     .toList();
    }

    private static double channel(String hex) {
        return Integer.parseInt(hex, 16) / 255.0;
    }
}
