package at.sv.bruteforcer;

import at.sv.bruteforcer.color.HexColorParser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads base and target colors interactively, alternating between a base and its target color. An empty line finishes
 * the input once at least one pair is complete.
 */
public final class ColorPrompt {

    private final BufferedReader in;
    private final PrintWriter out;
    private final PrintWriter err;

    public ColorPrompt(BufferedReader in, PrintWriter out, PrintWriter err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    /**
     * @throws MismatchedColors if the input ends while the entered colors are incomplete
     */
    public ColorPairs readColors() {
        List<String> baseColors = new ArrayList<>();
        List<String> targetColors = new ArrayList<>();
        out.println("Press Enter when you have finished entering all colors.");

        while (true) {
            boolean base = baseColors.size() == targetColors.size();
            out.print("Enter " + (base ? "base" : "target") + " color #" + (targetColors.size() + 1) + ": ");
            out.flush();
            String line = readLine();

            if (line == null || line.isBlank()) {
                if (!baseColors.isEmpty() && baseColors.size() == targetColors.size()) {
                    break;
                }
                if (line == null) {
                    throw new MismatchedColors(getIncompleteInputMessage(baseColors, targetColors));
                }
                if (!baseColors.isEmpty()) {
                    err.println(getIncompleteInputMessage(baseColors, targetColors));
                    err.flush();
                }
                continue;
            }

            String color = line.trim();
            if (!HexColorParser.isValid(color)) {
                err.println("Invalid color format. Please enter a valid hex code.");
                err.flush();
                continue;
            }
            if (base) {
                baseColors.add(color);
            } else {
                targetColors.add(color);
            }
        }
        return ColorInput.fromHexCodes(baseColors, targetColors);
    }

    private static String getIncompleteInputMessage(List<String> baseColors, List<String> targetColors) {
        if (baseColors.isEmpty()) {
            return "Please enter at least one base and target color.";
        }
        return "You have entered " + baseColors.size() + " base colors but " + targetColors.size() +
               " target colors. Please enter the same number of each.";
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read color input", e);
        }
    }
}
