package at.sv.bruteforcer;

import at.sv.bruteforcer.color.LinearColor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColorPromptTest {

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private ColorPairs readColors(String... lines) {
        BufferedReader in = new BufferedReader(new StringReader(String.join("\n", lines) + "\n"));
        return new ColorPrompt(in, new PrintWriter(out), new PrintWriter(err)).readColors();
    }

    @Test
    void readColors_skipsInvalidInputAndIncompletePairs() {
        ColorPairs pairs = readColors(
                "",         // Enter hit with no colors
                "#FFFFFF",
                "1488HH",   // invalid value
                "",         // Enter hit with mismatched number of colors
                "000000",
                "");

        assertThat(pairs.baseColors()).containsExactly(LinearColor.opaque(1.0, 1.0, 1.0));
        assertThat(pairs.targetColors()).containsExactly(LinearColor.opaque(0.0, 0.0, 0.0));
        assertThat(err.toString())
                .contains("Invalid color format. Please enter a valid hex code.")
                .contains("You have entered 1 base colors but 0 target colors. Please enter the same number of each.");
    }

    @Test
    void readColors_emptyLineBeforeAnyColor_asksAgainSilently() {
        ColorPairs pairs = readColors("", "#ffffff", "#000000", "");

        assertThat(pairs.size()).isEqualTo(1);
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void readColors_alternatesPrompts() {
        readColors("#ffffff", "#fabbbd", "#000000", "#47080b", "");

        assertThat(out.toString())
                .startsWith("Press Enter when you have finished entering all colors.")
                .contains("Enter base color #1: ", "Enter target color #1: ",
                        "Enter base color #2: ", "Enter target color #2: ", "Enter base color #3: ");
    }

    @Test
    void readColors_multiplePairs_keepsOrder() {
        ColorPairs pairs = readColors("#ffffff", "#fabbbd", "#000000", "#47080b", "");

        assertThat(pairs.size()).isEqualTo(2);
        assertThat(pairs.baseColors().get(1)).isEqualTo(LinearColor.opaque(0.0, 0.0, 0.0));
    }

    @Test
    void readColors_endOfInputWithCompletePairs_finishes() {
        BufferedReader in = new BufferedReader(new StringReader("#ffffff\n#000000"));

        ColorPairs pairs = new ColorPrompt(in, new PrintWriter(out), new PrintWriter(err)).readColors();

        assertThat(pairs.size()).isEqualTo(1);
    }

    @Test
    void readColors_endOfInputWithIncompletePair_throws() {
        BufferedReader in = new BufferedReader(new StringReader("#ffffff\n"));

        assertThatThrownBy(() -> new ColorPrompt(in, new PrintWriter(out), new PrintWriter(err)).readColors())
                .isInstanceOf(MismatchedColors.class);
    }
}
