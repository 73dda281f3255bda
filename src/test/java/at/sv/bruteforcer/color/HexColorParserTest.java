package at.sv.bruteforcer.color;

import at.sv.bruteforcer.InvalidColorFormat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HexColorParserTest {

    @Test
    void parse_withAndWithoutHash_caseInsensitive() {
        assertThat(HexColorParser.parse("#FFFFFF")).isEqualTo(LinearColor.opaque(1.0, 1.0, 1.0));
        assertThat(HexColorParser.parse("000000")).isEqualTo(LinearColor.opaque(0.0, 0.0, 0.0));
        assertThat(HexColorParser.parse("#abcdef")).isEqualTo(HexColorParser.parse("ABCDEF"));
    }

    @Test
    void parse_mapsChannelsWithoutGammaDecoding() {
        LinearColor color = HexColorParser.parse("#001488");

        assertThat(color.red()).isEqualTo(0.0);
        assertThat(color.green()).isCloseTo(20 / 255.0, within(1e-12));
        assertThat(color.blue()).isCloseTo(136 / 255.0, within(1e-12));
        assertThat(color.alpha()).isEqualTo(1.0);
    }

    @Test
    void parse_invalid_throws() {
        assertThatThrownBy(() -> HexColorParser.parse("#fff"))
                .isInstanceOf(InvalidColorFormat.class)
                .hasMessage("The color #fff is not a valid six-character hex color code.");
        assertThatThrownBy(() -> HexColorParser.parse("1488HH")).isInstanceOf(InvalidColorFormat.class);
        assertThatThrownBy(() -> HexColorParser.parse("##ffffff")).isInstanceOf(InvalidColorFormat.class);
        assertThatThrownBy(() -> HexColorParser.parse("#fffffff")).isInstanceOf(InvalidColorFormat.class);
        assertThatThrownBy(() -> HexColorParser.parse(null)).isInstanceOf(InvalidColorFormat.class);
    }

    @Test
    void parse_surroundingWhitespace_throws() {
        assertThatThrownBy(() -> HexColorParser.parse(" ffffff ")).isInstanceOf(InvalidColorFormat.class);
        assertThat(HexColorParser.isValid(" ffffff ")).isFalse();
        assertThat(HexColorParser.isValid("#ffffff\n")).isFalse();
    }

    @Test
    void isValid() {
        assertThat(HexColorParser.isValid("#001488")).isTrue();
        assertThat(HexColorParser.isValid("abcdef")).isTrue();
        assertThat(HexColorParser.isValid("FFFFFF")).isTrue();
        assertThat(HexColorParser.isValid("#fff")).isFalse();
        assertThat(HexColorParser.isValid("1488HH")).isFalse();
        assertThat(HexColorParser.isValid("")).isFalse();
        assertThat(HexColorParser.isValid(null)).isFalse();
    }

    @Test
    void parseAll_keepsOrder() {
        assertThat(HexColorParser.parseAll(List.of("#FFFFFF", "000000")))
                .containsExactly(LinearColor.opaque(1.0, 1.0, 1.0), LinearColor.opaque(0.0, 0.0, 0.0));
        assertThat(HexColorParser.parseAll(List.of())).isEmpty();
    }
}
