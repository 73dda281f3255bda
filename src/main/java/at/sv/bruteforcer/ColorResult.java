package at.sv.bruteforcer;

import lombok.Builder;

import java.util.Locale;

/**
 * An overlay color that, placed on top of every base color at the given opacity, comes within the max distance of the
 * corresponding target color.
 *
 * @param red             overlay red channel [0, 255]
 * @param green           overlay green channel [0, 255]
 * @param blue            overlay blue channel [0, 255]
 * @param alpha           overlay opacity in percent [1, 99]
 * @param averageDistance mean CIEDE2000 distance over all base/target pairs
 */
@Builder
public record ColorResult(int red, int green, int blue, int alpha, double averageDistance) {

    public String hex() {
        return String.format(Locale.ROOT, "#%02x%02x%02x", red, green, blue);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s at %d%% opacity; average distance: %.6f", hex(), alpha, averageDistance);
    }
}
