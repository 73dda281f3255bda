package at.sv.bruteforcer;

public interface SearchProgressListener {

    SearchProgressListener NONE = (alpha, matches, totalMatches, searched, total) -> {
    };

    /**
     * Called after the full color space has been searched for one opacity.
     *
     * @param alpha        the opacity just searched, in percent
     * @param matches      the number of matches at this opacity
     * @param totalMatches the number of matches found so far
     * @param searched     the number of opacities searched so far
     * @param total        the number of opacities in the configured range, an upper bound of {@code searched}
     */
    void onAlphaSearched(int alpha, int matches, int totalMatches, int searched, int total);
}
