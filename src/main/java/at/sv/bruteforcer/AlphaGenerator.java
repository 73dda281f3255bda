package at.sv.bruteforcer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Generates the opacity values (in percent) to search, adapting the order to the search results.
 * <p>
 * Values are first generated with large steps away from the midpoint of the range, alternating between values above
 * and below it. If this coarse pass finds nothing, the remaining values are generated with a step size of one, again
 * going outward from the midpoint. Once a value produces matches, the generator switches to the neighbours of that
 * first hit, going down first and then up, and stops in a direction as soon as it runs into an already checked value.
 * When a neighbour produces no matches, all remaining values on that side of the first hit are dropped.
 * <p>
 * Not thread-safe.
 */
@Slf4j
public final class AlphaGenerator {

    public static final int MIN_ALPHA = 1;
    public static final int MAX_ALPHA = 99;

    private static final int[] STEP_SIZES = {3, 1};

    public enum State {
        COARSE_SCAN,
        POST_HIT_EXPAND,
        PRUNED_SINGLE_SIDE,
        EXHAUSTED
    }

    private final int alphaMin;
    private final int alphaMax;
    private final boolean[] shouldCheck;
    /**
     * Values not yet returned, in delivery order.
     */
    private Deque<Integer> pending;
    private int previousAlpha;
    private Integer firstHit;
    @Getter
    private State state;

    public AlphaGenerator(int alphaMin, int alphaMax) {
        if (alphaMin < MIN_ALPHA || alphaMax > MAX_ALPHA || alphaMin > alphaMax) {
            throw new IllegalArgumentException("Invalid alpha range [" + alphaMin + "," + alphaMax + "]. " +
                                               "Expected " + MIN_ALPHA + " <= min <= max <= " + MAX_ALPHA);
        }
        this.alphaMin = alphaMin;
        this.alphaMax = alphaMax;
        shouldCheck = new boolean[MAX_ALPHA];
        for (int alpha = alphaMin; alpha <= alphaMax; alpha++) {
            shouldCheck[alpha - 1] = true;
        }
        pending = new ArrayDeque<>(generateInitialGuesses(alphaMin, alphaMax));
        state = State.COARSE_SCAN;
    }

    private static List<Integer> generateInitialGuesses(int alphaMin, int alphaMax) {
        int midpoint = alphaMin + (alphaMax - alphaMin) / 2;
        List<Integer> guesses = new ArrayList<>();
        Set<Integer> generated = new HashSet<>();
        for (int stepSize : STEP_SIZES) {
            int alpha = midpoint;
            while (alphaMin <= alpha && alpha <= alphaMax) {
                if (generated.add(alpha)) {
                    guesses.add(alpha);
                }
                int diff = alpha - midpoint;
                if (diff <= 0) {
                    alpha = midpoint + Math.abs(diff) + stepSize;
                } else {
                    alpha = midpoint - diff;
                }
            }
        }
        return guesses;
    }

    /**
     * Returns the next opacity to search.
     *
     * @param hadResults if the value returned by the previous call produced at least one match
     * @return the next opacity in percent, or empty if there is nothing left to search
     */
    public OptionalInt next(boolean hadResults) {
        if (hadResults && firstHit == null) {
            onFirstHit();
        } else if (!hadResults && firstHit != null) {
            pruneSideOf(previousAlpha);
        }

        Integer alpha = pending.pollFirst();
        if (alpha == null) {
            state = State.EXHAUSTED;
            return OptionalInt.empty();
        }
        shouldCheck[alpha - 1] = false;
        previousAlpha = alpha;
        return OptionalInt.of(alpha);
    }

    private void onFirstHit() {
        firstHit = previousAlpha;
        pending = new ArrayDeque<>(generateGuessesAroundFirstHit());
        state = State.POST_HIT_EXPAND;
        log.debug("First hit at {}%, expanding to {}", firstHit, pending);
    }

    private List<Integer> generateGuessesAroundFirstHit() {
        List<Integer> guesses = new ArrayList<>();
        for (int alpha = firstHit - 1; alpha >= alphaMin && isEligible(alpha); alpha--) {
            guesses.add(alpha);
        }
        for (int alpha = firstHit + 1; alpha <= alphaMax && isEligible(alpha); alpha++) {
            guesses.add(alpha);
        }
        return guesses;
    }

    private boolean isEligible(int alpha) {
        return shouldCheck[alpha - 1];
    }

    /**
     * The band of matches ended at the given value, so nothing further out on its side of the first hit can match.
     */
    private void pruneSideOf(int failedAlpha) {
        if (failedAlpha < firstHit) {
            pending.removeIf(alpha -> alpha < firstHit);
        } else {
            pending.removeIf(alpha -> alpha > firstHit);
        }
        state = State.PRUNED_SINGLE_SIDE;
        log.debug("No matches at {}%, remaining: {}", failedAlpha, pending);
    }
}
