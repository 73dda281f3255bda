package at.sv.bruteforcer;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class LoggingProgressListener implements SearchProgressListener {

    @Override
    public void onAlphaSearched(int alpha, int matches, int totalMatches, int searched, int total) {
        log.debug("{}% opacity: {} matches", alpha, matches);
        log.info("Found {} possible colors ({}/{} opacities searched)", totalMatches, searched, total);
    }
}
