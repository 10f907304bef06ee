package dev.reviewgate.analysis.security;

import java.util.List;

/**
 * A pure check over a single line. Returns the messages it fires, or an empty list.
 */
@FunctionalInterface
public interface LineDetector {

    List<String> detect(LineContext context);
}
