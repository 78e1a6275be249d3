package com.permgroups;

import java.util.List;
import java.util.Map;

/** Sifting (stripping) of permutations through base images and transversals. */
final class Sieve {

    private Sieve() {}

    /**
     * Divides {@code g} level by level by the transversal element matching
     * its base image. Stops at the first level whose transversal lacks the
     * image, or after the last level.
     */
    static StripResult strip(Perm g, List<Integer> base, List<Map<Integer, Perm>> transversals) {
        if (base.size() != transversals.size())
            throw new IllegalArgumentException("base and transversals differ in length");
        Perm h = g;
        for (int i = 0; i < base.size(); i++) {
            int beta = h.image(base.get(i));
            Perm u = transversals.get(i).get(beta);
            if (u == null) return new StripResult(h, i, base.size());
            h = h.multiply(u.inverse());
        }
        return new StripResult(h, base.size(), base.size());
    }
}
