package com.permgroups;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic Schreier-Sims (Holt, Handbook of Computational Group Theory,
 * 4.4.2). Builds a base and strong generating set from a generator list and
 * returns them as a {@link StabilizerChain}.
 */
final class SchreierSims {
    private static final Logger LOG = LoggerFactory.getLogger(SchreierSims.class);

    private final List<Integer> base = new ArrayList<>();
    private final List<List<Perm>> gens = new ArrayList<>();               // S[i]
    private final List<Map<Integer, Perm>> transversals = new ArrayList<>(); // Δ[i]
    private final ChainStats stats = new ChainStats();

    private SchreierSims() {}

    static StabilizerChain build(List<Perm> generators) {
        SchreierSims ss = new SchreierSims();
        ss.seed(generators);
        for (int i = 0; i < ss.base.size(); i++) ss.transversals.add(ss.orbitOf(i));
        ss.close();
        LOG.debug("Stabilizer chain: base={} {}", ss.base, ss.stats);
        return StabilizerChain.assemble(ss.base, ss.gens, ss.transversals, ss.stats);
    }

    /**
     * Each generator joins the buckets of successive base levels while it fixes
     * their base point; if it fixes them all, its smallest moved point opens a
     * new level.
     */
    private void seed(List<Perm> generators) {
        for (Perm x : generators) {
            if (x.isIdentity()) continue;
            int j = 0;
            while (j < base.size()) {
                gens.get(j).add(x);
                if (!x.fixes(base.get(j))) break;
                j++;
            }
            if (j == base.size()) {
                base.add(x.smallestMovedPoint());
                List<Perm> level = new ArrayList<>();
                level.add(x);
                gens.add(level);
            }
        }
    }

    /**
     * Closure pass from the deepest level upward. A level whose Schreier
     * generators all sift to the identity is done; otherwise the residual is
     * pushed to the deeper levels it escaped from and the scan resumes at the
     * deepest level touched.
     */
    private void close() {
        int i = base.size() - 1;
        while (i >= 0) {
            int restart = scanLevel(i);
            if (restart >= 0) {
                stats.rescans++;
                i = restart;
            } else {
                i--;
            }
        }
    }

    /** Returns the level to rescan, or -1 when level {@code i} is closed. */
    private int scanLevel(int i) {
        Map<Integer, Perm> delta = transversals.get(i);
        List<Perm> level = gens.get(i);
        for (Map.Entry<Integer, Perm> e : delta.entrySet()) {
            Perm u = e.getValue();
            for (Perm x : level) {
                stats.schreierGenerators++;
                Perm h = u.multiply(x).multiply(delta.get(x.image(e.getKey())).inverse());
                if (h.isIdentity()) continue;
                stats.sifted++;
                StripResult r = Sieve.strip(h, base, transversals);
                int j = r.level();
                Perm residual = r.residual();
                if (j <= i)
                    throw new IllegalStateException("Schreier generator " + h + " at level " + i + " escaped at level " + j);
                if (j == base.size()) {
                    if (residual.isIdentity()) continue;
                    base.add(residual.smallestMovedPoint());
                    gens.add(new ArrayList<>());
                    stats.baseExtensions++;
                    LOG.trace("Base extended with {} by residual {}", base.get(j), residual);
                }
                for (int l = i + 1; l <= j; l++) {
                    gens.get(l).add(residual);
                    if (l == transversals.size()) transversals.add(orbitOf(l));
                    else transversals.set(l, orbitOf(l));
                }
                stats.strongGeneratorsAdded++;
                return j;
            }
        }
        return -1;
    }

    private Map<Integer, Perm> orbitOf(int level) {
        return Orbits.orbitAndRepresentative(gens.get(level), base.get(level));
    }
}
