package com.permgroups;

/** Counters collected while building a stabilizer chain. */
public final class ChainStats {
    public int schreierGenerators;     // Schreier generators formed
    public int sifted;                 // non-identity ones sifted through the chain
    public int strongGeneratorsAdded;  // residuals appended to strong generating sets
    public int baseExtensions;         // base points added after seeding
    public int rescans;                // times the closure pass jumped to a deeper level

    @Override
    public String toString() {
        return "*Schreier-Sims: schreier_generators=" + schreierGenerators +
                " sifted=" + sifted +
                " strong_generators_added=" + strongGeneratorsAdded +
                " base_extensions=" + baseExtensions +
                " rescans=" + rescans;
    }
}
