package com.permgroups;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of a stabilizer chain: base {@code B}, strong generators
 * {@code S[i]}, centralizers {@code H[i] = <S[i]>} (the pointwise stabilizer
 * of {@code B[0..i-1]}) and transversals {@code Δ[i]} of {@code H[i]} on
 * {@code B[i]}. Levels are 0-based.
 */
public final class StabilizerChain {
    private final List<Integer> base;
    private final List<List<Perm>> strongGenerators;
    private final List<PermGroup> centralizers;
    private final List<Map<Integer, Perm>> transversals;
    private final ChainStats stats;

    private StabilizerChain(List<Integer> base, List<List<Perm>> strongGenerators,
                            List<PermGroup> centralizers, List<Map<Integer, Perm>> transversals,
                            ChainStats stats) {
        this.base = base;
        this.strongGenerators = strongGenerators;
        this.centralizers = centralizers;
        this.transversals = transversals;
        this.stats = stats;
        sanity();
    }

    /**
     * Freezes the builder's working lists into a chain and hands each
     * centralizer the tail of the chain starting at its level.
     */
    static StabilizerChain assemble(List<Integer> base, List<List<Perm>> gens,
                                    List<Map<Integer, Perm>> transversals, ChainStats stats) {
        int k = base.size();
        List<List<Perm>> s = new ArrayList<>(k);
        List<PermGroup> h = new ArrayList<>(k);
        List<Map<Integer, Perm>> d = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            List<Perm> level = List.copyOf(gens.get(i));
            s.add(level);
            h.add(new PermGroup(level));
            d.add(Collections.unmodifiableMap(new LinkedHashMap<>(transversals.get(i))));
        }
        StabilizerChain chain = new StabilizerChain(List.copyOf(base), Collections.unmodifiableList(s),
                Collections.unmodifiableList(h), Collections.unmodifiableList(d), stats);
        for (int i = 0; i < k; i++) h.get(i).adoptChain(chain.tail(i));
        return chain;
    }

    /** Chain of {@code centralizers().get(from)}, sharing this chain's data. */
    StabilizerChain tail(int from) {
        int k = depth();
        return new StabilizerChain(base.subList(from, k), strongGenerators.subList(from, k),
                centralizers.subList(from, k), transversals.subList(from, k), new ChainStats());
    }

    public int depth() { return base.size(); }
    public List<Integer> base() { return base; }
    public List<List<Perm>> strongGenerators() { return strongGenerators; }
    public List<PermGroup> centralizers() { return centralizers; }
    public List<Map<Integer, Perm>> transversals() { return transversals; }
    public ChainStats stats() { return stats; }

    /** Union of all levels' strong generators, first occurrence order. */
    public List<Perm> strongGeneratingSet() {
        Set<Perm> all = new LinkedHashSet<>();
        for (List<Perm> level : strongGenerators) all.addAll(level);
        return List.copyOf(all);
    }

    /** Orbit-stabilizer theorem, level by level. */
    public BigInteger order() {
        BigInteger n = BigInteger.ONE;
        for (Map<Integer, Perm> t : transversals) n = n.multiply(BigInteger.valueOf(t.size()));
        return n;
    }

    public StripResult strip(Perm g) {
        return Sieve.strip(g, base, transversals);
    }

    public boolean contains(Perm g) {
        return strip(g).isMember();
    }

    private void sanity() {
        int k = base.size();
        if (strongGenerators.size() != k || centralizers.size() != k || transversals.size() != k)
            throw new IllegalStateException("chain level count mismatch");
        for (int i = 0; i < k; i++) {
            int b = base.get(i);
            Map<Integer, Perm> t = transversals.get(i);
            Perm root = t.get(b);
            if (root == null || !root.isIdentity())
                throw new IllegalStateException("transversal " + i + " does not map base point " + b + " to the identity");
            for (Map.Entry<Integer, Perm> e : t.entrySet()) {
                if (e.getValue().image(b) != e.getKey())
                    throw new IllegalStateException("representative for " + e.getKey() + " at level " + i + " is wrong");
            }
            for (Perm x : strongGenerators.get(i)) {
                for (int j = 0; j < i; j++) {
                    if (!x.fixes(base.get(j)))
                        throw new IllegalStateException("strong generator " + x + " at level " + i + " moves base point " + base.get(j));
                }
            }
        }
    }
}
