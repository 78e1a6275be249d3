package com.permgroups;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Orbit computations under a list of generators. All routines are
 * breadth-first closures and terminate because every generator moves only
 * finitely many points.
 */
public final class Orbits {

    private Orbits() {}

    /** Orbit of {@code p}, sorted. A point no generator moves has orbit {@code {p}}. */
    public static SortedSet<Integer> orbit(List<Perm> gens, int p) {
        return orbit(gens, Collections.singleton(p));
    }

    /** Closure of a set of points under the generators. */
    public static SortedSet<Integer> orbit(List<Perm> gens, Collection<Integer> points) {
        Objects.requireNonNull(gens, "gens");
        BitSet res = new BitSet();
        BitSet fresh = new BitSet();
        for (int p : points) {
            checkPoint(p);
            fresh.set(p);
        }
        while (!fresh.isEmpty()) {
            res.or(fresh);
            BitSet next = new BitSet();
            for (int q = fresh.nextSetBit(0); q >= 0; q = fresh.nextSetBit(q + 1)) {
                for (Perm s : gens) next.set(s.image(q));
            }
            next.andNot(res);
            fresh = next;
        }
        SortedSet<Integer> out = new TreeSet<>();
        for (int q = res.nextSetBit(0); q >= 0; q = res.nextSetBit(q + 1)) out.add(q);
        return out;
    }

    /** Partition of {@code 1..degree} into orbits, ordered by smallest point. */
    public static List<SortedSet<Integer>> orbits(List<Perm> gens, int degree) {
        List<SortedSet<Integer>> out = new ArrayList<>();
        BitSet covered = new BitSet();
        for (int p = 1; p <= degree; p++) {
            if (covered.get(p)) continue;
            SortedSet<Integer> o = orbit(gens, p);
            for (int q : o) covered.set(q);
            out.add(Collections.unmodifiableSortedSet(o));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Maps every point {@code q} of the orbit of {@code p} to a permutation
     * {@code r} with {@code p^r == q}; {@code p} maps to the identity. Iteration
     * order of the returned map is discovery order.
     */
    public static Map<Integer, Perm> orbitAndRepresentative(List<Perm> gens, int p) {
        Objects.requireNonNull(gens, "gens");
        checkPoint(p);
        Map<Integer, Perm> d = new LinkedHashMap<>();
        d.put(p, Perm.IDENTITY);
        List<Integer> fresh = new ArrayList<>();
        fresh.add(p);
        while (!fresh.isEmpty()) {
            List<Integer> old = fresh;
            fresh = new ArrayList<>();
            for (Perm s : gens) {
                for (int i : old) {
                    int e = s.image(i);
                    if (!d.containsKey(e)) {
                        d.put(e, d.get(i).multiply(s));
                        fresh.add(e);
                    }
                }
            }
        }
        return d;
    }

    /**
     * Schreier vector of the orbit of {@code p}, indexed by point (entry 0
     * unused): {@code -1} at {@code p}, the 1-based index of the generator that
     * first reached a point, {@code 0} outside the orbit.
     */
    public static int[] schreierVector(List<Perm> gens, int p, int degree) {
        Objects.requireNonNull(gens, "gens");
        checkPoint(p);
        if (p > degree) throw new IllegalArgumentException("Point " + p + " exceeds degree " + degree);
        int[] res = new int[degree + 1];
        res[p] = -1;
        List<Integer> fresh = new ArrayList<>();
        fresh.add(p);
        while (!fresh.isEmpty()) {
            List<Integer> old = fresh;
            fresh = new ArrayList<>();
            for (int q : old) {
                for (int i = 0; i < gens.size(); i++) {
                    int r = gens.get(i).image(q);
                    if (r > degree)
                        throw new IllegalArgumentException("Generator " + (i + 1) + " moves " + q + " beyond degree " + degree);
                    if (res[r] == 0) {
                        res[r] = i + 1;
                        fresh.add(r);
                    }
                }
            }
        }
        return res;
    }

    /**
     * Rebuilds the representative carrying the root of {@code vector} to
     * {@code q} by walking the vector back to the root.
     */
    public static Perm traceSchreierVector(List<Perm> gens, int[] vector, int q) {
        checkPoint(q);
        if (q >= vector.length || vector[q] == 0)
            throw new IllegalArgumentException("Point " + q + " is not in the orbit described by the vector");
        Perm rep = Perm.IDENTITY;
        int cur = q;
        while (vector[cur] != -1) {
            Perm s = gens.get(vector[cur] - 1);
            rep = s.multiply(rep);
            cur = s.preimage(cur);
        }
        return rep;
    }

    private static void checkPoint(int p) {
        if (p < 1) throw new IllegalArgumentException("Points are positive integers, got " + p);
    }
}
