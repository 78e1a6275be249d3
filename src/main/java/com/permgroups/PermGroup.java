package com.permgroups;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A permutation group given by generators. Everything else (degree,
 * stabilizer chain, order, element and word lists) is derived on first
 * request and kept for the lifetime of the group. The derived slots are
 * filled under the group's monitor, so a chain is only ever seen complete.
 *
 * <p>Iterating a group walks its stabilizer chain and yields every element
 * exactly once, in no particular order; {@link #elements()} is the sorted
 * list built by the word enumerator instead.
 */
public final class PermGroup implements Iterable<Perm> {
    private static final Logger LOG = LoggerFactory.getLogger(PermGroup.class);

    private final List<Perm> gens;

    // derived data, computed on demand
    private Integer degree;
    private StabilizerChain chain;
    private BigInteger order;
    private ElementsAndWords elementsAndWords;

    public PermGroup(List<Perm> gens) {
        Objects.requireNonNull(gens, "gens");
        for (Perm g : gens) Objects.requireNonNull(g, "generator");
        this.gens = List.copyOf(gens);
    }

    /** Factories */
    public static PermGroup of(Perm... gens) { return new PermGroup(List.of(gens)); }

    public static PermGroup trivial() { return new PermGroup(List.of()); }

    /** Symmetric group on {@code 1..n}, generated by the transpositions {@code (i,i+1)}. */
    public static PermGroup symmetricGroup(int n) {
        List<Perm> g = new ArrayList<>();
        for (int i = 1; i < n; i++) g.add(Perm.transposition(i, i + 1));
        return new PermGroup(g);
    }

    /** Alternating group on {@code 1..n}, generated by the 3-cycles {@code (i,i+1,i+2)}. */
    public static PermGroup alternatingGroup(int n) {
        List<Perm> g = new ArrayList<>();
        for (int i = 1; i + 2 <= n; i++) g.add(Perm.cycle(i, i + 1, i + 2));
        return new PermGroup(g);
    }

    /** Cyclic group generated by {@code (1,2,...,n)}. */
    public static PermGroup cyclicGroup(int n) {
        if (n < 2) return trivial();
        int[] c = new int[n];
        for (int i = 0; i < n; i++) c[i] = i + 1;
        return of(Perm.cycle(c));
    }

    public List<Perm> gens() { return gens; }

    public Perm identity() { return Perm.IDENTITY; }

    /** Largest point moved by a generator; 0 when no generator moves anything. */
    public synchronized int degree() {
        if (degree == null) {
            int d = 0;
            for (Perm g : gens) d = Math.max(d, g.largestMovedPoint());
            degree = d;
        }
        return degree;
    }

    // ---- orbits ----

    public SortedSet<Integer> orbit(int p) { return Orbits.orbit(gens, p); }

    /** Orbits on {@code 1..degree()}, including fixed points as singletons. */
    public List<SortedSet<Integer>> orbits() { return Orbits.orbits(gens, degree()); }

    public Map<Integer, Perm> orbitAndRepresentative(int p) { return Orbits.orbitAndRepresentative(gens, p); }

    public int[] schreierVector(int p) { return Orbits.schreierVector(gens, p, degree()); }

    // ---- stabilizer chain ----

    public synchronized StabilizerChain chain() {
        if (chain == null) {
            chain = SchreierSims.build(gens);
            LOG.debug("{}: base {} of length {}", this, chain.base(), chain.depth());
        }
        return chain;
    }

    /** Centralizers get the tail of their parent's chain instead of rebuilding it. */
    synchronized void adoptChain(StabilizerChain c) {
        if (chain == null) chain = c;
    }

    /** Points no non-identity element fixes all of. */
    public List<Integer> base() { return chain().base(); }

    /** Level {@code i} generates the pointwise stabilizer of {@code base()[0..i-1]}. */
    public List<List<Perm>> strongGenerators() { return chain().strongGenerators(); }

    public List<Perm> strongGeneratingSet() { return chain().strongGeneratingSet(); }

    /** Level {@code i} is the pointwise stabilizer of {@code base()[0..i-1]}. */
    public List<PermGroup> centralizers() { return chain().centralizers(); }

    /** Level {@code i} maps each point of the orbit of {@code base()[i]} under level {@code i} to a representative. */
    public List<Map<Integer, Perm>> centralizerOrbits() { return chain().transversals(); }

    public ChainStats chainStats() { return chain().stats(); }

    public synchronized BigInteger order() {
        if (order == null) order = chain().order();
        return order;
    }

    public StripResult strip(Perm g) {
        Objects.requireNonNull(g, "g");
        return chain().strip(g);
    }

    public boolean contains(Perm g) {
        return strip(g).isMember();
    }

    // ---- elements and words ----

    public synchronized ElementsAndWords elementsAndWords() {
        if (elementsAndWords == null) {
            elementsAndWords = WordEnumerator.enumerate(gens);
            LOG.debug("{}: enumerated {} elements with words", this, elementsAndWords.size());
        }
        return elementsAndWords;
    }

    /** All elements, sorted. */
    public List<Perm> elements() { return elementsAndWords().elements(); }

    /** {@code words().get(j)} evaluates to {@code elements().get(j)}. */
    public List<List<Integer>> words() { return elementsAndWords().words(); }

    /** Stored word of {@code g}; {@code IllegalArgumentException} if {@code g} is not in the group. */
    public List<Integer> word(Perm g) {
        List<Integer> w = elementsAndWords().wordOf(g);
        if (w == null) throw new IllegalArgumentException(g + " is not an element of " + this);
        return w;
    }

    /** Composes generators along a word of 1-based indices, left to right. */
    public Perm evaluate(List<Integer> word) {
        Perm p = Perm.IDENTITY;
        for (int k : word) {
            if (k < 1 || k > gens.size())
                throw new IllegalArgumentException("Generator index " + k + " outside 1.." + gens.size());
            p = p.multiply(gens.get(k - 1));
        }
        return p;
    }

    // ---- iteration ----

    @Override
    public Iterator<Perm> iterator() {
        return new ChainIterator(chain());
    }

    public Stream<Perm> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(),
                Spliterator.DISTINCT | Spliterator.NONNULL | Spliterator.IMMUTABLE), false);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PermGroup(");
        for (int i = 0; i < gens.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(gens.get(i));
        }
        return sb.append(')').toString();
    }
}
