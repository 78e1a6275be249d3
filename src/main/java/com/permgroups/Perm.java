package com.permgroups;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable permutation of the positive integers with finite support.
 * Points are numbered from 1 and composition is left to right:
 * {@code p^(a*b) == (p^a)^b}.
 */
public final class Perm implements GroupElement<Perm> {
    public static final Perm IDENTITY = new Perm(new int[0]);

    private final int[] img;    // img[i-1] = image of point i, trimmed to the largest moved point

    private Perm(int[] img) { this.img = img; }

    /** Factories */
    public static Perm of(int... images) {
        Objects.requireNonNull(images, "images");
        int n = images.length;
        boolean[] seen = new boolean[n + 1];
        for (int i = 0; i < n; i++) {
            int v = images[i];
            if (v < 1 || v > n)
                throw new IllegalArgumentException("Image " + v + " of point " + (i + 1) + " is outside 1.." + n);
            if (seen[v]) throw new IllegalArgumentException("Point " + v + " is the image of two points");
            seen[v] = true;
        }
        return trimmed(images.clone());
    }

    public static Perm cycle(int... points) {
        Objects.requireNonNull(points, "points");
        return cycles(points);
    }

    /** Product of disjoint cycles; a point may appear at most once overall. */
    public static Perm cycles(int[]... cycles) {
        int n = 0;
        for (int[] c : cycles) {
            for (int p : c) {
                checkPoint(p);
                n = Math.max(n, p);
            }
        }
        int[] a = new int[n];
        for (int i = 0; i < n; i++) a[i] = i + 1;
        boolean[] used = new boolean[n + 1];
        for (int[] c : cycles) {
            for (int k = 0; k < c.length; k++) {
                int p = c[k];
                if (used[p]) throw new IllegalArgumentException("Point " + p + " repeated in cycle notation");
                used[p] = true;
                a[p - 1] = c[(k + 1) % c.length];
            }
        }
        return trimmed(a);
    }

    public static Perm transposition(int i, int j) {
        if (i == j) throw new IllegalArgumentException("Transposition needs two distinct points, got " + i);
        return cycle(i, j);
    }

    /** Parse cycle notation, e.g. "(1,2)(3,4,5)" or "(1 2)"; "()" is the identity. */
    public static Perm parse(String s) {
        Objects.requireNonNull(s, "text");
        String t = s.trim();
        if (t.isEmpty()) throw new IllegalArgumentException("Empty permutation text");
        List<int[]> cs = new ArrayList<>();
        int pos = 0;
        while (pos < t.length()) {
            char c = t.charAt(pos);
            if (Character.isWhitespace(c)) { pos++; continue; }
            if (c != '(') throw new IllegalArgumentException("Expected '(' at position " + pos + " in: " + s);
            int close = t.indexOf(')', pos);
            if (close < 0) throw new IllegalArgumentException("Unclosed cycle in: " + s);
            String body = t.substring(pos + 1, close).trim();
            if (!body.isEmpty()) {
                String[] toks = body.split("\\s*,\\s*|\\s+", -1);
                int[] cyc = new int[toks.length];
                for (int k = 0; k < toks.length; k++) {
                    if (toks[k].isEmpty()) throw new IllegalArgumentException("Missing point in: " + s);
                    try {
                        cyc[k] = Integer.parseInt(toks[k]);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Bad point '" + toks[k] + "' in: " + s, e);
                    }
                }
                cs.add(cyc);
            }
            pos = close + 1;
        }
        return cycles(cs.toArray(new int[0][]));
    }

    // ---- point action ----

    /** {@code p^this}; points beyond the support are fixed. */
    public int image(int p) {
        checkPoint(p);
        return p <= img.length ? img[p - 1] : p;
    }

    public int preimage(int p) {
        checkPoint(p);
        for (int i = 0; i < img.length; i++) if (img[i] == p) return i + 1;
        return p;
    }

    public boolean fixes(int p) { return image(p) == p; }

    /** 0 for the identity. */
    public int smallestMovedPoint() {
        for (int i = 0; i < img.length; i++) if (img[i] != i + 1) return i + 1;
        return 0;
    }

    /** 0 for the identity. */
    public int largestMovedPoint() { return img.length; }

    // ---- GroupElement ----

    @Override public Perm multiply(Perm o) {
        int[] b = o.img;
        int n = Math.max(img.length, b.length);
        int[] a = new int[n];
        for (int i = 1; i <= n; i++) {
            int x = i <= img.length ? img[i - 1] : i;
            a[i - 1] = x <= b.length ? b[x - 1] : x;
        }
        return trimmed(a);
    }

    @Override public Perm inverse() {
        if (img.length == 0) return this;
        int[] a = new int[img.length];
        for (int i = 0; i < img.length; i++) a[img[i] - 1] = i + 1;
        return new Perm(a);    // same largest moved point, already trimmed
    }

    @Override public boolean isIdentity() { return img.length == 0; }

    /** {@code this^k}; negative exponents power the inverse. */
    public Perm power(int k) {
        long e = k;
        Perm base = this;
        if (e < 0) { base = inverse(); e = -e; }
        Perm result = IDENTITY;
        while (e > 0) {
            if ((e & 1L) != 0) result = result.multiply(base);
            e >>= 1;
            if (e > 0) base = base.multiply(base);
        }
        return result;
    }

    /** Non-trivial cycles, each starting at its smallest point, ordered by that point. */
    public List<int[]> cycles() {
        List<int[]> out = new ArrayList<>();
        boolean[] done = new boolean[img.length + 1];
        for (int p = 1; p <= img.length; p++) {
            if (done[p] || img[p - 1] == p) continue;
            List<Integer> cyc = new ArrayList<>();
            int q = p;
            while (!done[q]) {
                done[q] = true;
                cyc.add(q);
                q = img[q - 1];
            }
            out.add(cyc.stream().mapToInt(Integer::intValue).toArray());
        }
        return Collections.unmodifiableList(out);
    }

    /** Order as a group element: lcm of the cycle lengths. */
    public BigInteger order() {
        BigInteger l = BigInteger.ONE;
        for (int[] c : cycles()) {
            BigInteger len = BigInteger.valueOf(c.length);
            l = l.divide(l.gcd(len)).multiply(len);
        }
        return l;
    }

    // ---- Comparable ----

    /** Lexicographic on image lists padded to a common length; the identity is the minimum. */
    @Override public int compareTo(Perm o) {
        int n = Math.max(img.length, o.img.length);
        for (int i = 1; i <= n; i++) {
            int a = i <= img.length ? img[i - 1] : i;
            int b = i <= o.img.length ? o.img[i - 1] : i;
            if (a != b) return Integer.compare(a, b);
        }
        return 0;
    }

    // ---- Object ----

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Perm)) return false;
        return Arrays.equals(img, ((Perm) obj).img);
    }

    @Override public int hashCode() { return Arrays.hashCode(img); }

    /** GAP-style cycle notation; "()" for the identity. */
    @Override public String toString() {
        if (img.length == 0) return "()";
        StringBuilder sb = new StringBuilder();
        for (int[] c : cycles()) {
            sb.append('(');
            for (int k = 0; k < c.length; k++) {
                if (k > 0) sb.append(',');
                sb.append(c[k]);
            }
            sb.append(')');
        }
        return sb.toString();
    }

    private static Perm trimmed(int[] a) {
        int n = a.length;
        while (n > 0 && a[n - 1] == n) n--;
        if (n == 0) return IDENTITY;
        return new Perm(n == a.length ? a : Arrays.copyOf(a, n));
    }

    private static void checkPoint(int p) {
        if (p < 1) throw new IllegalArgumentException("Points are positive integers, got " + p);
    }
}
