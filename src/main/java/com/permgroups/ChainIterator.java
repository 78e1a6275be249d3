package com.permgroups;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Walks the cross product of a chain's transversals. Every group element is
 * uniquely {@code u[k-1]*...*u[1]*u[0]} with {@code u[i]} in {@code Δ[i]};
 * {@code partial[i]} caches {@code u[k-1]*...*u[i]}, so advancing level 0
 * costs one multiplication.
 */
final class ChainIterator implements Iterator<Perm> {
    private final List<List<Perm>> values;
    private final int[] index;
    private final Perm[] partial;
    private boolean exhausted;
    private boolean identityPending;    // trivial chain: yield the identity once

    ChainIterator(StabilizerChain chain) {
        int k = chain.depth();
        this.values = new ArrayList<>(k);
        for (Map<Integer, Perm> t : chain.transversals()) values.add(new ArrayList<>(t.values()));
        this.index = new int[k];
        this.partial = new Perm[k];
        this.identityPending = k == 0;
        if (k > 0) refill(k - 1);
    }

    @Override
    public boolean hasNext() {
        return identityPending || (!exhausted && partial.length > 0);
    }

    @Override
    public Perm next() {
        if (identityPending) {
            identityPending = false;
            return Perm.IDENTITY;
        }
        if (!hasNext()) throw new NoSuchElementException();
        Perm out = partial[0];
        advance();
        return out;
    }

    private void advance() {
        for (int i = 0; i < index.length; i++) {
            if (index[i] + 1 < values.get(i).size()) {
                index[i]++;
                for (int j = 0; j < i; j++) index[j] = 0;
                refill(i);
                return;
            }
        }
        exhausted = true;
    }

    /** Recomputes partial products from level {@code top} down to level 0. */
    private void refill(int top) {
        for (int i = top; i >= 0; i--) {
            Perm u = values.get(i).get(index[i]);
            partial[i] = i + 1 < partial.length ? partial[i + 1].multiply(u) : u;
        }
    }
}
