package com.permgroups;

import java.util.Objects;

/** Outcome of sifting a permutation through a stabilizer chain. */
public final class StripResult {
    private final Perm residual;
    private final int level;       // 0-based level where sifting stopped; depth when fully sifted
    private final int depth;       // chain depth the permutation was sifted through

    StripResult(Perm residual, int level, int depth) {
        this.residual = Objects.requireNonNull(residual, "residual");
        this.level = level;
        this.depth = depth;
    }

    public Perm residual() { return residual; }
    public int level() { return level; }

    /** True when every level absorbed the permutation's base image. */
    public boolean passedAllLevels() { return level == depth; }

    /** Membership: sifted through every level down to the identity. */
    public boolean isMember() { return passedAllLevels() && residual.isIdentity(); }

    @Override
    public String toString() {
        return "StripResult{residual=" + residual + ", level=" + level + "/" + depth + "}";
    }
}
