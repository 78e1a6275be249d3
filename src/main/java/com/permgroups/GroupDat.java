package com.permgroups;

import java.util.*;

/** Run configuration for the command-line driver. */
public final class GroupDat {
    public enum Mode { ORDER, BASE, CHAIN, ELEMENTS, WORDS, ITERATE, ORBITS }

    public static final long DEFAULT_MAX_ORDER = 1_000_000L;

    public final Set<Mode> modes;           // sections to print, in declaration order
    public final int[] orbitPoints;         // -orbit p, in command-line order
    public final List<Perm> members;        // -member perm, parsed
    public final long maxOrder;             // cap for listing elements (0 = no cap)
    public final boolean printStats;        // Schreier-Sims counters

    private GroupDat(Builder b) {
        EnumSet<Mode> m = b.modes.isEmpty() ? EnumSet.of(Mode.ORDER) : EnumSet.copyOf(b.modes);
        this.modes = Collections.unmodifiableSet(m);
        this.orbitPoints = b.orbitPoints.stream().mapToInt(Integer::intValue).toArray();
        this.members = List.copyOf(b.members);
        this.maxOrder = b.maxOrder;
        this.printStats = b.printStats;
    }

    public boolean has(Mode m) { return modes.contains(m); }

    public static final class Builder {
        private final EnumSet<Mode> modes = EnumSet.noneOf(Mode.class);
        private final List<Integer> orbitPoints = new ArrayList<>();
        private final List<Perm> members = new ArrayList<>();
        private long maxOrder = DEFAULT_MAX_ORDER;
        private boolean printStats;

        public Builder mode(Mode m){ this.modes.add(m); return this; }
        public Builder addOrbit(int p){
            if (p < 1) throw new IllegalArgumentException("Orbit point must be positive: " + p);
            this.orbitPoints.add(p); return this;
        }
        public Builder addMember(Perm perm){ this.members.add(Objects.requireNonNull(perm, "perm")); return this; }
        public Builder maxOrder(long v){
            if (v < 0) throw new IllegalArgumentException("maxorder must be >= 0: " + v);
            this.maxOrder = v; return this;
        }
        public Builder printStats(boolean v){ this.printStats = v; return this; }
        public GroupDat build(){ return new GroupDat(this); }
    }
}
