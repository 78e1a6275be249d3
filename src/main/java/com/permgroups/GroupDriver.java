package com.permgroups;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one job from the command line:
 *  - parse options (delegates to OptionsParser)
 *  - read the generator file (GroupFile)
 *  - answer the requested queries on the group
 *  - print totals and elapsed time
 */
public final class GroupDriver {
    private static final Logger LOG = LoggerFactory.getLogger(GroupDriver.class);

    private final PrintStream out;
    private final PrintStream err;

    public GroupDriver() { this(System.out, System.err); }

    public GroupDriver(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /** Exit status: 0 ok, 1 input error, 2 argument error, 3 order above -maxorder, -1 unrecoverable. */
    public int run(String[] args) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage();
            err.println("Argument error: " + e.getMessage());
            return 2;
        }

        final GroupDat dat = parsed.dat;
        final String inputPath = parsed.inputPath;

        final Instant t0 = Instant.now();
        try {
            GroupFile file = GroupFile.readFromFile(inputPath);
            PermGroup g = file.toGroup();
            LOG.debug("Read {} generators from {}", g.gens().size(), inputPath);

            if (!listable(g, dat)) {
                err.println("*order " + g.order() + " exceeds -maxorder " + dat.maxOrder
                        + "; nothing listed (use -maxorder 0 to lift the cap)");
                return 3;
            }

            out.println(file.getName() != null ? file.getName() : baseName(inputPath));
            report(g, dat);

            out.printf("*Totals: order=%s degree=%d base_length=%d generators=%d%n",
                    g.order(), g.degree(), g.base().size(), g.gens().size());
            if (dat.printStats) out.println(g.chainStats());

            double secs = Duration.between(t0, Instant.now()).toMillis() / 1000.0;
            out.printf("*elapsed time: %.3f seconds%n", secs);
            return 0;
        } catch (FileNotFoundException e) {
            err.println("File not found: " + inputPath);
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            LOG.debug("Run failed", e);
            err.println("*unrecoverable error: " + e.getMessage());
            return -1;
        }
    }

    private void report(PermGroup g, GroupDat dat) {
        if (dat.has(GroupDat.Mode.ORDER)) out.println("order " + g.order());
        if (dat.has(GroupDat.Mode.BASE)) {
            out.println("base " + joined(g.base()));
            StringJoiner sizes = new StringJoiner(" ");
            for (Map<Integer, Perm> t : g.centralizerOrbits()) sizes.add(String.valueOf(t.size()));
            out.println("transversal_sizes " + sizes);
        }
        if (dat.has(GroupDat.Mode.CHAIN)) {
            StabilizerChain c = g.chain();
            for (int i = 0; i < c.depth(); i++) {
                out.printf("level %d base_point %d orbit_length %d%n",
                        i, c.base().get(i), c.transversals().get(i).size());
                for (Perm x : c.strongGenerators().get(i)) out.println("  " + x);
            }
        }
        if (dat.has(GroupDat.Mode.ORBITS)) {
            for (SortedSet<Integer> o : g.orbits()) out.println("orbit " + joined(o));
        }
        for (int p : dat.orbitPoints) out.println("orbit_of " + p + ": " + joined(g.orbit(p)));
        for (Perm m : dat.members) out.println("member " + m + " " + g.contains(m));

        if (dat.has(GroupDat.Mode.ELEMENTS)) {
            List<Perm> es = g.elements();
            out.println("elements " + es.size());
            out.println("begin");
            for (Perm e : es) out.println(e);
            out.println("end");
        }
        if (dat.has(GroupDat.Mode.WORDS)) {
            List<Perm> es = g.elements();
            List<List<Integer>> ws = g.words();
            out.println("words " + ws.size());
            out.println("begin");
            for (int j = 0; j < es.size(); j++) out.println(es.get(j) + " " + ws.get(j));
            out.println("end");
        }
        if (dat.has(GroupDat.Mode.ITERATE)) {
            out.println("iterate " + g.order());
            out.println("begin");
            for (Perm e : g) out.println(e);
            out.println("end");
        }
    }

    /** False when an element listing is requested for a group larger than the cap. */
    private static boolean listable(PermGroup g, GroupDat dat) {
        boolean lists = dat.has(GroupDat.Mode.ELEMENTS) || dat.has(GroupDat.Mode.WORDS) || dat.has(GroupDat.Mode.ITERATE);
        return !lists || dat.maxOrder == 0 || g.order().compareTo(BigInteger.valueOf(dat.maxOrder)) <= 0;
    }

    private static String joined(Iterable<Integer> points) {
        StringJoiner sj = new StringJoiner(" ");
        for (int p : points) sj.add(String.valueOf(p));
        return sj.toString();
    }

    private static String baseName(String path) {
        String base = Paths.get(path).getFileName().toString();
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }

    private void usage() {
        err.println(
                "Usage: permgroups [options] <input-file>\n" +
                        "Queries:\n" +
                        "  -order         group order  [default]\n" +
                        "  -base          base points and transversal sizes\n" +
                        "  -chain         stabilizer chain with strong generators per level\n" +
                        "  -orbits        orbits on 1..degree\n" +
                        "  -orbit p       orbit of point p (repeatable)\n" +
                        "  -member perm   membership test, perm in cycle notation (repeatable)\n" +
                        "  -elements      sorted element list\n" +
                        "  -words         elements with words in the generators\n" +
                        "  -iterate       elements in stabilizer-chain order\n" +
                        "Options:\n" +
                        "  -maxorder N    refuse to list groups larger than N (0 = no cap, default " +
                        GroupDat.DEFAULT_MAX_ORDER + ")\n" +
                        "  -stats         print Schreier-Sims counters\n"
        );
    }
}
