package com.permgroups;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A named list of generators in an lrs-like text format:
 * <pre>
 * s4
 * * comment
 * begin
 * (1,2)
 * (1,2,3,4)
 * end
 * </pre>
 * The name line is optional. Lines starting with {@code *} or {@code #} are
 * comments; one generator per line, in cycle notation.
 */
public class GroupFile {
    private final String name;
    private final List<Perm> generators;

    public GroupFile(String name, List<Perm> generators) {
        this.name = name;
        this.generators = List.copyOf(generators);
    }

    /** May be null when the file has no name line. */
    public String getName() { return name; }
    public List<Perm> getGenerators() { return generators; }
    public PermGroup toGroup() { return new PermGroup(generators); }

    public static GroupFile readFromFile(String filename) throws IOException {
        try (FileReader fr = new FileReader(filename)) {
            return read(fr);
        }
    }

    public static GroupFile read(Reader in) throws IOException {
        BufferedReader br = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        String line;
        int lineNo = 0;
        String name = null;
        boolean sawBegin = false;

        // ---- header: optional name, comments, then 'begin' ----
        while ((line = br.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || isComment(line)) continue;
            if (line.toLowerCase(Locale.ROOT).equals("begin")) { sawBegin = true; break; }
            if (name != null) throw new IOException("line " + lineNo + ": unexpected text before 'begin': " + line);
            name = line;
        }
        if (!sawBegin) throw new IOException("No 'begin' line found");

        // ---- generators until 'end' ----
        List<Perm> gens = new ArrayList<>();
        boolean sawEnd = false;
        while ((line = br.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || isComment(line)) continue;
            if (line.equalsIgnoreCase("end")) { sawEnd = true; break; }
            try {
                gens.add(Perm.parse(line));
            } catch (IllegalArgumentException e) {
                throw new IOException("line " + lineNo + ": " + e.getMessage(), e);
            }
        }
        if (!sawEnd) throw new IOException("Unexpected end of file, expected 'end'");
        return new GroupFile(name, gens);
    }

    public void write(PrintWriter out) {
        if (name != null) out.println(name);
        out.println("begin");
        for (Perm g : generators) out.println(g);
        out.println("end");
    }

    private static boolean isComment(String line) {
        return line.startsWith("*") || line.startsWith("#");
    }
}
