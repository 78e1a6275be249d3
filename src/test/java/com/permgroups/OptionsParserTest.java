package com.permgroups;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class OptionsParserTest {
    @Test
    public void parsesBasicFlags() {
        String[] args = {
                "-base", "-words", "-orbit", "3", "-orbit", "1", "-member", "(1,2)",
                "-maxorder", "500", "-stats", "m11.grp"
        };
        OptionsParser.Parsed p = OptionsParser.parse(args);
        GroupDat d = p.dat;
        assertEquals("m11.grp", p.inputPath);
        assertEquals(Set.of(GroupDat.Mode.BASE, GroupDat.Mode.WORDS), d.modes);
        assertArrayEquals(new int[]{3, 1}, d.orbitPoints);
        assertEquals(List.of(Perm.transposition(1, 2)), d.members);
        assertEquals(500L, d.maxOrder);
        assertTrue(d.printStats);
    }

    @Test
    public void defaultsToOrder() {
        GroupDat d = OptionsParser.parse(new String[]{"g.grp"}).dat;
        assertEquals(Set.of(GroupDat.Mode.ORDER), d.modes);
        assertEquals(GroupDat.DEFAULT_MAX_ORDER, d.maxOrder);
        assertFalse(d.printStats);
        assertEquals(0, d.orbitPoints.length);
    }

    @Test
    public void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"-bogus", "g.grp"}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"a.grp", "b.grp"}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"g.grp", "-orbit"}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"-orbit", "0", "g.grp"}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"-maxorder", "x", "g.grp"}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"-member", "(1,x)", "g.grp"}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"-member", "(1,2)(2,3)", "g.grp"}));
    }
}
