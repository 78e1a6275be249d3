package com.permgroups;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for the {@link Perm} value class: parsing, composition
 * convention, normalization and ordering.
 */
public class PermTest {

    @Test
    public void testParseAndPrintCycleNotation() {
        assertEquals("(1,2)(3,4,5)", Perm.parse("(1,2)(3,4,5)").toString());
        // cycles are rotated to start at their smallest point
        assertEquals("(1,2,3)", Perm.parse("(3,1,2)").toString());
        assertEquals("(1,2)", Perm.parse(" ( 1 2 ) ").toString());
        assertEquals("(1,2,3)", Perm.parse("(1 , 2,  3)").toString());
        assertSame(Perm.IDENTITY, Perm.parse("()"));
        assertEquals(Perm.IDENTITY, Perm.parse("(4)"));
        assertEquals("()", Perm.IDENTITY.toString());
    }

    @Test
    public void testMalformedInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Perm.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Perm.parse("(1,2"));
        assertThrows(IllegalArgumentException.class, () -> Perm.parse("1,2"));
        assertThrows(IllegalArgumentException.class, () -> Perm.parse("(1,x)"));
        assertThrows(IllegalArgumentException.class, () -> Perm.parse("(1,,2)"));
        assertThrows(IllegalArgumentException.class, () -> Perm.parse("(,1,2)"));
        assertThrows(IllegalArgumentException.class, () -> Perm.parse("(1,2,)"));
        assertThrows(IllegalArgumentException.class, () -> Perm.parse("(1,2)(2,3)"), "cycles must be disjoint");
        assertThrows(IllegalArgumentException.class, () -> Perm.parse("(0,1)"));
        assertThrows(IllegalArgumentException.class, () -> Perm.of(1, 1));
        assertThrows(IllegalArgumentException.class, () -> Perm.of(3, 1));
        assertThrows(IllegalArgumentException.class, () -> Perm.transposition(2, 2));
    }

    @Test
    public void testCompositionIsLeftToRight() {
        Perm a = Perm.transposition(1, 2);
        Perm b = Perm.transposition(2, 3);
        Perm ab = a.multiply(b);
        // 1 -> 2 -> 3, 2 -> 1 -> 1, 3 -> 3 -> 2
        assertEquals(3, ab.image(1));
        assertEquals(1, ab.image(2));
        assertEquals(2, ab.image(3));
        assertEquals(Perm.parse("(1,3,2)"), ab);
        assertEquals(Perm.parse("(1,2,3)"), b.multiply(a));
    }

    @Test
    public void testInverseAndPower() {
        Perm c = Perm.cycle(1, 2, 3, 4);
        assertEquals(Perm.parse("(1,4,3,2)"), c.inverse());
        assertTrue(c.multiply(c.inverse()).isIdentity());
        assertEquals(Perm.parse("(1,3)(2,4)"), c.power(2));
        assertEquals(c.inverse(), c.power(-1));
        assertEquals(c.inverse(), c.power(3));
        assertTrue(c.power(4).isIdentity());
        assertTrue(c.power(0).isIdentity());
        assertEquals(2, c.preimage(3));
    }

    @Test
    public void testEqualityIgnoresTrailingFixedPoints() {
        Perm x = Perm.of(2, 1, 3, 4);
        Perm y = Perm.of(2, 1);
        assertEquals(x, y);
        assertEquals(x.hashCode(), y.hashCode());
        assertEquals(2, x.largestMovedPoint());
        assertEquals(Perm.IDENTITY, Perm.of(1, 2, 3));
    }

    @Test
    public void testMovedPointsAndPointAction() {
        Perm p = Perm.parse("(2,5)");
        assertEquals(2, p.smallestMovedPoint());
        assertEquals(5, p.largestMovedPoint());
        assertEquals(0, Perm.IDENTITY.smallestMovedPoint());
        assertEquals(0, Perm.IDENTITY.largestMovedPoint());
        assertEquals(7, p.image(7), "points beyond the support are fixed");
        assertTrue(p.fixes(3));
        assertFalse(p.fixes(5));
        assertThrows(IllegalArgumentException.class, () -> p.image(0));
    }

    @Test
    public void testCyclesAndOrder() {
        Perm p = Perm.parse("(4,5,3)(1,2)");
        List<int[]> cs = p.cycles();
        assertEquals(2, cs.size());
        assertArrayEquals(new int[]{1, 2}, cs.get(0));
        assertArrayEquals(new int[]{3, 4, 5}, cs.get(1));
        assertEquals(BigInteger.valueOf(6), p.order());
        assertEquals(BigInteger.ONE, Perm.IDENTITY.order());
    }

    @Test
    public void testOrderingIsLexicographicOnImages() {
        List<Perm> s3 = new ArrayList<>(Arrays.asList(
                Perm.parse("(1,3)"), Perm.parse("(1,2,3)"), Perm.parse("(2,3)"),
                Perm.IDENTITY, Perm.parse("(1,3,2)"), Perm.parse("(1,2)")));
        Collections.sort(s3);
        assertEquals("[(), (2,3), (1,2), (1,2,3), (1,3,2), (1,3)]", s3.toString());
        assertEquals(0, Perm.of(2, 1, 3).compareTo(Perm.of(2, 1)));
        assertTrue(Perm.IDENTITY.compareTo(Perm.parse("(7,8)")) < 0);
    }
}
