package com.permgroups;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Sifting permutations through the chain of the symmetric group on 3 points. */
public class SieveTest {

    private final StabilizerChain s3 = PermGroup.symmetricGroup(3).chain();

    @Test
    public void testMemberSiftsToIdentity() {
        for (String g : new String[]{"()", "(1,2)", "(2,3)", "(1,3)", "(1,2,3)", "(1,3,2)"}) {
            StripResult r = s3.strip(Perm.parse(g));
            assertTrue(r.isMember(), g);
            assertEquals(2, r.level());
            assertTrue(r.residual().isIdentity());
        }
    }

    @Test
    public void testNonMemberStopsWhereTheTransversalEnds() {
        // base image 1 -> 2 is covered by (1,2); the residual (2,4) then sends 2 outside {2,3}
        StripResult r = s3.strip(Perm.parse("(1,2,4)"));
        assertEquals(1, r.level());
        assertEquals(Perm.parse("(2,4)"), r.residual());
        assertFalse(r.passedAllLevels());
        assertFalse(r.isMember());
    }

    @Test
    public void testResidualFixingTheBaseIsNotAMember() {
        StripResult r = s3.strip(Perm.parse("(4,5)"));
        assertTrue(r.passedAllLevels());
        assertEquals(Perm.parse("(4,5)"), r.residual());
        assertFalse(r.isMember());
    }

    @Test
    public void testEmptyChainKeepsThePermutation() {
        StripResult r = PermGroup.trivial().strip(Perm.parse("(1,2)"));
        assertEquals(0, r.level());
        assertTrue(r.passedAllLevels());
        assertFalse(r.isMember());
        assertTrue(PermGroup.trivial().strip(Perm.IDENTITY).isMember());
    }
}
