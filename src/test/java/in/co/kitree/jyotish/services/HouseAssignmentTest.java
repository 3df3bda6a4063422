package in.co.kitree.jyotish.services;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class HouseAssignmentTest {

    @Test
    public void test_ascendantSign_isFirstHouse() {
        for (int asc = 0; asc < 12; asc++) {
            assertEquals(1, HouseAssignment.houseOf(asc, asc));
        }
    }

    @Test
    public void test_signBeforeAscendant_isTwelfthHouse() {
        assertEquals(12, HouseAssignment.houseOf(11, 0));
        assertEquals(12, HouseAssignment.houseOf(4, 5));
        assertEquals(7, HouseAssignment.houseOf(1, 7));
    }

    @Test
    public void test_everyAscendant_mapsSignsOntoAllTwelveHouses() {
        for (int asc = 0; asc < 12; asc++) {
            Set<Integer> houses = new HashSet<>();
            for (int sign = 0; sign < 12; sign++) {
                houses.add(HouseAssignment.houseOf(sign, asc));
            }
            assertEquals(12, houses.size());
            assertTrue(houses.stream().allMatch(h -> h >= 1 && h <= 12));
        }
    }

    @Test
    public void test_ascendantOutsideFirstHouse_failsLoudly() {
        assertThrows(IllegalStateException.class, () -> HouseAssignment.verifyAscendantHouse("D9", 2));
        assertDoesNotThrow(() -> HouseAssignment.verifyAscendantHouse("D9", 1));
    }
}
