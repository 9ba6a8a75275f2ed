package com.pbxguard.editor;

import com.pbxguard.value.Identifiers;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IdGeneratorTest {

    @Test
    void producesWellFormedUppercaseIds() {
        IdGenerator generator = new IdGenerator(new Random(11));
        for (int i = 0; i < 50; i++) {
            String id = generator.next(Set.of());
            assertTrue(Identifiers.isWellFormed(id), id);
            assertEquals(id.toUpperCase(), id);
        }
    }

    @Test
    void sameSeedSameSequence() {
        IdGenerator a = new IdGenerator(new Random(5));
        IdGenerator b = new IdGenerator(new Random(5));
        assertEquals(a.next(Set.of()), b.next(Set.of()));
    }

    @Test
    void skipsTakenIdsAndCountsCollisions() {
        String first = new IdGenerator(new Random(99)).next(Set.of());
        IdGenerator generator = new IdGenerator(new Random(99));

        String id = generator.next(Set.of(first));

        assertNotEquals(first, id);
        assertEquals(1, generator.getCollisions());
    }

    @Test
    void neverRepeatsWithinATakenSet() {
        IdGenerator generator = new IdGenerator(new Random(0));
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            assertTrue(taken.add(generator.next(taken)));
        }
    }
}
