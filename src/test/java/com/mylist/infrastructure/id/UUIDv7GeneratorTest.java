package com.mylist.infrastructure.id;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UUIDv7GeneratorTest {

    private final UUIDv7Generator generator = new UUIDv7Generator();

    @Test
    void shouldGenerateUniqueIds() {
        Set<UUID> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(generator.generate());
        }
        assertEquals(1000, ids.size(), "All generated UUIDs should be unique");
    }

    @Test
    void shouldGenerateVersion7() {
        assertEquals(7, generator.generate().version());
    }

    @Test
    void laterIdsShouldSortAfterEarlierOnes() throws InterruptedException {
        UUID first = generator.generate();
        Thread.sleep(2);
        UUID second = generator.generate();

        // Tie-breaking in list order compares ids as unsigned 128-bit values
        assertTrue(first.toString().compareTo(second.toString()) < 0);
    }
}
