package org.bigcsters.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilIDMapperTest {

    private static final List<String> EMAILS = List.of(
            "ada@uwaterloo.ca",
            "grace@uwaterloo.ca",
            "linus@uwaterloo.ca"
    );

    @Test
    @DisplayName("Baseline Correctness: ids map to their input position and back")
    void testSimpleMapping() {
        IDMapper mapper = IDMapper.createImmutable(EMAILS);

        assertEquals(0, mapper.toInternal("ada@uwaterloo.ca"));
        assertEquals(2, mapper.toInternal("linus@uwaterloo.ca"));
        assertEquals("grace@uwaterloo.ca", mapper.toExternal(1));

        assertTrue(mapper.containsExternal("ada@uwaterloo.ca"));
        assertFalse(mapper.containsExternal("alan@uwaterloo.ca"));
        assertTrue(mapper.containsInternal(0));
        assertFalse(mapper.containsInternal(3));
        assertFalse(mapper.containsInternal(-1));
        assertEquals(3, mapper.size());
    }

    @Test
    @DisplayName("Exception Path: unknown participant id")
    void testUnknownExternalId() {
        IDMapper mapper = new FastUtilIDMapper(EMAILS);

        assertThrows(IDMapper.UnknownIDException.class, () -> mapper.toInternal("alan@uwaterloo.ca"));
    }

    @Test
    @DisplayName("Exception Path: invalid internal index")
    void testInvalidInternalId() {
        IDMapper mapper = new FastUtilIDMapper(EMAILS);

        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(99));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(-1));
    }

    @Test
    @DisplayName("Validation: duplicate, blank and null inputs are rejected")
    void testValidation() {
        assertThrows(IDMapper.DuplicateIDException.class,
                () -> new FastUtilIDMapper(List.of("a@x.ca", "b@x.ca", "a@x.ca")));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(List.of("a@x.ca", " ")));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(Arrays.asList("a@x.ca", null)));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(null));
    }

    @Test
    @DisplayName("Edge Case: empty mapper")
    void testEmpty() {
        IDMapper mapper = new FastUtilIDMapper(List.of());

        assertEquals(0, mapper.size());
        assertFalse(mapper.containsInternal(0));
    }

    @Test
    @DisplayName("Concurrency: parallel readers see a consistent mapping")
    void testConcurrentReads() throws InterruptedException {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 1_000; i++) {
            ids.add("mentee" + i + "@uwaterloo.ca");
        }
        IDMapper mapper = new FastUtilIDMapper(ids);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicInteger errors = new AtomicInteger();

        for (int t = 0; t < 4; t++) {
            pool.submit(() -> {
                for (int i = 0; i < ids.size(); i++) {
                    if (mapper.toInternal(ids.get(i)) != i || !mapper.toExternal(i).equals(ids.get(i))) {
                        errors.incrementAndGet();
                    }
                }
            });
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(0, errors.get());
    }
}
