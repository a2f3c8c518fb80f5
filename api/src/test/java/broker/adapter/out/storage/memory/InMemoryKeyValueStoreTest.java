package broker.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import broker.support.MutableClock;

@DisplayName("InMemoryKeyValueStore")
class InMemoryKeyValueStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
        store = new InMemoryKeyValueStore(clock);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Nested
    @DisplayName("Expiry")
    class ExpiryTests {

        @Test
        @DisplayName("should return value before TTL and nothing after")
        void shouldExpireAfterTtl() {
            store.put("key", "value", Duration.ofSeconds(10)).await().atMost(TIMEOUT);

            clock.advance(Duration.ofSeconds(9));
            assertEquals(Optional.of("value"), store.get("key").await().atMost(TIMEOUT));

            clock.advance(Duration.ofSeconds(1));
            assertEquals(Optional.empty(), store.get("key").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should treat expired key as absent for putIfAbsent")
        void shouldReplaceExpiredKeyOnPutIfAbsent() {
            store.put("key", "old", Duration.ofSeconds(1)).await().atMost(TIMEOUT);
            clock.advance(Duration.ofSeconds(2));

            assertTrue(store.putIfAbsent("key", "new", Duration.ofSeconds(5)).await().atMost(TIMEOUT));
            assertEquals(Optional.of("new"), store.get("key").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("putIfAbsent()")
    class PutIfAbsentTests {

        @Test
        @DisplayName("should not overwrite live value")
        void shouldNotOverwrite() {
            assertTrue(store.putIfAbsent("key", "first", Duration.ofMinutes(1)).await().atMost(TIMEOUT));
            assertFalse(store.putIfAbsent("key", "second", Duration.ofMinutes(1)).await().atMost(TIMEOUT));

            assertEquals(Optional.of("first"), store.get("key").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("getAndDelete()")
    class GetAndDeleteTests {

        @Test
        @DisplayName("should return value once")
        void shouldReturnOnce() {
            store.put("key", "value", Duration.ofMinutes(1)).await().atMost(TIMEOUT);

            assertEquals(Optional.of("value"), store.getAndDelete("key").await().atMost(TIMEOUT));
            assertEquals(Optional.empty(), store.getAndDelete("key").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("replaceIfPresent()")
    class ReplaceIfPresentTests {

        @Test
        @DisplayName("should replace a live value and apply the new TTL")
        void shouldReplaceLiveValue() {
            store.put("session:a", "v1", Duration.ofMinutes(1)).await().atMost(TIMEOUT);

            assertTrue(store.replaceIfPresent("session:a", "v2", Duration.ofMinutes(5)).await().atMost(TIMEOUT));
            assertEquals(Optional.of("v2"), store.get("session:a").await().atMost(TIMEOUT));

            clock.advance(Duration.ofMinutes(2));
            assertEquals(Optional.of("v2"), store.get("session:a").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should not recreate a deleted key")
        void shouldNotRecreateDeletedKey() {
            store.put("session:a", "v1", Duration.ofMinutes(1)).await().atMost(TIMEOUT);
            store.delete("session:a").await().atMost(TIMEOUT);

            assertFalse(store.replaceIfPresent("session:a", "v2", Duration.ofMinutes(5)).await().atMost(TIMEOUT));
            assertEquals(Optional.empty(), store.get("session:a").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should treat an expired key as absent")
        void shouldTreatExpiredKeyAsAbsent() {
            store.put("session:a", "v1", Duration.ofSeconds(30)).await().atMost(TIMEOUT);
            clock.advance(Duration.ofSeconds(30));

            assertFalse(store.replaceIfPresent("session:a", "v2", Duration.ofMinutes(5)).await().atMost(TIMEOUT));
            assertEquals(Optional.empty(), store.get("session:a").await().atMost(TIMEOUT));
            assertEquals(0, store.size());
        }
    }

    @Nested
    @DisplayName("deleteIfEquals()")
    class DeleteIfEqualsTests {

        @Test
        @DisplayName("should delete only when value matches")
        void shouldCompareBeforeDelete() {
            store.put("lease", "owner-a", Duration.ofMinutes(1)).await().atMost(TIMEOUT);

            assertFalse(store.deleteIfEquals("lease", "owner-b").await().atMost(TIMEOUT));
            assertEquals(Optional.of("owner-a"), store.get("lease").await().atMost(TIMEOUT));

            assertTrue(store.deleteIfEquals("lease", "owner-a").await().atMost(TIMEOUT));
            assertEquals(Optional.empty(), store.get("lease").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should report false for absent key")
        void shouldReportFalseForAbsentKey() {
            assertFalse(store.deleteIfEquals("missing", "owner").await().atMost(TIMEOUT));
        }
    }

    @Test
    @DisplayName("delete() should tolerate absent keys")
    void deleteShouldTolerateAbsentKeys() {
        store.delete("missing").await().atMost(TIMEOUT);

        assertEquals(0, store.size());
    }
}
