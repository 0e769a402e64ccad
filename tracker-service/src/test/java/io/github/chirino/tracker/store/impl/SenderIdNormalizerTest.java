package io.github.chirino.tracker.store.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.chirino.tracker.store.TrackerEventRepository;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class SenderIdNormalizerTest {

    @Test
    void rewrites_numeric_sender_id() {
        TrackerEventRepository repository = mock(TrackerEventRepository.class);
        when(repository.rewriteLegacySenderId(42L, "42")).thenReturn(3L);

        assertTrue(new SenderIdNormalizer(repository).migrateLegacySenderId("42"));

        verify(repository).rewriteLegacySenderId(42L, "42");
    }

    @Test
    void reports_nothing_to_retry_when_no_record_matched() {
        TrackerEventRepository repository = mock(TrackerEventRepository.class);
        when(repository.rewriteLegacySenderId(42L, "42")).thenReturn(0L);

        assertFalse(new SenderIdNormalizer(repository).migrateLegacySenderId("42"));
    }

    @Test
    void skips_non_numeric_sender_id() {
        TrackerEventRepository repository = mock(TrackerEventRepository.class);
        SenderIdNormalizer normalizer = new SenderIdNormalizer(repository);

        assertFalse(normalizer.migrateLegacySenderId("alice"));
        assertFalse(normalizer.migrateLegacySenderId("-5"));
        assertFalse(normalizer.migrateLegacySenderId("4.2"));

        verify(repository, never()).rewriteLegacySenderId(anyLong(), anyString());
    }

    @Test
    void legacy_numeric_id_accepts_only_ascii_digits() {
        assertEquals(OptionalLong.of(42L), SenderIdNormalizer.legacyNumericId("42"));
        assertEquals(OptionalLong.of(7L), SenderIdNormalizer.legacyNumericId("007"));
        assertEquals(OptionalLong.empty(), SenderIdNormalizer.legacyNumericId(""));
        assertEquals(OptionalLong.empty(), SenderIdNormalizer.legacyNumericId(null));
        assertEquals(OptionalLong.empty(), SenderIdNormalizer.legacyNumericId(" 42"));
        assertEquals(OptionalLong.empty(), SenderIdNormalizer.legacyNumericId("+42"));
        assertEquals(OptionalLong.empty(), SenderIdNormalizer.legacyNumericId("٤٢"));
    }

    @Test
    void legacy_numeric_id_ignores_values_beyond_long_range() {
        assertEquals(
                OptionalLong.of(Long.MAX_VALUE),
                SenderIdNormalizer.legacyNumericId(String.valueOf(Long.MAX_VALUE)));
        assertEquals(
                OptionalLong.empty(), SenderIdNormalizer.legacyNumericId("99999999999999999999"));
    }
}
