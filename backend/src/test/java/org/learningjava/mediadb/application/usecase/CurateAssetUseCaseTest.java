package org.learningjava.mediadb.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.mediadb.application.port.AssetStorePort;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.domain.model.EpisodeUpdate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CurateAssetUseCaseTest {

    private static final Instant NOW = Instant.parse("2026-05-05T12:00:00Z");

    private AssetStorePort store;
    private CurateAssetUseCase useCase;
    private final UUID id = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        store = mock(AssetStorePort.class);
        useCase = new CurateAssetUseCase(store, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void rateAsset_out_of_range_writes_nothing() {
        assertThrows(IllegalArgumentException.class, () -> useCase.rateAsset(id, 11, "too high"));
        assertThrows(IllegalArgumentException.class, () -> useCase.rateAsset(id, 0, null));
        verifyNoInteractions(store);
    }

    @Test
    void rateAsset_unknown_id_is_not_found() {
        when(store.updateRating(id, 8, "nice")).thenReturn(false);

        assertThrows(MediaNotFoundException.class, () -> useCase.rateAsset(id, 8, "nice"));
    }

    @Test
    void rateAsset_writes_rating_and_notes() {
        when(store.updateRating(id, 8, "nice")).thenReturn(true);

        useCase.rateAsset(id, 8, "nice");

        verify(store).updateRating(id, 8, "nice");
    }

    @Test
    void assignToEpisode_reports_added_or_already_present() {
        when(store.addEpisode(id, 2)).thenReturn(EpisodeUpdate.ADDED, EpisodeUpdate.ALREADY_PRESENT);

        assertTrue(useCase.assignToEpisode(id, 2));
        assertFalse(useCase.assignToEpisode(id, 2));
    }

    @Test
    void assignToEpisode_validates_and_maps_missing_asset() {
        assertThrows(IllegalArgumentException.class, () -> useCase.assignToEpisode(id, 9));
        when(store.addEpisode(id, 4)).thenReturn(EpisodeUpdate.NOT_FOUND);
        assertThrows(MediaNotFoundException.class, () -> useCase.assignToEpisode(id, 4));
    }

    @Test
    void markUsed_stamps_clock_time() {
        when(store.markUsed(eq(id), any())).thenReturn(true);

        useCase.markUsed(id);

        verify(store).markUsed(id, NOW);
    }

    @Test
    void markUsed_unknown_id_is_not_found() {
        when(store.markUsed(eq(id), any())).thenReturn(false);

        assertThrows(MediaNotFoundException.class, () -> useCase.markUsed(id));
    }
}
