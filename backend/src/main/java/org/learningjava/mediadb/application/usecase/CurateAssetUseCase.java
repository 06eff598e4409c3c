package org.learningjava.mediadb.application.usecase;

import org.learningjava.mediadb.application.port.AssetStorePort;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.domain.model.EpisodeUpdate;
import org.learningjava.mediadb.domain.model.MediaAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * The only mutations an asset ever sees: rating, episode assignment, usage bookkeeping.
 */
@Service
public class CurateAssetUseCase {

    private static final Logger log = LoggerFactory.getLogger(CurateAssetUseCase.class);

    private final AssetStorePort store;
    private final Clock clock;

    public CurateAssetUseCase(AssetStorePort store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public void rateAsset(UUID id, int rating, String notes) {
        MediaAsset.requireValidRating(rating);
        if (!store.updateRating(id, rating, notes)) throw MediaNotFoundException.asset(id);
        log.info("Rated asset {} as {}/10", id, rating);
    }

    /**
     * @return true if the episode was added, false if the asset already had it
     */
    public boolean assignToEpisode(UUID id, int episode) {
        MediaAsset.requireValidEpisode(episode);
        EpisodeUpdate result = store.addEpisode(id, episode);
        if (result == EpisodeUpdate.NOT_FOUND) throw MediaNotFoundException.asset(id);
        if (result == EpisodeUpdate.ALREADY_PRESENT) {
            log.debug("Asset {} already assigned to episode {}", id, episode);
            return false;
        }
        log.info("Assigned asset {} to episode {}", id, episode);
        return true;
    }

    public void markUsed(UUID id) {
        if (!store.markUsed(id, clock.instant().truncatedTo(ChronoUnit.MICROS))) throw MediaNotFoundException.asset(id);
        log.debug("Marked asset {} as used", id);
    }
}
