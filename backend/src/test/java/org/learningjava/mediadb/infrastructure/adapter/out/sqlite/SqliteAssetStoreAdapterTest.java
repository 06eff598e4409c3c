package org.learningjava.mediadb.infrastructure.adapter.out.sqlite;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.mediadb.domain.model.AssetFacts;
import org.learningjava.mediadb.domain.model.AssetFilter;
import org.learningjava.mediadb.domain.model.AssetPage;
import org.learningjava.mediadb.domain.model.Classification;
import org.learningjava.mediadb.domain.model.Content;
import org.learningjava.mediadb.domain.model.Embedding;
import org.learningjava.mediadb.domain.model.EpisodeUpdate;
import org.learningjava.mediadb.domain.model.MediaAsset;
import org.learningjava.mediadb.domain.model.MediaType;
import org.learningjava.mediadb.domain.model.Provenance;
import org.learningjava.mediadb.domain.model.ScoredAsset;
import org.learningjava.mediadb.domain.model.TechnicalSpecs;
import org.learningjava.mediadb.testsupport.FakeEmbeddingPort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SqliteAssetStoreAdapterTest extends SqliteTestBase {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private SqliteAssetStoreAdapter store;
    private int seq;

    @BeforeEach
    void init() {
        store = new SqliteAssetStoreAdapter(dataSource());
        store.ensureSchema();
    }

    private MediaAsset asset(MediaType type, Embedding e, String source, Set<String> subjects,
                             Integer rating, Set<Integer> episodes) {
        int n = seq++;
        return new MediaAsset(UUID.randomUUID(), "file" + n + (type == MediaType.IMAGE ? ".png" : ".mp4"), type, e,
                new Provenance(source, "prompt " + n, null, null, null),
                new TechnicalSpecs(640, 480, type == MediaType.VIDEO ? 5.0 : null, 1000L + n, type == MediaType.IMAGE ? "png" : "mp4"),
                new Classification("hero", subjects, Set.of("cinematic")),
                rating, null, episodes, 0, T0.plusSeconds(n), null, false);
    }

    private MediaAsset image(float[] v) {
        return asset(MediaType.IMAGE, Embedding.computed(v), "studio", Set.of(), null, Set.of());
    }

    @Test
    void append_and_findById_round_trip_all_metadata() {
        MediaAsset a = asset(MediaType.IMAGE, Embedding.computed(FakeEmbeddingPort.vectorFor(1)), "press_kit",
                Set.of("mac_studio", "dgx_spark"), 8, Set.of(2, 5));
        byte[] bytes = {1, 2, 3, 4};

        store.append(a, Content.image(bytes));
        MediaAsset loaded = store.findById(a.id()).orElseThrow();

        assertThat(loaded.filename()).isEqualTo(a.filename());
        assertThat(loaded.mediaType()).isEqualTo(MediaType.IMAGE);
        assertThat(loaded.provenance()).isEqualTo(a.provenance());
        assertThat(loaded.specs()).isEqualTo(a.specs());
        assertThat(loaded.classification().subjects()).containsExactlyInAnyOrder("mac_studio", "dgx_spark");
        assertThat(loaded.qualityRating()).isEqualTo(8);
        assertThat(loaded.episodeAssignments()).containsExactlyInAnyOrder(2, 5);
        assertThat(loaded.createdAt()).isEqualTo(a.createdAt());
        assertThat(((Embedding.Computed) loaded.embedding()).vector())
                .containsExactly(((Embedding.Computed) a.embedding()).vector());
        assertThat(store.loadContent(a.id()).orElseThrow().bytes()).isEqualTo(bytes);
    }

    @Test
    void video_without_embedding_round_trips_as_unavailable() {
        MediaAsset v = asset(MediaType.VIDEO, Embedding.unavailable(), "veo", Set.of(), null, Set.of());
        store.append(v, Content.video(new byte[]{9, 9}, null));

        MediaAsset loaded = store.findById(v.id()).orElseThrow();
        assertThat(loaded.embedding().isAvailable()).isFalse();
        assertThat(loaded.hasThumbnail()).isFalse();
        Content c = store.loadContent(v.id()).orElseThrow();
        assertThat(c).isInstanceOf(Content.Video.class);
        assertThat(((Content.Video) c).thumbnailBytes()).isEmpty();
    }

    @Test
    void unknown_id_is_empty() {
        assertThat(store.findById(UUID.randomUUID())).isEmpty();
        assertThat(store.loadContent(UUID.randomUUID())).isEmpty();
    }

    @Test
    void nearest_ranks_by_distance_and_skips_unavailable() {
        MediaAsset x = image(FakeEmbeddingPort.axis(0));
        MediaAsset y = image(FakeEmbeddingPort.axis(1));
        MediaAsset v = asset(MediaType.VIDEO, Embedding.unavailable(), "veo", Set.of(), null, Set.of());
        store.append(x, Content.image(new byte[]{1}));
        store.append(y, Content.image(new byte[]{2}));
        store.append(v, Content.video(new byte[]{3}, null));

        List<ScoredAsset> hits = store.nearest(FakeEmbeddingPort.axis(0), AssetFilter.none(), 10);

        assertThat(hits).extracting(h -> h.asset().id()).containsExactly(x.id(), y.id());
        assertThat(hits.get(0).distance()).isCloseTo(0.0, within(1e-6));
        assertThat(hits.get(1).distance()).isCloseTo(Math.sqrt(2), within(1e-6));
    }

    @Test
    void nearest_applies_filter_before_truncation() {
        // three close images, one far video: a type filter must still return the video
        for (int i = 0; i < 3; i++) store.append(image(FakeEmbeddingPort.axis(0)), Content.image(new byte[]{1}));
        MediaAsset vid = asset(MediaType.VIDEO, Embedding.computed(FakeEmbeddingPort.axis(7)), "veo", Set.of(), null, Set.of());
        store.append(vid, Content.video(new byte[]{1}, new byte[]{2}));

        List<ScoredAsset> hits = store.nearest(FakeEmbeddingPort.axis(0), AssetFilter.none().withMediaType(MediaType.VIDEO), 1);

        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).asset().id()).isEqualTo(vid.id());
    }

    @Test
    void nearest_with_min_quality_excludes_unrated() {
        MediaAsset rated = asset(MediaType.IMAGE, Embedding.computed(FakeEmbeddingPort.axis(0)), "s", Set.of(), 9, Set.of());
        MediaAsset unrated = image(FakeEmbeddingPort.axis(0));
        MediaAsset low = asset(MediaType.IMAGE, Embedding.computed(FakeEmbeddingPort.axis(0)), "s", Set.of(), 3, Set.of());
        store.append(rated, Content.image(new byte[]{1}));
        store.append(unrated, Content.image(new byte[]{1}));
        store.append(low, Content.image(new byte[]{1}));

        List<ScoredAsset> hits = store.nearest(FakeEmbeddingPort.axis(0), AssetFilter.none().withMinQuality(7), 10);

        assertThat(hits).extracting(h -> h.asset().id()).containsExactly(rated.id());
    }

    @Test
    void find_by_subject_is_exact_membership() {
        MediaAsset studio = asset(MediaType.IMAGE, Embedding.computed(FakeEmbeddingPort.axis(0)), "s", Set.of("mac_studio"), null, Set.of());
        MediaAsset mac = asset(MediaType.IMAGE, Embedding.computed(FakeEmbeddingPort.axis(0)), "s", Set.of("mac"), null, Set.of());
        store.append(studio, Content.image(new byte[]{1}));
        store.append(mac, Content.image(new byte[]{1}));

        assertThat(store.find(AssetFilter.none().withSubject("mac"))).extracting(MediaAsset::id).containsExactly(mac.id());
        assertThat(store.find(AssetFilter.none().withSubject("studio"))).isEmpty();
    }

    @Test
    void find_by_episode_membership_and_exclusion() {
        MediaAsset in3 = asset(MediaType.IMAGE, Embedding.computed(FakeEmbeddingPort.axis(0)), "s", Set.of(), null, Set.of(3));
        MediaAsset in13 = asset(MediaType.IMAGE, Embedding.computed(FakeEmbeddingPort.axis(0)), "s", Set.of(), null, Set.of(1));
        store.append(in3, Content.image(new byte[]{1}));
        store.append(in13, Content.image(new byte[]{1}));

        assertThat(store.find(AssetFilter.none().withEpisode(3))).extracting(MediaAsset::id).containsExactly(in3.id());
        assertThat(store.find(AssetFilter.none().withoutEpisode(3))).extracting(MediaAsset::id).containsExactly(in13.id());
    }

    @Test
    void updateRating_and_markUsed_report_missing_rows() {
        MediaAsset a = image(FakeEmbeddingPort.axis(0));
        store.append(a, Content.image(new byte[]{1}));

        assertThat(store.updateRating(a.id(), 7, "solid")).isTrue();
        assertThat(store.updateRating(UUID.randomUUID(), 7, null)).isFalse();
        assertThat(store.markUsed(a.id(), T0.plusSeconds(100))).isTrue();
        assertThat(store.markUsed(a.id(), T0.plusSeconds(200))).isTrue();
        assertThat(store.markUsed(UUID.randomUUID(), T0)).isFalse();

        MediaAsset loaded = store.findById(a.id()).orElseThrow();
        assertThat(loaded.qualityRating()).isEqualTo(7);
        assertThat(loaded.qualityNotes()).isEqualTo("solid");
        assertThat(loaded.useCount()).isEqualTo(2);
        assertThat(loaded.lastUsedAt()).isEqualTo(T0.plusSeconds(200));
    }

    @Test
    void addEpisode_is_idempotent() {
        MediaAsset a = image(FakeEmbeddingPort.axis(0));
        store.append(a, Content.image(new byte[]{1}));

        assertThat(store.addEpisode(a.id(), 4)).isEqualTo(EpisodeUpdate.ADDED);
        assertThat(store.addEpisode(a.id(), 4)).isEqualTo(EpisodeUpdate.ALREADY_PRESENT);
        assertThat(store.addEpisode(UUID.randomUUID(), 4)).isEqualTo(EpisodeUpdate.NOT_FOUND);
        assertThat(store.findById(a.id()).orElseThrow().episodeAssignments()).containsExactly(4);
    }

    @Test
    void concurrent_episode_assignments_are_not_lost() throws Exception {
        MediaAsset a = image(FakeEmbeddingPort.axis(0));
        store.append(a, Content.image(new byte[]{1}));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<EpisodeUpdate>> futures = new ArrayList<>();
            for (int round = 0; round < 3; round++) {
                for (int ep = 1; ep <= 8; ep++) {
                    int episode = ep;
                    futures.add(pool.submit(() -> store.addEpisode(a.id(), episode)));
                }
            }
            for (Future<EpisodeUpdate> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.findById(a.id()).orElseThrow().episodeAssignments())
                .containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7, 8);
    }

    @Test
    void list_pages_newest_first_with_total() {
        for (int i = 0; i < 5; i++) store.append(image(FakeEmbeddingPort.axis(i)), Content.image(new byte[]{1}));
        store.append(asset(MediaType.VIDEO, Embedding.unavailable(), "veo", Set.of(), null, Set.of()),
                Content.video(new byte[]{1}, null));

        AssetPage page = store.list(MediaType.IMAGE, null, 2, 1);

        assertThat(page.total()).isEqualTo(5);
        assertThat(page.assets()).extracting(MediaAsset::filename).containsExactly("file3.png", "file2.png");
        assertThat(store.list(null, "veo", 10, 0).total()).isEqualTo(1);
    }

    @Test
    void scanFacts_and_existingFilenames_cover_every_row() {
        store.append(image(FakeEmbeddingPort.axis(0)), Content.image(new byte[]{1}));
        store.append(asset(MediaType.VIDEO, Embedding.unavailable(), null, Set.of(), 4, Set.of()),
                Content.video(new byte[]{1}, null));

        List<AssetFacts> facts = store.scanFacts();

        assertThat(facts).hasSize(2);
        assertThat(facts).filteredOn(f -> !f.embedded()).hasSize(1);
        assertThat(store.existingFilenames()).containsExactlyInAnyOrder("file0.png", "file1.mp4");
    }

    @Test
    void checkpoint_runs_on_live_store() {
        store.append(image(FakeEmbeddingPort.axis(0)), Content.image(new byte[]{1}));

        store.checkpoint();

        assertThat(store.findById(store.find(AssetFilter.none()).get(0).id())).isPresent();
    }
}
