package org.learningjava.mediadb.infrastructure.adapter.in.web;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.mediadb.application.usecase.CurateAssetUseCase;
import org.learningjava.mediadb.application.usecase.ExportAssetUseCase;
import org.learningjava.mediadb.application.usecase.IngestMediaUseCase;
import org.learningjava.mediadb.application.usecase.SearchAssetsUseCase;
import org.learningjava.mediadb.domain.exception.ExternalServiceException;
import org.learningjava.mediadb.domain.exception.InvalidMediaException;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.domain.model.AssetPage;
import org.learningjava.mediadb.domain.model.Content;
import org.learningjava.mediadb.domain.model.IngestOptions;
import org.learningjava.mediadb.domain.model.MediaAsset;
import org.learningjava.mediadb.domain.model.MediaType;
import org.learningjava.mediadb.testsupport.AssetFixtures;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.http.MediaType.APPLICATION_JSON;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AssetControllerTest {

    private final IngestMediaUseCase ingest = mock(IngestMediaUseCase.class);
    private final SearchAssetsUseCase search = mock(SearchAssetsUseCase.class);
    private final CurateAssetUseCase curate = mock(CurateAssetUseCase.class);
    private final ExportAssetUseCase export = mock(ExportAssetUseCase.class);
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new AssetController(ingest, search, curate, export))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void get_returnsMetadataWithoutBinaryContent() throws Exception {
        MediaAsset a = AssetFixtures.image("hero.png");
        when(search.getAsset(a.id())).thenReturn(Optional.of(a));

        mvc.perform(get("/asset/{id}", a.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filename", is("hero.png")))
                .andExpect(jsonPath("$.media_type", is("image")))
                .andExpect(jsonPath("$.has_embedding", is(true)))
                .andExpect(jsonPath("$.image_data").doesNotExist())
                .andExpect(jsonPath("$.embedding").doesNotExist());
    }

    @Test
    void get_unknownIdIs404() throws Exception {
        UUID id = UUID.randomUUID();
        when(search.getAsset(id)).thenReturn(Optional.empty());

        mvc.perform(get("/asset/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", is("not_found")));
    }

    @Test
    void get_malformedIdIs400() throws Exception {
        mvc.perform(get("/asset/{id}", "not-a-uuid")).andExpect(status().isBadRequest());
    }

    @Test
    void content_streamsStoredBytesWithMimeType() throws Exception {
        MediaAsset a = AssetFixtures.image("hero.png");
        when(search.getAsset(a.id())).thenReturn(Optional.of(a));
        when(export.content(a.id())).thenReturn(Content.image(new byte[]{1, 2, 3}));

        byte[] body = mvc.perform(get("/asset/{id}/content", a.id()))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, "image/png"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("hero.png")))
                .andReturn().getResponse().getContentAsByteArray();

        assertArrayEquals(new byte[]{1, 2, 3}, body);
    }

    @Test
    void addImage_decodesBase64AndPassesOptions() throws Exception {
        UUID id = UUID.randomUUID();
        when(ingest.addImageBytes(any(), eq("hero.png"), any(IngestOptions.class))).thenReturn(id);
        String b64 = Base64.getEncoder().encodeToString(new byte[]{9, 8, 7});

        mvc.perform(post("/asset/image").contentType(APPLICATION_JSON).content("""
                        {"image_base64":"%s","filename":"hero.png","source":"press_kit",
                         "subjects":["mac_studio"],"quality_rating":8,"episode_assignments":[2]}""".formatted(b64)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.asset_id", is(id.toString())));

        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        ArgumentCaptor<IngestOptions> opts = ArgumentCaptor.forClass(IngestOptions.class);
        verify(ingest).addImageBytes(bytes.capture(), eq("hero.png"), opts.capture());
        assertArrayEquals(new byte[]{9, 8, 7}, bytes.getValue());
        assertEquals("press_kit", opts.getValue().source());
        assertEquals(8, opts.getValue().qualityRating());
        assertTrue(opts.getValue().subjects().contains("mac_studio"));
        assertEquals(Set.of(2), opts.getValue().episodes());
    }

    @Test
    void addImage_badBase64Is400() throws Exception {
        mvc.perform(post("/asset/image").contentType(APPLICATION_JSON)
                        .content("{\"image_base64\":\"@@not base64@@\",\"filename\":\"x.png\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(ingest);
    }

    @Test
    void addImage_undecodableImageIs422() throws Exception {
        when(ingest.addImageBytes(any(), any(), any())).thenThrow(new InvalidMediaException("not an image"));

        mvc.perform(post("/asset/image").contentType(APPLICATION_JSON)
                        .content("{\"image_base64\":\"AQID\",\"filename\":\"x.png\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error", is("invalid_media")));
    }

    @Test
    void addImage_embeddingOutageIs502() throws Exception {
        when(ingest.addImageBytes(any(), any(), any())).thenThrow(new ExternalServiceException("clip down"));

        mvc.perform(post("/asset/image").contentType(APPLICATION_JSON)
                        .content("{\"image_base64\":\"AQID\",\"filename\":\"x.png\"}"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void addVideo_passesOptionalThumbnail() throws Exception {
        UUID id = UUID.randomUUID();
        when(ingest.addVideoBytes(any(), eq("clip.mp4"), any(), any(IngestOptions.class))).thenReturn(id);

        mvc.perform(post("/asset/video").contentType(APPLICATION_JSON)
                        .content("{\"video_base64\":\"AAAAGA==\",\"filename\":\"clip.mp4\",\"thumbnail_base64\":\"AQI=\"}"))
                .andExpect(status().isCreated());

        ArgumentCaptor<byte[]> thumb = ArgumentCaptor.forClass(byte[].class);
        verify(ingest).addVideoBytes(any(), eq("clip.mp4"), thumb.capture(), any(IngestOptions.class));
        assertArrayEquals(new byte[]{1, 2}, thumb.getValue());
    }

    @Test
    void addVideo_passesRatingNotesAndEpisodeAssignments() throws Exception {
        UUID id = UUID.randomUUID();
        when(ingest.addVideoBytes(any(), eq("clip.mp4"), any(), any(IngestOptions.class))).thenReturn(id);

        mvc.perform(post("/asset/video").contentType(APPLICATION_JSON).content("""
                        {"video_base64":"AAAAGA==","filename":"clip.mp4","source":"veo",
                         "quality_rating":7,"quality_notes":"usable b-roll","episode_assignments":[2]}"""))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.asset_id", is(id.toString())));

        ArgumentCaptor<IngestOptions> opts = ArgumentCaptor.forClass(IngestOptions.class);
        verify(ingest).addVideoBytes(any(), eq("clip.mp4"), isNull(), opts.capture());
        assertEquals(7, opts.getValue().qualityRating());
        assertEquals("usable b-roll", opts.getValue().qualityNotes());
        assertEquals(Set.of(2), opts.getValue().episodes());
    }

    @Test
    void rate_outOfRangeIs400() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(new IllegalArgumentException("Rating must be between 1 and 10, got 11"))
                .when(curate).rateAsset(id, 11, null);

        mvc.perform(post("/asset/rate").contentType(APPLICATION_JSON)
                        .content("{\"asset_id\":\"" + id + "\",\"rating\":11}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", containsString("between 1 and 10")));
    }

    @Test
    void rate_unknownAssetIs404() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(MediaNotFoundException.asset(id)).when(curate).rateAsset(id, 5, "ok");

        mvc.perform(post("/asset/rate").contentType(APPLICATION_JSON)
                        .content("{\"asset_id\":\"" + id + "\",\"rating\":5,\"notes\":\"ok\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void assignEpisode_reportsWhetherAdded() throws Exception {
        UUID id = UUID.randomUUID();
        when(curate.assignToEpisode(id, 3)).thenReturn(false);

        mvc.perform(post("/asset/assign-episode").contentType(APPLICATION_JSON)
                        .content("{\"asset_id\":\"" + id + "\",\"episode\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.added", is(false)));
    }

    @Test
    void assignEpisode_missingFieldIs400() throws Exception {
        mvc.perform(post("/asset/assign-episode").contentType(APPLICATION_JSON).content("{\"episode\":3}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(curate);
    }

    @Test
    void use_bumpsCounterAndReturnsAsset() throws Exception {
        MediaAsset a = AssetFixtures.image("hero.png");
        when(search.getAsset(a.id())).thenReturn(Optional.of(a));

        mvc.perform(post("/asset/{id}/use", a.id())).andExpect(status().isOk());

        verify(curate).markUsed(a.id());
    }

    @Test
    void list_pagesWithFilters() throws Exception {
        MediaAsset a = AssetFixtures.image("a.png");
        when(search.listAssets(MediaType.IMAGE, null, 1, 2)).thenReturn(new AssetPage(5, 2, 1, List.of(a)));

        mvc.perform(get("/assets").param("media_type", "image").param("limit", "1").param("offset", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total", is(5)))
                .andExpect(jsonPath("$.assets", hasSize(1)));
    }

    @Test
    void list_unknownMediaTypeIs400() throws Exception {
        mvc.perform(get("/assets").param("media_type", "audio")).andExpect(status().isBadRequest());

        verify(search, never()).listAssets(any(), isNull(), anyInt(), anyInt());
    }
}
