package org.learningjava.mediadb.infrastructure.adapter.in.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.learningjava.mediadb.application.usecase.CurateAssetUseCase;
import org.learningjava.mediadb.application.usecase.ExportAssetUseCase;
import org.learningjava.mediadb.application.usecase.IngestMediaUseCase;
import org.learningjava.mediadb.application.usecase.SearchAssetsUseCase;
import org.learningjava.mediadb.domain.exception.MediaNotFoundException;
import org.learningjava.mediadb.domain.model.AssetPage;
import org.learningjava.mediadb.domain.model.Content;
import org.learningjava.mediadb.domain.model.IngestOptions;
import org.learningjava.mediadb.domain.model.MediaAsset;
import org.learningjava.mediadb.domain.model.MediaType;
import org.learningjava.mediadb.domain.service.MediaFormats;
import org.learningjava.mediadb.infrastructure.adapter.in.web.dto.AssetView;
import org.learningjava.mediadb.infrastructure.adapter.in.web.dto.Base64Payloads;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
public class AssetController {

    private final IngestMediaUseCase ingest;
    private final SearchAssetsUseCase search;
    private final CurateAssetUseCase curate;
    private final ExportAssetUseCase export;

    public AssetController(IngestMediaUseCase ingest,
                           SearchAssetsUseCase search,
                           CurateAssetUseCase curate,
                           ExportAssetUseCase export) {
        this.ingest = ingest;
        this.search = search;
        this.curate = curate;
        this.export = export;
    }

    @GetMapping("/asset/{id}")
    public AssetView get(@PathVariable("id") UUID id) {
        return AssetView.from(find(id));
    }

    @GetMapping("/asset/{id}/content")
    public ResponseEntity<byte[]> content(@PathVariable("id") UUID id) {
        MediaAsset a = find(id);
        Content c = export.content(id);
        String format = a.specs() != null ? a.specs().format() : null;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(org.springframework.http.MediaType.parseMediaType(MediaFormats.mimeType(a.mediaType(), format)));
        headers.setContentDisposition(ContentDisposition.attachment().filename(a.filename()).build());
        headers.setContentLength(c.bytes().length);
        return new ResponseEntity<>(c.bytes(), headers, HttpStatus.OK);
    }

    @PostMapping("/asset/image")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> addImage(@Valid @RequestBody AddImageRequest req) {
        byte[] bytes = Base64Payloads.decode("image_base64", req.imageBase64());
        UUID id = ingest.addImageBytes(bytes, req.filename(), req.options());
        return created(id);
    }

    @PostMapping("/asset/video")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> addVideo(@Valid @RequestBody AddVideoRequest req) {
        byte[] bytes = Base64Payloads.decode("video_base64", req.videoBase64());
        byte[] thumbnail = Base64Payloads.decodeOptional("thumbnail_base64", req.thumbnailBase64());
        UUID id = ingest.addVideoBytes(bytes, req.filename(), thumbnail, req.options());
        return created(id);
    }

    @PostMapping("/asset/rate")
    public Map<String, Object> rate(@Valid @RequestBody RateRequest req) {
        curate.rateAsset(req.assetId(), req.rating(), req.notes());
        return Map.of("status", "ok", "asset_id", req.assetId(), "rating", req.rating());
    }

    @PostMapping("/asset/assign-episode")
    public Map<String, Object> assignEpisode(@Valid @RequestBody AssignEpisodeRequest req) {
        boolean added = curate.assignToEpisode(req.assetId(), req.episode());
        return Map.of("status", "ok", "asset_id", req.assetId(), "episode", req.episode(), "added", added);
    }

    @PostMapping("/asset/{id}/use")
    public AssetView markUsed(@PathVariable("id") UUID id) {
        curate.markUsed(id);
        return AssetView.from(find(id));
    }

    @GetMapping("/assets")
    public Map<String, Object> list(@RequestParam(name = "media_type", required = false) String mediaType,
                                    @RequestParam(required = false) String source,
                                    @RequestParam(defaultValue = "100") int limit,
                                    @RequestParam(defaultValue = "0") int offset) {
        AssetPage page = search.listAssets(MediaType.fromWire(mediaType), blankToNull(source), limit, offset);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("total", page.total());
        out.put("offset", page.offset());
        out.put("limit", page.limit());
        out.put("assets", page.assets().stream().map(AssetView::from).toList());
        return out;
    }

    // ---------- helpers ----------

    private MediaAsset find(UUID id) {
        return search.getAsset(id).orElseThrow(() -> MediaNotFoundException.asset(id));
    }

    private static Map<String, Object> created(UUID id) {
        return Map.of("status", "created", "asset_id", id);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record AddImageRequest(
            @NotBlank String imageBase64,
            @NotBlank String filename,
            String source,
            String generationPrompt,
            String generationModel,
            Double generationTimeSeconds,
            Double generationCostUsd,
            String contentType,
            List<String> subjects,
            List<String> styleTags,
            Integer qualityRating,
            String qualityNotes,
            List<Integer> episodeAssignments
    ) {
        IngestOptions options() {
            return IngestOptions.builder()
                    .source(source).generationPrompt(generationPrompt).generationModel(generationModel)
                    .generationTimeSeconds(generationTimeSeconds).generationCostUsd(generationCostUsd)
                    .contentType(contentType).subjects(subjects).styleTags(styleTags)
                    .qualityRating(qualityRating).qualityNotes(qualityNotes).episodes(episodeAssignments)
                    .build();
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record AddVideoRequest(
            @NotBlank String videoBase64,
            @NotBlank String filename,
            String thumbnailBase64,
            String source,
            String generationPrompt,
            String generationModel,
            Double generationTimeSeconds,
            Double generationCostUsd,
            String contentType,
            List<String> subjects,
            List<String> styleTags,
            Integer qualityRating,
            String qualityNotes,
            List<Integer> episodeAssignments
    ) {
        IngestOptions options() {
            return IngestOptions.builder()
                    .source(source).generationPrompt(generationPrompt).generationModel(generationModel)
                    .generationTimeSeconds(generationTimeSeconds).generationCostUsd(generationCostUsd)
                    .contentType(contentType).subjects(subjects).styleTags(styleTags)
                    .qualityRating(qualityRating).qualityNotes(qualityNotes).episodes(episodeAssignments)
                    .build();
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RateRequest(@NotNull UUID assetId, @NotNull Integer rating, String notes) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record AssignEpisodeRequest(@NotNull UUID assetId, @NotNull Integer episode) {
    }
}
