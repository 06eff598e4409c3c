package org.learningjava.mediadb.infrastructure.adapter.in.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.mediadb.application.usecase.SearchAssetsUseCase;
import org.learningjava.mediadb.domain.model.MediaType;
import org.learningjava.mediadb.infrastructure.adapter.in.web.dto.AssetView;
import org.learningjava.mediadb.infrastructure.adapter.in.web.dto.Base64Payloads;
import org.learningjava.mediadb.infrastructure.adapter.in.web.dto.ScoredAssetView;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/search")
public class SearchController {

    private final SearchAssetsUseCase search;

    public SearchController(SearchAssetsUseCase search) {
        this.search = search;
    }

    @GetMapping("/theme")
    public List<ScoredAssetView> byTheme(
            @RequestParam String query,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(name = "min_quality", required = false) Integer minQuality,
            @RequestParam(name = "media_type", required = false) String mediaType
    ) {
        return search.findByTheme(query, limit, minQuality, MediaType.fromWire(mediaType))
                .stream().map(ScoredAssetView::from).toList();
    }

    @PostMapping("/similar")
    public List<ScoredAssetView> similar(@Valid @RequestBody SimilarRequest req) {
        byte[] image = Base64Payloads.decode("image_base64", req.imageBase64());
        int limit = req.limit() != null ? req.limit() : 10;
        return search.findSimilar(image, limit, MediaType.fromWire(req.mediaType()))
                .stream().map(ScoredAssetView::from).toList();
    }

    @GetMapping("/subject/{subject}")
    public List<AssetView> bySubject(@PathVariable("subject") String subject,
                                     @RequestParam(name = "media_type", required = false) String mediaType) {
        return search.findBySubject(subject, MediaType.fromWire(mediaType))
                .stream().map(AssetView::from).toList();
    }

    @GetMapping("/episode/{episode}")
    public List<AssetView> forEpisode(@PathVariable("episode") int episode,
                                      @RequestParam(defaultValue = "false") boolean unassigned) {
        return search.findForEpisode(episode, unassigned).stream().map(AssetView::from).toList();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SimilarRequest(
            @NotBlank String imageBase64,
            @Min(1) @Max(1000) Integer limit,
            String mediaType
    ) {
    }
}
