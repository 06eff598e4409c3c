package org.learningjava.mediadb.infrastructure.adapter.in.web.dto;

import org.learningjava.mediadb.domain.model.ScoredAsset;

public record ScoredAssetView(double distance, AssetView asset) {
    public static ScoredAssetView from(ScoredAsset s) {
        return new ScoredAssetView(s.distance(), AssetView.from(s.asset()));
    }
}
