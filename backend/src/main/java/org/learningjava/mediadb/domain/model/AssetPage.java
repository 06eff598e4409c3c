package org.learningjava.mediadb.domain.model;

import java.util.List;

public record AssetPage(long total, int offset, int limit, List<MediaAsset> assets) {
    public AssetPage {
        assets = assets == null ? List.of() : List.copyOf(assets);
    }
}
