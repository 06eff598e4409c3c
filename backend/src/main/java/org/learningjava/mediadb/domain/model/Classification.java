package org.learningjava.mediadb.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record Classification(
        String contentType,     // product_hero, workspace, carousel, ...
        Set<String> subjects,   // mac_studio, dgx_spark, ...
        Set<String> styleTags   // cinematic, minimal, ...
) {
    public Classification {
        subjects = copyOf(subjects);
        styleTags = copyOf(styleTags);
    }

    public static Classification empty() {
        return new Classification(null, Set.of(), Set.of());
    }

    static Set<String> copyOf(Collection<String> values) {
        if (values == null || values.isEmpty()) return Set.of();
        Set<String> out = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return Collections.unmodifiableSet(out);
    }
}
