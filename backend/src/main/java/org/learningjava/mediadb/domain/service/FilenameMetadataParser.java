package org.learningjava.mediadb.domain.service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers tags from studio file naming conventions, e.g.
 * {@code press_kit/dgx_spark/hero_cinematic.png} or {@code wan26_ep3_scene2.mp4}.
 */
public final class FilenameMetadataParser {

    public record FilenameMetadata(
            Set<String> subjects,
            Set<String> styleTags,
            String contentType,
            String source,
            String generationModel,
            Set<Integer> episodes
    ) {
    }

    private static final Pattern EPISODE = Pattern.compile("ep(\\d+)");
    private static final Pattern SCENE = Pattern.compile("scene(\\d+)");

    private static final Set<String> PRESS_KIT_PRODUCTS = Set.of("dgx_spark", "mac_studio");

    private static final Map<String, String> COMPANIES = new LinkedHashMap<>();
    private static final Map<String, String> STYLE_KEYWORDS = new LinkedHashMap<>();

    static {
        COMPANIES.put("acsa", "acsa");
        COMPANIES.put("bmw", "bmw");
        COMPANIES.put("bsi", "bsi");
        COMPANIES.put("citrix", "citrix");
        COMPANIES.put("hp", "hp");
        COMPANIES.put("ibm", "ibm");
        COMPANIES.put("sun", "sun_microsystems");
        COMPANIES.put("symantec", "symantec");

        STYLE_KEYWORDS.put("cinematic", "cinematic");
        STYLE_KEYWORDS.put("hero", "hero_shot");
        STYLE_KEYWORDS.put("premium", "premium");
        STYLE_KEYWORDS.put("professional", "professional");
        STYLE_KEYWORDS.put("neural", "neural_network");
        STYLE_KEYWORDS.put("holographic", "futuristic");
        STYLE_KEYWORDS.put("robot", "robotics");
        STYLE_KEYWORDS.put("humanoid", "robotics");
    }

    private static final List<String> PRODUCTS = List.of("mac_studio", "dgx_spark", "dgx spark", "macstudio");

    public FilenameMetadata parse(Path file) {
        String stem = stem(file.getFileName().toString()).toLowerCase(Locale.ROOT);
        Path parent = file.getParent();
        String parentDir = dirName(parent);
        String grandparentDir = parent != null ? dirName(parent.getParent()) : "";

        Set<String> subjects = new LinkedHashSet<>();
        Set<String> styleTags = new LinkedHashSet<>();
        String contentType = null;
        String source = null;
        String model = null;
        Set<Integer> episodes = new LinkedHashSet<>();

        if ("press_kit".equals(grandparentDir) || "press_kit".equals(parentDir)) {
            source = "press_kit";
            if (PRESS_KIT_PRODUCTS.contains(parentDir)) {
                subjects.add(parentDir);
                contentType = "product_hero";
            }
        }

        COMPANIES.forEach((key, subject) -> {
            if (stem.contains(key)) subjects.add(subject);
        });

        for (String product : PRODUCTS) {
            if (stem.contains(product.replace('_', ' ')) || stem.contains(product)) {
                subjects.add(product.replace(' ', '_'));
            }
        }

        if (stem.startsWith("ai ") || stem.startsWith("ai_")) {
            styleTags.add("ai_generated");
            subjects.add("ai_concept");
        }

        String detected = contentTypeOf(stem);
        if (detected != null) {
            contentType = detected;
            if ("datacenter".equals(detected)) subjects.add("datacenter");
        }

        if (stem.contains("wan26")) {
            source = "wan26_api";
            model = "wan2.6";
        } else if (stem.contains("veo")) {
            source = "veo";
            model = "veo3.1";
        } else if (stem.contains("gemini")) {
            source = "gemini";
            styleTags.add("ai_generated");
        }

        Matcher ep = EPISODE.matcher(stem);
        if (ep.find()) {
            // long digit runs are never an episode number; skip them rather than overflow
            String digits = ep.group(1);
            if (digits.length() <= 9) {
                int n = Integer.parseInt(digits);
                if (n >= 1 && n <= 8) episodes.add(n);
            }
        }

        STYLE_KEYWORDS.forEach((keyword, tag) -> {
            if (stem.contains(keyword)) styleTags.add(tag);
        });

        Matcher scene = SCENE.matcher(stem);
        if (scene.find()) styleTags.add("scene_" + scene.group(1));

        return new FilenameMetadata(subjects, styleTags, contentType, source, model, episodes);
    }

    private static String contentTypeOf(String stem) {
        if (stem.contains("carousel")) return "carousel";
        if (stem.contains("storyboard")) return "storyboard";
        if (stem.contains("hero")) return "hero";
        if (stem.contains("profile") || stem.contains("headshot")) return "profile";
        if (stem.contains("brand")) return "brand";
        if (stem.contains("dashboard")) return "dashboard";
        if (stem.contains("datacenter") || stem.contains("data_center")) return "datacenter";
        if (stem.contains("office") || stem.contains("workspace")) return "workspace";
        if (stem.contains("boardroom")) return "boardroom";
        return null;
    }

    private static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    private static String dirName(Path dir) {
        if (dir == null || dir.getFileName() == null) return "";
        return dir.getFileName().toString().toLowerCase(Locale.ROOT);
    }
}
