package org.learningjava.mediadb.infrastructure.adapter.out.clip;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.learningjava.mediadb.application.port.EmbeddingPort;
import org.learningjava.mediadb.domain.exception.ExternalServiceException;
import org.learningjava.mediadb.domain.model.Embedding;
import org.learningjava.mediadb.domain.service.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;

/**
 * Talks to a CLIP-style embedding server. Images and text land in the same space, so text queries
 * can rank images.
 */
public class ClipEmbeddingAdapter implements EmbeddingPort {

    private static final Logger log = LoggerFactory.getLogger(ClipEmbeddingAdapter.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String baseUrl;
    private final String model;

    public ClipEmbeddingAdapter(String baseUrl, String model, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.http = new OkHttpClient.Builder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build();
    }

    private static String preview(String text) {
        return text.replace("\n", " ").substring(0, Math.min(40, text.length()));
    }

    @Override
    public float[] encodeImage(byte[] imageBytes) {
        ObjectNode body = om.createObjectNode();
        body.put("model", model);
        body.put("image", Base64.getEncoder().encodeToString(imageBytes));
        float[] v = post("/embed/image", body);
        log.debug("Image embedding dim={} for {} bytes", v.length, imageBytes.length);
        return v;
    }

    @Override
    public float[] encodeText(String text) {
        ObjectNode body = om.createObjectNode();
        body.put("model", model);
        body.put("text", text);
        float[] v = post("/embed/text", body);
        log.debug("Text embedding dim={} for preview='{}...'", v.length, preview(text));
        return v;
    }

    private float[] post(String path, ObjectNode body) {
        try {
            Request req = new Request.Builder()
                    .url(baseUrl + path)
                    .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                    .build();

            try (Response resp = http.newCall(req).execute()) {
                if (!resp.isSuccessful()) {
                    log.warn("CLIP embed failed: HTTP {} {}", resp.code(), resp.message());
                    throw new IOException("CLIP embed failed: HTTP " + resp.code());
                }
                String s = resp.body() != null ? resp.body().string() : "{}";
                JsonNode json = om.readTree(s);
                float[] v;
                if (json.has("embedding")) {
                    v = toFloatArray(json.get("embedding"));
                } else if (json.has("embeddings") && json.get("embeddings").isArray() && json.get("embeddings").size() > 0) {
                    v = toFloatArray(json.get("embeddings").get(0));
                } else {
                    log.warn("Unexpected embeddings payload from CLIP server: {}", s.length() > 200 ? s.substring(0, 200) : s);
                    throw new IOException("Unexpected embeddings payload");
                }
                if (v.length != Embedding.DIMENSION) {
                    throw new IOException("Expected " + Embedding.DIMENSION + " dims, got " + v.length);
                }
                return VectorMath.normalize(v);
            }
        } catch (IOException | IllegalArgumentException e) {
            log.error("Embedding failed for model '{}' at {}{}: {}", model, baseUrl, path, e.getMessage());
            throw new ExternalServiceException("Embedding failed for model '" + model + "' at " + baseUrl + path
                    + ". Check the embedding server is reachable.", e);
        }
    }

    private float[] toFloatArray(JsonNode arr) throws IOException {
        if (arr == null || !arr.isArray()) throw new IOException("Expected numeric array, got: " + arr);
        float[] v = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) v[i] = (float) arr.get(i).asDouble();
        return v;
    }
}
