package com.task.tablescan.locator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.task.tablescan.model.Token;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Posts the image to an external OCR HTTP service that answers with
 * {@code {"tokens": [{"text", "y", "x", "confidence"}, ...]}}.
 */
public class OcrServiceTokenLocator implements TokenLocator {

    public static final String NAME = "OCR_SERVICE";

    private final OkHttpClient http;
    private final ObjectMapper om;
    private final String serviceUrl;
    private final double minConfidence;

    public OcrServiceTokenLocator(OkHttpClient http, ObjectMapper om, String serviceUrl, double minConfidence) {
        this.http = http;
        this.om = om;
        this.serviceUrl = serviceUrl;
        this.minConfidence = minConfidence;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Token> locate(Path image) throws Exception {
        File file = image.toFile();
        if (!file.exists()) throw new IllegalArgumentException("File not found: " + image);

        RequestBody fileBody = RequestBody.create(file, MediaType.parse("image/*"));
        MultipartBody requestBody = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", file.getName(), fileBody)
                .build();

        Request request = new Request.Builder()
                .url(serviceUrl)
                .post(requestBody)
                .build();

        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("OCR service returned: " + response.code() + " - " + response.message());
            }

            String body = response.body() == null ? "" : response.body().string();
            JsonNode root = om.readTree(body);
            JsonNode tokenNodes = root == null ? null : root.get("tokens");
            if (tokenNodes == null || !tokenNodes.isArray()) {
                throw new IOException("OCR service response has no tokens array");
            }

            List<Token> tokens = new ArrayList<>();
            for (JsonNode node : tokenNodes) {
                String text = node.path("text").asText("");
                double confidence = node.path("confidence").asDouble(0.0);
                if (text.isBlank() || !(confidence >= minConfidence)) {
                    continue;
                }
                tokens.add(new Token(text, node.path("y").asInt(), node.path("x").asInt(), Math.min(1.0, confidence)));
            }
            return tokens;
        }
    }
}
