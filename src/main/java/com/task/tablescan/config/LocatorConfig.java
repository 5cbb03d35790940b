package com.task.tablescan.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.ImageAnnotatorSettings;
import com.task.tablescan.locator.GoogleVisionTokenLocator;
import com.task.tablescan.locator.LocatorChain;
import com.task.tablescan.locator.OcrServiceTokenLocator;
import com.task.tablescan.locator.TokenLocator;
import com.task.tablescan.locator.VisionChatTokenLocator;
import dev.langchain4j.model.chat.ChatModel;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Builds the ordered OCR backend chain from configuration. A backend whose
 * credentials are missing or whose client cannot be created is left out; an
 * empty chain stops startup.
 */
@Configuration
public class LocatorConfig {

    private static final Logger log = LoggerFactory.getLogger(LocatorConfig.class);

    @Bean
    public LocatorChain locatorChain(
            @Value("${ocr.locators.order:GOOGLE_VISION,OCR_SERVICE,VISION_CHAT}") List<String> order,
            @Value("${ocr.min-confidence:0.2}") double minConfidence,
            @Value("${GOOGLE_CREDENTIALS_JSON:}") String googleCredentialsJson,
            @Value("${GOOGLE_APPLICATION_CREDENTIALS:}") String googleCredentialsFile,
            @Value("${ocr.service.url:}") String ocrServiceUrl,
            OkHttpClient http,
            ObjectMapper om,
            ObjectProvider<ChatModel> chatModel
    ) {
        List<TokenLocator> locators = new ArrayList<>();
        for (String name : order) {
            String backend = name.trim().toUpperCase(Locale.ROOT);
            switch (backend) {
                case GoogleVisionTokenLocator.NAME -> {
                    if (googleCredentialsJson.isBlank() && googleCredentialsFile.isBlank()) {
                        log.info("[OCR] Google Cloud Vision skipped: no credentials configured");
                        continue;
                    }
                    try {
                        locators.add(new GoogleVisionTokenLocator(createVisionClient(googleCredentialsJson), minConfidence));
                    } catch (IOException | RuntimeException e) {
                        log.warn("[OCR] Google Cloud Vision unavailable: {}", e.getMessage());
                    }
                }
                case OcrServiceTokenLocator.NAME -> {
                    if (ocrServiceUrl.isBlank()) {
                        log.info("[OCR] OCR service skipped: ocr.service.url not set");
                        continue;
                    }
                    locators.add(new OcrServiceTokenLocator(http, om, ocrServiceUrl, minConfidence));
                }
                case VisionChatTokenLocator.NAME -> {
                    ChatModel model = chatModel.getIfAvailable();
                    if (model == null) {
                        log.info("[OCR] Vision chat skipped: OPENAI_API_KEY not set");
                        continue;
                    }
                    locators.add(new VisionChatTokenLocator(model, minConfidence));
                }
                default -> log.warn("[OCR] Unknown backend '{}' in ocr.locators.order", name);
            }
        }

        LocatorChain chain = new LocatorChain(locators);
        log.info("[OCR] Backend order: {}", chain.backendNames());
        return chain;
    }

    /**
     * Client from GOOGLE_CREDENTIALS_JSON (raw JSON or base64) when present,
     * otherwise from application default credentials.
     */
    static ImageAnnotatorClient createVisionClient(String credentialsJson) throws IOException {
        if (credentialsJson == null || credentialsJson.isBlank()) {
            return ImageAnnotatorClient.create();
        }

        String trimmed = credentialsJson.trim();
        byte[] raw = trimmed.startsWith("{")
                ? trimmed.getBytes(StandardCharsets.UTF_8)
                : Base64.getDecoder().decode(trimmed.replaceAll("\\s+", ""));
        GoogleCredentials credentials = GoogleCredentials.fromStream(new ByteArrayInputStream(raw));

        ImageAnnotatorSettings settings = ImageAnnotatorSettings.newBuilder()
                .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
                .build();
        return ImageAnnotatorClient.create(settings);
    }
}
