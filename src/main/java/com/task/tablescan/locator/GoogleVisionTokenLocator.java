package com.task.tablescan.locator;

import com.google.cloud.vision.v1.AnnotateImageRequest;
import com.google.cloud.vision.v1.AnnotateImageResponse;
import com.google.cloud.vision.v1.BatchAnnotateImagesResponse;
import com.google.cloud.vision.v1.Block;
import com.google.cloud.vision.v1.Feature;
import com.google.cloud.vision.v1.Image;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.Page;
import com.google.cloud.vision.v1.Paragraph;
import com.google.cloud.vision.v1.Symbol;
import com.google.cloud.vision.v1.Vertex;
import com.google.cloud.vision.v1.Word;
import com.google.protobuf.ByteString;
import com.task.tablescan.model.Token;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Cloud Vision document text detection. Each word becomes one token at
 * the center of its bounding box, scored by the mean confidence of its symbols.
 */
public class GoogleVisionTokenLocator implements TokenLocator, AutoCloseable {

    public static final String NAME = "GOOGLE_VISION";

    private final ImageAnnotatorClient client;
    private final double minConfidence;

    public GoogleVisionTokenLocator(ImageAnnotatorClient client, double minConfidence) {
        this.client = client;
        this.minConfidence = minConfidence;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Token> locate(Path image) throws Exception {
        ByteString content = ByteString.copyFrom(Files.readAllBytes(image));

        AnnotateImageRequest request = AnnotateImageRequest.newBuilder()
                .addFeatures(Feature.newBuilder().setType(Feature.Type.DOCUMENT_TEXT_DETECTION).build())
                .setImage(Image.newBuilder().setContent(content).build())
                .build();

        BatchAnnotateImagesResponse response = client.batchAnnotateImages(List.of(request));

        List<Token> tokens = new ArrayList<>();
        for (AnnotateImageResponse res : response.getResponsesList()) {
            if (res.hasError()) {
                throw new IOException("Vision API error: " + res.getError().getMessage());
            }
            if (!res.hasFullTextAnnotation()) {
                continue;
            }
            for (Page page : res.getFullTextAnnotation().getPagesList()) {
                for (Block block : page.getBlocksList()) {
                    for (Paragraph paragraph : block.getParagraphsList()) {
                        for (Word word : paragraph.getWordsList()) {
                            Token token = toToken(word);
                            if (token != null) {
                                tokens.add(token);
                            }
                        }
                    }
                }
            }
        }
        return tokens;
    }

    private Token toToken(Word word) {
        StringBuilder text = new StringBuilder();
        double confidenceSum = 0;
        for (Symbol symbol : word.getSymbolsList()) {
            text.append(symbol.getText());
            confidenceSum += symbol.getConfidence();
        }
        double confidence = word.getSymbolsCount() == 0 ? 0.0 : confidenceSum / word.getSymbolsCount();

        List<Vertex> vertices = word.getBoundingBox().getVerticesList();
        if (text.toString().isBlank() || !(confidence >= minConfidence) || vertices.isEmpty()) {
            return null;
        }

        double sumX = 0;
        double sumY = 0;
        for (Vertex vertex : vertices) {
            sumX += vertex.getX();
            sumY += vertex.getY();
        }
        int centerY = (int) (sumY / vertices.size());
        int centerX = (int) (sumX / vertices.size());
        return new Token(text.toString(), centerY, centerX, Math.min(1.0, confidence));
    }

    @Override
    public void close() {
        client.close();
    }
}
