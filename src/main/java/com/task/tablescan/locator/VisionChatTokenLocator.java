package com.task.tablescan.locator;

import com.task.tablescan.model.Token;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Asks a vision-capable chat model to read the image and list every word as
 * {@code TEXT|Y|X|CONFIDENCE}, with Y and X in coarse grid units.
 */
public class VisionChatTokenLocator implements TokenLocator {

    public static final String NAME = "VISION_CHAT";

    // grid unit to pixels
    static final int GRID_SCALE = 20;

    private static final Logger log = LoggerFactory.getLogger(VisionChatTokenLocator.class);

    private final ChatModel chatModel;
    private final double minConfidence;

    public VisionChatTokenLocator(ChatModel chatModel, double minConfidence) {
        this.chatModel = chatModel;
        this.minConfidence = minConfidence;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Token> locate(Path image) throws Exception {
        String base64 = Base64.getEncoder().encodeToString(Files.readAllBytes(image));
        String mimeType = Files.probeContentType(image);
        if (mimeType == null) {
            mimeType = "image/png";
        }

        List<ChatMessage> messages = List.of(UserMessage.from(
                TextContent.from(buildPrompt()),
                ImageContent.from(base64, mimeType)
        ));

        ChatResponse response = chatModel.chat(messages);
        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return parse(text);
    }

    List<Token> parse(String text) {
        List<Token> tokens = new ArrayList<>();
        for (String line : text.strip().split("\n")) {
            line = line.strip();
            if (!line.contains("|")) {
                continue;
            }
            String[] parts = line.split("\\|");
            if (parts.length < 4) {
                continue;
            }
            try {
                String word = parts[0].strip();
                int y = Integer.parseInt(parts[1].strip());
                int x = Integer.parseInt(parts[2].strip());
                double confidence = Double.parseDouble(parts[3].strip().replace("%", "")) / 100.0;
                if (word.isEmpty() || !(confidence >= minConfidence)) {
                    continue;
                }
                tokens.add(new Token(word, y * GRID_SCALE, x * GRID_SCALE, Math.min(1.0, confidence)));
            } catch (NumberFormatException e) {
                log.debug("Skipping unparseable line '{}'", line);
            }
        }
        return tokens;
    }

    private String buildPrompt() {
        return """
                Analyze this document image and extract ALL visible text.
                For each word or number you find:
                1. Extract the exact text content
                2. Estimate its Y position (row number, starting from 1 at top)
                3. Estimate its X position (column number, starting from 1 at left)
                4. Rate your confidence (0-100%)

                Format each entry on its own line as: TEXT|Y|X|CONFIDENCE
                Example: "Book|5|10|85" means "Book" at row 5, column 10, 85% confident
                List entries from top to bottom, left to right.
                Extract EVERYTHING you can read, even if confidence is low.
                """;
    }
}
