package com.task.tablescan.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.task.tablescan.locator.BackendUnavailableException;
import com.task.tablescan.locator.LocatorChain;
import dev.langchain4j.model.chat.ChatModel;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class LocatorConfigTest {

    @Mock
    private ObjectProvider<ChatModel> chatModelProvider;

    @Mock
    private ChatModel chatModel;

    private final LocatorConfig config = new LocatorConfig();

    @Test
    public void testLocatorChain_FollowsConfiguredOrderAndSkipsUnconfigured() throws Exception {
        when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);

        try (LocatorChain chain = config.locatorChain(
                List.of("vision_chat", "GOOGLE_VISION", " OCR_SERVICE ", "TESSERACT"),
                0.2, "", "", "http://localhost:8000/ocr",
                new OkHttpClient(), new ObjectMapper(), chatModelProvider)) {

            assertEquals(List.of("VISION_CHAT", "OCR_SERVICE"), chain.backendNames());
            assertEquals("VISION_CHAT", chain.primaryBackend());
        }
    }

    @Test
    public void testLocatorChain_NothingConfiguredIsFatal() {
        when(chatModelProvider.getIfAvailable()).thenReturn(null);

        assertThrows(BackendUnavailableException.class, () -> config.locatorChain(
                List.of("GOOGLE_VISION", "OCR_SERVICE", "VISION_CHAT"),
                0.2, "", "", "",
                new OkHttpClient(), new ObjectMapper(), chatModelProvider));
    }
}
