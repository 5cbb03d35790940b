package com.task.tablescan.locator;

import com.google.cloud.vision.v1.AnnotateImageResponse;
import com.google.cloud.vision.v1.BatchAnnotateImagesResponse;
import com.google.cloud.vision.v1.Block;
import com.google.cloud.vision.v1.BoundingPoly;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.Page;
import com.google.cloud.vision.v1.Paragraph;
import com.google.cloud.vision.v1.Symbol;
import com.google.cloud.vision.v1.TextAnnotation;
import com.google.cloud.vision.v1.Vertex;
import com.google.cloud.vision.v1.Word;
import com.google.rpc.Status;
import com.task.tablescan.model.Token;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class GoogleVisionTokenLocatorTest {

    @Mock
    private ImageAnnotatorClient client;

    @TempDir
    Path tmp;

    private Path image;

    @BeforeEach
    public void setUp() throws IOException {
        image = Files.write(tmp.resolve("scan.png"), new byte[]{1, 2, 3});
    }

    private static Word word(String text, float confidence, int left, int top, int right, int bottom) {
        Word.Builder word = Word.newBuilder()
                .setBoundingBox(BoundingPoly.newBuilder()
                        .addVertices(Vertex.newBuilder().setX(left).setY(top))
                        .addVertices(Vertex.newBuilder().setX(right).setY(top))
                        .addVertices(Vertex.newBuilder().setX(right).setY(bottom))
                        .addVertices(Vertex.newBuilder().setX(left).setY(bottom)));
        for (char ch : text.toCharArray()) {
            word.addSymbols(Symbol.newBuilder().setText(String.valueOf(ch)).setConfidence(confidence));
        }
        return word.build();
    }

    private static BatchAnnotateImagesResponse responseWith(Word... words) {
        Paragraph.Builder paragraph = Paragraph.newBuilder();
        for (Word w : words) {
            paragraph.addWords(w);
        }
        TextAnnotation annotation = TextAnnotation.newBuilder()
                .addPages(Page.newBuilder().addBlocks(Block.newBuilder().addParagraphs(paragraph)))
                .build();
        return BatchAnnotateImagesResponse.newBuilder()
                .addResponses(AnnotateImageResponse.newBuilder().setFullTextAnnotation(annotation))
                .build();
    }

    @Test
    public void testLocate_WordsBecomeCenteredTokens() throws Exception {
        when(client.batchAnnotateImages(anyList())).thenReturn(responseWith(
                word("Name", 0.9f, 10, 20, 50, 40),
                word("smudge", 0.1f, 60, 20, 90, 40),
                word("Age", 0.8f, 100, 21, 140, 41)
        ));

        List<Token> tokens = new GoogleVisionTokenLocator(client, 0.2).locate(image);

        assertEquals(2, tokens.size());
        assertEquals("Name", tokens.get(0).text());
        assertEquals(30, tokens.get(0).y());
        assertEquals(30, tokens.get(0).x());
        assertEquals(0.9, tokens.get(0).confidence(), 1e-6);
        assertEquals("Age", tokens.get(1).text());
        assertEquals(31, tokens.get(1).y());
        assertEquals(120, tokens.get(1).x());
    }

    @Test
    public void testLocate_NoAnnotation() throws Exception {
        when(client.batchAnnotateImages(anyList())).thenReturn(BatchAnnotateImagesResponse.newBuilder()
                .addResponses(AnnotateImageResponse.getDefaultInstance())
                .build());

        assertTrue(new GoogleVisionTokenLocator(client, 0.2).locate(image).isEmpty());
    }

    @Test
    public void testLocate_ApiErrorIsRaised() {
        when(client.batchAnnotateImages(anyList())).thenReturn(BatchAnnotateImagesResponse.newBuilder()
                .addResponses(AnnotateImageResponse.newBuilder()
                        .setError(Status.newBuilder().setCode(7).setMessage("permission denied")))
                .build());

        IOException e = assertThrows(IOException.class,
                () -> new GoogleVisionTokenLocator(client, 0.2).locate(image));
        assertTrue(e.getMessage().contains("permission denied"));
    }
}
