package com.task.tablescan.locator;

import com.task.tablescan.model.LocatedTokens;
import com.task.tablescan.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Ordered list of locators. Each call tries them in order and keeps the first
 * non-empty result; a locator that throws or finds nothing hands over to the next.
 * When all of them come back empty the result is empty and carries the first
 * locator's name.
 */
public class LocatorChain implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocatorChain.class);

    private final List<TokenLocator> locators;

    public LocatorChain(List<TokenLocator> locators) {
        if (locators == null || locators.isEmpty()) {
            throw new BackendUnavailableException("No OCR backend available. Set GOOGLE_APPLICATION_CREDENTIALS, "
                    + "GOOGLE_CREDENTIALS_JSON, ocr.service.url or OPENAI_API_KEY");
        }
        this.locators = List.copyOf(locators);
    }

    public List<String> backendNames() {
        return locators.stream().map(TokenLocator::name).toList();
    }

    public String primaryBackend() {
        return locators.get(0).name();
    }

    public LocatedTokens locate(Path image) {
        for (TokenLocator locator : locators) {
            try {
                List<Token> tokens = locator.locate(image);
                if (tokens != null && !tokens.isEmpty()) {
                    log.info("[OCR] {} located {} tokens in {}", locator.name(), tokens.size(), image.getFileName());
                    return new LocatedTokens(locator.name(), tokens);
                }
                log.warn("[OCR] {} returned no tokens for {}, trying next backend", locator.name(), image.getFileName());
            } catch (Exception e) {
                log.warn("[OCR] {} failed for {}: {}", locator.name(), image.getFileName(), e.getMessage(), e);
            }
        }
        return new LocatedTokens(primaryBackend(), List.of());
    }

    @Override
    public void close() throws Exception {
        for (TokenLocator locator : locators) {
            if (locator instanceof AutoCloseable closeable) {
                closeable.close();
            }
        }
    }
}
