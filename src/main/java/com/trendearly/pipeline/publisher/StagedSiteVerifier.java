package com.trendearly.pipeline.publisher;

import com.trendearly.pipeline.config.PipelineProperties;
import com.trendearly.pipeline.exception.PublishException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Rejects a staged tree whose HTML mentions any configured forbidden term.
 */
@Slf4j
@Component
public class StagedSiteVerifier {

    private final List<String> forbiddenTerms;

    public StagedSiteVerifier(PipelineProperties properties) {
        this.forbiddenTerms = properties.getSite().getForbiddenTerms().stream()
                .map(term -> term.toLowerCase(Locale.ROOT))
                .filter(term -> !term.isBlank())
                .collect(Collectors.toList());
    }

    /**
     * Case-insensitive check of a single text, used to keep such keywords off the site before
     * the staged tree is scanned.
     */
    public boolean containsForbiddenTerm(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return forbiddenTerms.stream().anyMatch(lower::contains);
    }

    public void verify(Path stagedDir) throws PublishException {
        List<Path> htmlFiles;
        try (Stream<Path> walk = Files.walk(stagedDir)) {
            htmlFiles = walk.filter(p -> p.getFileName().toString().endsWith(".html")).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new PublishException("Failed to scan staged tree " + stagedDir, e);
        }

        if (htmlFiles.isEmpty()) {
            throw new PublishException("Staged tree has no HTML pages: " + stagedDir);
        }

        List<String> violations = new ArrayList<>();
        for (Path file : htmlFiles) {
            String content;
            try {
                content = Files.readString(file, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
            } catch (IOException e) {
                throw new PublishException("Failed to read staged page " + file, e);
            }
            for (String term : forbiddenTerms) {
                if (content.contains(term)) {
                    violations.add(stagedDir.relativize(file) + ": \"" + term + "\"");
                }
            }
        }

        if (!violations.isEmpty()) {
            violations.forEach(v -> log.error("[Publish] forbidden term in {}", v));
            throw new PublishException("Staged tree contains " + violations.size() + " forbidden term(s): " + violations);
        }
        log.debug("[Publish] verified {} staged pages", htmlFiles.size());
    }
}
