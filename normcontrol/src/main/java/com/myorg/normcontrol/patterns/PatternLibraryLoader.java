package com.myorg.normcontrol.patterns;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.normcontrol.exception.PatternLibraryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a pattern library from JSON. Locations use Spring resource syntax
 * ({@code classpath:patterns/x.json}, {@code file:/etc/normcontrol/x.json}).
 */
@Slf4j
public class PatternLibraryLoader {

    public static final String DEFAULT_LOCATION = "classpath:patterns/default-pattern-library.json";

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public PatternLibraryLoader(ObjectMapper objectMapper) {
        this(objectMapper, new DefaultResourceLoader());
    }

    public PatternLibraryLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        // "weight": null in a hand-edited library must fail instead of reading as zero
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        this.resourceLoader = resourceLoader;
    }

    public PatternLibrary load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new PatternLibraryException("Pattern library not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return load(in, location);
        } catch (IOException e) {
            throw new PatternLibraryException("Cannot read pattern library at " + location, e);
        }
    }

    public PatternLibrary load(InputStream in, String sourceName) {
        PatternLibraryDefinition definition;
        try {
            definition = objectMapper.readValue(in, PatternLibraryDefinition.class);
        } catch (IOException e) {
            throw new PatternLibraryException("Malformed pattern library " + sourceName + ": " + e.getMessage(), e);
        }
        PatternLibrary library = PatternLibrary.compile(definition);
        log.info("Loaded pattern library {} from {} ({} rules, {} norm rule sets, {} marks)",
                library.version(), sourceName, library.rules().size(),
                definition.getNormRuleSets().size(), library.marks().size());
        return library;
    }
}
