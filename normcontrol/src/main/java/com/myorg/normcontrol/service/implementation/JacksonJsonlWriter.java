package com.myorg.normcontrol.service.implementation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.myorg.normcontrol.service.JsonlWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Append-only JSON Lines file. One compact document per line, null fields left out.
 */
@Slf4j
public class JacksonJsonlWriter<T> implements JsonlWriter<T> {

    private final ObjectWriter lineWriter;

    public JacksonJsonlWriter(ObjectMapper mapper) {
        // a pretty-printing mapper would split one entry over several lines
        this.lineWriter = mapper.copy()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .writer();
    }

    @Override
    public void append(File outputFile, List<T> data) throws IOException {
        if (outputFile == null) {
            throw new IllegalArgumentException("outputFile must not be null");
        }
        if (data == null || data.isEmpty()) {
            log.debug("Nothing to append to {}", outputFile);
            return;
        }

        Path target = outputFile.toPath().toAbsolutePath();
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        try (BufferedWriter out = Files.newBufferedWriter(target, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            for (T entry : data) {
                out.write(lineWriter.writeValueAsString(entry));
                out.write('\n');
            }
        }
        log.debug("Appended {} entries to {}", data.size(), target);
    }
}
