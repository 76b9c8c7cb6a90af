package com.myorg.normcontrol.patterns;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.normcontrol.exception.PatternLibraryException;
import com.myorg.normcontrol.model.PageRole;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternLibraryLoaderTest {

    private final PatternLibraryLoader loader = new PatternLibraryLoader(new ObjectMapper());

    private static InputStream json(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loadsTheBundledLibrary() {
        PatternLibrary library = loader.load(PatternLibraryLoader.DEFAULT_LOCATION);

        assertThat(library.version()).isNotBlank();
        assertThat(library.rules()).isNotEmpty();
        assertThat(library.marks()).isNotEmpty();
    }

    @Test
    void loadsFromTheFileSystem(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("library.json");
        Files.writeString(file, "{\"version\":\"fs-1\",\"role_priority\":[\"drawing\"],\"unknown_key\":true}");

        PatternLibrary library = loader.load(file.toUri().toString());

        assertThat(library.version()).isEqualTo("fs-1");
        assertThat(library.rolePriority()).containsExactly(PageRole.DRAWING);
    }

    @Test
    void missingResourceFails() {
        assertThatThrownBy(() -> loader.load("classpath:patterns/does-not-exist.json"))
                .isInstanceOf(PatternLibraryException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void malformedJsonFails() {
        assertThatThrownBy(() -> loader.load(json("{ not json"), "inline"))
                .isInstanceOf(PatternLibraryException.class)
                .hasMessageContaining("inline");
    }

    @Test
    void nullWeightFails() {
        String library = "{\"version\":\"1\",\"stamp_fields\":[{\"field\":\"scale\",\"patterns\":[],\"weight\":null}]}";

        assertThatThrownBy(() -> loader.load(json(library), "inline"))
                .isInstanceOf(PatternLibraryException.class);
    }

    @Test
    void providerSwapsLibrariesAtomically() {
        PatternLibrary first = loader.load(json("{\"version\":\"a\"}"), "a");
        PatternLibrary second = loader.load(json("{\"version\":\"b\"}"), "b");
        PatternLibraryProvider provider = new PatternLibraryProvider(first);

        assertThat(provider.replace(second)).isSameAs(first);
        assertThat(provider.current().version()).isEqualTo("b");
    }
}
