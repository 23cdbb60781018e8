package com.asyncreview.core.snapshot;

import com.asyncreview.core.model.SymbolTag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegexSymbolScannerTest {

    @Test
    @DisplayName("python classes, functions and imports are tagged with 1-based lines")
    void python() {
        String source = """
                import json
                from os import path

                class Loader:
                    def load(self):
                        pass

                def main():
                    pass
                """;

        List<SymbolTag> tags = RegexSymbolScanner.forLanguage("python").scan(source);

        assertTrue(tags.stream().anyMatch(t -> t.name().equals("Loader") && t.kind().equals("class") && t.line() == 4));
        assertTrue(tags.stream().anyMatch(t -> t.name().equals("main") && t.line() == 8));
    }

    @Test
    @DisplayName("tags are sorted by line then name")
    void sorted() {
        String source = "function b() {}\nfunction a() {}\n";

        List<SymbolTag> tags = RegexSymbolScanner.forLanguage("javascript").scan(source);

        for (int i = 1; i < tags.size(); i++) {
            assertTrue(tags.get(i - 1).line() <= tags.get(i).line());
        }
    }

    @Test
    @DisplayName("unknown languages produce no tags")
    void unknownLanguage() {
        assertTrue(RegexSymbolScanner.forLanguage("text").scan("def x(): pass").isEmpty());
    }

    @Test
    @DisplayName("language detection uses extension and special file names")
    void languageDetection() {
        assertEquals("python", LanguageDetector.detect(Path.of("a/b.py")));
        assertEquals("typescript", LanguageDetector.detect(Path.of("x.ts")));
        assertEquals("dockerfile", LanguageDetector.detect(Path.of("Dockerfile")));
    }
}
