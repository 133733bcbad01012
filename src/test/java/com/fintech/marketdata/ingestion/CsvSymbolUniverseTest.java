package com.fintech.marketdata.ingestion;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CsvSymbolUniverse Tests")
class CsvSymbolUniverseTest {

    private Path dir;

    @BeforeEach
    void setUp() throws IOException {
        dir = Files.createDirectories(Path.of("target/test-symbols-" + System.nanoTime()));
        Files.writeString(dir.resolve("nifty50_symbols.csv"), "symbol,name\nRELIANCE,Reliance\n,blank\nTCS,TCS\nRELIANCE,again\n");
        Files.writeString(dir.resolve("indices_symbols.csv"), "name,symbol\nNifty 50,NIFTY\n");
        Files.writeString(dir.resolve("notes.txt"), "ignored");
    }

    @AfterEach
    void tearDown() throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.toList()) {
                Files.delete(file);
            }
        }
        Files.delete(dir);
    }

    @Test
    @DisplayName("Categories come from symbol file names")
    void testCategories() {
        assertThat(new CsvSymbolUniverse(dir).categories()).containsExactly("indices", "nifty50");
    }

    @Test
    @DisplayName("Symbols keep file order without blanks or repeats")
    void testSymbols() {
        Map<String, List<String>> symbols = new CsvSymbolUniverse(dir).symbols(List.of("nifty50", "indices"));

        assertThat(symbols).containsEntry("nifty50", List.of("RELIANCE", "TCS"))
            .containsEntry("indices", List.of("NIFTY"));
    }

    @Test
    @DisplayName("Unknown category is rejected")
    void testUnknownCategory() {
        assertThatThrownBy(() -> new CsvSymbolUniverse(dir).symbols(List.of("midcap")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("midcap");
    }

    @Test
    @DisplayName("Missing directory has no categories")
    void testMissingDirectory() {
        assertThat(new CsvSymbolUniverse(dir.resolve("absent")).categories()).isEmpty();
    }
}
