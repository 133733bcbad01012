package com.fintech.marketdata.ingestion;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code {dir}/{category}_symbols.csv} files with a {@code symbol} header column.
 * Blank entries and repeats are dropped; file order is kept.
 */
public class CsvSymbolUniverse implements SymbolUniverse {

    private static final Logger log = LoggerFactory.getLogger(CsvSymbolUniverse.class);
    private static final String SUFFIX = "_symbols.csv";

    private final Path directory;
    private final CsvMapper csvMapper = new CsvMapper();

    public CsvSymbolUniverse(Path directory) {
        this.directory = directory;
    }

    @Override
    public List<String> categories() {
        if (!Files.isDirectory(directory)) {
            log.warn("Symbol directory missing: {}", directory.toAbsolutePath());
            return Collections.emptyList();
        }
        List<String> categories = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                categories.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list symbol files in " + directory, e);
        }
        Collections.sort(categories);
        return categories;
    }

    @Override
    public Map<String, List<String>> symbols(Collection<String> categories) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String category : categories) {
            result.put(category, load(category));
        }
        return result;
    }

    private List<String> load(String category) {
        Path file = directory.resolve(category + SUFFIX);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Unknown category '" + category + "': no " + file);
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        Set<String> symbols = new LinkedHashSet<>();
        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(file.toFile())) {
            while (rows.hasNext()) {
                String symbol = rows.next().get("symbol");
                if (symbol != null && !symbol.isBlank()) {
                    symbols.add(symbol.trim());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read symbol file " + file, e);
        }
        log.info("Loaded symbols: category={}, count={}", category, symbols.size());
        return new ArrayList<>(symbols);
    }
}
