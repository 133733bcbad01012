package com.fintech.marketdata.ingestion;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Source of the instruments to ingest, grouped by category.
 * Curating the universe happens elsewhere; this only reads the result.
 */
public interface SymbolUniverse {

    /** Returns every category the universe knows. */
    List<String> categories();

    /**
     * Returns the symbols of each requested category, in request order.
     *
     * @throws IllegalArgumentException if a category is unknown
     */
    Map<String, List<String>> symbols(Collection<String> categories);
}
