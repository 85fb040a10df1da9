package com.acme.reconcile.config;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

/**
 * Builds the Jackson CSV mapper used for the record sets and the feature table.
 * <p>
 * Not a Spring bean: {@link CsvMapper} is an {@code ObjectMapper}, and exposing one would replace
 * the JSON mapper Spring Boot auto-configures for the web layer and the services.
 */
public final class CsvMapperFactory {

    private CsvMapperFactory() {
    }

    public static CsvMapper create() {
        return CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
    }
}
