package com.flagship.ledger_replay.config;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for the CSV transaction log and account report.
 *
 * Key features:
 * - Whitespace around values is trimmed
 * - Rows may leave out the trailing amount column; extra columns are ignored
 * - Empty cells are read as null
 * - Writers never close the stream they were given (stdout stays open)
 */
@Configuration
public class CsvConfig {

    @Bean
    public CsvMapper csvMapper() {
        return CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                .build();
    }
}
