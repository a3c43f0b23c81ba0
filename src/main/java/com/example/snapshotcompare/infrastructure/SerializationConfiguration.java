package com.example.snapshotcompare.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * {@link CsvMapper} is itself an {@link ObjectMapper}, so declaring it switches off Boot's
 * default mapper. The JSON mapper is therefore declared here as well, built from the
 * auto-configured builder so it still picks up {@link SnapshotJacksonModule}.
 */
@Configuration
public class SerializationConfiguration {

    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.createXmlMapper(false).build();
    }

    @Bean
    public CsvMapper csvMapper() {
        return new CsvMapper();
    }
}
