package com.trender.pipeline.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trender.pipeline.model.RepositoryCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Streams search results, as fetched, into {@code raw_github_repos}.
 */
public class RawStore {

    private static final Logger logger = LoggerFactory.getLogger(RawStore.class);

    /**
     * Which search produced the candidates.
     */
    public enum SourceType {
        TRENDING("trending"),
        RENDER_ECOSYSTEM("render_ecosystem");

        private final String value;

        SourceType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    private final BigQueryWarehouse warehouse;
    private final ObjectMapper objectMapper;

    public RawStore(BigQueryWarehouse warehouse) {
        this.warehouse = warehouse;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @param sourceLanguage language filter of the search, {@code null} for ecosystem searches
     */
    public InsertResult store(List<RepositoryCandidate> candidates, String sourceLanguage, SourceType sourceType) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (RepositoryCandidate candidate : candidates) {
            Map<String, Object> row = new HashMap<>();
            row.put("repo_full_name", candidate.fullName());
            row.put("api_response", toJson(candidate));
            row.put("source_language", sourceLanguage);
            row.put("source_type", sourceType.value());
            rows.add(row);
        }
        return warehouse.insertRows(warehouse.rawDataset(), WarehouseTables.RAW_GITHUB_REPOS, rows);
    }

    private String toJson(RepositoryCandidate candidate) {
        try {
            return objectMapper.writeValueAsString(candidate);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize {} for the raw layer: {}", candidate.fullName(), e.getOriginalMessage());
            return null;
        }
    }
}
