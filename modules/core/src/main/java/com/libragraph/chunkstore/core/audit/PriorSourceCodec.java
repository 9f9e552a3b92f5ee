package com.libragraph.chunkstore.core.audit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;

/**
 * JSON form of {@link PriorSource} lists as stored in pending-deletion and audit rows.
 */
@ApplicationScoped
public class PriorSourceCodec {

    private static final TypeReference<List<PriorSource>> LIST_TYPE = new TypeReference<>() {
    };
    private static final int MAX_LENGTH = 4000;

    private final ObjectMapper objectMapper;

    @Inject
    public PriorSourceCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(List<PriorSource> sources) {
        try {
            String json = objectMapper.writeValueAsString(sources);
            // Column holds 4000 characters; keep the head of the list
            while (json.length() > MAX_LENGTH && sources.size() > 1) {
                sources = sources.subList(0, sources.size() / 2);
                json = objectMapper.writeValueAsString(sources);
            }
            return json;
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize prior sources: " + sources, e);
        }
    }

    public List<PriorSource> decode(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, LIST_TYPE);
        } catch (Exception e) {
            throw new RuntimeException("Failed to deserialize prior sources: " + json, e);
        }
    }
}
