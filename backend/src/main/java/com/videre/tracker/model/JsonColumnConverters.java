package com.videre.tracker.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON text columns for snapshot fields. Each field is replaced as a whole on update,
 * so the stored value is always the latest snapshot.
 */
public final class JsonColumnConverters {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonColumnConverters() {}

    abstract static class JsonConverter<T> implements AttributeConverter<T, String> {
        private final TypeReference<T> type;

        JsonConverter(TypeReference<T> type) {
            this.type = type;
        }

        abstract T empty();

        @Override
        public String convertToDatabaseColumn(T attribute) {
            try {
                return MAPPER.writeValueAsString(attribute == null ? empty() : attribute);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Cannot serialize column value: " + e.getMessage(), e);
            }
        }

        @Override
        public T convertToEntityAttribute(String dbData) {
            if (dbData == null || dbData.isBlank()) return empty();
            try {
                return MAPPER.readValue(dbData, type);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Cannot read column value: " + e.getMessage(), e);
            }
        }
    }

    @Converter
    public static class CardEntryList extends JsonConverter<List<CardEntry>> {
        public CardEntryList() { super(new TypeReference<>() {}); }
        @Override List<CardEntry> empty() { return new ArrayList<>(); }
    }

    @Converter
    public static class PlayerResultList extends JsonConverter<List<PlayerResult>> {
        public PlayerResultList() { super(new TypeReference<>() {}); }
        @Override List<PlayerResult> empty() { return new ArrayList<>(); }
    }

    @Converter
    public static class GamePlayerResultList extends JsonConverter<List<GamePlayerResult>> {
        public GamePlayerResultList() { super(new TypeReference<>() {}); }
        @Override List<GamePlayerResult> empty() { return new ArrayList<>(); }
    }

    // game id -> card deltas applied before that game
    @Converter
    public static class SideboardChanges extends JsonConverter<Map<Long, List<CardEntry>>> {
        public SideboardChanges() { super(new TypeReference<>() {}); }
        @Override Map<Long, List<CardEntry>> empty() { return new LinkedHashMap<>(); }
    }
}
