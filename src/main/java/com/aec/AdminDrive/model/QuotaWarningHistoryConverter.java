package com.aec.AdminDrive.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class QuotaWarningHistoryConverter implements AttributeConverter<List<QuotaWarningRecord>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<List<QuotaWarningRecord>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<QuotaWarningRecord> records) {
        if (records == null || records.isEmpty()) return "[]";
        try {
            return MAPPER.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize quota warning history", e);
        }
    }

    @Override
    public List<QuotaWarningRecord> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            return new ArrayList<>(MAPPER.readValue(json, TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read quota warning history", e);
        }
    }
}
