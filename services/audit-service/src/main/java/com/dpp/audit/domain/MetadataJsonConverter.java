package com.dpp.audit.domain;

import com.dpp.audit.crypto.CanonicalJson;
import com.dpp.audit.crypto.MetadataValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores metadata as its canonical JSON text, so the column holds exactly the
 * bytes that were hashed.
 */
@Converter
public class MetadataJsonConverter implements AttributeConverter<MetadataValue, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(MetadataValue attribute) {
        return attribute != null ? CanonicalJson.write(attribute) : null;
    }

    @Override
    public MetadataValue convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        try {
            return MetadataValue.fromJson(MAPPER.readTree(dbData));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored audit metadata is not valid JSON", e);
        }
    }
}
