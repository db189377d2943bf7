package org.example.medassist.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Stores a list of free-text items as a single column, items joined by {@value #SEPARATOR}.
 * An empty list is stored as NULL and NULL reads back as an empty list.
 */
@Converter
public class DelimitedListConverter implements AttributeConverter<List<String>, String> {

    public static final String SEPARATOR = ", ";

    @Override
    public String convertToDatabaseColumn(List<String> items) {
        if (items == null || items.isEmpty()) {
            return null;
        }
        return String.join(SEPARATOR, items);
    }

    @Override
    public List<String> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return new ArrayList<>();
        }
        // items that themselves contain the separator come back split
        return new ArrayList<>(Arrays.asList(column.split(SEPARATOR)));
    }
}
