package com.scanq.schedule;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.List;

/**
 * Stores the weekly day list as a comma separated column, e.g. {@code Monday,Friday}.
 */
@Converter
public class DaysOfWeekConverter implements AttributeConverter<List<String>, String> {

    @Override
    public String convertToDatabaseColumn(List<String> days) {
        if (days == null || days.isEmpty()) {
            return null;
        }
        return String.join(",", days);
    }

    @Override
    public List<String> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return List.of();
        }
        return Arrays.stream(column.split(","))
                .map(String::trim)
                .filter(day -> !day.isEmpty())
                .toList();
    }
}
