package com.ruchira.nest.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruchira.nest.exception.BusinessException;
import com.ruchira.nest.exception.RecordFormatException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ruchira.nest.constant.Constants.INCORRECT_FLAT_RECORDS_FORMAT;

/**
 * Reads flat records from JSON and writes nested groupings back as JSON.
 * <p>
 * Input must be a JSON array whose elements are all JSON objects:
 * [{"currency": "EUR", "amount": 20}, {"currency": "USD", "amount": 100}]
 */
@Component
@RequiredArgsConstructor
public class JsonParser {

    private static final TypeReference<List<Map<String, Object>>> FLAT_RECORDS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Parse a JSON array of flat records.
     *
     * @param rawFlatRecords JSON text
     * @return the decoded records, in input order
     * @throws RecordFormatException if the text is not a JSON array of JSON objects
     */
    public List<Map<String, Object>> parseFlatRecords(String rawFlatRecords) {
        List<Map<String, Object>> flatRecords;
        try {
            flatRecords = objectMapper.readValue(rawFlatRecords, FLAT_RECORDS_TYPE);
        } catch (JsonProcessingException e) {
            throw new RecordFormatException(e.getOriginalMessage(), INCORRECT_FLAT_RECORDS_FORMAT, e);
        }

        if (flatRecords == null) {
            throw new RecordFormatException("Expected a JSON array, got null", INCORRECT_FLAT_RECORDS_FORMAT);
        }
        for (int index = 0; index < flatRecords.size(); index++) {
            if (flatRecords.get(index) == null) {
                throw new RecordFormatException(
                        String.format("Expected a JSON object at index %d, got null", index),
                        INCORRECT_FLAT_RECORDS_FORMAT);
            }
        }
        return flatRecords;
    }

    /**
     * Serialize a nested grouping.
     *
     * @param nested the grouping to write
     * @param pretty indent the output and sort map keys
     * @return JSON text
     */
    public String render(Object nested, boolean pretty) {
        try {
            if (!pretty) {
                return objectMapper.writeValueAsString(nested);
            }
            return objectMapper.writer(new IndentedPrettyPrinter()).writeValueAsString(sortedByText(nested));
        } catch (JsonProcessingException e) {
            throw new BusinessException("Failed to serialize nested result", e);
        }
    }

    /**
     * Copies maps with their entries ordered by the text form of each key. Keys of
     * different types sharing one text form (1 and "1") stay separate entries, in their
     * original relative order.
     */
    private Object sortedByText(Object node) {
        if (node instanceof Map<?, ?> map) {
            List<Map.Entry<?, ?>> entries = new ArrayList<>(map.entrySet());
            entries.sort(Comparator.comparing((Map.Entry<?, ?> entry) -> String.valueOf(entry.getKey())));

            Map<Object, Object> sorted = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : entries) {
                sorted.put(entry.getKey(), sortedByText(entry.getValue()));
            }
            return sorted;
        }
        if (node instanceof List<?> list) {
            List<Object> sorted = new ArrayList<>(list.size());
            for (Object element : list) {
                sorted.add(sortedByText(element));
            }
            return sorted;
        }
        return node;
    }
}
