package com.ruchira.nest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

import static com.ruchira.nest.constant.Constants.FLAT_DICTS_FIELD;
import static com.ruchira.nest.constant.Constants.NESTING_LEVELS_FIELD;
import static com.ruchira.nest.constant.Constants.USE_RECURSIVE_REALIZATION_FIELD;

/**
 * Data and conditions for one transformation, e.g.
 * <pre>
 * {
 *   "flat_dicts": [{"currency": "GBP", "country": "UK", "amount": 100}],
 *   "nesting_levels": ["currency", "country"]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransformationRequestDto {

    @NotNull
    @JsonProperty(FLAT_DICTS_FIELD)
    private List<@NotNull Map<String, Object>> flatDicts;

    @NotNull
    @JsonProperty(NESTING_LEVELS_FIELD)
    private List<@NotNull String> nestingLevels;

    @JsonProperty(USE_RECURSIVE_REALIZATION_FIELD)
    private boolean useRecursiveRealization;
}
