package com.ruchira.nest.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One structural problem with a request body, located by its path, e.g. ["body", "nesting_levels"].
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ValidationErrorDto {

    private List<String> loc;
    private String msg;
    private String type;
}
