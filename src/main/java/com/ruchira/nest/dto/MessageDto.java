package com.ruchira.nest.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response body for errors. {@code detail} is either a single message or a list of validation errors.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class MessageDto {

    private Object detail;
}
