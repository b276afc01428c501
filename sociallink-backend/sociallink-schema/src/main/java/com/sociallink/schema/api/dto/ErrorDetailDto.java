package com.sociallink.schema.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body of every non-2xx response.
 *
 * Example:
 * {
 *   "detail": "Please verify your email before logging in"
 * }
 *
 * Validation failures (422) may carry a structured detail instead of a
 * string; readers should not bind those to this type.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorDetailDto {

    private String detail;
}
