package com.sociallink.schema.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A post as returned by the API. {@code created_at} is kept as the server's
 * string form since its exact timestamp format is not part of the contract.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PostResponseDto {

    @NotBlank(message = "Post id is required")
    private String id;

    @NotNull(message = "Post text is required")
    private String text;

    @NotBlank(message = "created_at is required")
    @JsonProperty("created_at")
    private String createdAt;
}
