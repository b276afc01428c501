package com.sociallink.schema.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A like links one user to one post; at most one exists per (user, post).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LikeResponseDto {

    @NotBlank(message = "Like id is required")
    private String id;

    @NotBlank(message = "post_id is required")
    @JsonProperty("post_id")
    private String postId;

    @NotBlank(message = "user_id is required")
    @JsonProperty("user_id")
    private String userId;
}
