package com.sociallink.schema.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CommentResponseDto {

    @NotBlank(message = "Comment id is required")
    private String id;

    @NotNull(message = "Comment text is required")
    private String text;

    @NotBlank(message = "post_id is required")
    @JsonProperty("post_id")
    private String postId;

    @NotBlank(message = "created_at is required")
    @JsonProperty("created_at")
    private String createdAt;
}
