package com.sociallink.schema.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of create and update post calls.
 */
public class PostRequestDto {

    @NotBlank(message = "Post text is required")
    private String text;

    public PostRequestDto() {
    }

    public PostRequestDto(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }
}
