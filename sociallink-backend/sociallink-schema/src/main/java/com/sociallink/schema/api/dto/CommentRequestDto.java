package com.sociallink.schema.api.dto;

import jakarta.validation.constraints.NotBlank;

public class CommentRequestDto {

    @NotBlank(message = "Comment text is required")
    private String text;

    public CommentRequestDto() {
    }

    public CommentRequestDto(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }
}
