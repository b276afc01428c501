package com.sociallink.schema.api.dto;

import com.sociallink.schema.domain.constants.SchemaConstants;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public class EmailVerificationRequestDto {

    @NotBlank(message = "Email is required")
    @Email(regexp = SchemaConstants.EMAIL_PATTERN, message = "Email must be a valid email address")
    private String email;

    public EmailVerificationRequestDto() {
    }

    public EmailVerificationRequestDto(String email) {
        this.email = email;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }
}
