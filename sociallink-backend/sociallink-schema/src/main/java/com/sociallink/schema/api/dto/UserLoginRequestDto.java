package com.sociallink.schema.api.dto;

import com.sociallink.schema.domain.constants.SchemaConstants;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public class UserLoginRequestDto {

    @NotBlank(message = "Email is required")
    @Email(regexp = SchemaConstants.EMAIL_PATTERN, message = "Email must be a valid email address")
    private String email;

    @NotBlank(message = "Password is required")
    private String password;

    public UserLoginRequestDto() {
    }

    public UserLoginRequestDto(String email, String password) {
        this.email = email;
        this.password = password;
    }

    // Getters and setters
    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }
}
