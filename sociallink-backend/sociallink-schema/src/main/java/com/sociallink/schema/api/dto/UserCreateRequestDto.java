package com.sociallink.schema.api.dto;

import com.sociallink.schema.domain.constants.SchemaConstants;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * Registration payload. Password strength is checked by the server, not here.
 */
public class UserCreateRequestDto {

    @NotBlank(message = "Username is required")
    private String username;

    @NotBlank(message = "Email is required")
    @Email(regexp = SchemaConstants.EMAIL_PATTERN, message = "Email must be a valid email address")
    private String email;

    @NotBlank(message = "Password is required")
    private String password;

    public UserCreateRequestDto() {
    }

    public UserCreateRequestDto(String username, String email, String password) {
        this.username = username;
        this.email = email;
        this.password = password;
    }

    // Getters and setters
    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

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

    @Override
    public String toString() {
        return "UserCreateRequestDto{username='" + username + "', email='" + email + "'}";
    }
}
