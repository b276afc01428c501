package com.sociallink.schema.domain.validation;

import com.sociallink.schema.api.dto.EmailVerificationRequestDto;
import com.sociallink.schema.api.dto.PostRequestDto;
import com.sociallink.schema.api.dto.TokenResponseDto;
import com.sociallink.schema.api.dto.UserCreateRequestDto;
import com.sociallink.schema.api.dto.UserLoginRequestDto;
import com.sociallink.schema.api.dto.UserResponseDto;
import com.sociallink.schema.domain.exception.PayloadValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("PayloadValidator")
class PayloadValidatorTest {

    private final PayloadValidator validator = PayloadValidator.createDefault();

    @Nested
    @DisplayName("user creation payload")
    class UserCreate {

        @Test
        @DisplayName("accepts username, well-formed email and password")
        void acceptsCompletePayload() {
            UserCreateRequestDto dto = new UserCreateRequestDto("alice", "alice@example.com", "password123");

            assertThat(validator.validate(dto)).isSameAs(dto);
            assertThat(validator.isValid(dto)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"invalid-email", "alice@", "@example.com", "alice@example", "al ice@example.com"})
        @DisplayName("rejects malformed email addresses")
        void rejectsMalformedEmail(String email) {
            UserCreateRequestDto dto = new UserCreateRequestDto("alice", email, "password123");

            PayloadValidationException ex = catchThrowableOfType(
                    () -> validator.validate(dto), PayloadValidationException.class);

            assertThat(ex.getFieldErrors()).containsOnlyKeys("email");
            assertThat(ex.getMessage()).startsWith("email ");
        }

        @Test
        @DisplayName("reports every missing field, ordered by name")
        void reportsAllMissingFields() {
            PayloadValidationException ex = catchThrowableOfType(
                    () -> validator.validate(new UserCreateRequestDto()), PayloadValidationException.class);

            assertThat(ex.getFieldErrors().keySet()).containsExactly("email", "password", "username");
            assertThat(ex.getMessage()).isEqualTo("email Email is required");
        }

        @Test
        @DisplayName("keeps the same message when a field breaks two constraints")
        void picksOneMessagePerFieldDeterministically() {
            UserCreateRequestDto dto = new UserCreateRequestDto("alice", " ", "password123");

            PayloadValidationException ex = catchThrowableOfType(
                    () -> validator.validate(dto), PayloadValidationException.class);

            assertThat(ex.getFieldErrors()).containsOnly(entry("email", "Email is required"));
            assertThat(ex.getMessage()).isEqualTo("email Email is required");
        }

        @Test
        @DisplayName("leaves password length to the server")
        void acceptsShortPassword() {
            UserCreateRequestDto dto = new UserCreateRequestDto("alice", "alice@example.com", "123");

            assertThat(validator.isValid(dto)).isTrue();
        }
    }

    @Test
    @DisplayName("login payload needs email and password")
    void loginRequiresBothFields() {
        assertThat(validator.isValid(new UserLoginRequestDto("bob@example.com", "secret"))).isTrue();
        assertThat(validator.isValid(new UserLoginRequestDto("bob@example.com", " "))).isFalse();
        assertThat(validator.isValid(new UserLoginRequestDto("not-an-email", "secret"))).isFalse();
    }

    @Test
    @DisplayName("token response cascades into the wrapped user")
    void tokenResponseCascades() {
        TokenResponseDto ok = new TokenResponseDto(
                new UserResponseDto("u-1", "carol", "carol@example.com"), "opaque-token");
        TokenResponseDto badUser = new TokenResponseDto(
                new UserResponseDto("u-1", "carol", "carol-at-example"), "opaque-token");

        assertThat(validator.isValid(ok)).isTrue();
        PayloadValidationException ex = catchThrowableOfType(
                () -> validator.validate(badUser), PayloadValidationException.class);
        assertThat(ex.getFieldErrors()).containsOnlyKeys("user.email");
    }

    @Test
    @DisplayName("token response without token is rejected")
    void tokenResponseNeedsToken() {
        TokenResponseDto dto = new TokenResponseDto(new UserResponseDto("u-1", "carol", "carol@example.com"), null);

        assertThat(validator.isValid(dto)).isFalse();
    }

    @Test
    @DisplayName("verification request and post payloads")
    void otherRequests() {
        assertThat(validator.isValid(new EmailVerificationRequestDto("dave@example.com"))).isTrue();
        assertThat(validator.isValid(new EmailVerificationRequestDto(""))).isFalse();
        assertThat(validator.isValid(new PostRequestDto("hello"))).isTrue();
        assertThat(validator.isValid(new PostRequestDto("   "))).isFalse();
    }

    @Test
    @DisplayName("null payload is rejected")
    void rejectsNull() {
        assertThatThrownBy(() -> validator.validate(null))
                .isInstanceOf(PayloadValidationException.class)
                .hasMessage("Payload is required");
        assertThat(validator.isValid(null)).isFalse();
    }
}
