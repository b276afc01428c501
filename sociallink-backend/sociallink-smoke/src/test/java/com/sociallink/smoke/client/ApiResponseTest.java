package com.sociallink.smoke.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sociallink.schema.api.dto.PostResponseDto;
import com.sociallink.smoke.domain.exception.SmokeAssertionException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void detailOfStringAndStructuredErrors() {
        assertThat(new ApiResponse(404, "{\"detail\":\"Post not found\"}", objectMapper).detail())
                .isEqualTo("Post not found");
        assertThat(new ApiResponse(422, "{\"detail\":[{\"loc\":[\"body\",\"email\"]}]}", objectMapper).detail())
                .isEmpty();
        assertThat(new ApiResponse(204, null, objectMapper).detail()).isEmpty();
    }

    @Test
    void nonJsonBodyIsAnAssertionFailure() {
        ApiResponse response = new ApiResponse(500, "<html>Internal Server Error</html>", objectMapper);

        assertThatThrownBy(response::json)
                .isInstanceOf(SmokeAssertionException.class)
                .hasMessageContaining("status 500");
        assertThat(response.pretty()).isEqualTo("<html>Internal Server Error</html>");
    }

    @Test
    void readBodyBindsSnakeCase() {
        ApiResponse response = new ApiResponse(200,
                "{\"id\":\"p1\",\"text\":\"t\",\"created_at\":\"2024-01-01T00:00:00\"}", objectMapper);

        PostResponseDto post = response.readBody(PostResponseDto.class);

        assertThat(post.getCreatedAt()).isEqualTo("2024-01-01T00:00:00");
    }

    @Test
    void readBodyOfWrongShapeIsAnAssertionFailure() {
        ApiResponse response = new ApiResponse(200, "[1,2]", objectMapper);

        assertThatThrownBy(() -> response.readBody(PostResponseDto.class))
                .isInstanceOf(SmokeAssertionException.class)
                .hasMessageContaining("PostResponseDto");
    }

    @Test
    void onlyTwoHundredsCountAsSuccess() {
        assertThat(new ApiResponse(201, "{}", objectMapper).is2xxSuccessful()).isTrue();
        assertThat(new ApiResponse(204, null, objectMapper).is2xxSuccessful()).isTrue();
        assertThat(new ApiResponse(400, "{\"detail\":\"Post already liked\"}", objectMapper).is2xxSuccessful()).isFalse();
        assertThat(new ApiResponse(302, "", objectMapper).is2xxSuccessful()).isFalse();
    }
}
