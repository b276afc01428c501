package com.sociallink.smoke.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sociallink.schema.api.dto.CommentRequestDto;
import com.sociallink.schema.api.dto.EmailVerificationRequestDto;
import com.sociallink.schema.api.dto.PostRequestDto;
import com.sociallink.schema.api.dto.UserCreateRequestDto;
import com.sociallink.schema.api.dto.UserLoginRequestDto;
import com.sociallink.schema.domain.constants.SchemaConstants;
import com.sociallink.smoke.config.SmokeProperties;
import com.sociallink.smoke.domain.exception.ApiUnreachableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static com.sociallink.schema.domain.constants.ApiPaths.*;

/**
 * Thin client over the SocialLink REST API.
 *
 * Every call returns the status and body as they came back; error statuses are
 * not thrown. Only transport failures raise {@link ApiUnreachableException}.
 */
@Slf4j
@Component
public class SocialApiClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiBaseUrl;

    public SocialApiClient(RestTemplate smokeRestTemplate, ObjectMapper objectMapper, SmokeProperties properties) {
        this.restTemplate = smokeRestTemplate;
        this.objectMapper = objectMapper;
        this.apiBaseUrl = properties.getApiBaseUrl();
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    // Accounts

    public ApiResponse register(UserCreateRequestDto request) {
        return send(HttpMethod.POST, uri(REGISTER, Map.of()), null, request);
    }

    /**
     * Login with any payload; the harness also posts full registration bodies here.
     */
    public ApiResponse login(Object credentials) {
        return send(HttpMethod.POST, uri(LOGIN, Map.of()), null, credentials);
    }

    public ApiResponse login(UserLoginRequestDto request) {
        return login((Object) request);
    }

    public ApiResponse requestVerification(EmailVerificationRequestDto request) {
        return send(HttpMethod.POST, uri(VERIFICATION_REQUEST, Map.of()), null, request);
    }

    public ApiResponse confirmVerification(String token) {
        return send(HttpMethod.POST,
                uri(VERIFICATION_CONFIRM + "?" + TOKEN_PARAM + "={token}", Map.of("token", token)), null, null);
    }

    public ApiResponse profile(String bearerToken) {
        return send(HttpMethod.GET, uri(PROFILE, Map.of()), bearerToken, null);
    }

    // Posts

    public ApiResponse createPost(String bearerToken, PostRequestDto request) {
        return send(HttpMethod.POST, uri(POSTS, Map.of()), bearerToken, request);
    }

    public ApiResponse listPosts() {
        return send(HttpMethod.GET, uri(POSTS, Map.of()), null, null);
    }

    public ApiResponse getPost(String postId) {
        return send(HttpMethod.GET, uri(POST_BY_ID, Map.of("postId", postId)), null, null);
    }

    public ApiResponse updatePost(String bearerToken, String postId, PostRequestDto request) {
        return send(HttpMethod.PUT, uri(POST_BY_ID, Map.of("postId", postId)), bearerToken, request);
    }

    // Comments

    public ApiResponse createComment(String bearerToken, String postId, CommentRequestDto request) {
        return send(HttpMethod.POST, uri(COMMENTS + postIdQuery(), Map.of("postId", postId)), bearerToken, request);
    }

    public ApiResponse listComments(String postId) {
        return send(HttpMethod.GET, uri(COMMENTS_OF_POST, Map.of("postId", postId)), null, null);
    }

    // Likes

    public ApiResponse like(String bearerToken, String postId) {
        return send(HttpMethod.POST, uri(LIKES + postIdQuery(), Map.of("postId", postId)), bearerToken, null);
    }

    public ApiResponse unlike(String bearerToken, String postId) {
        return send(HttpMethod.DELETE, uri(LIKES + postIdQuery(), Map.of("postId", postId)), bearerToken, null);
    }

    private static String postIdQuery() {
        return "?" + POST_ID_PARAM + "={postId}";
    }

    private URI uri(String template, Map<String, ?> variables) {
        return UriComponentsBuilder.fromUriString(apiBaseUrl + template)
                .encode()
                .buildAndExpand(variables)
                .toUri();
    }

    /**
     * @param bearerToken token for the Authorization header, or null for none
     * @param body        JSON body, or null for none
     */
    private ApiResponse send(HttpMethod method, URI uri, String bearerToken, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (bearerToken != null) {
            headers.set(HttpHeaders.AUTHORIZATION, SchemaConstants.BEARER_PREFIX + bearerToken);
        }

        RequestEntity<?> request;
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
            request = new RequestEntity<>(body, headers, method, uri);
        } else {
            request = new RequestEntity<>(headers, method, uri);
        }

        log.debug("[HTTP_REQUEST] {} {} | authenticated={}", method, uri, bearerToken != null);
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(request, String.class);
        } catch (ResourceAccessException e) {
            log.warn("[HTTP_UNREACHABLE] {} {} failed | error={}", method, uri, e.getMessage());
            throw new ApiUnreachableException(apiBaseUrl, e);
        }

        ApiResponse result = new ApiResponse(response.getStatusCode().value(), response.getBody(), objectMapper);
        if (log.isDebugEnabled()) {
            log.debug("[HTTP_RESPONSE] {} {} | status={} | body={}", method, uri, result.getStatus(), result.pretty());
        }
        return result;
    }
}
