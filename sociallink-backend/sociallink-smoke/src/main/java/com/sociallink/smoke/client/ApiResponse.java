package com.sociallink.smoke.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.sociallink.smoke.domain.exception.SmokeAssertionException;
import org.springframework.http.HttpStatusCode;

/**
 * Status and raw body of one API call. The body is parsed on demand.
 */
public class ApiResponse {

    private final int status;
    private final String body;
    private final ObjectMapper objectMapper;
    private JsonNode json;

    public ApiResponse(int status, String body, ObjectMapper objectMapper) {
        this.status = status;
        this.body = body == null ? "" : body;
        this.objectMapper = objectMapper;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public boolean is2xxSuccessful() {
        return HttpStatusCode.valueOf(status).is2xxSuccessful();
    }

    /**
     * Body as a JSON tree; a missing node for an empty body.
     *
     * @throws SmokeAssertionException if the body is not JSON
     */
    public JsonNode json() {
        if (json == null) {
            if (body.isBlank()) {
                json = MissingNode.getInstance();
            } else {
                try {
                    json = objectMapper.readTree(body);
                } catch (JsonProcessingException e) {
                    throw new SmokeAssertionException("Response is not valid JSON (status " + status + "): " + body, e);
                }
            }
        }
        return json;
    }

    /**
     * Binds the body to a payload type.
     *
     * @throws SmokeAssertionException if the body does not bind
     */
    public <T> T readBody(Class<T> type) {
        try {
            return objectMapper.treeToValue(json(), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SmokeAssertionException(
                    "Response does not match " + type.getSimpleName() + " (status " + status + "): " + body, e);
        }
    }

    /**
     * The {@code detail} message of an error body, or an empty string.
     */
    public String detail() {
        if (body.isBlank()) {
            return "";
        }
        JsonNode detail = json().path("detail");
        return detail.isTextual() ? detail.asText() : "";
    }

    public String pretty() {
        if (body.isBlank()) {
            return "<empty>";
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(json());
        } catch (JsonProcessingException | SmokeAssertionException e) {
            return body;
        }
    }
}
