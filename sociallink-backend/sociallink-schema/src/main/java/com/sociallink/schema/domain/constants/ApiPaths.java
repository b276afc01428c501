package com.sociallink.schema.domain.constants;

/**
 * Endpoint paths relative to the API base path (e.g. {@code http://host:8000/api}).
 */
public final class ApiPaths {

    private ApiPaths() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    public static final String DEFAULT_API_PATH = "/api";

    // Accounts
    public static final String REGISTER = "/register";
    public static final String LOGIN = "/login";
    public static final String PROFILE = "/profile";
    public static final String VERIFICATION_REQUEST = "/email-verification/request";
    public static final String VERIFICATION_CONFIRM = "/email-verification/confirm";

    // Posts
    public static final String POSTS = "/posts";
    public static final String POST_BY_ID = "/posts/{postId}";

    // Comments: created with ?post_id=, listed under the post id itself
    public static final String COMMENTS = "/comments";
    public static final String COMMENTS_OF_POST = "/{postId}/comments";

    // Likes: both calls take ?post_id=
    public static final String LIKES = "/likes";

    public static final String TOKEN_PARAM = "token";
    public static final String POST_ID_PARAM = "post_id";
}
