package uk.gov.di.oautherrors.api.entity;

import java.util.Objects;

import static java.lang.String.format;

/**
 * One factory per RFC 6749 failure scenario. The codes are part of the contract: a new scenario
 * gets the next unused code, existing codes are never renumbered.
 */
public final class ProtocolErrors {

    public static final int INVALID_GRANT_CODE = 1;
    public static final int UNSUPPORTED_GRANT_TYPE_CODE = 2;
    public static final int INVALID_REQUEST_CODE = 3;
    public static final int INVALID_CLIENT_CODE = 4;
    public static final int INVALID_SCOPE_CODE = 5;
    public static final int INVALID_CREDENTIALS_CODE = 6;
    public static final int SERVER_ERROR_CODE = 7;
    public static final int INVALID_REFRESH_TOKEN_CODE = 8;
    public static final int ACCESS_DENIED_CODE = 9;

    private static final String GRANT_TYPE_HINT = "Check the `grant_type` parameter";

    private ProtocolErrors() {}

    public static ProtocolError invalidGrant() {
        return new ProtocolError(
                INVALID_GRANT_CODE,
                ErrorType.INVALID_GRANT,
                400,
                "The provided authorization grant is invalid, expired, revoked, does not match "
                        + "the redirection URI used in the authorization request, or was issued to "
                        + "another client.",
                GRANT_TYPE_HINT,
                null);
    }

    public static ProtocolError unsupportedGrantType() {
        return new ProtocolError(
                UNSUPPORTED_GRANT_TYPE_CODE,
                ErrorType.UNSUPPORTED_GRANT_TYPE,
                400,
                "The authorization grant type is not supported by the authorization server.",
                GRANT_TYPE_HINT,
                null);
    }

    public static ProtocolError invalidRequest(String parameter) {
        return invalidRequest(parameter, null);
    }

    /** A {@code null} hint is replaced with one pointing at {@code parameter}. */
    public static ProtocolError invalidRequest(String parameter, String hint) {
        Objects.requireNonNull(parameter, "parameter");
        return new ProtocolError(
                INVALID_REQUEST_CODE,
                ErrorType.INVALID_REQUEST,
                400,
                "The request is missing a required parameter, includes an invalid parameter "
                        + "value, includes a parameter more than once, or is otherwise malformed.",
                Objects.requireNonNullElse(hint, format("Check the `%s` parameter", parameter)),
                null);
    }

    public static ProtocolError invalidClient() {
        return new ProtocolError(
                INVALID_CLIENT_CODE,
                ErrorType.INVALID_CLIENT,
                401,
                "Client authentication failed",
                null,
                null);
    }

    public static ProtocolError invalidScope(String scope) {
        return invalidScope(scope, null);
    }

    public static ProtocolError invalidScope(String scope, String redirectUri) {
        Objects.requireNonNull(scope, "scope");
        return new ProtocolError(
                INVALID_SCOPE_CODE,
                ErrorType.INVALID_SCOPE,
                400,
                "The requested scope is invalid, unknown, or malformed",
                format("Check the `%s` scope", scope),
                redirectUri);
    }

    public static ProtocolError invalidCredentials() {
        return new ProtocolError(
                INVALID_CREDENTIALS_CODE,
                ErrorType.INVALID_CREDENTIALS,
                401,
                "The user credentials were incorrect.",
                null,
                null);
    }

    /** The hint goes into the message; server errors never carry a separate hint. */
    public static ProtocolError serverError(String hint) {
        Objects.requireNonNull(hint, "hint");
        return new ProtocolError(
                SERVER_ERROR_CODE,
                ErrorType.SERVER_ERROR,
                500,
                "The authorization server encountered an unexpected condition which prevented "
                        + "it from fulfilling the request: "
                        + hint,
                null,
                null);
    }

    public static ProtocolError invalidRefreshToken() {
        return invalidRefreshToken(null);
    }

    public static ProtocolError invalidRefreshToken(String hint) {
        return new ProtocolError(
                INVALID_REFRESH_TOKEN_CODE,
                ErrorType.INVALID_REQUEST,
                400,
                "The refresh token is invalid.",
                hint,
                null);
    }

    public static ProtocolError accessDenied() {
        return accessDenied(ErrorDetails.none());
    }

    public static ProtocolError accessDenied(ErrorDetails details) {
        return new ProtocolError(
                ACCESS_DENIED_CODE,
                ErrorType.ACCESS_DENIED,
                401,
                "The resource owner or authorization server denied the request.",
                details.hint(),
                details.redirectUri());
    }
}
