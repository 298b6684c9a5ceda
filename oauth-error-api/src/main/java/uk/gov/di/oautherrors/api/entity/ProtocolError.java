package uk.gov.di.oautherrors.api.entity;

import com.nimbusds.oauth2.sdk.ErrorObject;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A classified OAuth 2.0 failure, ready to be rendered. Build one with {@link ProtocolErrors}.
 *
 * <p>{@code code} identifies the failure scenario and never appears on the wire. {@code
 * errorType}, {@code message} and {@code hint} become the {@code error}, {@code message} and
 * {@code hint} fields of the response body. When {@code redirectUri} is set the same fields are
 * also merged into that URI and sent back in the {@code Location} header.
 */
public record ProtocolError(
        int code,
        ErrorType errorType,
        int httpStatusCode,
        String message,
        String hint,
        String redirectUri) {

    private static final Set<Integer> SUPPORTED_STATUS_CODES = Set.of(400, 401, 500);

    public ProtocolError {
        Objects.requireNonNull(errorType, "errorType");
        if (!SUPPORTED_STATUS_CODES.contains(httpStatusCode)) {
            throw new IllegalArgumentException(
                    "Unsupported HTTP status for a protocol error: " + httpStatusCode);
        }
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("Protocol error message must not be empty");
        }
    }

    public Optional<String> getHint() {
        return Optional.ofNullable(hint);
    }

    public Optional<String> getRedirectUri() {
        return Optional.ofNullable(redirectUri);
    }

    public boolean isRedirect() {
        return redirectUri != null;
    }

    public ErrorObject toErrorObject() {
        return new ErrorObject(errorType.getValue(), message, httpStatusCode);
    }
}
