package uk.gov.di.oautherrors.shared.helpers;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import org.apache.http.HttpHeaders;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds {@link APIGatewayProxyResponseEvent}s. Every step copies the event it is given, so a
 * response can be threaded through a sequence of {@code with...} calls without the caller's
 * instance changing underneath it.
 */
public final class ApiGatewayResponseHelper {

    public enum SecurityHeaders {
        XSS_PROTECTION("X-XSS-Protection", "1; mode=block"),
        CONTENT_TYPE_OPTIONS("X-Content-Type-Options", "nosniff"),
        CONTENT_SECURITY_POLICY("Content-Security-Policy", "frame-ancestors 'none'"),
        STRICT_TRANSPORT_SECURITY(
                "Strict-Transport-Security", "max-age=31536000; includeSubDomains; preload"),
        FRAME_OPTIONS("X-Frame-Options", "DENY"),
        CACHE_CONTROL(HttpHeaders.CACHE_CONTROL, "no-cache, no-store"),
        PRAGMA(HttpHeaders.PRAGMA, "no-cache");

        private final String headerName;
        private final String headerValue;

        SecurityHeaders(String headerName, String headerValue) {
            this.headerName = headerName;
            this.headerValue = headerValue;
        }

        public static Map<String, String> headers() {
            return Arrays.stream(SecurityHeaders.values())
                    .collect(Collectors.toMap(x -> x.headerName, x -> x.headerValue));
        }
    }

    private ApiGatewayResponseHelper() {}

    public static APIGatewayProxyResponseEvent generateDefaultResponse(
            boolean includeSecurityHeaders) {
        var headers = caseInsensitiveHeaders();
        if (includeSecurityHeaders) {
            headers.putAll(SecurityHeaders.headers());
        }
        return new APIGatewayProxyResponseEvent()
                .withStatusCode(200)
                .withHeaders(headers)
                .withBody("");
    }

    public static APIGatewayProxyResponseEvent withHeader(
            APIGatewayProxyResponseEvent response, String name, String value) {
        var next = copyOf(response);
        next.getHeaders().remove(name);
        next.getHeaders().put(name, value);
        if (next.getMultiValueHeaders() != null) {
            next.getMultiValueHeaders().remove(name);
        }
        return next;
    }

    public static APIGatewayProxyResponseEvent withAppendedBody(
            APIGatewayProxyResponseEvent response, String content) {
        var existing = Objects.requireNonNullElse(response.getBody(), "");
        return copyOf(response).withBody(existing + content);
    }

    public static APIGatewayProxyResponseEvent withStatus(
            APIGatewayProxyResponseEvent response, int statusCode) {
        return copyOf(response).withStatusCode(statusCode);
    }

    private static APIGatewayProxyResponseEvent copyOf(APIGatewayProxyResponseEvent response) {
        var headers = caseInsensitiveHeaders();
        if (response.getHeaders() != null) {
            headers.putAll(response.getHeaders());
        }
        Map<String, List<String>> multiValueHeaders = null;
        if (response.getMultiValueHeaders() != null) {
            multiValueHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            multiValueHeaders.putAll(response.getMultiValueHeaders());
        }
        return new APIGatewayProxyResponseEvent()
                .withStatusCode(response.getStatusCode())
                .withHeaders(headers)
                .withMultiValueHeaders(multiValueHeaders)
                .withBody(response.getBody())
                .withIsBase64Encoded(response.getIsBase64Encoded());
    }

    private static Map<String, String> caseInsensitiveHeaders() {
        return new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    }
}
