package uk.gov.di.oautherrors.shared.helpers;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class RequestHeaderHelper {

    private RequestHeaderHelper() {}

    public static Optional<String> getOptionalHeaderValueFromHeaders(
            Map<String, String> headers, String headerName, boolean matchCaseInsensitive) {
        return lookup(headers, headerName, matchCaseInsensitive);
    }

    /**
     * Returns the first value sent for {@code headerName}. Multi-value headers are checked before
     * single-value ones since API Gateway keeps the order the client sent them in there.
     */
    public static Optional<String> getFirstHeaderValue(
            APIGatewayProxyRequestEvent request, String headerName, boolean matchCaseInsensitive) {
        var fromMultiValue =
                lookup(request.getMultiValueHeaders(), headerName, matchCaseInsensitive)
                        .filter(values -> !values.isEmpty())
                        .map(values -> values.get(0));
        if (fromMultiValue.isPresent()) {
            return fromMultiValue;
        }
        return getOptionalHeaderValueFromHeaders(
                request.getHeaders(), headerName, matchCaseInsensitive);
    }

    public static Optional<String> getQueryParameter(
            APIGatewayProxyRequestEvent request, String parameterName) {
        return lookup(request.getQueryStringParameters(), parameterName, false);
    }

    private static <V> Optional<V> lookup(
            Map<String, V> values, String name, boolean matchCaseInsensitive) {
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        } else if (values.containsKey(name)) {
            return Optional.ofNullable(values.get(name));
        } else if (matchCaseInsensitive) {
            return values.entrySet().stream()
                    .filter(entry -> name.equalsIgnoreCase(entry.getKey()))
                    .map(Map.Entry::getValue)
                    .filter(Objects::nonNull)
                    .findFirst();
        } else {
            return Optional.empty();
        }
    }
}
