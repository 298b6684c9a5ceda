package uk.gov.di.oautherrors.shared.helpers;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static uk.gov.di.oautherrors.shared.helpers.RequestHeaderHelper.getFirstHeaderValue;
import static uk.gov.di.oautherrors.shared.helpers.RequestHeaderHelper.getOptionalHeaderValueFromHeaders;
import static uk.gov.di.oautherrors.shared.helpers.RequestHeaderHelper.getQueryParameter;

class RequestHeaderHelperTest {

    private static final Map<String, String> MAP_ONE_ENTRY_UPPER_CASE =
            Map.of("Authorization", "Bearer abc123");
    private static final Map<String, String> MAP_ONE_ENTRY_LOWER_CASE =
            Map.of("authorization", "Bearer abc123");
    private static final Map<String, String> MAP_ONE_ENTRY_MIXED_CASE =
            Map.of("AUTHORIZATION", "Bearer abc123");

    private static Stream<Arguments> headersTestParameters() {
        return Stream.of(
                arguments(null, "Authorization", false, null),
                arguments(null, "Authorization", true, null),
                arguments(Collections.emptyMap(), "Authorization", false, null),
                arguments(Collections.emptyMap(), "Authorization", true, null),
                arguments(MAP_ONE_ENTRY_UPPER_CASE, "Missing-Header", false, null),
                arguments(MAP_ONE_ENTRY_UPPER_CASE, "Missing-Header", true, null),
                arguments(MAP_ONE_ENTRY_UPPER_CASE, "Authorization", false, "Bearer abc123"),
                arguments(MAP_ONE_ENTRY_UPPER_CASE, "Authorization", true, "Bearer abc123"),
                arguments(MAP_ONE_ENTRY_LOWER_CASE, "Authorization", false, null),
                arguments(MAP_ONE_ENTRY_LOWER_CASE, "Authorization", true, "Bearer abc123"),
                arguments(MAP_ONE_ENTRY_MIXED_CASE, "Authorization", false, null),
                arguments(MAP_ONE_ENTRY_MIXED_CASE, "Authorization", true, "Bearer abc123"));
    }

    @ParameterizedTest
    @MethodSource("headersTestParameters")
    void testGetOptionalHeaderValueFromHeaders(
            Map<String, String> headers,
            String headerName,
            boolean matchCaseInsensitive,
            String expectedValue) {
        assertEquals(
                Optional.ofNullable(expectedValue),
                getOptionalHeaderValueFromHeaders(headers, headerName, matchCaseInsensitive));
    }

    @Test
    void shouldPreferFirstMultiValueHeader() {
        var request =
                new APIGatewayProxyRequestEvent()
                        .withHeaders(Map.of("Authorization", "Basic abc"))
                        .withMultiValueHeaders(
                                Map.of("authorization", List.of("MAC id=1", "Bearer xyz")));

        assertEquals(Optional.of("MAC id=1"), getFirstHeaderValue(request, "Authorization", true));
    }

    @Test
    void shouldFallBackToSingleValueHeaders() {
        var request =
                new APIGatewayProxyRequestEvent()
                        .withHeaders(Map.of("Authorization", "Basic abc"))
                        .withMultiValueHeaders(Map.of("Authorization", List.of()));

        assertEquals(Optional.of("Basic abc"), getFirstHeaderValue(request, "Authorization", true));
    }

    @Test
    void shouldReturnEmptyWhenRequestHasNoHeaders() {
        assertEquals(
                Optional.empty(),
                getFirstHeaderValue(new APIGatewayProxyRequestEvent(), "Authorization", true));
    }

    @Test
    void shouldReadQueryParameter() {
        var request =
                new APIGatewayProxyRequestEvent()
                        .withQueryStringParameters(Map.of("response_mode", "fragment"));

        assertEquals(Optional.of("fragment"), getQueryParameter(request, "response_mode"));
        assertEquals(Optional.empty(), getQueryParameter(request, "state"));
    }
}
