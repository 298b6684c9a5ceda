package uk.gov.di.oautherrors.shared.helpers;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import org.apache.http.HttpHeaders;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.aMapWithSize;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.collection.IsMapContaining.hasEntry;
import static org.hamcrest.collection.IsMapContaining.hasKey;
import static org.hamcrest.core.IsNot.not;

class ApiGatewayResponseHelperTest {

    @Test
    void shouldAddDefaultSecurityHeadersToDefaultResponse() {
        APIGatewayProxyResponseEvent result =
                ApiGatewayResponseHelper.generateDefaultResponse(true);

        assertThat(result.getHeaders(), hasEntry(HttpHeaders.CACHE_CONTROL, "no-cache, no-store"));
        assertThat(result.getHeaders(), hasEntry(HttpHeaders.PRAGMA, "no-cache"));
        assertThat(result.getHeaders(), hasEntry("X-XSS-Protection", "1; mode=block"));
        assertThat(result.getHeaders(), hasEntry("X-Content-Type-Options", "nosniff"));
        assertThat(
                result.getHeaders(), hasEntry("Content-Security-Policy", "frame-ancestors 'none'"));
        assertThat(
                result.getHeaders(),
                hasEntry("Strict-Transport-Security", "max-age=31536000; includeSubDomains; preload"));
        assertThat(result.getHeaders(), hasEntry("X-Frame-Options", "DENY"));
        assertThat(result.getBody(), equalTo(""));
    }

    @Test
    void shouldLeaveOutSecurityHeadersWhenNotRequested() {
        var result = ApiGatewayResponseHelper.generateDefaultResponse(false);

        assertThat(result.getHeaders(), aMapWithSize(0));
    }

    @Test
    void shouldReplaceHeaderRegardlessOfCase() {
        var response =
                new APIGatewayProxyResponseEvent()
                        .withHeaders(new HashMap<>(Map.of("content-type", "text/html")));

        var result =
                ApiGatewayResponseHelper.withHeader(
                        response, HttpHeaders.CONTENT_TYPE, "application/json");

        assertThat(result.getHeaders(), aMapWithSize(1));
        assertThat(result.getHeaders(), hasEntry("Content-Type", "application/json"));
    }

    @Test
    void shouldDropSameNamedMultiValueHeaderWhenSettingHeader() {
        var response =
                new APIGatewayProxyResponseEvent()
                        .withHeaders(new HashMap<>())
                        .withMultiValueHeaders(
                                new HashMap<>(
                                        Map.of(
                                                "content-type", List.of("text/html"),
                                                "Vary", List.of("Origin"))));

        var result =
                ApiGatewayResponseHelper.withHeader(
                        response, HttpHeaders.CONTENT_TYPE, "application/json");

        assertThat(result.getHeaders(), hasEntry("Content-Type", "application/json"));
        assertThat(result.getMultiValueHeaders(), not(hasKey("Content-Type")));
        assertThat(result.getMultiValueHeaders(), hasKey("Vary"));
        assertThat(response.getMultiValueHeaders(), hasKey("content-type"));
    }

    @Test
    void shouldNotChangeTheResponseItWasGiven() {
        var response =
                new APIGatewayProxyResponseEvent()
                        .withStatusCode(200)
                        .withHeaders(new HashMap<>())
                        .withBody("abc");

        var withHeader = ApiGatewayResponseHelper.withHeader(response, "Location", "/cb");
        var withBody = ApiGatewayResponseHelper.withAppendedBody(withHeader, "def");
        var withStatus = ApiGatewayResponseHelper.withStatus(withBody, 400);

        assertThat(response.getHeaders(), not(hasKey("Location")));
        assertThat(response.getBody(), equalTo("abc"));
        assertThat(response.getStatusCode(), equalTo(200));
        assertThat(withStatus.getHeaders(), hasEntry("Location", "/cb"));
        assertThat(withStatus.getBody(), equalTo("abcdef"));
        assertThat(withStatus.getStatusCode(), equalTo(400));
    }

    @Test
    void shouldAppendToMissingBody() {
        var result =
                ApiGatewayResponseHelper.withAppendedBody(
                        new APIGatewayProxyResponseEvent(), "{}");

        assertThat(result.getBody(), equalTo("{}"));
    }
}
