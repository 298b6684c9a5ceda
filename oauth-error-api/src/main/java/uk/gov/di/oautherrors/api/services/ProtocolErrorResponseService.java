package uk.gov.di.oautherrors.api.services;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.nimbusds.oauth2.sdk.ResponseMode;
import org.apache.http.HttpHeaders;
import org.apache.http.entity.ContentType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oautherrors.api.entity.ErrorType;
import uk.gov.di.oautherrors.api.entity.ProtocolError;
import uk.gov.di.oautherrors.api.exceptions.ProtocolErrorRenderingException;
import uk.gov.di.oautherrors.shared.serialization.Json;
import uk.gov.di.oautherrors.shared.serialization.Json.JsonException;
import uk.gov.di.oautherrors.shared.services.ConfigurationService;
import uk.gov.di.oautherrors.shared.services.SerializationService;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static uk.gov.di.oautherrors.shared.helpers.ApiGatewayResponseHelper.generateDefaultResponse;
import static uk.gov.di.oautherrors.shared.helpers.ApiGatewayResponseHelper.withAppendedBody;
import static uk.gov.di.oautherrors.shared.helpers.ApiGatewayResponseHelper.withHeader;
import static uk.gov.di.oautherrors.shared.helpers.ApiGatewayResponseHelper.withStatus;
import static uk.gov.di.oautherrors.shared.helpers.RedirectUriHelper.withFragmentParameters;
import static uk.gov.di.oautherrors.shared.helpers.RedirectUriHelper.withQueryParameters;

/**
 * Renders a {@link ProtocolError} as an HTTP response.
 *
 * <p>The body is always the JSON payload {@code {"error", "message", "hint"}}, with {@code hint}
 * left out when the error has none. Errors carrying a redirect URI also get a {@code Location}
 * header: the same payload merged into the URI's query string, or into its fragment when fragment
 * delivery is asked for. The body is written in that case too.
 *
 * <p>An {@code invalid_client} error rendered with the inbound request gets a {@code
 * WWW-Authenticate} challenge for the scheme the client tried to authenticate with.
 */
public class ProtocolErrorResponseService {

    private static final Logger LOG = LogManager.getLogger(ProtocolErrorResponseService.class);

    public static final String ERROR_FIELD = "error";
    public static final String MESSAGE_FIELD = "message";
    public static final String HINT_FIELD = "hint";

    private final ConfigurationService configurationService;
    private final AuthenticationSchemeDetector authenticationSchemeDetector;
    private final Json objectMapper;

    public ProtocolErrorResponseService() {
        this(ConfigurationService.getInstance());
    }

    public ProtocolErrorResponseService(ConfigurationService configurationService) {
        this(
                configurationService,
                new AuthenticationSchemeDetector(configurationService),
                SerializationService.getInstance());
    }

    public ProtocolErrorResponseService(
            ConfigurationService configurationService,
            AuthenticationSchemeDetector authenticationSchemeDetector,
            Json objectMapper) {
        this.configurationService = configurationService;
        this.authenticationSchemeDetector = authenticationSchemeDetector;
        this.objectMapper = objectMapper;
    }

    public APIGatewayProxyResponseEvent generateHttpResponse(ProtocolError error) {
        return generateHttpResponse(error, Optional.empty(), Optional.empty(), false);
    }

    public APIGatewayProxyResponseEvent generateHttpResponse(
            ProtocolError error, boolean useFragment) {
        return generateHttpResponse(error, Optional.empty(), Optional.empty(), useFragment);
    }

    public APIGatewayProxyResponseEvent generateHttpResponseWithResponseMode(
            ProtocolError error, ResponseMode responseMode) {
        var useFragment = ResponseMode.FRAGMENT.equals(responseMode);
        return generateHttpResponse(error, Optional.empty(), Optional.empty(), useFragment);
    }

    public APIGatewayProxyResponseEvent generateHttpResponse(
            ProtocolError error, APIGatewayProxyRequestEvent request) {
        return generateHttpResponse(error, Optional.empty(), Optional.ofNullable(request), false);
    }

    public APIGatewayProxyResponseEvent generateHttpResponse(
            ProtocolError error,
            Optional<APIGatewayProxyResponseEvent> existingResponse,
            Optional<APIGatewayProxyRequestEvent> request,
            boolean useFragment) {
        logError(error);

        var includeSecurityHeaders = configurationService.isSecurityHeadersEnabled();
        var response =
                existingResponse.orElseGet(() -> generateDefaultResponse(includeSecurityHeaders));
        var headers = getHttpHeaders(error, request);
        var payload = getPayload(error);

        error.getRedirectUri()
                .ifPresent(
                        redirectUri ->
                                headers.put(
                                        HttpHeaders.LOCATION,
                                        useFragment
                                                ? withFragmentParameters(redirectUri, payload)
                                                : withQueryParameters(redirectUri, payload)));

        var body = serialize(payload);

        for (Map.Entry<String, String> header : headers.entrySet()) {
            response = withHeader(response, header.getKey(), header.getValue());
        }
        response = withAppendedBody(response, body);
        return withStatus(response, error.httpStatusCode());
    }

    public Map<String, String> getHttpHeaders(ProtocolError error) {
        return getHttpHeaders(error, Optional.empty());
    }

    public Map<String, String> getHttpHeaders(
            ProtocolError error, Optional<APIGatewayProxyRequestEvent> request) {
        var headers = new LinkedHashMap<String, String>();
        headers.put(HttpHeaders.CONTENT_TYPE, ContentType.APPLICATION_JSON.getMimeType());

        if (error.errorType() == ErrorType.INVALID_CLIENT) {
            request.flatMap(authenticationSchemeDetector::detect)
                    .map(scheme -> scheme.challenge(configurationService.getAuthenticationRealm()))
                    .ifPresent(challenge -> headers.put(HttpHeaders.WWW_AUTHENTICATE, challenge));
        }
        return headers;
    }

    public Map<String, String> getPayload(ProtocolError error) {
        var payload = new LinkedHashMap<String, String>();
        payload.put(ERROR_FIELD, error.errorType().getValue());
        payload.put(MESSAGE_FIELD, error.message());
        error.getHint().ifPresent(hint -> payload.put(HINT_FIELD, hint));
        return payload;
    }

    private String serialize(Map<String, String> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonException e) {
            throw new ProtocolErrorRenderingException("Unable to serialize error payload", e);
        }
    }

    private void logError(ProtocolError error) {
        if (error.httpStatusCode() >= 500) {
            LOG.error(
                    "Returning {} error response (code {}, status {})",
                    error.errorType().getValue(),
                    error.code(),
                    error.httpStatusCode());
        } else {
            LOG.warn(
                    "Returning {} error response (code {}, status {})",
                    error.errorType().getValue(),
                    error.code(),
                    error.httpStatusCode());
        }
        error.getHint().ifPresent(hint -> LOG.debug("Error hint: {}", hint));
    }
}
