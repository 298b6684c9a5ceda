package uk.gov.di.oautherrors.api.services;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent.ProxyRequestContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oautherrors.api.entity.AuthenticationScheme;
import uk.gov.di.oautherrors.shared.services.ConfigurationService;

import java.util.Optional;

import static uk.gov.di.oautherrors.shared.domain.RequestHeaders.AUTHORIZATION_HEADER;
import static uk.gov.di.oautherrors.shared.helpers.RequestHeaderHelper.getFirstHeaderValue;

/**
 * Works out which authentication scheme a client used, so that a failed client authentication
 * can be answered with a matching {@code WWW-Authenticate} challenge (RFC 6749 section 5.2).
 *
 * <p>Credentials the gateway authorizer already extracted from HTTP Basic authentication take
 * priority over the raw {@code Authorization} header.
 */
public class AuthenticationSchemeDetector {

    private static final Logger LOG = LogManager.getLogger(AuthenticationSchemeDetector.class);

    private final ConfigurationService configurationService;

    public AuthenticationSchemeDetector(ConfigurationService configurationService) {
        this.configurationService = configurationService;
    }

    public Optional<AuthenticationScheme> detect(APIGatewayProxyRequestEvent request) {
        if (hasBasicAuthUser(request)) {
            LOG.info("Client authenticated with basic auth parameters");
            return Optional.of(AuthenticationScheme.BASIC);
        }
        var scheme =
                getFirstHeaderValue(
                                request,
                                AUTHORIZATION_HEADER,
                                configurationService.getHeadersCaseInsensitive())
                        .flatMap(AuthenticationScheme::fromAuthorizationHeader);
        if (scheme.isEmpty()) {
            LOG.info("No recognised authentication scheme on request");
        }
        return scheme;
    }

    private boolean hasBasicAuthUser(APIGatewayProxyRequestEvent request) {
        return Optional.ofNullable(request.getRequestContext())
                .map(ProxyRequestContext::getAuthorizer)
                .map(authorizer -> authorizer.get(configurationService.getBasicAuthUserParameter()))
                .isPresent();
    }
}
