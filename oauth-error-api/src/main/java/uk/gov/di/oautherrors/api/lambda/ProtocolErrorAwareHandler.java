package uk.gov.di.oautherrors.api.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.nimbusds.oauth2.sdk.ResponseMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import uk.gov.di.oautherrors.api.exceptions.ProtocolErrorException;
import uk.gov.di.oautherrors.api.services.ProtocolErrorResponseService;

import java.util.Optional;

import static uk.gov.di.oautherrors.shared.domain.RequestParameters.RESPONSE_MODE;
import static uk.gov.di.oautherrors.shared.helpers.LogLineHelper.LogFieldName.AWS_REQUEST_ID;
import static uk.gov.di.oautherrors.shared.helpers.LogLineHelper.LogFieldName.ERROR_CODE;
import static uk.gov.di.oautherrors.shared.helpers.LogLineHelper.LogFieldName.ERROR_TYPE;
import static uk.gov.di.oautherrors.shared.helpers.LogLineHelper.attachLogFieldToLogs;
import static uk.gov.di.oautherrors.shared.helpers.LogLineHelper.detachLogFieldFromLogs;
import static uk.gov.di.oautherrors.shared.helpers.RequestHeaderHelper.getQueryParameter;

/**
 * Base for handlers that signal OAuth failures by throwing {@link ProtocolErrorException}. The
 * exception is turned into the error response here, using the inbound request for the
 * authentication challenge. Any other exception is left to propagate.
 */
public abstract class ProtocolErrorAwareHandler
        implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private static final Logger LOG = LogManager.getLogger(ProtocolErrorAwareHandler.class);

    protected final ProtocolErrorResponseService protocolErrorResponseService;

    protected ProtocolErrorAwareHandler() {
        this(new ProtocolErrorResponseService());
    }

    protected ProtocolErrorAwareHandler(
            ProtocolErrorResponseService protocolErrorResponseService) {
        this.protocolErrorResponseService = protocolErrorResponseService;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(
            APIGatewayProxyRequestEvent input, Context context) {
        attachLogFieldToLogs(AWS_REQUEST_ID, context.getAwsRequestId());
        try {
            return handleRequestWithProtocolErrors(input, context);
        } catch (ProtocolErrorException e) {
            var error = e.getProtocolError();
            attachLogFieldToLogs(ERROR_TYPE, error.errorType().getValue());
            attachLogFieldToLogs(ERROR_CODE, String.valueOf(error.code()));
            try {
                LOG.info("Handler {} raised a protocol error", getClass().getName());
                return protocolErrorResponseService.generateHttpResponse(
                        error, Optional.empty(), Optional.ofNullable(input), useFragment(input));
            } finally {
                detachLogFieldFromLogs(ERROR_TYPE);
                detachLogFieldFromLogs(ERROR_CODE);
            }
        }
    }

    public abstract APIGatewayProxyResponseEvent handleRequestWithProtocolErrors(
            APIGatewayProxyRequestEvent input, Context context);

    protected boolean useFragment(APIGatewayProxyRequestEvent input) {
        return Optional.ofNullable(input)
                .flatMap(request -> getQueryParameter(request, RESPONSE_MODE))
                .filter(ResponseMode.FRAGMENT.getValue()::equals)
                .isPresent();
    }
}
