package uk.gov.di.oautherrors.sharedtest.helper;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent.ProxyRequestContext;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class RequestEventHelper {

    private RequestEventHelper() {}

    public static APIGatewayProxyRequestEvent requestWithAuthorizationHeader(String value) {
        return new APIGatewayProxyRequestEvent().withHeaders(Map.of("Authorization", value));
    }

    public static APIGatewayProxyRequestEvent requestWithMultiValueAuthorizationHeader(
            String... values) {
        return new APIGatewayProxyRequestEvent()
                .withMultiValueHeaders(Map.of("Authorization", List.of(values)));
    }

    public static APIGatewayProxyRequestEvent requestWithAuthorizerParameter(
            String name, Object value) {
        Map<String, Object> authorizer = new HashMap<>();
        authorizer.put(name, value);
        var requestContext = new ProxyRequestContext();
        requestContext.setAuthorizer(authorizer);
        return new APIGatewayProxyRequestEvent().withRequestContext(requestContext);
    }
}
