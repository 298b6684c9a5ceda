package uk.gov.di.oautherrors.sharedtest.matchers;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import org.apache.http.HttpHeaders;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeDiagnosingMatcher;

import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

public class APIGatewayProxyResponseEventMatcher<T>
        extends TypeSafeDiagnosingMatcher<APIGatewayProxyResponseEvent> {

    private final String name;
    private final Function<APIGatewayProxyResponseEvent, T> mapper;
    private final Matcher<T> matcher;

    private APIGatewayProxyResponseEventMatcher(
            String name, Function<APIGatewayProxyResponseEvent, T> mapper, Matcher<T> matcher) {
        this.name = name;
        this.mapper = mapper;
        this.matcher = matcher;
    }

    @Override
    protected boolean matchesSafely(
            APIGatewayProxyResponseEvent item, Description mismatchDescription) {
        var actual = mapper.apply(item);

        boolean matched = matcher.matches(actual);

        if (!matched) {
            mismatchDescription.appendText(description(actual));
        }

        return matched;
    }

    @Override
    public void describeTo(Description description) {
        description.appendText(name + " ").appendDescriptionOf(matcher);
    }

    private String description(T value) {
        return "an APIGatewayProxyResponseEvent with " + name + ": " + value;
    }

    public static APIGatewayProxyResponseEventMatcher<Integer> hasStatus(int statusCode) {
        return new APIGatewayProxyResponseEventMatcher<>(
                "status code", APIGatewayProxyResponseEvent::getStatusCode, equalTo(statusCode));
    }

    public static APIGatewayProxyResponseEventMatcher<String> hasBody(String body) {
        return new APIGatewayProxyResponseEventMatcher<>(
                "body", APIGatewayProxyResponseEvent::getBody, equalTo(body));
    }

    public static APIGatewayProxyResponseEventMatcher<String> hasHeader(
            String headerName, String value) {
        return hasHeader(headerName, equalTo(value));
    }

    public static APIGatewayProxyResponseEventMatcher<String> hasHeader(
            String headerName, Matcher<String> value) {
        return new APIGatewayProxyResponseEventMatcher<>(
                "header " + headerName, response -> header(response, headerName), value);
    }

    public static APIGatewayProxyResponseEventMatcher<String> doesNotHaveHeader(
            String headerName) {
        return new APIGatewayProxyResponseEventMatcher<>(
                "header " + headerName,
                response -> header(response, headerName),
                nullValue(String.class));
    }

    public static APIGatewayProxyResponseEventMatcher<URI> isRedirectTo(Matcher<URI> expected) {
        return new APIGatewayProxyResponseEventMatcher<>(
                "redirect to",
                response ->
                        Optional.ofNullable(header(response, HttpHeaders.LOCATION))
                                .map(URI::create)
                                .orElse(null),
                expected);
    }

    private static String header(APIGatewayProxyResponseEvent response, String headerName) {
        var headers = response.getHeaders();
        if (headers == null) {
            return null;
        }
        return headers.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(headerName))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }
}
