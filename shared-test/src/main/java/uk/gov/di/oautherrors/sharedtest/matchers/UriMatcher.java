package uk.gov.di.oautherrors.sharedtest.matchers;

import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeDiagnosingMatcher;

import java.net.URI;
import java.util.Map;
import java.util.function.Function;

import static org.hamcrest.Matchers.equalTo;
import static uk.gov.di.oautherrors.shared.helpers.RedirectUriHelper.parseQueryParameters;

public class UriMatcher<T> extends TypeSafeDiagnosingMatcher<URI> {

    private final String name;
    private final Function<URI, T> mapper;
    private final Matcher<? super T> matcher;

    private UriMatcher(String name, Function<URI, T> mapper, Matcher<? super T> matcher) {
        this.name = name;
        this.mapper = mapper;
        this.matcher = matcher;
    }

    @Override
    protected boolean matchesSafely(URI item, Description mismatchDescription) {
        T actual = mapper.apply(item);

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
        return "a URI with " + name + ": " + value;
    }

    public static UriMatcher<String> baseUri(String expected) {
        return new UriMatcher<>(
                "base URI",
                uri -> uri.getScheme() + "://" + uri.getRawAuthority() + uri.getRawPath(),
                equalTo(expected));
    }

    public static UriMatcher<Map<String, String>> queryParameters(
            Matcher<? super Map<String, String>> expected) {
        return new UriMatcher<>(
                "query parameters", uri -> parseQueryParameters(uri.getRawQuery()), expected);
    }

    public static UriMatcher<Map<String, String>> fragmentParameters(
            Matcher<? super Map<String, String>> expected) {
        return new UriMatcher<>(
                "fragment parameters", uri -> parseQueryParameters(uri.getRawFragment()), expected);
    }

    public static UriMatcher<String> rawQuery(Matcher<String> expected) {
        return new UriMatcher<>("raw query", URI::getRawQuery, expected);
    }

    public static UriMatcher<String> rawFragment(Matcher<String> expected) {
        return new UriMatcher<>("raw fragment", URI::getRawFragment, expected);
    }
}
