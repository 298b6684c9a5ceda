package uk.gov.di.oautherrors.sharedtest.logging;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

import java.util.Arrays;

public class LogEventMatcher {

    private LogEventMatcher() {}

    public static Matcher<LogEvent> hasContextData(String key, String value) {
        return new TypeSafeMatcher<>() {

            @Override
            protected boolean matchesSafely(LogEvent item) {
                return item.getContextData().containsKey(key)
                        && item.getContextData().getValue(key).equals(value);
            }

            @Override
            public void describeTo(Description description) {
                description.appendText(
                        "a log event with ContextData property [" + key + ", " + value + "]");
            }
        };
    }

    public static Matcher<LogEvent> withLevel(Level level) {
        return new TypeSafeMatcher<>() {

            @Override
            protected boolean matchesSafely(LogEvent item) {
                return level.equals(item.getLevel());
            }

            @Override
            public void describeTo(Description description) {
                description.appendText("a log event at level [" + level + "]");
            }
        };
    }

    public static Matcher<LogEvent> withMessageContaining(String... values) {
        return new TypeSafeMatcher<>() {

            @Override
            protected boolean matchesSafely(LogEvent item) {
                var message = item.getMessage().getFormattedMessage();

                return Arrays.stream(values).allMatch(message::contains);
            }

            @Override
            public void describeTo(Description description) {
                description.appendText(
                        "a log event with message containing " + Arrays.asList(values));
            }
        };
    }
}
