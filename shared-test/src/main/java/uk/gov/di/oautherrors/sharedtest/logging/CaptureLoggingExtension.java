package uk.gov.di.oautherrors.sharedtest.logging;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.util.List;

/** Collects the events logged by one class for the duration of each test. */
public class CaptureLoggingExtension implements BeforeEachCallback, AfterEachCallback {

    private final StubAppender appender = new StubAppender();
    private final Class<?> classUnderTest;

    public CaptureLoggingExtension(Class<?> classUnderTest) {
        this.classUnderTest = classUnderTest;
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        appender.clear();
        appender.start();
        logger().addAppender(appender);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        logger().removeAppender(appender);
        appender.stop();
    }

    public List<LogEvent> events() {
        return appender.getEvents();
    }

    private Logger logger() {
        return (Logger) LogManager.getLogger(classUnderTest);
    }
}
