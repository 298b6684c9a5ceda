package uk.gov.di.oautherrors.shared.helpers;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static uk.gov.di.oautherrors.shared.helpers.LogLineHelper.LogFieldName.AWS_REQUEST_ID;
import static uk.gov.di.oautherrors.shared.helpers.LogLineHelper.LogFieldName.ERROR_TYPE;
import static uk.gov.di.oautherrors.shared.helpers.LogLineHelper.attachLogFieldToLogs;
import static uk.gov.di.oautherrors.shared.helpers.LogLineHelper.detachLogFieldFromLogs;

class LogLineHelperTest {

    @BeforeEach
    void setup() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldAttachFieldToThreadContext() {
        attachLogFieldToLogs(ERROR_TYPE, "invalid_client");

        assertTrue(ThreadContext.containsKey(ERROR_TYPE.getLogFieldName()));
        assertEquals("invalid_client", ThreadContext.get(ERROR_TYPE.getLogFieldName()));
    }

    @Test
    void shouldAttachUnknownWhenValueIsMissing() {
        attachLogFieldToLogs(AWS_REQUEST_ID, null);

        assertEquals(LogLineHelper.UNKNOWN, ThreadContext.get(AWS_REQUEST_ID.getLogFieldName()));
    }

    @Test
    void shouldOnlyDetachTheNamedField() {
        attachLogFieldToLogs(AWS_REQUEST_ID, "aws-request-id");
        attachLogFieldToLogs(ERROR_TYPE, "server_error");

        detachLogFieldFromLogs(ERROR_TYPE);

        assertFalse(ThreadContext.containsKey(ERROR_TYPE.getLogFieldName()));
        assertEquals("aws-request-id", ThreadContext.get(AWS_REQUEST_ID.getLogFieldName()));
    }
}
