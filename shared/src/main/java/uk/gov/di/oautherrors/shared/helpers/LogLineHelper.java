package uk.gov.di.oautherrors.shared.helpers;

import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;

public class LogLineHelper {

    public static final String UNKNOWN = "unknown";

    public enum LogFieldName {
        AWS_REQUEST_ID("awsRequestId"),
        ERROR_TYPE("errorType"),
        ERROR_CODE("errorCode");

        private final String logFieldName;

        LogFieldName(String fieldName) {
            this.logFieldName = fieldName;
        }

        public String getLogFieldName() {
            return logFieldName;
        }
    }

    public static void attachLogFieldToLogs(LogFieldName logFieldName, String value) {
        ThreadContext.put(
                logFieldName.getLogFieldName(), Objects.requireNonNullElse(value, UNKNOWN));
    }

    public static void detachLogFieldFromLogs(LogFieldName logFieldName) {
        ThreadContext.remove(logFieldName.getLogFieldName());
    }
}
