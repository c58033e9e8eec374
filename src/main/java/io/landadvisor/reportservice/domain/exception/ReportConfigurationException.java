package io.landadvisor.reportservice.domain.exception;

/**
 * A startup precondition of the report pipeline does not hold (a font asset is missing or
 * unreadable). Fatal: the service must not start.
 */
public class ReportConfigurationException extends IllegalStateException {

    public ReportConfigurationException(String message) {
        super(message);
    }

    public ReportConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
