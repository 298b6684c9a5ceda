package uk.gov.di.oautherrors.api.exceptions;

public class ProtocolErrorRenderingException extends RuntimeException {

    public ProtocolErrorRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
