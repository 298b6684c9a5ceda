package uk.gov.di.oautherrors.shared.exceptions;

public class InvalidRedirectUriException extends RuntimeException {

    public InvalidRedirectUriException(String message, Throwable cause) {
        super(message, cause);
    }
}
