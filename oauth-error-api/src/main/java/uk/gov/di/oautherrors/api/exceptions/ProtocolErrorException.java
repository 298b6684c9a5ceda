package uk.gov.di.oautherrors.api.exceptions;

import uk.gov.di.oautherrors.api.entity.ProtocolError;

public class ProtocolErrorException extends RuntimeException {

    private final ProtocolError protocolError;

    public ProtocolErrorException(ProtocolError protocolError) {
        super(protocolError.message());
        this.protocolError = protocolError;
    }

    public ProtocolErrorException(ProtocolError protocolError, Throwable cause) {
        super(protocolError.message(), cause);
        this.protocolError = protocolError;
    }

    public ProtocolError getProtocolError() {
        return protocolError;
    }
}
