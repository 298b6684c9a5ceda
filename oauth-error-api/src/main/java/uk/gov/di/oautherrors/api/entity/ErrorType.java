package uk.gov.di.oautherrors.api.entity;

import com.nimbusds.oauth2.sdk.OAuth2Error;

public enum ErrorType {
    INVALID_GRANT(OAuth2Error.INVALID_GRANT_CODE),
    UNSUPPORTED_GRANT_TYPE(OAuth2Error.UNSUPPORTED_GRANT_TYPE_CODE),
    INVALID_REQUEST(OAuth2Error.INVALID_REQUEST_CODE),
    INVALID_CLIENT(OAuth2Error.INVALID_CLIENT_CODE),
    INVALID_SCOPE(OAuth2Error.INVALID_SCOPE_CODE),
    INVALID_CREDENTIALS("invalid_credentials"),
    SERVER_ERROR(OAuth2Error.SERVER_ERROR_CODE),
    ACCESS_DENIED(OAuth2Error.ACCESS_DENIED_CODE);

    private final String value;

    ErrorType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
