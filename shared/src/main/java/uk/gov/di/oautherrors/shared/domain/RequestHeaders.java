package uk.gov.di.oautherrors.shared.domain;

public final class RequestHeaders {

    public static final String AUTHORIZATION_HEADER = "Authorization";

    private RequestHeaders() {}
}
