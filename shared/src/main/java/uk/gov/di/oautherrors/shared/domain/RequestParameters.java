package uk.gov.di.oautherrors.shared.domain;

public final class RequestParameters {

    public static final String RESPONSE_MODE = "response_mode";

    private RequestParameters() {}
}
