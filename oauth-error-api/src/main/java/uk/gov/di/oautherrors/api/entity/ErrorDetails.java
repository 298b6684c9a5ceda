package uk.gov.di.oautherrors.api.entity;

/**
 * The optional parts of a {@link ProtocolError}. Start from {@link #none()} and add what the
 * failure needs.
 */
public record ErrorDetails(String hint, String redirectUri) {

    private static final ErrorDetails NONE = new ErrorDetails(null, null);

    public static ErrorDetails none() {
        return NONE;
    }

    public ErrorDetails withHint(String hint) {
        return new ErrorDetails(hint, redirectUri);
    }

    public ErrorDetails withRedirectUri(String redirectUri) {
        return new ErrorDetails(hint, redirectUri);
    }
}
