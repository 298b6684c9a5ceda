package uk.gov.di.oautherrors.api.entity;

import java.util.Arrays;
import java.util.Optional;

import static java.lang.String.format;

public enum AuthenticationScheme {
    BEARER("Bearer"),
    MAC("MAC"),
    BASIC("Basic");

    private final String value;

    AuthenticationScheme(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public String challenge(String realm) {
        return format("%s realm=\"%s\"", value, realm);
    }

    // Prefix match is case-sensitive and checked in declaration order.
    public static Optional<AuthenticationScheme> fromAuthorizationHeader(String headerValue) {
        if (headerValue == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(scheme -> headerValue.startsWith(scheme.value))
                .findFirst();
    }
}
