package uk.gov.di.oautherrors.shared.services;

public class SystemService {
    String getOrDefault(String key, String defaultValue) {
        return System.getenv().getOrDefault(key, defaultValue);
    }
}
