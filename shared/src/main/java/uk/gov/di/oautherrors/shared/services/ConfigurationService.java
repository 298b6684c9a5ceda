package uk.gov.di.oautherrors.shared.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class ConfigurationService {

    private static final Logger LOG = LogManager.getLogger(ConfigurationService.class);
    public static final String FEATURE_SWITCH_ON = "true";
    private static ConfigurationService configurationService;

    public static ConfigurationService getInstance() {
        if (configurationService == null) {
            configurationService = new ConfigurationService();
        }
        return configurationService;
    }

    protected SystemService systemService;

    public ConfigurationService() {
        this(new SystemService());
    }

    public ConfigurationService(SystemService systemService) {
        this.systemService = systemService;
    }

    // Please keep the method names in alphabetical order so we can find stuff more easily.
    public String getAuthenticationRealm() {
        return getNonBlankOrDefault("AUTHENTICATION_REALM", "OAuth");
    }

    public String getBasicAuthUserParameter() {
        return getNonBlankOrDefault("BASIC_AUTH_USER_PARAMETER", "basicAuthUser");
    }

    public boolean getHeadersCaseInsensitive() {
        return Boolean.parseBoolean(
                systemService.getOrDefault("HEADERS_CASE_INSENSITIVE", FEATURE_SWITCH_ON));
    }

    public boolean isSecurityHeadersEnabled() {
        return Boolean.parseBoolean(
                systemService.getOrDefault("INCLUDE_SECURITY_HEADERS", FEATURE_SWITCH_ON));
    }

    private String getNonBlankOrDefault(String name, String defaultValue) {
        var value = systemService.getOrDefault(name, defaultValue);
        if (value == null || value.isBlank()) {
            LOG.warn("{} is blank, falling back to {}", name, defaultValue);
            return defaultValue;
        }
        return value;
    }
}
