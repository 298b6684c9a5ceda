package uk.gov.di.oautherrors.shared.helpers;

import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;
import org.apache.http.message.BasicNameValuePair;
import uk.gov.di.oautherrors.shared.exceptions.InvalidRedirectUriException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;

public final class RedirectUriHelper {

    private RedirectUriHelper() {}

    /**
     * Merges {@code parameters} into the query string of {@code redirectUri}. Parameters already in
     * the query are kept; a parameter with the same name is overwritten in place.
     */
    public static String withQueryParameters(String redirectUri, Map<String, String> parameters) {
        var uri = parse(redirectUri);
        var merged = merge(uri, parameters);
        return rebuild(uri, encode(merged), uri.getRawFragment());
    }

    /**
     * Like {@link #withQueryParameters(String, Map)}, but the merged parameters replace the
     * fragment and the query string is left as it was.
     */
    public static String withFragmentParameters(
            String redirectUri, Map<String, String> parameters) {
        var uri = parse(redirectUri);
        var merged = merge(uri, parameters);
        return rebuild(uri, uri.getRawQuery(), encode(merged));
    }

    public static Map<String, String> parseQueryParameters(String rawQuery) {
        var parameters = new LinkedHashMap<String, String>();
        if (Objects.isNull(rawQuery) || rawQuery.isEmpty()) {
            return parameters;
        }
        for (NameValuePair pair : URLEncodedUtils.parse(rawQuery, UTF_8)) {
            parameters.put(pair.getName(), Objects.requireNonNullElse(pair.getValue(), ""));
        }
        return parameters;
    }

    private static URI parse(String redirectUri) {
        try {
            return new URI(redirectUri);
        } catch (URISyntaxException e) {
            throw new InvalidRedirectUriException("Unable to parse redirect URI", e);
        }
    }

    private static Map<String, String> merge(URI uri, Map<String, String> parameters) {
        var merged = parseQueryParameters(uri.getRawQuery());
        merged.putAll(parameters);
        return merged;
    }

    private static String encode(Map<String, String> parameters) {
        List<NameValuePair> pairs =
                parameters.entrySet().stream()
                        .map(entry -> new BasicNameValuePair(entry.getKey(), entry.getValue()))
                        .collect(Collectors.toList());
        return URLEncodedUtils.format(pairs, UTF_8);
    }

    private static String rebuild(URI uri, String rawQuery, String rawFragment) {
        var builder = new StringBuilder();
        if (Objects.nonNull(uri.getScheme())) {
            builder.append(uri.getScheme()).append(':');
        }
        if (uri.isOpaque()) {
            builder.append(uri.getRawSchemeSpecificPart());
        } else {
            if (Objects.nonNull(uri.getRawAuthority())) {
                builder.append("//").append(uri.getRawAuthority());
            }
            builder.append(Objects.requireNonNullElse(uri.getRawPath(), ""));
        }
        if (Objects.nonNull(rawQuery)) {
            builder.append('?').append(rawQuery);
        }
        if (Objects.nonNull(rawFragment)) {
            builder.append('#').append(rawFragment);
        }
        return builder.toString();
    }
}
