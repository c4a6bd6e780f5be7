package ai.jira.adapter.config;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * Connection settings for one issue-tracker site. The API token is never part of {@link #toString()}.
 */
public record JiraSiteConfig(String alias, URI url, String email, String apiToken) {

    public JiraSiteConfig {
        alias = requireNonBlank(alias, "alias");
        Objects.requireNonNull(url, "url");
        String scheme = url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT);
        if (!url.isAbsolute() || !(scheme.equals("http") || scheme.equals("https")) || url.getHost() == null) {
            throw new IllegalArgumentException("site '" + alias + "' url must be an absolute http(s) URL: " + url);
        }
        email = requireNonBlank(email, "email");
        apiToken = requireNonBlank(apiToken, "apiToken");
    }

    /**
     * Site URL without trailing slashes, ready for path concatenation.
     */
    public String baseUrl() {
        String value = url.toString();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    public String browseUrl(String issueKey) {
        return baseUrl() + "/browse/" + issueKey;
    }

    @Override
    public String toString() {
        return "JiraSiteConfig[alias=" + alias + ", url=" + url + ", email=" + email + ", apiToken=****]";
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
