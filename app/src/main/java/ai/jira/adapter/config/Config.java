package ai.jira.adapter.config;

import ai.jira.adapter.markdown.ConverterOptions;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable runtime configuration assembled from the config file, environment values and CLI options.
 */
public record Config(
        String name,
        Map<String, JiraSiteConfig> sites,
        Optional<String> defaultSiteAlias,
        LogFormat logFormat,
        String logLevel,
        int maxNestingDepth,
        HttpSettings http,
        Optional<Path> loadedConfigPath
) {

    static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public Config {
        name = name == null || name.isBlank() ? "jira-adapter" : name;
        sites = sites == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sites));
        defaultSiteAlias = defaultSiteAlias == null ? Optional.empty() : defaultSiteAlias;
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        logLevel = Objects.requireNonNull(logLevel, "logLevel").trim().toUpperCase(Locale.ROOT);
        if (!LOG_LEVELS.contains(logLevel)) {
            throw new IllegalArgumentException("Unsupported log level '" + logLevel + "'");
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be at least 1");
        }
        http = Objects.requireNonNull(http, "http");
        loadedConfigPath = loadedConfigPath == null ? Optional.empty() : loadedConfigPath;
    }

    public ConverterOptions converterOptions() {
        return new ConverterOptions(maxNestingDepth);
    }

    /**
     * Picks the site to talk to: the explicit alias, else the default alias, else the only configured site.
     */
    public JiraSiteConfig activeSite(Optional<String> alias) {
        Optional<String> requested = alias == null ? Optional.empty() : alias.filter(value -> !value.isBlank());
        Optional<String> effective = requested.or(() -> defaultSiteAlias);
        if (effective.isPresent()) {
            JiraSiteConfig site = sites.get(effective.get());
            if (site == null) {
                throw new ConfigurationException("Unknown site alias '" + effective.get() + "'. Available sites: "
                        + availableAliases());
            }
            return site;
        }
        if (sites.isEmpty()) {
            throw new ConfigurationException("No Jira site configured; add one to the config file or set "
                    + "JIRA_URL, JIRA_EMAIL and JIRA_API_TOKEN");
        }
        if (sites.size() > 1) {
            throw new ConfigurationException("Several sites configured and no default_site_alias set. Available sites: "
                    + availableAliases());
        }
        return sites.values().iterator().next();
    }

    private String availableAliases() {
        return sites.isEmpty() ? "(none)" : String.join(", ", sites.keySet());
    }
}
