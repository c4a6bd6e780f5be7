package ai.jira.adapter.config;

import ai.jira.adapter.cli.CliArguments;
import ai.jira.adapter.markdown.ConverterOptions;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} by layering CLI options over environment variables over the YAML config file.
 */
public class ConfigLoader {

    static final String ENV_CONFIG = "JIRA_ADAPTER_CONFIG";
    static final String ENV_JIRA_URL = "JIRA_URL";
    static final String ENV_JIRA_EMAIL = "JIRA_EMAIL";
    static final String ENV_JIRA_API_TOKEN = "JIRA_API_TOKEN";
    static final String ENV_JIRA_SITE_ALIAS = "JIRA_SITE_ALIAS";
    static final String ENV_DEFAULT_SITE = "JIRA_DEFAULT_SITE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "LOG_LEVEL";
    static final String ENV_MAX_NESTING_DEPTH = "ADF_MAX_NESTING_DEPTH";
    static final String ENV_MAX_RETRY_ATTEMPTS = "JIRA_MAX_RETRY_ATTEMPTS";
    static final String ENV_TIMEOUT_SECONDS = "JIRA_TIMEOUT_SECONDS";

    private static final String DEFAULT_SITE_ALIAS = "default";
    private static final String DEFAULT_LOG_LEVEL = "INFO";

    private final EnvironmentReader environmentReader;
    private final Path defaultConfigPath;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, Path.of(System.getProperty("user.home", "."), ".config", "jira-adapter", "config.yaml"));
    }

    ConfigLoader(EnvironmentReader environmentReader, Path defaultConfigPath) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.defaultConfigPath = Objects.requireNonNull(defaultConfigPath, "defaultConfigPath");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Optional<Path> configPath = resolveConfigPath(arguments);
        ConfigFile file = configPath.map(ConfigFile::read).orElseGet(ConfigFile::empty);
        String origin = configPath.map(Path::toString).orElse("configuration");

        Map<String, JiraSiteConfig> sites = fileSites(file, origin);
        environmentSite(sites).ifPresent(site -> sites.put(site.alias(), site));

        Optional<String> defaultSiteAlias = Optional.ofNullable(arguments.site())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.nonBlank(ENV_DEFAULT_SITE))
                .or(() -> Optional.ofNullable(file.defaultSiteAlias).filter(ConfigLoader::isNotBlank));

        try {
            return new Config(
                    file.name,
                    sites,
                    defaultSiteAlias,
                    resolveLogFormat(arguments, file),
                    resolveLogLevel(arguments, file),
                    resolveMaxNestingDepth(file),
                    resolveHttpSettings(file),
                    configPath);
        } catch (IllegalArgumentException ex) {
            if (configPath.isPresent()) {
                throw new ConfigurationException("Invalid configuration in " + origin + ": " + ex.getMessage(), ex);
            }
            throw ex;
        }
    }

    private Optional<Path> resolveConfigPath(CliArguments arguments) {
        Optional<Path> explicit = Optional.ofNullable(arguments.configPath())
                .or(() -> environmentReader.nonBlank(ENV_CONFIG).map(Path::of));
        if (explicit.isPresent()) {
            if (!Files.isRegularFile(explicit.get())) {
                throw new ConfigurationException("Configuration file not found: " + explicit.get());
            }
            return explicit;
        }
        return Files.isRegularFile(defaultConfigPath) ? Optional.of(defaultConfigPath) : Optional.empty();
    }

    private static Map<String, JiraSiteConfig> fileSites(ConfigFile file, String origin) {
        Map<String, JiraSiteConfig> sites = new LinkedHashMap<>();
        file.sites.forEach((alias, site) -> {
            if (site == null) {
                throw new ConfigurationException("Site '" + alias + "' in " + origin + " has no settings");
            }
            try {
                sites.put(alias, new JiraSiteConfig(alias, toUri(site.url), site.email, site.apiToken));
            } catch (IllegalArgumentException ex) {
                throw new ConfigurationException("Invalid site '" + alias + "' in " + origin + ": " + ex.getMessage(), ex);
            }
        });
        return sites;
    }

    /**
     * Site described by JIRA_URL / JIRA_EMAIL / JIRA_API_TOKEN; values not set fall back to the file's site of the same alias.
     */
    private Optional<JiraSiteConfig> environmentSite(Map<String, JiraSiteConfig> fileSites) {
        Optional<String> url = environmentReader.nonBlank(ENV_JIRA_URL);
        Optional<String> email = environmentReader.nonBlank(ENV_JIRA_EMAIL);
        Optional<String> token = environmentReader.nonBlank(ENV_JIRA_API_TOKEN);
        if (url.isEmpty() && email.isEmpty() && token.isEmpty()) {
            return Optional.empty();
        }
        String alias = environmentReader.nonBlank(ENV_JIRA_SITE_ALIAS).orElse(DEFAULT_SITE_ALIAS);
        Optional<JiraSiteConfig> base = Optional.ofNullable(fileSites.get(alias));
        URI resolvedUrl = url.map(ConfigLoader::toUri).or(() -> base.map(JiraSiteConfig::url))
                .orElseThrow(() -> missing(ENV_JIRA_URL, alias));
        String resolvedEmail = email.or(() -> base.map(JiraSiteConfig::email))
                .orElseThrow(() -> missing(ENV_JIRA_EMAIL, alias));
        String resolvedToken = token.or(() -> base.map(JiraSiteConfig::apiToken))
                .orElseThrow(() -> missing(ENV_JIRA_API_TOKEN, alias));
        return Optional.of(new JiraSiteConfig(alias, resolvedUrl, resolvedEmail, resolvedToken));
    }

    private static IllegalArgumentException missing(String key, String alias) {
        return new IllegalArgumentException(key + " must be set to define site '" + alias + "' from the environment");
    }

    private LogFormat resolveLogFormat(CliArguments arguments, ConfigFile file) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.nonBlank(ENV_LOG_FORMAT)
                .or(() -> Optional.ofNullable(file.logFormat).filter(ConfigLoader::isNotBlank))
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private String resolveLogLevel(CliArguments arguments, ConfigFile file) {
        return Optional.ofNullable(arguments.logLevel())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.nonBlank(ENV_LOG_LEVEL))
                .or(() -> Optional.ofNullable(file.logLevel).filter(ConfigLoader::isNotBlank))
                .orElse(DEFAULT_LOG_LEVEL);
    }

    private int resolveMaxNestingDepth(ConfigFile file) {
        return environmentReader.nonBlank(ENV_MAX_NESTING_DEPTH)
                .map(raw -> parseInteger(raw, ENV_MAX_NESTING_DEPTH))
                .or(() -> Optional.ofNullable(file.converter.maxNestingDepth))
                .orElse(ConverterOptions.DEFAULT_MAX_NESTING_DEPTH);
    }

    private HttpSettings resolveHttpSettings(ConfigFile file) {
        int maxRetryAttempts = environmentReader.nonBlank(ENV_MAX_RETRY_ATTEMPTS)
                .map(raw -> parseInteger(raw, ENV_MAX_RETRY_ATTEMPTS))
                .or(() -> Optional.ofNullable(file.http.maxRetryAttempts))
                .orElse(HttpSettings.DEFAULT_MAX_RETRY_ATTEMPTS);
        long timeoutSeconds = environmentReader.nonBlank(ENV_TIMEOUT_SECONDS)
                .map(raw -> (long) parseInteger(raw, ENV_TIMEOUT_SECONDS))
                .or(() -> Optional.ofNullable(file.http.timeoutSeconds).map(Integer::longValue))
                .orElse(HttpSettings.DEFAULT_TIMEOUT_SECONDS);
        long initialBackoff = Optional.ofNullable(file.http.initialBackoffSeconds)
                .map(Integer::longValue)
                .orElse(HttpSettings.DEFAULT_INITIAL_BACKOFF_SECONDS);
        long maxBackoff = Optional.ofNullable(file.http.maxBackoffSeconds)
                .map(Integer::longValue)
                .orElse(HttpSettings.DEFAULT_MAX_BACKOFF_SECONDS);
        return new HttpSettings(maxRetryAttempts,
                Duration.ofSeconds(initialBackoff),
                Duration.ofSeconds(maxBackoff),
                Duration.ofSeconds(timeoutSeconds),
                HttpSettings.DEFAULT_JITTER_FACTOR);
    }

    private static URI toUri(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        return URI.create(raw.trim());
    }

    private static int parseInteger(String raw, String key) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
