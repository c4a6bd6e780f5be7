package ai.jira.adapter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw contents of the YAML configuration file. Every field is optional; defaults are applied by {@link ConfigLoader}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
class ConfigFile {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public String name;

    @JsonProperty("log_level")
    public String logLevel;

    @JsonProperty("log_format")
    public String logFormat;

    @JsonProperty("default_site_alias")
    public String defaultSiteAlias;

    public Map<String, Site> sites = new LinkedHashMap<>();

    public Converter converter = new Converter();

    public Http http = new Http();

    static ConfigFile empty() {
        return new ConfigFile();
    }

    static ConfigFile read(Path path) {
        try {
            ConfigFile file = YAML_MAPPER.readValue(path.toFile(), ConfigFile.class);
            if (file == null) {
                return empty();
            }
            if (file.sites == null) {
                file.sites = new LinkedHashMap<>();
            }
            if (file.converter == null) {
                file.converter = new Converter();
            }
            if (file.http == null) {
                file.http = new Http();
            }
            return file;
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read configuration file " + path + ": " + ex.getMessage(), ex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Site {
        public String url;
        public String email;

        @JsonProperty("api_token")
        public String apiToken;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Converter {
        @JsonProperty("max_nesting_depth")
        public Integer maxNestingDepth;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Http {
        @JsonProperty("max_retry_attempts")
        public Integer maxRetryAttempts;

        @JsonProperty("initial_backoff_seconds")
        public Integer initialBackoffSeconds;

        @JsonProperty("max_backoff_seconds")
        public Integer maxBackoffSeconds;

        @JsonProperty("timeout_seconds")
        public Integer timeoutSeconds;
    }
}
