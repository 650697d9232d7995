package adm.java.engine;

import adm.core.model.Tier;
import adm.core.model.TierLimits;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads {@link AdmissionConfig} from the {@code admission} section of a YAML
 * document, bound to {@link AdmissionSettings} with Jackson.
 *
 * <pre>
 * admission:
 *   tier:
 *     api: { sustained: 30, burst: 10 }
 *   global: { limit: 100 }
 *   block:
 *     sustained: { seconds: 300 }
 *     global: { seconds: 600 }
 *   bypass: [ "127.0.0.1", "::1" ]
 *   shards: 64
 *   max-clients: 100000
 *   sweep: { seconds: 30 }
 *   server: { port: 9090 }
 * </pre>
 *
 * <p>Any property named {@code admission.<path>} overrides the node at that
 * path. Its value is read as a YAML fragment, so lists are written in flow
 * style: {@code -Dadmission.bypass='["10.0.0.1"]'}. Blank overrides are ignored.
 */
public final class AdmissionConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(AdmissionConfigLoader.class);

    public static final String RESOURCE = "admission.yml";
    public static final int DEFAULT_PORT = 9090;

    private static final String ROOT = "admission";

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

    static {
        MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        MAPPER.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    private final AdmissionSettings settings;

    public AdmissionConfigLoader(AdmissionSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.settings = settings;
    }

    /**
     * Loads the classpath resource (if present) overlaid with system properties.
     *
     * @throws UncheckedIOException if the resource exists but cannot be read
     * @throws IllegalArgumentException on malformed values
     */
    public static AdmissionConfigLoader fromClasspath() {
        JsonNode root;
        try (InputStream in = AdmissionConfigLoader.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.info("No {} on classpath, using defaults", RESOURCE);
                root = MAPPER.createObjectNode();
            } else {
                root = MAPPER.readTree(in);
            }
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + RESOURCE + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return load(root, System.getProperties());
    }

    /**
     * Loads a YAML document overlaid with the given {@code admission.*} properties.
     *
     * @throws IllegalArgumentException on malformed YAML or values
     */
    public static AdmissionConfigLoader fromYaml(String yaml, Properties overrides) {
        try {
            return load(MAPPER.readTree(yaml), overrides);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed admission YAML: " + e.getOriginalMessage(), e);
        }
    }

    private static AdmissionConfigLoader load(JsonNode document, Properties overrides) {
        ObjectNode root = document instanceof ObjectNode ? (ObjectNode) document : MAPPER.createObjectNode();
        if (overrides != null) {
            for (String key : overrides.stringPropertyNames()) {
                String value = overrides.getProperty(key);
                if (key.startsWith(ROOT + ".") && !value.isBlank()) {
                    overlay(root, key.split("\\."), value.trim());
                }
            }
        }

        JsonNode section = root.path(ROOT);
        if (section.isMissingNode() || section.isNull()) {
            return new AdmissionConfigLoader(AdmissionSettings.EMPTY);
        }
        try {
            return new AdmissionConfigLoader(MAPPER.treeToValue(section, AdmissionSettings.class));
        } catch (JsonMappingException e) {
            throw new IllegalArgumentException("Invalid value for " + pathOf(e) + ": " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid admission configuration: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Builds the admission configuration.
     *
     * @throws IllegalArgumentException on unknown tiers or out-of-range values
     */
    public AdmissionConfig admissionConfig() {
        AdmissionConfig config = AdmissionConfig.defaults();

        if (settings.tier() != null) {
            Map<String, Tier> tiers = Arrays.stream(Tier.values())
                .filter(t -> !t.isGlobal())
                .collect(Collectors.toMap(Tier::wireName, Function.identity()));
            for (Map.Entry<String, AdmissionSettings.Limits> entry : settings.tier().entrySet()) {
                Tier tier = tiers.get(entry.getKey().toLowerCase(Locale.ROOT));
                if (tier == null) {
                    throw new IllegalArgumentException("Unknown tier admission.tier." + entry.getKey());
                }
                AdmissionSettings.Limits limits = entry.getValue();
                if (limits == null) {
                    continue;
                }
                TierLimits current = config.limitsFor(tier);
                config = config.withTierLimits(tier, TierLimits.of(
                    orElse(limits.sustained(), current.sustained()),
                    orElse(limits.burst(), current.burst())));
            }
        }

        if (settings.global() != null) {
            config = config.withGlobalLimit(orElse(settings.global().limit(), config.globalLimit()));
        }
        if (settings.block() != null) {
            config = config.withBlockDurations(
                seconds(settings.block().sustained(), config.sustainedBlock()),
                seconds(settings.block().global(), config.globalBlock()));
        }
        config = config.withCapacity(
            orElse(settings.shards(), config.shards()),
            orElse(settings.maxClients(), config.maxClients()));
        config = config.withSweepInterval(seconds(settings.sweep(), config.sweepInterval()));

        if (settings.bypass() != null) {
            config = config.withBypass(settings.bypass().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new)));
        }
        return config;
    }

    /**
     * gRPC listen port.
     */
    public int serverPort() {
        int port = settings.server() == null ? DEFAULT_PORT : orElse(settings.server().port(), DEFAULT_PORT);
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("admission.server.port out of range: " + port);
        }
        return port;
    }

    private static void overlay(ObjectNode root, String[] path, String value) {
        ObjectNode node = root;
        for (int i = 0; i < path.length - 1; i++) {
            JsonNode child = node.get(path[i]);
            node = child instanceof ObjectNode ? (ObjectNode) child : node.putObject(path[i]);
        }
        node.set(path[path.length - 1], fragment(value));
    }

    private static JsonNode fragment(String value) {
        try {
            JsonNode parsed = MAPPER.readTree(value);
            return parsed == null || parsed.isMissingNode() ? TextNode.valueOf(value) : parsed;
        } catch (JsonProcessingException e) {
            // not a YAML fragment (e.g. a bare "::1"): keep it as text
            return TextNode.valueOf(value);
        }
    }

    private static String pathOf(JsonMappingException e) {
        return e.getPath().stream()
            .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : Integer.toString(ref.getIndex()))
            .collect(Collectors.joining(".", ROOT + ".", ""));
    }

    private static int orElse(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static Duration seconds(AdmissionSettings.Seconds value, Duration fallback) {
        return value == null || value.seconds() == null ? fallback : Duration.ofSeconds(value.seconds());
    }
}
