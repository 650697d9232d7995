package adm.java.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Raw {@code admission} section of {@code admission.yml}, bound by Jackson.
 * Every field is optional; absent values keep the {@link AdmissionConfig#defaults()} value.
 * The nesting mirrors the dotted override keys ({@code admission.tier.api.sustained}).
 *
 * @param tier Limits keyed by tier wire name (health, api, ml, data)
 * @param global Global budget
 * @param block Block durations
 * @param bypass Identities that are never limited; a single value is read as a one-element list
 * @param shards Lock stripes and accountant shards
 * @param maxClients Upper bound on tracked clients
 * @param sweep Idle sweep period
 * @param server gRPC server settings
 */
public record AdmissionSettings(
    Map<String, Limits> tier,
    Global global,
    Block block,
    List<String> bypass,
    Integer shards,
    @JsonProperty("max-clients") Integer maxClients,
    Seconds sweep,
    Server server
) {
    public static final AdmissionSettings EMPTY = new AdmissionSettings(null, null, null, null, null, null, null, null);

    public record Limits(Integer sustained, Integer burst) {
    }

    public record Global(Integer limit) {
    }

    public record Block(Seconds sustained, Seconds global) {
    }

    public record Seconds(Integer seconds) {
    }

    public record Server(Integer port) {
    }
}
