package org.fhirstack.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.fhirstack.orchestrator.StackDefinition;
import org.fhirstack.registry.InvalidSpecException;
import org.fhirstack.spec.HealthProbeSpec;
import org.fhirstack.spec.LaunchDescriptor;
import org.fhirstack.spec.PortMapping;
import org.fhirstack.spec.ProbeType;
import org.fhirstack.spec.RestartMode;
import org.fhirstack.spec.RestartPolicy;
import org.fhirstack.spec.ServiceSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the {@code stack} block of the configuration into a {@link StackDefinition}.
 *
 * <pre>
 * stack {
 *   name = "fhir-stack"
 *   work-dir = ".fhir-stack"
 *   dependency-timeout = 120s
 *   stop-timeout = 10s
 *   wait-for-healthy = true
 *   defaults { health { ... }, restart { ... } }
 *   services = [
 *     { name = "db", image = "mongo", ports = ["17017:27017"], health { type = tcp, target = "localhost:17017" } }
 *   ]
 * }
 * </pre>
 * Services are a list so that their declaration order, which breaks ties in the startup order,
 * is kept. Per-service {@code health} and {@code restart} blocks fall back to
 * {@code stack.defaults}. Environment values are taken verbatim and never logged.
 */
public final class StackConfigParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(StackConfigParser.class);
    private static final String STACK_PATH = "stack";

    private StackConfigParser() {
        // Private constructor to prevent instantiation
    }

    /**
     * @throws ConfigurationException if the {@code stack} block is missing or malformed
     * @throws InvalidSpecException   if a service declaration is invalid
     */
    public static StackDefinition parse(final Config config) {
        if (!config.hasPath(STACK_PATH)) {
            throw new ConfigurationException("Configuration has no '" + STACK_PATH + "' block");
        }
        final Config stack = config.getConfig(STACK_PATH);
        final String name;
        final Path workDir;
        final Duration dependencyTimeout;
        final Duration stopTimeout;
        final boolean waitForHealthy;
        final String dockerHost;
        final Config defaults;
        final List<? extends Config> serviceConfigs;
        try {
            name = stack.getString("name");
            workDir = Path.of(stack.getString("work-dir"));
            dependencyTimeout = stack.getDuration("dependency-timeout");
            stopTimeout = stack.getDuration("stop-timeout");
            waitForHealthy = stack.getBoolean("wait-for-healthy");
            dockerHost = stack.hasPath("docker-host") ? stack.getString("docker-host") : null;
            defaults = stack.hasPath("defaults") ? stack.getConfig("defaults") : ConfigFactory.empty();
            serviceConfigs = stack.getConfigList("services");
        } catch (final ConfigException e) {
            throw new ConfigurationException("Invalid stack settings: " + e.getMessage(), e);
        }
        if (!name.matches("[a-zA-Z0-9][a-zA-Z0-9_.-]*")) {
            throw new ConfigurationException("Invalid stack name '" + name + "'");
        }
        if (dependencyTimeout.isZero() || dependencyTimeout.isNegative() || stopTimeout.isNegative()) {
            throw new ConfigurationException("stack.dependency-timeout must be positive and stack.stop-timeout not negative");
        }

        final List<ServiceSpec> services = new ArrayList<>();
        for (int i = 0; i < serviceConfigs.size(); i++) {
            services.add(parseService(serviceConfigs.get(i), defaults, i));
        }
        LOGGER.debug("Parsed stack '{}' with services {}", name,
            services.stream().map(ServiceSpec::name).toList());
        return new StackDefinition(name, workDir, dependencyTimeout, stopTimeout, waitForHealthy, dockerHost, services);
    }

    static ServiceSpec parseService(final Config service, final Config defaults, final int index) {
        final String name = service.hasPath("name") ? service.getString("name") : "#" + (index + 1);
        try {
            return ServiceSpec.builder(name)
                .launch(parseLaunch(name, service))
                .environment(parseEnvironment(service))
                .ports(parsePorts(service))
                .volumes(service.hasPath("volumes") ? service.getStringList("volumes") : List.of())
                .dependsOn(service.hasPath("depends-on") ? service.getStringList("depends-on") : List.of())
                .health(parseHealth(withDefaults(service, defaults, "health")))
                .restart(parseRestart(withDefaults(service, defaults, "restart")))
                .build();
        } catch (final ConfigException | IllegalArgumentException e) {
            throw new InvalidSpecException(name, e.getMessage(), e);
        }
    }

    private static LaunchDescriptor parseLaunch(final String name, final Config service) {
        final boolean hasImage = service.hasPath("image");
        final boolean hasCommand = service.hasPath("command");
        if (hasImage == hasCommand) {
            throw new InvalidSpecException(name, "declare exactly one of 'image' or 'command'");
        }
        final List<String> command = hasCommand ? stringOrList(service, "command") : List.of();
        final String workingDirectory = service.hasPath("working-directory") ? service.getString("working-directory") : null;
        if (hasImage) {
            if (workingDirectory != null) {
                throw new InvalidSpecException(name, "'working-directory' is only supported for command services");
            }
            final List<String> override = service.hasPath("args") ? stringOrList(service, "args") : List.of();
            return new LaunchDescriptor(LaunchDescriptor.Kind.IMAGE, service.getString("image"), override, null);
        }
        return new LaunchDescriptor(LaunchDescriptor.Kind.COMMAND, null, command, workingDirectory);
    }

    private static List<String> stringOrList(final Config config, final String path) {
        if (config.getValue(path).valueType() == ConfigValueType.LIST) {
            return config.getStringList(path);
        }
        return List.of(config.getString(path).trim().split("\\s+"));
    }

    private static Map<String, String> parseEnvironment(final Config service) {
        final Map<String, String> environment = new LinkedHashMap<>();
        if (!service.hasPath("environment")) {
            return environment;
        }
        for (final Map.Entry<String, ConfigValue> entry : service.getObject("environment").entrySet()) {
            if (entry.getValue().valueType() == ConfigValueType.OBJECT || entry.getValue().valueType() == ConfigValueType.LIST) {
                throw new IllegalArgumentException("environment variable '" + entry.getKey() + "' must be a plain value");
            }
            if (entry.getValue().valueType() != ConfigValueType.NULL) {
                environment.put(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
            }
        }
        return environment;
    }

    private static List<PortMapping> parsePorts(final Config service) {
        if (!service.hasPath("ports")) {
            return List.of();
        }
        return service.getStringList("ports").stream().map(PortMapping::parse).toList();
    }

    private static Config withDefaults(final Config service, final Config defaults, final String block) {
        final Config own = service.hasPath(block) ? service.getConfig(block) : ConfigFactory.empty();
        final Config fallback = defaults.hasPath(block) ? defaults.getConfig(block) : ConfigFactory.empty();
        return own.withFallback(fallback);
    }

    static HealthProbeSpec parseHealth(final Config health) {
        final ProbeType type = health.hasPath("type") ? ProbeType.fromConfig(health.getString("type")) : ProbeType.PROCESS;
        return new HealthProbeSpec(
            type,
            health.hasPath("target") ? health.getString("target") : null,
            durationOr(health, "interval", HealthProbeSpec.DEFAULT_INTERVAL),
            durationOr(health, "timeout", HealthProbeSpec.DEFAULT_TIMEOUT),
            health.hasPath("success-threshold") ? health.getInt("success-threshold") : HealthProbeSpec.DEFAULT_SUCCESS_THRESHOLD,
            health.hasPath("failure-threshold") ? health.getInt("failure-threshold") : HealthProbeSpec.DEFAULT_FAILURE_THRESHOLD,
            durationOr(health, "start-period", Duration.ZERO));
    }

    static RestartPolicy parseRestart(final Config restart) {
        final RestartMode mode = restart.hasPath("policy") ? RestartMode.fromConfig(restart.getString("policy")) : RestartMode.NEVER;
        return new RestartPolicy(
            mode,
            durationOr(restart, "backoff-base", RestartPolicy.DEFAULT_BACKOFF_BASE),
            durationOr(restart, "backoff-max", RestartPolicy.DEFAULT_BACKOFF_MAX),
            restart.hasPath("max-attempts") ? restart.getInt("max-attempts") : RestartPolicy.DEFAULT_MAX_ATTEMPTS);
    }

    private static Duration durationOr(final Config config, final String path, final Duration fallback) {
        return config.hasPath(path) ? config.getDuration(path) : fallback;
    }
}
