package com.loom.orchestrator.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.loom.orchestrator.provider.GenerationParams;
import com.loom.orchestrator.provider.ProviderRegistry;
import com.loom.orchestrator.provider.TextProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the effective settings of every stage against three layers:
 * {@code stages.<name>} overrides, then {@code defaults}, then
 * {@link BuiltInDefaults}. The first layer that sets a value wins.
 *
 * <p>Resolution is eager. {@link #create} resolves every stage of the
 * resolution order up front and throws {@link ConfigException} listing every
 * problem found, so a bad document is rejected before any provider call.
 * {@link #inspect} does the same work but keeps the problems for reporting.
 *
 * <p>Instances are immutable and built once per run.
 */
public final class ConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigResolver.class);

    private final PipelineConfigDocument document;
    private final ProviderRegistry       providers;
    private final List<String>           order;
    private final List<String>           orderProblems;

    private final Map<String, EffectiveStageConfig> resolved      = new LinkedHashMap<>();
    private final Map<String, List<String>>         stageProblems = new LinkedHashMap<>();

    private ConfigResolver(PipelineConfigDocument document,
                           List<String> registeredStages,
                           ProviderRegistry providers) {
        this.document      = document;
        this.providers     = providers;
        this.orderProblems = new ArrayList<>();
        this.order         = computeOrder(document, registeredStages, orderProblems);

        for (String stageName : document.stages().keySet()) {
            if (!registeredStages.contains(stageName)) {
                log.warn("Ignoring configuration for unregistered stage '{}'", stageName);
            }
        }
        for (String stageName : order) {
            List<String> problems = new ArrayList<>();
            EffectiveStageConfig config = build(stageName, problems);
            if (problems.isEmpty()) {
                resolved.put(stageName, config);
            } else {
                stageProblems.put(stageName, List.copyOf(problems));
            }
        }
    }

    /**
     * Build a resolver and fail fast on any problem.
     *
     * @param registeredStages stage names in registration order
     * @throws ConfigException listing every problem found
     */
    public static ConfigResolver create(PipelineConfigDocument document,
                                        List<String> registeredStages,
                                        ProviderRegistry providers) {
        ConfigResolver resolver = inspect(document, registeredStages, providers);
        if (!resolver.isValid()) {
            throw new ConfigException(resolver.problems());
        }
        return resolver;
    }

    /** Build a resolver that records problems instead of throwing. */
    public static ConfigResolver inspect(PipelineConfigDocument document,
                                         List<String> registeredStages,
                                         ProviderRegistry providers) {
        return new ConfigResolver(document, List.copyOf(registeredStages), providers);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** Stage names in execution order. */
    public List<String> resolutionOrder() {
        return order;
    }

    /**
     * @throws ConfigException if {@code stageName} is not in the resolution
     *         order or its settings could not be resolved
     */
    public EffectiveStageConfig resolve(String stageName) {
        EffectiveStageConfig config = resolved.get(stageName);
        if (config != null) {
            return config;
        }
        List<String> problems = stageProblems.get(stageName);
        if (problems != null) {
            throw new ConfigException(problems);
        }
        throw new ConfigException("Stage '" + stageName + "' is not part of the resolution order " + order);
    }

    public boolean isValid() {
        return orderProblems.isEmpty() && stageProblems.isEmpty();
    }

    /** Problems with {@code stageExecutionOrder}. */
    public List<String> orderProblems() {
        return Collections.unmodifiableList(orderProblems);
    }

    /** Problems resolving {@code stageName}; empty when it resolved cleanly. */
    public List<String> problemsFor(String stageName) {
        return stageProblems.getOrDefault(stageName, List.of());
    }

    /** Every problem found, order problems first. */
    public List<String> problems() {
        List<String> all = new ArrayList<>(orderProblems);
        stageProblems.values().forEach(all::addAll);
        return all;
    }

    /** Resolve one setting for one stage, with the layer that supplied it. */
    public <T> Resolved<T> resolveSetting(String stageName, Setting<T> setting) {
        Optional<T> fromStage = setting.readFrom(document.stageBlock(stageName), "stages." + stageName);
        if (fromStage.isPresent()) {
            return new Resolved<>(fromStage.get(), ConfigLayer.STAGE);
        }
        Optional<T> fromDefaults = setting.readFrom(document.defaults(), PipelineConfigLoader.DEFAULTS);
        if (fromDefaults.isPresent()) {
            return new Resolved<>(fromDefaults.get(), ConfigLayer.DEFAULTS);
        }
        return new Resolved<>(derivedBuiltIn(stageName, setting), ConfigLayer.BUILT_IN);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private <T> T derivedBuiltIn(String stageName, Setting<T> setting) {
        if (setting == StageSettings.MODEL) {
            String providerId = resolveSetting(stageName, StageSettings.PROVIDER).value();
            TextProvider provider = providers.find(providerId).orElseThrow(() ->
                    new ConfigException("No model configured for stage '" + stageName
                            + "' and provider '" + providerId + "' is unknown"));
            return (T) provider.defaultModel();
        }
        if (setting == StageSettings.FALLBACK_MODE) {
            boolean required = resolveSetting(stageName, StageSettings.REQUIRED).value();
            return (T) (required ? BuiltInDefaults.REQUIRED_FALLBACK : BuiltInDefaults.OPTIONAL_FALLBACK);
        }
        return setting.builtIn();
    }

    private EffectiveStageConfig build(String stageName, List<String> problems) {
        Map<String, ConfigLayer> sources = new LinkedHashMap<>();

        Resolved<String> provider = collect(stageName, StageSettings.PROVIDER, sources, problems);
        if (provider == null) {
            return null;
        }
        if (!providers.contains(provider.value())) {
            problems.add(locate(stageName, StageSettings.PROVIDER, provider.layer())
                    + ": unknown provider '" + provider.value() + "', expected one of " + providers.providerIds());
            return null;
        }
        Resolved<String>       model        = collect(stageName, StageSettings.MODEL, sources, problems);
        Resolved<Double>       temperature  = collect(stageName, StageSettings.TEMPERATURE, sources, problems);
        Resolved<Integer>      maxTokens    = collect(stageName, StageSettings.MAX_TOKENS, sources, problems);
        Resolved<Double>       topP         = collect(stageName, StageSettings.TOP_P, sources, problems);
        Resolved<Integer>      topK         = collect(stageName, StageSettings.TOP_K, sources, problems);
        Resolved<Integer>      retryCount   = collect(stageName, StageSettings.RETRY_COUNT, sources, problems);
        Resolved<Double>       timeout      = collect(stageName, StageSettings.TIMEOUT_SECONDS, sources, problems);
        Resolved<Boolean>      required     = collect(stageName, StageSettings.REQUIRED, sources, problems);
        Resolved<FallbackMode> fallbackMode = collect(stageName, StageSettings.FALLBACK_MODE, sources, problems);
        Resolved<String>       defaultValue = collect(stageName, StageSettings.DEFAULT_VALUE, sources, problems);

        if (!problems.isEmpty()) {
            return null;
        }
        return new EffectiveStageConfig(
                stageName,
                provider.value(),
                new GenerationParams(model.value(), temperature.value(), maxTokens.value(),
                        topP.value(), topK.value()),
                retryCount.value(),
                Duration.ofMillis(Math.round(timeout.value() * 1000)),
                new ErrorBoundary(required.value(), fallbackMode.value(), defaultValue.value()),
                sources);
    }

    private <T> Resolved<T> collect(String stageName,
                                    Setting<T> setting,
                                    Map<String, ConfigLayer> sources,
                                    List<String> problems) {
        try {
            Resolved<T> value = resolveSetting(stageName, setting);
            sources.put(setting.name(), value.layer());
            return value;
        } catch (ConfigException e) {
            problems.addAll(e.problems());
            return null;
        }
    }

    private static String locate(String stageName, Setting<?> setting, ConfigLayer layer) {
        switch (layer) {
            case STAGE:    return "stages." + stageName + "." + setting.name();
            case DEFAULTS: return PipelineConfigLoader.DEFAULTS + "." + setting.name();
            default:       return "built-in " + setting.name();
        }
    }

    private static List<String> computeOrder(PipelineConfigDocument document,
                                             List<String> registeredStages,
                                             List<String> problems) {
        Optional<List<String>> explicit = document.explicitOrder();
        if (explicit.isEmpty()) {
            return registeredStages;
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String name : explicit.get()) {
            if (!registeredStages.contains(name)) {
                problems.add(PipelineConfigLoader.ORDER + " names unknown stage '" + name
                        + "', registered stages are " + registeredStages);
            } else if (!unique.add(name)) {
                log.warn("Stage '{}' listed more than once in {}; keeping its first position",
                        name, PipelineConfigLoader.ORDER);
            }
        }
        for (String name : registeredStages) {
            if (!unique.contains(name)) {
                log.info("Stage '{}' is registered but not listed in {}; it will not run",
                        name, PipelineConfigLoader.ORDER);
            }
        }
        return List.copyOf(unique);
    }
}
