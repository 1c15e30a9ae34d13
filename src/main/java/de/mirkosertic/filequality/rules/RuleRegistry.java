package de.mirkosertic.filequality.rules;

import de.mirkosertic.filequality.config.ApplicationConfig;
import de.mirkosertic.filequality.config.BuildInfo;
import de.mirkosertic.filequality.config.RuleSettings;
import de.mirkosertic.filequality.model.FileMetadata;
import de.mirkosertic.filequality.model.Fingerprint;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Immutable, ordered set of quality rules.
 * <p>
 * Rules are evaluated in registration order. The {@link #version()} identifies the exact
 * rule set: it changes whenever a rule is added, removed, reordered or reconfigured, and
 * whenever the engine version changes. Cached results are only valid for the version they
 * were computed with.
 */
public final class RuleRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RuleRegistry.class);

    public static final String DUPLICATE_CONTENT = "duplicate-content";

    /**
     * Per-file rules known to the configuration, in evaluation order.
     */
    private static final Map<String, Function<RuleSettings, QualityRule>> FACTORIES = createFactories();

    private final List<RegisteredRule> rules;
    private final @Nullable RuleSettings crossFileSettings;
    private final String engineVersion;
    private final String version;

    private RuleRegistry(final List<RegisteredRule> rules, final @Nullable RuleSettings crossFileSettings,
                         final String engineVersion) {
        this.rules = List.copyOf(rules);
        this.crossFileSettings = crossFileSettings;
        this.engineVersion = engineVersion;
        this.version = computeVersion();
    }

    private static Map<String, Function<RuleSettings, QualityRule>> createFactories() {
        final Map<String, Function<RuleSettings, QualityRule>> factories = new LinkedHashMap<>();
        factories.put(FileSizeRule.NAME, FileSizeRule::fromSettings);
        factories.put(EncodingRule.NAME, EncodingRule::fromSettings);
        factories.put(LineEndingRule.NAME, LineEndingRule::fromSettings);
        factories.put(NamingConventionRule.NAME, NamingConventionRule::fromSettings);
        return Collections.unmodifiableMap(factories);
    }

    /**
     * Build the registry from the {@code quality.rules} section. Disabled rules are left out.
     */
    public static RuleRegistry fromConfig(final ApplicationConfig config) {
        final Builder builder = builder();
        final Map<String, RuleSettings> configured = config.getRules();

        for (final String name : configured.keySet()) {
            if (!FACTORIES.containsKey(name) && !DUPLICATE_CONTENT.equals(name)) {
                logger.warn("Ignoring configuration of unknown rule '{}'", name);
            }
        }

        for (final Map.Entry<String, Function<RuleSettings, QualityRule>> factory : FACTORIES.entrySet()) {
            final RuleSettings settings = config.getRuleSettings(factory.getKey());
            if (!settings.enabled()) {
                logger.info("Rule '{}' is disabled", factory.getKey());
                continue;
            }
            builder.register(factory.getValue().apply(settings), settings);
        }

        final RuleSettings duplicateSettings = config.getRuleSettings(DUPLICATE_CONTENT);
        if (duplicateSettings.enabled()) {
            builder.crossFileRule(duplicateSettings);
        }

        final RuleRegistry registry = builder.build();
        logger.info("Rule set {} with rules {}", registry.version().substring(0, 12), registry.ruleNames());
        return registry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rules whose globs match the file's path relative to the root and whose own predicate
     * accepts the file, in registration order.
     */
    public List<QualityRule> applicableRules(final FileMetadata metadata) {
        final List<QualityRule> applicable = new ArrayList<>();
        for (final RegisteredRule entry : rules) {
            if (entry.matcher().shouldInclude(metadata.relativePath()) && acceptsFile(entry.rule(), metadata)) {
                applicable.add(entry.rule());
            }
        }
        return applicable;
    }

    // A failing predicate lets the rule run, so that its failure shows up as a finding
    private static boolean acceptsFile(final QualityRule rule, final FileMetadata metadata) {
        try {
            return rule.appliesTo(metadata);
        } catch (final RuntimeException e) {
            logger.warn("Applicability check of rule '{}' failed for {}", rule.name(), metadata.path(), e);
            return true;
        }
    }

    public List<RegisteredRule> rules() {
        return rules;
    }

    public List<String> ruleNames() {
        return rules.stream().map(RegisteredRule::name).toList();
    }

    public Optional<RegisteredRule> rule(final String name) {
        return rules.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    /**
     * Settings of the cross-file duplicate check, empty if it is disabled.
     */
    public Optional<RuleSettings> crossFileSettings() {
        return Optional.ofNullable(crossFileSettings);
    }

    public double weightOf(final String ruleName) {
        if (crossFileSettings != null && crossFileSettings.name().equals(ruleName)) {
            return crossFileSettings.weight();
        }
        return rule(ruleName).map(RegisteredRule::weight).orElse(1.0);
    }

    public String engineVersion() {
        return engineVersion;
    }

    public String version() {
        return version;
    }

    public int size() {
        return rules.size();
    }

    private String computeVersion() {
        final StringBuilder source = new StringBuilder("engine=").append(engineVersion);
        for (final RegisteredRule entry : rules) {
            source.append('\n')
                    .append(entry.rule().getClass().getName())
                    .append('|')
                    .append(entry.rule().fingerprintSource())
                    .append('|')
                    .append(entry.settings().fingerprintSource());
        }
        if (crossFileSettings != null) {
            source.append("\ncross-file|").append(crossFileSettings.fingerprintSource());
        }
        return Fingerprint.of(source.toString());
    }

    public static final class Builder {

        private final Map<String, RegisteredRule> rules = new LinkedHashMap<>();
        private @Nullable RuleSettings crossFileSettings;
        private String engineVersion = BuildInfo.getVersion();

        private Builder() {
        }

        public Builder register(final QualityRule rule) {
            return register(rule, RuleSettings.defaults(rule.name()));
        }

        public Builder register(final QualityRule rule, final RuleSettings settings) {
            if (rules.containsKey(rule.name())) {
                throw new IllegalArgumentException("Rule already registered: " + rule.name());
            }
            rules.put(rule.name(), new RegisteredRule(rule, settings));
            return this;
        }

        public Builder crossFileRule(final RuleSettings settings) {
            this.crossFileSettings = settings;
            return this;
        }

        public Builder engineVersion(final String engineVersion) {
            this.engineVersion = engineVersion;
            return this;
        }

        public RuleRegistry build() {
            return new RuleRegistry(new ArrayList<>(rules.values()), crossFileSettings, engineVersion);
        }
    }
}
