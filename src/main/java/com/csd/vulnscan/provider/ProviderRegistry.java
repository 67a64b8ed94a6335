package com.csd.vulnscan.provider;

import com.csd.vulnscan.exception.DetectionFailureException;
import com.csd.vulnscan.model.DetectionResult;
import com.csd.vulnscan.model.ScanInput;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Picks the ecosystem provider for a scan input. Providers are consulted in registration order.
 */
@Slf4j
public class ProviderRegistry {

    @Value
    private static class SuffixRule {
        String suffix;
        ProviderId providerId;
        String name;
    }

    private static final List<SuffixRule> STANDALONE_RULES = List.of(
            new SuffixRule("pnpm-lock.yaml", ProviderId.NODE, "pnpm"),
            new SuffixRule("pnpm-workspace.yaml", ProviderId.NODE, "pnpm"),
            new SuffixRule("yarn.lock", ProviderId.NODE, "yarn"),
            new SuffixRule("package.json", ProviderId.NODE, "npm"),
            new SuffixRule("package-lock.json", ProviderId.NODE, "npm"),
            new SuffixRule("npm-shrinkwrap.json", ProviderId.NODE, "npm"),
            new SuffixRule("poetry.lock", ProviderId.PYTHON_POETRY, "poetry"),
            new SuffixRule("pyproject.toml", ProviderId.PYTHON_POETRY, "poetry"),
            new SuffixRule("requirements.txt", ProviderId.PYTHON_PIP, "pip"),
            new SuffixRule("go.mod", ProviderId.GO, "Go modules"),
            new SuffixRule("go.sum", ProviderId.GO, "Go modules"));

    private final List<EcosystemProvider> providers;

    public ProviderRegistry(List<EcosystemProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    public List<EcosystemProvider> getProviders() {
        return providers;
    }

    public ProviderSelection selectProvider(ScanInput input) {
        if (input.isStandalone()) {
            String fileName = input.fileName();
            for (SuffixRule rule : STANDALONE_RULES) {
                if (!fileName.endsWith(rule.getSuffix())) {
                    continue;
                }
                Optional<EcosystemProvider> provider = find(rule.getProviderId());
                if (provider.isPresent()) {
                    log.debug("Selected {} for standalone file {}", rule.getProviderId().id(), fileName);
                    return new ProviderSelection(provider.get(), DetectionResult.builder()
                            .providerId(rule.getProviderId().id())
                            .name(rule.getName())
                            .confidence(1.0)
                            .build());
                }
            }
        }

        for (EcosystemProvider provider : providers) {
            Optional<DetectionResult> detection = provider.detect(input.getDirectory());
            if (detection.isPresent()) {
                log.debug("Detected {} in {}", detection.get().getProviderId(), input.getDirectory());
                return new ProviderSelection(provider, detection.get());
            }
        }

        String supported = providers.stream()
                .map(p -> p.id().displayName())
                .collect(Collectors.joining(", "));
        throw new DetectionFailureException("No supported ecosystem detected in " + input.getDirectory()
                + ". Supported: " + supported);
    }

    /**
     * Every file name some provider accepts, in provider order without duplicates.
     */
    public List<String> listSupportedManifestFilenames() {
        Set<String> names = new LinkedHashSet<>();
        for (EcosystemProvider provider : providers) {
            names.addAll(provider.supportedFiles());
        }
        return new ArrayList<>(names);
    }

    private Optional<EcosystemProvider> find(ProviderId id) {
        return providers.stream().filter(p -> p.id() == id).findFirst();
    }
}
