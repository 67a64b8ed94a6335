package com.csd.vulnscan.config;

import com.csd.vulnscan.client.GhsaClient;
import com.csd.vulnscan.client.GitHubTokenProvider;
import com.csd.vulnscan.client.OsvClient;
import com.csd.vulnscan.client.PackageRegistryClient;
import com.csd.vulnscan.client.RetryPolicy;
import com.csd.vulnscan.process.CommandRunner;
import com.csd.vulnscan.process.ProcessCommandRunner;
import com.csd.vulnscan.provider.GoProvider;
import com.csd.vulnscan.provider.NodeProvider;
import com.csd.vulnscan.provider.PipProvider;
import com.csd.vulnscan.provider.PoetryProvider;
import com.csd.vulnscan.provider.ProviderRegistry;
import com.csd.vulnscan.service.AdvisoryMerger;
import com.csd.vulnscan.service.AdvisoryQueryEngine;
import com.csd.vulnscan.service.IgnoreService;
import com.csd.vulnscan.service.MaintenanceService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties(ScannerProperties.class)
public class ScannerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CommandRunner commandRunner(ScannerProperties props) {
        return new ProcessCommandRunner(props.getPackageManager().getTimeout());
    }

    /**
     * Detection order matters: Poetry has to be asked before pip.
     */
    @Bean
    public ProviderRegistry providerRegistry(CommandRunner commandRunner) {
        return new ProviderRegistry(List.of(
                new NodeProvider(commandRunner),
                new GoProvider(commandRunner),
                new PoetryProvider(commandRunner),
                new PipProvider(commandRunner)));
    }

    @Bean
    public OkHttpClient okHttpClient(ScannerProperties props) {
        // the retry policy owns the per-attempt deadline; this only stops a hung socket from outliving it
        return new OkHttpClient.Builder()
                .callTimeout(props.getRetry().getTimeout())
                .build();
    }

    @Bean
    public GitHubTokenProvider gitHubTokenProvider(ScannerProperties props, CommandRunner commandRunner) {
        return new GitHubTokenProvider(props.getGhsa().getTokenEnvVariable(), commandRunner);
    }

    @Bean
    public GhsaClient ghsaClient(OkHttpClient okHttpClient, ObjectMapper objectMapper,
                                 GitHubTokenProvider tokenProvider, ScannerProperties props) {
        return new GhsaClient(okHttpClient, objectMapper, tokenProvider, RetryPolicy.from(props.getRetry()),
                props.getGhsa().getEndpoint(), props.getGhsa().getPageSize());
    }

    @Bean
    public AdvisoryQueryEngine advisoryQueryEngine(OsvClient osvClient, GhsaClient ghsaClient, ScannerProperties props) {
        if (!props.getGhsa().isEnabled()) {
            log.warn("GitHub advisory source disabled (vulnscan.ghsa.enabled=false); results come from OSV.dev only");
        }
        return new AdvisoryQueryEngine(osvClient, props.getGhsa().isEnabled() ? ghsaClient : null,
                props.getOsv().getBatchSize());
    }

    @Bean
    public AdvisoryMerger advisoryMerger() {
        return new AdvisoryMerger();
    }

    @Bean
    public IgnoreService ignoreService(ObjectMapper objectMapper, Clock clock, ScannerProperties props) {
        return new IgnoreService(objectMapper, clock, props.getScan().getIgnoreFileName());
    }

    @Bean
    public MaintenanceService maintenanceService(PackageRegistryClient registryClient, Clock clock, ScannerProperties props) {
        return new MaintenanceService(registryClient, clock, props.getMaintenance().getUnmaintainedAfterDays());
    }
}
