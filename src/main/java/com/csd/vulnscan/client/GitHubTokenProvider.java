package com.csd.vulnscan.client;

import com.csd.vulnscan.exception.CredentialMissingException;
import com.csd.vulnscan.exception.PackageManagerInvocationException;
import com.csd.vulnscan.process.CommandResult;
import com.csd.vulnscan.process.CommandRunner;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Resolves the GitHub bearer token: environment variable first, then {@code gh auth token}.
 * The first token found is kept for the life of the process until {@link #reset()}.
 */
@Slf4j
public class GitHubTokenProvider {

    static final List<String> GH_AUTH_TOKEN = List.of("gh", "auth", "token");

    private final String envVariable;
    private final Function<String, String> environment;
    private final CommandRunner commandRunner;
    private final AtomicReference<String> cachedToken = new AtomicReference<>();

    public GitHubTokenProvider(String envVariable, Function<String, String> environment, CommandRunner commandRunner) {
        this.envVariable = envVariable;
        this.environment = environment;
        this.commandRunner = commandRunner;
    }

    public GitHubTokenProvider(String envVariable, CommandRunner commandRunner) {
        this(envVariable, System::getenv, commandRunner);
    }

    public Optional<String> getToken() {
        String cached = cachedToken.get();
        if (cached != null) {
            return Optional.of(cached);
        }

        String fromEnv = environment.apply(envVariable);
        if (fromEnv != null && !fromEnv.isBlank()) {
            cachedToken.compareAndSet(null, fromEnv.trim());
            return Optional.of(cachedToken.get());
        }

        Optional<String> fromCli = readFromGhCli();
        fromCli.ifPresent(token -> cachedToken.compareAndSet(null, token));
        return fromCli.map(token -> cachedToken.get());
    }

    /**
     * @throws CredentialMissingException when neither source yields a token
     */
    public String requireToken() {
        return getToken().orElseThrow(() -> new CredentialMissingException(
                "GitHub token required for GHSA queries (set " + envVariable + " or run `gh auth login`)"));
    }

    public void reset() {
        cachedToken.set(null);
    }

    private Optional<String> readFromGhCli() {
        try {
            CommandResult result = commandRunner.run(Path.of("."), GH_AUTH_TOKEN);
            if (result.isSuccess() && result.getOutput() != null && !result.getOutput().isBlank()) {
                return Optional.of(result.getOutput().trim());
            }
            log.debug("gh auth token exited with code {}", result.getExitCode());
        } catch (PackageManagerInvocationException e) {
            log.debug("gh CLI not available: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
