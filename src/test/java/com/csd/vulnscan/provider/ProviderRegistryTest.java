package com.csd.vulnscan.provider;

import com.csd.vulnscan.exception.DetectionFailureException;
import com.csd.vulnscan.model.ScanInput;
import com.csd.vulnscan.process.RecordingCommandRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProviderRegistryTest {

    @TempDir
    Path dir;

    private final RecordingCommandRunner runner = new RecordingCommandRunner();
    private final ProviderRegistry registry = new ProviderRegistry(List.of(
            new NodeProvider(runner), new GoProvider(runner), new PoetryProvider(runner), new PipProvider(runner)));

    @Test
    void standaloneFileSelectedBySuffix() throws IOException {
        Path lock = Files.writeString(dir.resolve("upload-123-pnpm-lock.yaml"), "lockfileVersion: '9.0'\n");

        ProviderSelection selection = registry.selectProvider(ScanInput.standalone(lock));
        assertInstanceOf(NodeProvider.class, selection.getProvider());
        assertEquals("pnpm", selection.getDetection().getName());
        assertEquals(1.0, selection.getDetection().getConfidence());
    }

    @Test
    void standaloneGoSumNeedsNoGoMod() throws IOException {
        Path sum = Files.writeString(dir.resolve("go.sum"), "");
        ProviderSelection selection = registry.selectProvider(ScanInput.standalone(sum));
        assertEquals("go", selection.getDetection().getProviderId());
    }

    @Test
    void directoryUsesFirstMatchingProvider() throws IOException {
        Files.writeString(dir.resolve("package.json"), "{}");
        Files.writeString(dir.resolve("requirements.txt"), "flask==2.3.2\n");

        assertInstanceOf(NodeProvider.class, registry.selectProvider(ScanInput.directory(dir)).getProvider());
    }

    @Test
    void poetryWinsOverPipWhenBothPresent() throws IOException {
        Files.writeString(dir.resolve("pyproject.toml"), "[tool.poetry]\nname = \"demo\"\n");
        Files.writeString(dir.resolve("requirements.txt"), "flask==2.3.2\n");

        assertInstanceOf(PoetryProvider.class, registry.selectProvider(ScanInput.directory(dir)).getProvider());
    }

    @Test
    void nothingDetectedListsSupportedEcosystems() {
        DetectionFailureException ex = assertThrows(DetectionFailureException.class,
                () -> registry.selectProvider(ScanInput.directory(dir)));
        assertTrue(ex.getMessage().contains("No supported ecosystem detected"));
        assertTrue(ex.getMessage().contains("Python (pip)"));
    }

    @Test
    void supportedFileNamesAreUnique() {
        List<String> names = registry.listSupportedManifestFilenames();
        assertEquals(List.of("package.json", "package-lock.json", "npm-shrinkwrap.json", "pnpm-lock.yaml",
                "pnpm-workspace.yaml", "yarn.lock", "go.mod", "go.sum", "pyproject.toml", "poetry.lock",
                "requirements.txt"), names);
    }
}
