package me.golemcore.engine.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.model.ServiceLaunchConfig;
import me.golemcore.engine.domain.model.ServiceName;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceLaunchResolverTest {

    @TempDir
    Path repoRoot;

    private EngineProperties properties;
    private ServiceLaunchResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.getWorkspace().setRoot(repoRoot.toString());
        resolver = new ServiceLaunchResolver(properties, new WorkspacePaths(properties), new ObjectMapper());
    }

    @Test
    void shouldBeUnconfiguredWithoutCommandOrInstall() {
        ServiceLaunchConfig config = resolver.resolve(ServiceName.MLX);

        assertFalse(config.isConfigured());
        assertNull(config.healthUrl());
        assertEquals("http://127.0.0.1:12345", config.baseUrl());
        assertFalse(config.autoStart());
        assertNull(config.configError());
    }

    @Test
    void shouldSplitCommandAndDeriveHealthUrl() {
        EngineProperties.ServiceProperties mlx = new EngineProperties.ServiceProperties();
        mlx.setCommand("python -m 'mlx_lm.server' --port 9000");
        mlx.setPort(9000);
        properties.getServices().put("mlx", mlx);

        ServiceLaunchConfig config = resolver.resolve(ServiceName.MLX);

        assertEquals(List.of("python", "-m", "mlx_lm.server", "--port", "9000"), config.command());
        assertEquals("http://127.0.0.1:9000/health", config.healthUrl());
        assertEquals(repoRoot.toAbsolutePath().normalize(), config.workingDirectory());
    }

    @Test
    void shouldPreferCommandJsonOverCommand() {
        EngineProperties.ServiceProperties vlm = new EngineProperties.ServiceProperties();
        vlm.setCommand("ignored");
        vlm.setCommandJson("[\"python\", \"server.py\", \"--flag with space\"]");
        properties.getServices().put("vlm", vlm);

        ServiceLaunchConfig config = resolver.resolve(ServiceName.VLM);

        assertEquals(List.of("python", "server.py", "--flag with space"), config.command());
    }

    @Test
    void shouldReportInvalidCommandJson() {
        EngineProperties.ServiceProperties vlm = new EngineProperties.ServiceProperties();
        vlm.setCommandJson("{\"not\": \"an array\"}");
        properties.getServices().put("vlm", vlm);

        ServiceLaunchConfig config = resolver.resolve(ServiceName.VLM);

        assertFalse(config.isConfigured());
        assertNotNull(config.configError());
        assertTrue(config.configError().contains("JSON array"));
    }

    @Test
    void shouldReportUnterminatedQuoteAsConfigError() {
        EngineProperties.ServiceProperties kokomo = new EngineProperties.ServiceProperties();
        kokomo.setCommand("python 'server.py");
        properties.getServices().put("kokomo", kokomo);

        ServiceLaunchConfig config = resolver.resolve(ServiceName.KOKOMO);

        assertFalse(config.isConfigured());
        assertTrue(config.configError().contains("Unterminated quote"));
    }

    @Test
    void shouldUseWrapperScriptOnceInstalled() throws IOException {
        Path wrapper = repoRoot.resolve("scripts/services/mlx/run-server.sh");
        Path python = repoRoot.resolve("external/mlx-llm/.venv/bin/python");
        Files.createDirectories(wrapper.getParent());
        Files.createDirectories(python.getParent());
        Files.writeString(wrapper, "#!/bin/bash\n");
        Files.writeString(python, "");

        ServiceLaunchConfig config = resolver.resolve(ServiceName.MLX);

        assertTrue(resolver.isInstalled(ServiceName.MLX));
        assertEquals("bash", config.command().get(0));
        assertTrue(config.command().get(1).endsWith("run-server.sh"));
        assertTrue(config.autoStart());
        assertEquals(30_000, config.readyTimeoutMs());
    }

    @Test
    void shouldUseWrapperWithUseDefaultsEvenWhenNotInstalled() {
        EngineProperties.ServiceProperties kokomo = new EngineProperties.ServiceProperties();
        kokomo.setUseDefaults(true);
        properties.getServices().put("kokomo", kokomo);

        ServiceLaunchConfig config = resolver.resolve(ServiceName.KOKOMO);

        assertTrue(config.isConfigured());
        assertFalse(config.autoStart());
        assertEquals("http://127.0.0.1:8880/health", config.healthUrl());
    }

    @Test
    void shouldHonorExplicitOverrides() {
        EngineProperties.ServiceProperties chatterbox = new EngineProperties.ServiceProperties();
        chatterbox.setCommand("run");
        chatterbox.setHost("localhost");
        chatterbox.setHealthUrl(" http://localhost:1/ready ");
        chatterbox.setReadyTimeoutMs(500L);
        chatterbox.setAutoStart(true);
        properties.getServices().put("chatterbox", chatterbox);

        ServiceLaunchConfig config = resolver.resolve(ServiceName.CHATTERBOX);

        assertEquals("http://localhost:8890", config.baseUrl());
        assertEquals("http://localhost:1/ready", config.healthUrl());
        assertEquals(500L, config.readyTimeoutMs());
        assertTrue(config.autoStart());
    }

    @Test
    void shouldExplainHowToConfigure() {
        String message = resolver.notConfiguredMessage(ServiceName.VLM);

        assertTrue(message.startsWith("MLX VLM is not configured/installed."));
        assertTrue(message.contains("ENGINE_SERVICES_VLM_COMMAND"));
        assertTrue(message.contains("scripts/services/vlm/run-server.sh"));
    }
}
