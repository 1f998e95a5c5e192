package me.golemcore.engine.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.exception.ServiceNotConfiguredException;
import me.golemcore.engine.domain.exception.ServiceStartException;
import me.golemcore.engine.domain.model.ChatCompletion;
import me.golemcore.engine.domain.model.HealthProbeResult;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.ServiceEvent;
import me.golemcore.engine.domain.model.ServiceName;
import me.golemcore.engine.domain.model.ServiceState;
import me.golemcore.engine.domain.model.ServiceStatus;
import me.golemcore.engine.infrastructure.config.EngineExecutors;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import me.golemcore.engine.port.outbound.EngineEventPort;
import me.golemcore.engine.port.outbound.HealthProbePort;
import me.golemcore.engine.port.outbound.LlmPort;
import me.golemcore.engine.port.outbound.ProcessSpawnPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ServiceSupervisorTest {

    @TempDir
    Path repo;

    private EngineProperties properties;
    private ProcessSpawnPort spawner;
    private HealthProbePort healthProbe;
    private EngineExecutors executors;
    private ServiceSupervisor supervisor;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.getWorkspace().setRoot(repo.toString());
        properties.getSupervisor().setHealthPollIntervalMs(10);
        spawner = mock(ProcessSpawnPort.class);
        healthProbe = mock(HealthProbePort.class);
        when(healthProbe.probe(anyString(), anyLong())).thenReturn(HealthProbeResult.failed("Connection refused"));
        executors = new EngineExecutors();
        supervisor = new ServiceSupervisor(properties,
                new ServiceLaunchResolver(properties, new WorkspacePaths(properties), new ObjectMapper()),
                spawner, healthProbe, executors);
    }

    @AfterEach
    void tearDown() {
        supervisor.stopAll();
        executors.shutdown();
    }

    @Test
    void shouldListEveryBackendAsStopped() {
        List<ServiceState> states = supervisor.listStates();

        assertEquals(List.of(ServiceName.KOKOMO, ServiceName.CHATTERBOX, ServiceName.MLX, ServiceName.VLM),
                states.stream().map(ServiceState::getName).toList());
        assertTrue(states.stream().allMatch(ServiceState::isQuiet));
    }

    @Test
    void shouldRejectStartOfUnconfiguredBackend() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> supervisor.start(ServiceName.KOKOMO).join());

        assertInstanceOf(ServiceNotConfiguredException.class, error.getCause());
        assertFalse(supervisor.canStart(ServiceName.KOKOMO));
        verifyNoInteractions(spawner);
    }

    @Test
    void shouldAdoptHealthyExternalInstanceAndNotifyListeners() throws IOException {
        EngineProperties.ServiceProperties mlx = new EngineProperties.ServiceProperties();
        mlx.setCommand("mlx-server --port 12345");
        properties.getServices().put("mlx", mlx);
        when(healthProbe.probe(anyString(), anyLong())).thenReturn(HealthProbeResult.ok());
        List<ServiceEvent> received = new CopyOnWriteArrayList<>();
        supervisor.addListener(received::add);

        supervisor.start(ServiceName.MLX).join();

        assertEquals(ServiceStatus.RUNNING, supervisor.getState(ServiceName.MLX).getStatus());
        assertTrue(supervisor.isHealthy(ServiceName.MLX));
        assertFalse(received.isEmpty());
        ServiceEvent last = received.get(received.size() - 1);
        assertInstanceOf(ServiceEvent.Status.class, last);
        assertEquals(ServiceStatus.RUNNING, ((ServiceEvent.Status) last).service().getStatus());
        verify(spawner, never()).spawn(any(), any());
    }

    @Test
    void shouldStopNotifyingRemovedListeners() {
        EngineProperties.ServiceProperties vlm = new EngineProperties.ServiceProperties();
        vlm.setCommand("vlm-server");
        properties.getServices().put("vlm", vlm);
        when(healthProbe.probe(anyString(), anyLong())).thenReturn(HealthProbeResult.ok());
        List<ServiceEvent> received = new CopyOnWriteArrayList<>();
        Runnable subscription = supervisor.addListener(received::add);
        subscription.run();

        supervisor.start(ServiceName.VLM).join();

        assertTrue(received.isEmpty());
    }

    @Test
    void shouldKeepNotifyingWhenOneListenerFails() {
        EngineProperties.ServiceProperties vlm = new EngineProperties.ServiceProperties();
        vlm.setCommand("vlm-server");
        properties.getServices().put("vlm", vlm);
        when(healthProbe.probe(anyString(), anyLong())).thenReturn(HealthProbeResult.ok());
        List<ServiceEvent> received = new CopyOnWriteArrayList<>();
        supervisor.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        supervisor.addListener(received::add);

        supervisor.start(ServiceName.VLM).join();

        assertFalse(received.isEmpty());
    }

    @Test
    void shouldSkipAutoStartWhenDisabled() {
        properties.getSupervisor().setAutoStart(false);
        EngineProperties.ServiceProperties mlx = new EngineProperties.ServiceProperties();
        mlx.setCommand("mlx-server");
        mlx.setAutoStart(true);
        properties.getServices().put("mlx", mlx);

        supervisor.autoStartIfConfigured();

        assertEquals(ServiceStatus.STOPPED, supervisor.getState(ServiceName.MLX).getStatus());
        verifyNoInteractions(spawner);
    }

    @Test
    void shouldContinueAutoStartAfterFailure() throws IOException {
        EngineProperties.ServiceProperties kokomo = new EngineProperties.ServiceProperties();
        kokomo.setCommand("kokomo-server");
        kokomo.setAutoStart(true);
        properties.getServices().put("kokomo", kokomo);
        EngineProperties.ServiceProperties mlx = new EngineProperties.ServiceProperties();
        mlx.setCommand("mlx-server");
        mlx.setAutoStart(true);
        properties.getServices().put("mlx", mlx);
        when(spawner.spawn(any(), any())).thenThrow(new IOException("No such file"));

        supervisor.autoStartIfConfigured();

        verify(spawner, times(2)).spawn(any(), any());
        assertEquals("No such file", supervisor.getState(ServiceName.KOKOMO).getLastError());
        assertEquals("No such file", supervisor.getState(ServiceName.MLX).getLastError());
        assertFalse(supervisor.getState(ServiceName.MLX).isQuiet());
    }

    @Test
    void shouldTimeOutReadinessWhileWorkbenchRunsAreStalled() throws Exception {
        CompletableFuture<ChatCompletion> stalled = new CompletableFuture<>();
        LlmPort llm = mock(LlmPort.class);
        when(llm.complete(anyList(), any())).thenReturn(stalled);
        properties.getWorkbench().setStrategies("quick");
        SessionTable sessionTable = new SessionTable(executors, Clock.systemUTC());
        sessionTable.run(sessions -> sessions.create("s1"));
        WorkbenchService workbench = new WorkbenchService(properties, llm, new PromptStackService(properties),
                sessionTable, mock(EngineEventPort.class), executors, Clock.systemUTC());
        Message user = Message.builder().id("m1").role(Message.ROLE_USER).content("hello there")
                .timestamp(Instant.EPOCH).build();
        WorkbenchService.Plan plan = new WorkbenchService.Plan("s1", "system", "chat.quick", "Hi!", "primary",
                List.of(user));

        EngineProperties.ServiceProperties mlx = new EngineProperties.ServiceProperties();
        mlx.setCommand("mlx-server");
        mlx.setReadyTimeoutMs(200L);
        properties.getServices().put("mlx", mlx);
        ProcessSpawnPort.SupervisedProcess process = mock(ProcessSpawnPort.SupervisedProcess.class);
        when(process.stop(any())).thenReturn(CompletableFuture.completedFuture(null));
        when(spawner.spawn(any(), any())).thenReturn(process);

        try {
            for (int i = 0; i < 4; i++) {
                workbench.schedule(plan);
            }
            verify(llm, timeout(2000).times(4)).complete(anyList(), any());

            ExecutionException error = assertThrows(ExecutionException.class,
                    () -> supervisor.start(ServiceName.MLX).get(3, TimeUnit.SECONDS));

            assertInstanceOf(ServiceStartException.class, error.getCause());
            assertTrue(error.getCause().getMessage().contains("Health check failed"));
            assertEquals(ServiceStatus.STOPPED, supervisor.getState(ServiceName.MLX).getStatus());
        } finally {
            stalled.complete(new ChatCompletion("primary", "Hi!"));
        }
    }
}
