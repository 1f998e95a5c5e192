package me.golemcore.engine.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.model.ServiceName;
import me.golemcore.engine.domain.model.ServiceState;
import me.golemcore.engine.domain.model.ServiceStatus;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.service.ServiceSupervisor;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ServiceStatusToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ServiceSupervisor supervisor = mock(ServiceSupervisor.class);
    private final ServiceStatusTool tool = new ServiceStatusTool(supervisor);

    @Test
    void shouldListAllBackendsInArgsExample() {
        String example = tool.getDefinition().getArgsExample();

        assertTrue(example.contains("\"kokomo\"|\"chatterbox\"|\"mlx\"|\"vlm\""));
    }

    @Test
    void shouldParseKnownServiceName() throws Exception {
        Optional<Map<String, Object>> params = tool.parseArguments(objectMapper.readTree("{\"name\":\"mlx\"}"));

        assertTrue(params.isPresent());
        assertEquals(ServiceName.MLX, params.get().get("name"));
    }

    @Test
    void shouldRejectUnknownServiceName() throws Exception {
        assertFalse(tool.parseArguments(objectMapper.readTree("{\"name\":\"whisper\"}")).isPresent());
        assertFalse(tool.parseArguments(objectMapper.readTree("{}")).isPresent());
    }

    @Test
    void shouldReturnSupervisorState() {
        ServiceState state = ServiceState.builder()
                .name(ServiceName.VLM)
                .status(ServiceStatus.RUNNING)
                .pid(1234L)
                .build();
        when(supervisor.getState(ServiceName.VLM)).thenReturn(state);

        ToolResult result = tool.execute(Map.of("name", ServiceName.VLM)).join();

        assertTrue(result.isSuccess());
        assertSame(state, result.getData());
    }
}
