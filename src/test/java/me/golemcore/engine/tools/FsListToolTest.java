package me.golemcore.engine.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.service.WorkspacePaths;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FsListToolTest {

    @TempDir
    Path repo;

    private FsListTool tool;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.getWorkspace().setRoot(repo.toString());
        tool = new FsListTool(new RepoPathResolver(new WorkspacePaths(properties)));
    }

    @Test
    void shouldListEntriesSortedByName() throws IOException {
        Files.writeString(repo.resolve("zeta.txt"), "z");
        Files.createDirectories(repo.resolve("alpha"));
        Files.writeString(repo.resolve("beta.md"), "b");

        ToolResult result = tool.execute(Map.of("path", ".")).join();

        assertTrue(result.isSuccess());
        List<?> entries = (List<?>) ((Map<?, ?>) result.getData()).get("entries");
        assertEquals(3, entries.size());
        assertEquals(Map.of("name", "alpha", "type", "dir"), entries.get(0));
        assertEquals(Map.of("name", "beta.md", "type", "file"), entries.get(1));
        assertEquals(Map.of("name", "zeta.txt", "type", "file"), entries.get(2));
    }

    @Test
    void shouldFailForMissingDirectory() {
        ToolResult result = tool.execute(Map.of("path", "nope")).join();

        assertFalse(result.isSuccess());
        assertEquals("directory does not exist", result.getError());
    }

    @Test
    void shouldFailForRegularFile() throws IOException {
        Files.writeString(repo.resolve("file.txt"), "x");

        ToolResult result = tool.execute(Map.of("path", "file.txt")).join();

        assertEquals("not a directory", result.getError());
    }

    @Test
    void shouldRejectAbsolutePath() {
        ToolResult result = tool.execute(Map.of("path", "/tmp")).join();

        assertEquals("absolute paths are not allowed", result.getError());
    }

    @Test
    void shouldRequireTextualPath() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();

        assertTrue(tool.parseArguments(objectMapper.readTree("{\"path\":\"src\"}")).isPresent());
        assertFalse(tool.parseArguments(objectMapper.readTree("{\"dir\":\"src\"}")).isPresent());
    }
}
