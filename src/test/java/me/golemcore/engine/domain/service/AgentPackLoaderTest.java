package me.golemcore.engine.domain.service;

import me.golemcore.engine.domain.model.AgentPack;
import me.golemcore.engine.domain.model.ToolNames;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class AgentPackLoaderTest {

    @TempDir
    Path repo;

    private WorkspacePaths workspacePaths;
    private AgentPackLoader loader;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.getWorkspace().setRoot(repo.toString());
        workspacePaths = new WorkspacePaths(properties);
        loader = new AgentPackLoader(workspacePaths);
    }

    @Test
    void shouldReturnBuiltInsSortedWhenNoAgentsDirectory() {
        List<AgentPack> agents = loader.loadAgents();

        assertEquals(List.of("chat.quick", "code.arch", "code.change", "debug.triage", "tool.use"),
                agents.stream().map(AgentPack::getName).toList());
    }

    @Test
    void shouldLoadCustomAgentFromFrontmatter() throws IOException {
        writeAgent("reviewer.md", """
                ---
                name: code.review
                description: Reviews diffs.
                tools: [fs.read, shell.exec, fs.read]
                max_tool_calls: 5
                max_history_turns: "12"
                temperature: 0.4
                ---
                Review the change carefully.
                """);

        AgentPack agent = find(loader.loadAgents(), "code.review");

        assertEquals("Reviews diffs.", agent.getDescription());
        assertEquals("Review the change carefully.", agent.getPrompt());
        assertEquals(List.of(ToolNames.FS_READ), agent.getTools());
        assertEquals(5, agent.getMaxToolCalls());
        assertEquals(12, agent.getMaxHistoryTurns());
        assertEquals(0.4, agent.getTemperature());
    }

    @Test
    void shouldUseFileNameAndDefaultsWithoutFrontmatter() throws IOException {
        writeAgent("notes.md", "Take notes.\n");

        AgentPack agent = find(loader.loadAgents(), "notes");

        assertEquals("Custom agent pack.", agent.getDescription());
        assertEquals("Take notes.", agent.getPrompt());
        assertEquals(List.of(), agent.getTools());
        assertEquals(3, agent.getMaxToolCalls());
        assertEquals(20, agent.getMaxHistoryTurns());
        assertNull(agent.getTemperature());
    }

    @Test
    void shouldOverrideBuiltInFieldByField() throws IOException {
        writeAgent("code.arch.md", """
                ---
                tools: fs.list, time.now
                ---
                """);

        AgentPack agent = find(loader.loadAgents(), BuiltInAgents.CODE_ARCH);
        AgentPack builtIn = find(BuiltInAgents.ALL, BuiltInAgents.CODE_ARCH);

        assertEquals(List.of(ToolNames.FS_LIST, ToolNames.TIME_NOW), agent.getTools());
        assertEquals(builtIn.getPrompt(), agent.getPrompt());
        assertEquals(builtIn.getDescription(), agent.getDescription());
        assertEquals(builtIn.getMaxToolCalls(), agent.getMaxToolCalls());
        assertEquals(builtIn.getTemperature(), agent.getTemperature());
    }

    @Test
    void shouldIgnoreBlankFilesAndNonMarkdown() throws IOException {
        writeAgent("empty.md", "   \n");
        writeAgent("readme.txt", "not an agent");

        assertEquals(BuiltInAgents.ALL.size(), loader.loadAgents().size());
    }

    @Test
    void shouldJoinSharedAndLocalWorkspacePrompts() throws IOException {
        Files.createDirectories(workspacePaths.stateDir());
        Files.writeString(workspacePaths.workspacePrompt(), "  Shared rules.\n");
        Files.writeString(workspacePaths.workspaceLocalPrompt(), "Local rules.");

        assertEquals("Shared rules.\n\nLocal rules.", loader.loadWorkspacePrompt());
    }

    @Test
    void shouldReturnEmptyWorkspacePromptWhenMissing() {
        assertEquals("", loader.load().workspacePrompt());
    }

    private void writeAgent(String fileName, String content) throws IOException {
        Files.createDirectories(workspacePaths.agentsDir());
        Files.writeString(workspacePaths.agentsDir().resolve(fileName), content);
    }

    private static AgentPack find(List<AgentPack> agents, String name) {
        return agents.stream().filter(agent -> agent.getName().equals(name)).findFirst().orElseThrow();
    }
}
