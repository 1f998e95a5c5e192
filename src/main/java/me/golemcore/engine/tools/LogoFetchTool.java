package me.golemcore.engine.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolNames;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.service.WorkspacePaths;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Downloads a company logo by domain into the workspace logo cache. A cached
 * file is returned without a network call.
 */
@Component
@Slf4j
public class LogoFetchTool implements ToolComponent {

    private static final String PARAM_DOMAIN = "domain";
    private static final Pattern DOMAIN_PATTERN = Pattern.compile("^[a-z0-9.-]+\\.[a-z]{2,}$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^a-z0-9.-]", Pattern.CASE_INSENSITIVE);

    private final OkHttpClient httpClient;
    private final WorkspacePaths workspacePaths;
    private final EngineProperties.ToolsProperties settings;

    public LogoFetchTool(OkHttpClient httpClient, WorkspacePaths workspacePaths, EngineProperties properties) {
        this.httpClient = httpClient;
        this.workspacePaths = workspacePaths;
        this.settings = properties.getTools();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolNames.LOGO_FETCH)
                .argsExample("{\"domain\":\"example.com\"}")
                .returns("{domain,url,filePath,bytes,cached}")
                .build();
    }

    @Override
    public Optional<Map<String, Object>> parseArguments(JsonNode args) {
        if (args == null || !args.isObject() || !args.path(PARAM_DOMAIN).isTextual()) {
            return Optional.empty();
        }
        return Optional.of(Map.of(PARAM_DOMAIN, args.get(PARAM_DOMAIN).asText()));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String domain = String.valueOf(parameters.get(PARAM_DOMAIN)).toLowerCase(Locale.ROOT).trim();
            if (!DOMAIN_PATTERN.matcher(domain).matches()) {
                return ToolResult.failure("invalid domain");
            }
            String url = trimSlash(settings.getLogoBaseUrl()) + "/" + domain;
            Path cacheDir = workspacePaths.stateDir().resolve("cache").resolve("logos");
            Path target = cacheDir.resolve(UNSAFE_FILE_CHARS.matcher(domain).replaceAll("_") + ".png");

            try {
                Files.createDirectories(cacheDir);
                if (Files.isRegularFile(target)) {
                    return ToolResult.success(result(domain, url, target, Files.size(target), true));
                }

                OkHttpClient client = httpClient.newBuilder()
                        .callTimeout(settings.getLogoTimeoutMs(), TimeUnit.MILLISECONDS)
                        .build();
                Request request = new Request.Builder().url(url).get().build();
                try (Response response = client.newCall(request).execute()) {
                    if (!response.isSuccessful()) {
                        return ToolResult.failure("fetch failed (" + response.code() + ")");
                    }
                    ResponseBody body = response.body();
                    byte[] bytes = body != null ? body.bytes() : new byte[0];
                    if (bytes.length == 0) {
                        return ToolResult.failure("empty response");
                    }
                    Files.write(target, bytes);
                    log.debug("[Tools] Cached logo for {} ({} bytes)", domain, bytes.length);
                    return ToolResult.success(result(domain, url, target, bytes.length, false));
                }
            } catch (IOException e) {
                return ToolResult.failure("fetch failed: " + e.getMessage());
            }
        });
    }

    private static Map<String, Object> result(String domain, String url, Path file, long bytes, boolean cached) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(PARAM_DOMAIN, domain);
        data.put("url", url);
        data.put("filePath", file.toString());
        data.put("bytes", bytes);
        data.put("cached", cached);
        return data;
    }

    private static String trimSlash(String base) {
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
