package me.golemcore.engine.adapter.outbound.health;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.HealthProbeResult;
import me.golemcore.engine.port.outbound.HealthProbePort;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Health probe issuing {@code GET <url>} through OkHttp.
 *
 * <p>
 * Each probe derives a client from the shared one with a call timeout equal to
 * the probe deadline, so a backend that accepts the connection but never
 * answers is reported unhealthy in time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OkHttpHealthProbe implements HealthProbePort {

    private final OkHttpClient httpClient;

    @Override
    public HealthProbeResult probe(String url, long timeoutMs) {
        if (url == null || url.isBlank()) {
            return HealthProbeResult.failed("no health url");
        }

        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build();

        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            return HealthProbeResult.failed("invalid health url: " + url);
        }

        try (Response response = client.newCall(request).execute()) {
            if (response.isSuccessful()) {
                return HealthProbeResult.ok();
            }
            String detail = (response.code() + " " + response.message()).trim();
            log.trace("[Health] {} -> {}", url, detail);
            return HealthProbeResult.failed(detail);
        } catch (IOException e) {
            log.trace("[Health] {} unreachable: {}", url, e.getMessage());
            return HealthProbeResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
