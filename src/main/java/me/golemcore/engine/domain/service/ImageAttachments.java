package me.golemcore.engine.domain.service;

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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;

/**
 * Turns image files into {@code data:} URLs for multimodal requests.
 */
public final class ImageAttachments {

    private static final Map<String, String> MIME_BY_EXTENSION = Map.of(
            ".png", "image/png",
            ".jpg", "image/jpeg",
            ".jpeg", "image/jpeg",
            ".webp", "image/webp",
            ".gif", "image/gif",
            ".bmp", "image/bmp");

    private ImageAttachments() {
    }

    /**
     * @throws IOException
     *             if the type is unsupported, or the file is unreadable or empty
     */
    public static String toDataUrl(Path file) throws IOException {
        String name = file.getFileName() != null ? file.getFileName().toString() : "";
        int dot = name.lastIndexOf('.');
        String extension = dot >= 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
        String mime = MIME_BY_EXTENSION.get(extension);
        if (mime == null) {
            throw new IOException("unsupported image type: " + (extension.isEmpty() ? "unknown" : extension));
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new IOException("no such file: " + file, e);
        }
        if (bytes.length == 0) {
            throw new IOException("empty image file");
        }
        return "data:" + mime + ";base64," + Base64.getEncoder().encodeToString(bytes);
    }

    public static String fileName(String path) {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}
