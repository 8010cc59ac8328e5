package me.golemcore.toolexec.checkpoint;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * JSON serialization and GZIP compression of checkpoint state.
 */
@Component
@RequiredArgsConstructor
public class CheckpointCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> STATE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public byte[] serialize(Map<String, Object> state) {
        try {
            return objectMapper.writeValueAsBytes(state != null ? state : Map.of());
        } catch (IOException e) {
            throw new UncheckedIOException("Checkpoint state is not serializable", e);
        }
    }

    public Map<String, Object> deserialize(byte[] bytes, boolean compressed) {
        try {
            byte[] json = compressed ? gunzip(bytes) : bytes;
            return objectMapper.readValue(json, STATE_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Checkpoint payload is corrupt", e);
        }
    }

    /**
     * Normalizes a state through a JSON round trip so in-memory values compare
     * equal to reconstructed ones.
     */
    public Map<String, Object> normalize(Map<String, Object> state) {
        return deserialize(serialize(state), false);
    }

    public byte[] gzip(byte[] bytes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, bytes.length / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Compression failed", e);
        }
        return out.toByteArray();
    }

    public byte[] gunzip(byte[] bytes) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return in.readAllBytes();
        }
    }
}
