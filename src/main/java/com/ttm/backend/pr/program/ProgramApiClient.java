package com.ttm.backend.pr.program;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 課表 API client：GET /users/{userId}/program-exercises
 * 回應可為 ["a","b"] 或 {"exercises":["a","b"]}；保留順序、略過空白。
 */
@Slf4j
public class ProgramApiClient implements ProgramExerciseProvider {

    private static final int MAX_ERROR_SNIPPET_BYTES = 1024;

    private final RestClient http;
    private final ObjectMapper om;

    public ProgramApiClient(RestClient http, ObjectMapper om) {
        this.http = http;
        this.om = om;
    }

    @Override
    public List<String> programExercises(long userId) {
        String body;
        try {
            body = http.get()
                    .uri("/users/{userId}/program-exercises", userId)
                    .retrieve()
                    // 4xx/5xx 與 JSON parse fail 分開
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        int status = res.getStatusCode().value();
                        throw new ProgramApiException(
                                status,
                                "PROGRAM_API_HTTP_" + status,
                                readBodySnippetQuietly(res, MAX_ERROR_SNIPPET_BYTES)
                        );
                    })
                    .body(String.class);
        } catch (ResourceAccessException e) {
            throw new ProgramApiException(0, "PROGRAM_API_UNREACHABLE", null, e);
        }

        if (body == null || body.isBlank()) {
            throw new ProgramApiException(200, "PROGRAM_API_EMPTY_BODY", null);
        }

        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (Exception e) {
            throw new ProgramApiException(200, "PROGRAM_API_JSON_PARSE_FAILED", shrink(body, 300), e);
        }

        JsonNode arr = root.isArray() ? root : root.path("exercises");
        if (!arr.isArray()) {
            throw new ProgramApiException(200, "PROGRAM_API_UNEXPECTED_SHAPE", shrink(body, 300));
        }

        List<String> out = new ArrayList<>(arr.size());
        for (JsonNode n : arr) {
            if (!n.isTextual()) continue;
            String name = n.asText().strip();
            if (!name.isEmpty()) out.add(name);
        }
        log.debug("program_api userId={} exercises={}", userId, out.size());
        return List.copyOf(out);
    }

    private static String readBodySnippetQuietly(ClientHttpResponse res, int maxBytes) {
        try (InputStream in = res.getBody()) {
            byte[] bytes = in.readNBytes(Math.max(0, maxBytes));
            if (bytes.length == 0) return "";
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.debug("program_api error body unreadable: {}", e.toString());
            return null;
        }
    }

    private static String shrink(String s, int maxChars) {
        if (s == null) return null;
        String t = s.replaceAll("\\s+", " ").trim();
        if (t.length() <= maxChars) return t;
        return t.substring(0, maxChars) + "...";
    }
}
