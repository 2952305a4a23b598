package com.valuebet.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Utility for making JSON HTTP requests to the exchange.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private HttpClientUtil() {
    }

    /**
     * Helper method to log response body preview for debugging.
     */
    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    /**
     * POSTs a body serialized as JSON and returns the response as JsonNode.
     */
    public static JsonNode postJson(String url, Object body, Map<String, String> headers) throws IOException {
        try (CloseableHttpClient httpClient = HttpClients.createDefault()) {
            HttpPost request = new HttpPost(url);
            if (headers != null) {
                headers.forEach(request::addHeader);
            }
            request.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                String responseBody;
                String contentType = null;

                // Get content type from entity before consuming it
                HttpEntity entity = response.getEntity();
                if (entity != null && entity.getContentType() != null) {
                    contentType = entity.getContentType();
                }

                try {
                    responseBody = entity == null ? "" : EntityUtils.toString(entity);
                } catch (ParseException e) {
                    throw new IOException("Failed to parse response", e);
                }

                if (statusCode < 200 || statusCode >= 300) {
                    logger.error("HTTP request failed with status {}: {}", statusCode, responseBody);
                    throw new IOException("HTTP request failed with status " + statusCode);
                }

                if (contentType != null && !contentType.isEmpty()
                    && !contentType.toLowerCase(Locale.ROOT).startsWith("application/json")) {
                    logger.error("Expected JSON but received content-type: {}. URL: {}", contentType, url);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("Expected JSON response but received: " + contentType);
                }

                try {
                    return objectMapper.readTree(responseBody);
                } catch (com.fasterxml.jackson.core.JsonParseException e) {
                    logger.error("Failed to parse JSON. URL: {}", url);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("Failed to parse JSON response: " + e.getMessage(), e);
                }
            }
        }
    }
}
