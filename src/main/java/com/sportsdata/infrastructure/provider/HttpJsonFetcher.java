package com.sportsdata.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.sportsdata.domain.ports.ProviderException;
import com.sportsdata.domain.ports.ProviderException.Kind;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link JsonFetcher} backed by Apache HttpClient.
 *
 * <p>HTTP status codes are translated into {@link ProviderException} kinds so the
 * federation layer can log what went wrong with a provider. A 404 is not a
 * failure: it yields a {@link MissingNode}.
 */
public class HttpJsonFetcher implements JsonFetcher {

    private static final Logger logger = LoggerFactory.getLogger(HttpJsonFetcher.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private static final Map<String, String> HEADERS = Map.of(
        "accept", "application/json, text/plain, */*",
        "user-agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36"
    );

    private final String provider;
    private final ObjectMapper objectMapper;
    private final RequestConfig requestConfig;
    private final ConnectionConfig connectionConfig;

    /**
     * @param requestTimeout bounds connecting, waiting for a pooled connection and waiting for the response
     */
    public HttpJsonFetcher(String provider, ObjectMapper objectMapper, Duration requestTimeout) {
        this.provider = provider;
        this.objectMapper = objectMapper;
        Timeout timeout = Timeout.ofMilliseconds(requestTimeout.toMillis());
        this.requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(timeout)
            .setResponseTimeout(timeout)
            .build();
        this.connectionConfig = ConnectionConfig.custom()
            .setConnectTimeout(timeout)
            .setSocketTimeout(timeout)
            .build();
    }

    ConnectionConfig connectionConfig() {
        return connectionConfig;
    }

    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.warn("Response body preview: {}", preview);
    }

    @Override
    public JsonNode getJson(String url, Map<String, String> params) throws ProviderException {
        String fullUrl = buildUrl(url, params);
        logger.debug("GET {}", fullUrl);

        try (CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                    .setDefaultConnectionConfig(connectionConfig)
                    .build())
                .setDefaultRequestConfig(requestConfig)
                .build()) {
            HttpGet request = new HttpGet(fullUrl);
            HEADERS.forEach(request::addHeader);

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                String responseBody = entity != null ? EntityUtils.toString(entity) : "";

                if (statusCode == 404) {
                    logger.debug("Nothing at {}", url);
                    return MissingNode.getInstance();
                }
                if (statusCode == 401 || statusCode == 403) {
                    throw new ProviderException(provider, Kind.AUTH, "HTTP " + statusCode + " for " + url);
                }
                if (statusCode == 429) {
                    throw new ProviderException(provider, Kind.RATE_LIMITED, "HTTP 429 for " + url);
                }
                if (statusCode < 200 || statusCode >= 300) {
                    throw new ProviderException(provider, Kind.TRANSPORT, "HTTP " + statusCode + " for " + url);
                }

                try {
                    return objectMapper.readTree(responseBody);
                } catch (JsonProcessingException e) {
                    logger.warn("Failed to parse JSON from {}", url);
                    logResponseBodyPreview(responseBody);
                    throw new ProviderException(provider, Kind.MALFORMED_RESPONSE,
                        "Unparseable JSON from " + url, e);
                }
            }
        } catch (ParseException e) {
            throw new ProviderException(provider, Kind.MALFORMED_RESPONSE, "Failed to read response from " + url, e);
        } catch (IOException e) {
            throw new ProviderException(provider, Kind.TRANSPORT, "Request to " + url + " failed: " + e.getMessage(), e);
        }
    }

    static String buildUrl(String baseUrl, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return baseUrl;
        }
        StringBuilder urlBuilder = new StringBuilder(baseUrl).append('?');
        for (Map.Entry<String, String> entry : params.entrySet()) {
            urlBuilder.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .append('&');
        }
        urlBuilder.setLength(urlBuilder.length() - 1);
        return urlBuilder.toString();
    }
}
