package com.sportsdata.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsdata.domain.ports.ProviderException;

import java.util.Map;

/**
 * Raw transport used by provider clients: fetches one endpoint and returns its
 * JSON body.
 */
public interface JsonFetcher {

    /**
     * @param url    endpoint URL without query string
     * @param params query parameters, may be empty
     * @return the parsed body, or a missing node when the resource does not exist
     * @throws ProviderException on any transport, auth, rate-limit or parse failure
     */
    JsonNode getJson(String url, Map<String, String> params) throws ProviderException;
}
