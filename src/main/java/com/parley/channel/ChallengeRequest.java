package com.parley.channel;

import org.springframework.http.HttpHeaders;

import java.util.Map;

/**
 * GET request a provider sends while setting up a webhook subscription.
 */
public record ChallengeRequest(
        ChannelId channel,
        Map<String, String> queryParams,
        HttpHeaders headers
) {

    public ChallengeRequest {
        queryParams = queryParams != null ? Map.copyOf(queryParams) : Map.of();
        headers = headers != null ? headers : new HttpHeaders();
    }

    public String queryParam(String name) {
        return queryParams.get(name);
    }

    public String header(String name) {
        return headers.getFirst(name);
    }
}
