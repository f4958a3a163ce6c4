package com.parley.channel;

import org.springframework.http.MediaType;

public record ChallengeResponse(int status, MediaType contentType, String body) {

    public static ChallengeResponse echo(String value) {
        return new ChallengeResponse(200, MediaType.TEXT_PLAIN, value);
    }
}
