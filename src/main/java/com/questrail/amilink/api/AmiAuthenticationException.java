package com.questrail.amilink.api;

import com.questrail.amilink.protocol.ami.model.AmiResponse;

import java.util.Objects;

/**
 * The switch rejected the login. Fatal to the current connect attempt only.
 */
public final class AmiAuthenticationException extends AmiException
{
    private final transient AmiResponse response;

    public AmiAuthenticationException(String username, AmiResponse response) {
        super("Login rejected for user '" + username + "': "
                + response.message().getOrDefault("Message", response.status()));
        this.response = Objects.requireNonNull(response, "response");
    }

    /**
     * @return the response that rejected the login
     */
    public AmiResponse response() {
        return response;
    }
}
