package com.carelink.backend.modules.user.domain;

import java.io.Serializable;
import java.util.Objects;

public class VerificationTokenId implements Serializable {

    private String identifier;
    private String token;

    protected VerificationTokenId() {
    }

    public VerificationTokenId(String identifier, String token) {
        this.identifier = identifier;
        this.token = token;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getToken() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VerificationTokenId that)) {
            return false;
        }
        return Objects.equals(identifier, that.identifier) && Objects.equals(token, that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, token);
    }
}
