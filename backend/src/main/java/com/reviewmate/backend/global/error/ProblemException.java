package com.reviewmate.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * A failure the client can act on: an HTTP status plus one of the {@link ProblemCodes} codes.
 * Build instances through the {@link ProblemCodes} factories so code and status stay paired.
 */
public class ProblemException extends ResponseStatusException {

    private static final String TYPE_PREFIX = "urn:problem:reviewmate:";

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, detail);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("problem code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return typeFor(code);
    }

    static String typeFor(String code) {
        return TYPE_PREFIX + code.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\-_.]+", "-");
    }
}
