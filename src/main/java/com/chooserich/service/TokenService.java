package com.chooserich.service;

import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotAuthorizedException;

/**
 * Resolves the bettor behind a request. Tokens are issued by the auth service; here they are only
 * verified and read.
 */
@ApplicationScoped
public class TokenService {

    static final String OWNER_CLAIM = "userId";

    private final JWTParser parser;

    @Inject
    public TokenService(JWTParser parser) {
        this.parser = parser;
    }

    public String getOwnerFromToken(String token) throws ParseException {
        if (token == null || token.isBlank()) {
            throw new NotAuthorizedException("Bearer");
        }
        // Remove "Bearer " prefix if present
        if (token.startsWith("Bearer ")) {
            token = token.substring(7);
        }
        String owner = parser.parse(token).getClaim(OWNER_CLAIM);
        if (owner == null || owner.isBlank()) {
            throw new ParseException("Token has no " + OWNER_CLAIM + " claim");
        }
        return owner;
    }
}
