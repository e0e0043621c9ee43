package com.chooserich.filter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.vertx.core.http.HttpServerRequest;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket per client IP on the game routes. Wallet reads are not limited.
 */
@Provider
public class RateLimitFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(RateLimitFilter.class);

    private final Cache<String, Bucket> buckets = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterAccess(1, TimeUnit.HOURS)
            .build();

    @ConfigProperty(name = "ratelimit.capacity", defaultValue = "20")
    long capacity;

    @ConfigProperty(name = "ratelimit.refill-per-second", defaultValue = "20")
    long refillPerSecond;

    @Context
    HttpServerRequest request;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if ("OPTIONS".equalsIgnoreCase(requestContext.getMethod()) || !isGameRoute(requestContext)) {
            return;
        }
        String ip = clientAddress();
        Bucket bucket = buckets.get(ip, k -> createNewBucket());

        if (!bucket.tryConsume(1)) {
            LOG.warn("Rate limit exceeded for IP: " + ip);
            requestContext.abortWith(Response.status(429)
                    .entity("Too many requests").build());
        }
    }

    private static boolean isGameRoute(ContainerRequestContext requestContext) {
        String path = requestContext.getUriInfo().getPath();
        if (path.startsWith("/")) {
            path = path.substring(1);
        }
        return path.startsWith("mines") || path.startsWith("apex");
    }

    private String clientAddress() {
        String ip = (request != null && request.remoteAddress() != null) ? request.remoteAddress().host() : null;
        return (ip == null || ip.isEmpty()) ? "unknown" : ip;
    }

    private Bucket createNewBucket() {
        Bandwidth limit = Bandwidth.builder()
                .capacity(capacity)
                .refillGreedy(refillPerSecond, Duration.ofSeconds(1))
                .build();
        return Bucket.builder().addLimit(limit).build();
    }
}
