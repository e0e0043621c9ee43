package com.chooserich.service;

import com.chooserich.client.RandomOracleClient;
import org.jboss.logging.Logger;

/**
 * Returns the local draw straight away and asks the remote oracle for a verifiable number in the
 * background. The oracle's answer is only logged; it never reaches the caller.
 */
public class OracleRandomSource implements RandomSource {

    private static final Logger LOG = Logger.getLogger(OracleRandomSource.class);

    private final RandomSource local;
    private final RandomOracleClient oracle;

    public OracleRandomSource(RandomSource local, RandomOracleClient oracle) {
        this.local = local;
        this.oracle = oracle;
    }

    @Override
    public int nextInt(int minInclusive, int maxInclusive) {
        int value = local.nextInt(minInclusive, maxInclusive);
        requestAuditNumber(value);
        return value;
    }

    private void requestAuditNumber(int localValue) {
        try {
            oracle.fetch()
                    .subscribe().with(response -> {
                        if (response == null || !response.success) {
                            LOG.warn("Random oracle reported failure (local draw " + localValue + ")");
                        } else {
                            LOG.debug("Random oracle number " + response.randomNumber + " (local draw " + localValue + ")");
                        }
                    }, t -> LOG.warn("Random oracle unavailable: " + t.getMessage()));
        } catch (RuntimeException e) {
            LOG.warn("Random oracle call could not be started: " + e.getMessage());
        }
    }
}
