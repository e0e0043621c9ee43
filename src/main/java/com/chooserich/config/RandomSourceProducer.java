package com.chooserich.config;

import com.chooserich.client.RandomOracleClient;
import com.chooserich.service.AuditedRandom;
import com.chooserich.service.LocalRandomSource;
import com.chooserich.service.OracleRandomSource;
import com.chooserich.service.RandomSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Produces;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

@ApplicationScoped
public class RandomSourceProducer {

    private static final Logger LOG = Logger.getLogger(RandomSourceProducer.class);

    @ConfigProperty(name = "random.oracle.enabled", defaultValue = "false")
    boolean oracleEnabled;

    @RestClient
    RandomOracleClient oracleClient;

    @Produces
    @Default
    @ApplicationScoped
    RandomSource localRandomSource() {
        return new LocalRandomSource();
    }

    @Produces
    @AuditedRandom
    @ApplicationScoped
    RandomSource auditedRandomSource() {
        LocalRandomSource local = new LocalRandomSource();
        if (!oracleEnabled) {
            LOG.info("Audited random source: local only");
            return local;
        }
        LOG.info("Audited random source: local draws with background oracle audit");
        return new OracleRandomSource(local, oracleClient);
    }
}
