package com.chooserich.client;

import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * Remote verifiable-random server. Only used as an audit trail next to local draws.
 */
@RegisterRestClient(configKey = "random-oracle")
@Path("/random")
public interface RandomOracleClient {

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    Uni<RandomNumberResponse> fetch();
}
