package com.chooserich.web;

import com.chooserich.dto.ApexResult;
import com.chooserich.service.ApexEngine;
import com.chooserich.service.ApexGameService;
import com.chooserich.service.TokenService;
import com.chooserich.web.model.ApexChooseRequest;
import com.chooserich.web.model.ApexSessionView;
import com.chooserich.web.model.ApexStartRequest;
import com.chooserich.web.model.ApexStartResponse;
import io.smallrye.common.annotation.Blocking;
import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/apex")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
@Blocking
public class ApexResource {

    private final ApexGameService apexGameService;
    private final ApexEngine apexEngine;
    private final TokenService tokenService;

    @Inject
    public ApexResource(ApexGameService apexGameService, ApexEngine apexEngine, TokenService tokenService) {
        this.apexGameService = apexGameService;
        this.apexEngine = apexEngine;
        this.tokenService = tokenService;
    }

    @POST
    @Path("/start")
    public ApexStartResponse start(@HeaderParam("Authorization") String token, @Valid ApexStartRequest req)
            throws ParseException {
        String owner = tokenService.getOwnerFromToken(token);
        ApexGameService.Started started = apexGameService.start(owner, req.stake(), req.mode());
        return ApexStartResponse.from(started.session(), apexEngine.odds(started.session()), started.blindResult());
    }

    @POST
    @Path("/choose")
    public ApexResult choose(@HeaderParam("Authorization") String token, @Valid ApexChooseRequest req)
            throws ParseException {
        String owner = tokenService.getOwnerFromToken(token);
        return apexGameService.choose(owner, req.sessionId(), req.comparison());
    }

    @GET
    @Path("/{sessionId}")
    public ApexSessionView get(@HeaderParam("Authorization") String token, @PathParam("sessionId") String sessionId)
            throws ParseException {
        String owner = tokenService.getOwnerFromToken(token);
        return ApexSessionView.from(apexGameService.find(owner, sessionId));
    }
}
