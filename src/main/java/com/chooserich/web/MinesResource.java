package com.chooserich.web;

import com.chooserich.dto.MinesCashoutResult;
import com.chooserich.dto.MinesMoveResult;
import com.chooserich.model.MinesSession;
import com.chooserich.service.MinesGameService;
import com.chooserich.service.TokenService;
import com.chooserich.web.model.MinesMoveRequest;
import com.chooserich.web.model.MinesSessionView;
import com.chooserich.web.model.MinesStartRequest;
import com.chooserich.web.model.MinesStartResponse;
import com.chooserich.web.model.SessionRequest;
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

@Path("/mines")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
@Blocking
public class MinesResource {

    private final MinesGameService minesGameService;
    private final TokenService tokenService;

    @Inject
    public MinesResource(MinesGameService minesGameService, TokenService tokenService) {
        this.minesGameService = minesGameService;
        this.tokenService = tokenService;
    }

    @POST
    @Path("/start")
    public MinesStartResponse start(@HeaderParam("Authorization") String token, @Valid MinesStartRequest req)
            throws ParseException {
        String owner = tokenService.getOwnerFromToken(token);
        MinesSession session = minesGameService.start(owner, req.stake(), req.blocks(), req.mines());
        return MinesStartResponse.from(session);
    }

    @POST
    @Path("/move")
    public MinesMoveResult move(@HeaderParam("Authorization") String token, @Valid MinesMoveRequest req)
            throws ParseException {
        String owner = tokenService.getOwnerFromToken(token);
        return minesGameService.move(owner, req.sessionId(), req.block());
    }

    @POST
    @Path("/cashout")
    public MinesCashoutResult cashout(@HeaderParam("Authorization") String token, @Valid SessionRequest req)
            throws ParseException {
        String owner = tokenService.getOwnerFromToken(token);
        return minesGameService.cashout(owner, req.sessionId());
    }

    @GET
    @Path("/{sessionId}")
    public MinesSessionView get(@HeaderParam("Authorization") String token, @PathParam("sessionId") String sessionId)
            throws ParseException {
        String owner = tokenService.getOwnerFromToken(token);
        return MinesSessionView.from(minesGameService.find(owner, sessionId));
    }
}
