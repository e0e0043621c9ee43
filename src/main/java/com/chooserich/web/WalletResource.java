package com.chooserich.web;

import com.chooserich.model.LedgerTransaction;
import com.chooserich.service.GameException;
import com.chooserich.service.LedgerService;
import com.chooserich.service.TokenService;
import com.chooserich.web.model.BalanceResponse;
import com.chooserich.web.model.WalletAmountRequest;
import com.chooserich.web.model.WalletOperationResponse;
import io.smallrye.common.annotation.Blocking;
import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.util.List;

@Path("/wallet")
@Produces(MediaType.APPLICATION_JSON)
@Blocking
public class WalletResource {

    private static final Logger LOG = Logger.getLogger(WalletResource.class);

    private static final int MAX_HISTORY = 200;

    private final LedgerService ledgerService;
    private final TokenService tokenService;

    @Inject
    public WalletResource(LedgerService ledgerService, TokenService tokenService) {
        this.ledgerService = ledgerService;
        this.tokenService = tokenService;
    }

    @GET
    @Path("/balance")
    public BalanceResponse balance(@HeaderParam("Authorization") String token) throws ParseException {
        String owner = tokenService.getOwnerFromToken(token);
        return new BalanceResponse(owner, ledgerService.balance(owner));
    }

    @GET
    @Path("/transactions")
    public List<LedgerTransaction> transactions(@HeaderParam("Authorization") String token,
            @QueryParam("limit") Integer limit) throws ParseException {
        String owner = tokenService.getOwnerFromToken(token);
        int actualLimit = (limit != null && limit > 0) ? Math.min(limit, MAX_HISTORY) : 50;
        return ledgerService.transactions(owner, actualLimit);
    }

    @POST
    @Path("/deposit")
    @Consumes(MediaType.APPLICATION_JSON)
    public WalletOperationResponse deposit(@HeaderParam("Authorization") String token,
            @Valid WalletAmountRequest req) throws ParseException {
        String owner = tokenService.getOwnerFromToken(token);
        LedgerTransaction transaction = ledgerService.deposit(owner, req.amount().setScale(2));
        LOG.info("Deposit of " + transaction.amount() + " for " + owner);
        return WalletOperationResponse.from(transaction, ledgerService.balance(owner));
    }

    @POST
    @Path("/withdraw")
    @Consumes(MediaType.APPLICATION_JSON)
    public WalletOperationResponse withdraw(@HeaderParam("Authorization") String token,
            @Valid WalletAmountRequest req) throws ParseException {
        String owner = tokenService.getOwnerFromToken(token);
        BigDecimal amount = req.amount().setScale(2);
        LedgerTransaction transaction = ledgerService.withdraw(owner, amount)
                .orElseThrow(GameException::insufficientFunds);
        LOG.info("Withdrawal of " + amount + " for " + owner);
        return WalletOperationResponse.from(transaction, ledgerService.balance(owner));
    }
}
