package com.chooserich.model;

import java.math.BigDecimal;

public class ApexSession extends GameSession {
    private ApexMode mode;
    private int systemNumber;
    private Integer userNumber;

    // filled in once the round is resolved
    private Comparison comparison;
    private Integer drawnNumber;
    private Boolean won;
    private BigDecimal payout;

    public ApexSession() {
    }

    public ApexSession(String id, String owner, BigDecimal stake, ApexMode mode, int systemNumber,
            Integer userNumber) {
        super(id, owner, stake);
        this.mode = mode;
        this.systemNumber = systemNumber;
        this.userNumber = userNumber;
    }

    @Override
    public GameKind getKind() {
        return GameKind.APEX;
    }

    public ApexMode getMode() {
        return mode;
    }

    public void setMode(ApexMode mode) {
        this.mode = mode;
    }

    public int getSystemNumber() {
        return systemNumber;
    }

    public void setSystemNumber(int systemNumber) {
        this.systemNumber = systemNumber;
    }

    public Integer getUserNumber() {
        return userNumber;
    }

    public void setUserNumber(Integer userNumber) {
        this.userNumber = userNumber;
    }

    public Comparison getComparison() {
        return comparison;
    }

    public void setComparison(Comparison comparison) {
        this.comparison = comparison;
    }

    public Integer getDrawnNumber() {
        return drawnNumber;
    }

    public void setDrawnNumber(Integer drawnNumber) {
        this.drawnNumber = drawnNumber;
    }

    public Boolean getWon() {
        return won;
    }

    public void setWon(Boolean won) {
        this.won = won;
    }

    public BigDecimal getPayout() {
        return payout;
    }

    public void setPayout(BigDecimal payout) {
        this.payout = payout;
    }
}
