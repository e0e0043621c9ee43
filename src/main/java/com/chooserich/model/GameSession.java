package com.chooserich.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;

/**
 * State shared by every game round. Concrete subclasses are tagged by {@link #getKind()} so a stored
 * payload always decodes back into the variant that wrote it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MinesSession.class, name = "MINES"),
        @JsonSubTypes.Type(value = ApexSession.class, name = "APEX")
})
public abstract class GameSession {
    private String id;
    private String owner;
    private BigDecimal stake;
    private SessionStatus status;
    private long createdAt;

    protected GameSession() {
    }

    protected GameSession(String id, String owner, BigDecimal stake) {
        this.id = id;
        this.owner = owner;
        this.stake = stake;
        this.status = SessionStatus.ACTIVE;
        this.createdAt = System.currentTimeMillis();
    }

    public abstract GameKind getKind();

    @JsonIgnore
    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public BigDecimal getStake() {
        return stake;
    }

    public void setStake(BigDecimal stake) {
        this.stake = stake;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public void setStatus(SessionStatus status) {
        this.status = status;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }
}
