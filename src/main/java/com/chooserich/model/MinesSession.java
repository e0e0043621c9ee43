package com.chooserich.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public class MinesSession extends GameSession {
    private int blocks;
    private int mines;
    private Set<Integer> minePositions = new TreeSet<>();
    private Set<Integer> revealedBlocks = new TreeSet<>();
    private List<MoveAction> actions = new ArrayList<>();
    private double currentMultiplier = 1.0;

    public MinesSession() {
    }

    public MinesSession(String id, String owner, BigDecimal stake, int blocks, int mines, Set<Integer> minePositions) {
        super(id, owner, stake);
        this.blocks = blocks;
        this.mines = mines;
        this.minePositions = new TreeSet<>(minePositions);
    }

    @Override
    public GameKind getKind() {
        return GameKind.MINES;
    }

    public int getBlocks() {
        return blocks;
    }

    public void setBlocks(int blocks) {
        this.blocks = blocks;
    }

    public int getMines() {
        return mines;
    }

    public void setMines(int mines) {
        this.mines = mines;
    }

    public Set<Integer> getMinePositions() {
        return minePositions;
    }

    public void setMinePositions(Set<Integer> minePositions) {
        this.minePositions = new TreeSet<>(minePositions);
    }

    public Set<Integer> getRevealedBlocks() {
        return revealedBlocks;
    }

    public void setRevealedBlocks(Set<Integer> revealedBlocks) {
        this.revealedBlocks = new TreeSet<>(revealedBlocks);
    }

    public List<MoveAction> getActions() {
        return actions;
    }

    public void setActions(List<MoveAction> actions) {
        this.actions = actions;
    }

    public double getCurrentMultiplier() {
        return currentMultiplier;
    }

    public void setCurrentMultiplier(double currentMultiplier) {
        this.currentMultiplier = currentMultiplier;
    }
}
