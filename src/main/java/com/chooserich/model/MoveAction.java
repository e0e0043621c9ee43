package com.chooserich.model;

public class MoveAction {
    private int block;
    private double multiplier;
    private boolean safe;

    public MoveAction() {
    }

    public MoveAction(int block, double multiplier, boolean safe) {
        this.block = block;
        this.multiplier = multiplier;
        this.safe = safe;
    }

    public int getBlock() {
        return block;
    }

    public void setBlock(int block) {
        this.block = block;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public void setMultiplier(double multiplier) {
        this.multiplier = multiplier;
    }

    public boolean isSafe() {
        return safe;
    }

    public void setSafe(boolean safe) {
        this.safe = safe;
    }
}
