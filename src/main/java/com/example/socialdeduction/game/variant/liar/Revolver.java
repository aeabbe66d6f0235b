package com.example.socialdeduction.game.variant.liar;

/**
 * Six chambers, one bullet. Each pull advances the cylinder; the bullet fires at
 * the latest on the sixth pull.
 */
public class Revolver {

    public static final int CHAMBERS = 6;

    private final int bulletChamber;
    private int currentChamber;

    public Revolver(int bulletChamber) {
        if (bulletChamber < 0 || bulletChamber >= CHAMBERS) {
            throw new IllegalArgumentException("bullet chamber out of range: " + bulletChamber);
        }
        this.bulletChamber = bulletChamber;
    }

    /**
     * @return true when the bullet fires
     */
    public boolean pullTrigger() {
        boolean fired = currentChamber == bulletChamber;
        currentChamber++;
        return fired;
    }

    public int getPulls() {
        return currentChamber;
    }
}
