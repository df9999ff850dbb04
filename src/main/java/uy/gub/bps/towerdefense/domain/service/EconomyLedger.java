package uy.gub.bps.towerdefense.domain.service;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.model.CommandFailure;
import uy.gub.bps.towerdefense.domain.model.CommandResult;
import uy.gub.bps.towerdefense.domain.model.PlayerAttribute;
import uy.gub.bps.towerdefense.domain.model.SimulationSettings;
import uy.gub.bps.towerdefense.domain.model.TowerAttribute;
import uy.gub.bps.towerdefense.domain.model.TowerType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Currency balance and prices. The balance never goes negative: a spend either succeeds in full or changes nothing.
 */
@Slf4j
public class EconomyLedger {
    private final SimulationSettings settings;
    private final Map<TowerType, Map<TowerAttribute, UpgradeCostCurve>> towerCurves = new EnumMap<>(TowerType.class);
    private final Map<PlayerAttribute, UpgradeCostCurve> playerCurves = new EnumMap<>(PlayerAttribute.class);
    private int balance;
    private int pendingCredit;
    private long totalEarned;
    private long totalSpent;

    public EconomyLedger(SimulationSettings settings) {
        this.settings = settings;
        this.balance = Math.max(0, settings.getStartingCurrency());
        for (TowerType type : TowerType.values()) {
            Map<TowerAttribute, UpgradeCostCurve> curves = new EnumMap<>(TowerAttribute.class);
            int maxLevel = type.armed ? settings.getMaxTowerLevel() : 0;
            for (TowerAttribute attribute : TowerAttribute.values()) {
                curves.put(attribute, new UpgradeCostCurve(attribute.baseCost * type.upgradeCostModifier,
                        attribute.costGrowth, maxLevel));
            }
            towerCurves.put(type, curves);
        }
        for (PlayerAttribute attribute : PlayerAttribute.values()) {
            playerCurves.put(attribute, new UpgradeCostCurve(attribute.baseCost, attribute.costGrowth,
                    settings.getMaxPlayerLevel()));
        }
    }

    public int getBalance() {
        return balance;
    }

    public long getTotalEarned() {
        return totalEarned;
    }

    public long getTotalSpent() {
        return totalSpent;
    }

    public boolean canAfford(int cost) {
        return cost >= 0 && balance >= cost;
    }

    /**
     * @return the balance left after spending
     */
    public CommandResult<Integer> spend(int cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("Cost must not be negative: " + cost);
        }
        if (!canAfford(cost)) {
            log.debug("Insufficient funds: need {}, have {}", cost, balance);
            return CommandResult.failed(CommandFailure.INSUFFICIENT_FUNDS);
        }
        balance -= cost;
        totalSpent += cost;
        return CommandResult.ok(balance);
    }

    public void credit(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Credit must not be negative: " + amount);
        }
        balance += amount;
        totalEarned += amount;
    }

    /** Rewards earned during a tick, credited in the economy phase. */
    public void queueReward(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Reward must not be negative: " + amount);
        }
        pendingCredit += amount;
    }

    public int pendingRewards() {
        return pendingCredit;
    }

    public int applyPending() {
        int amount = pendingCredit;
        pendingCredit = 0;
        if (amount > 0) {
            credit(amount);
        }
        return amount;
    }

    /** Always between zero and {@code cumulativeSpend}, and non-decreasing in it. */
    public int refundFor(int cumulativeSpend) {
        if (cumulativeSpend <= 0) {
            return 0;
        }
        double rate = Math.max(0, Math.min(1, settings.getSellRefundRate()));
        return (int) Math.floor(cumulativeSpend * rate);
    }

    public int interest() {
        int raw = (int) Math.floor(balance * Math.max(0, settings.getInterestRate()));
        return Math.min(raw, Math.max(0, settings.getMaxInterest()));
    }

    public int towerCost(TowerType type) {
        return settings.towerCost(type);
    }

    public UpgradeCostCurve curve(TowerType type, TowerAttribute attribute) {
        return towerCurves.get(type).get(attribute);
    }

    public UpgradeCostCurve curve(PlayerAttribute attribute) {
        return playerCurves.get(attribute);
    }

    public void reset() {
        balance = Math.max(0, settings.getStartingCurrency());
        pendingCredit = 0;
        totalEarned = 0;
        totalSpent = 0;
    }
}
