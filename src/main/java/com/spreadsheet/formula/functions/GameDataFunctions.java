package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.ValueCoercion;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.spreadsheet.formula.functions.FunctionArgs.arg;
import static com.spreadsheet.formula.functions.FunctionArgs.numberArg;

/**
 * Fixed game-balance formulas used by designers when tuning item and
 * character tables.
 * <p>
 * Every function in this family reports an invalid input domain by
 * returning the text {@value #VALUE_ERROR} rather than throwing, so the
 * offending cell shows the marker and its neighbours keep recalculating:
 * <ul>
 *   <li>DAMAGE_CALC: attack or defense without a number, or defense = -100</li>
 *   <li>STAT_SCALE: level or base without a number, level &lt; 1, unknown curve</li>
 *   <li>DROP_RATE: base rate without a number</li>
 *   <li>EXP_CURVE: level without a number or &lt; 1</li>
 *   <li>GACHA_RATE: rarity without a number or outside 1..6</li>
 * </ul>
 * RARITY_BONUS and STAT_TOTAL accept anything.
 */
public final class GameDataFunctions {

    public static final String VALUE_ERROR = "#VALUE!";

    private static final Map<String, Double> RARITY_BONUSES = new HashMap<>();
    static {
        RARITY_BONUSES.put("common", 1.0);
        RARITY_BONUSES.put("uncommon", 1.1);
        RARITY_BONUSES.put("rare", 1.25);
        RARITY_BONUSES.put("epic", 1.5);
        RARITY_BONUSES.put("legendary", 2.0);
        RARITY_BONUSES.put("mythic", 3.0);
    }

    // common .. mythic, in percent
    private static final double[] DEFAULT_GACHA_RATES = {40, 25, 15, 10, 5, 0.6};

    private GameDataFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("DAMAGE_CALC", GameDataFunctions::damageCalc);
        registry.register("STAT_TOTAL", MathFunctions::sum);
        registry.register("RARITY_BONUS", GameDataFunctions::rarityBonus);
        registry.register("STAT_SCALE", GameDataFunctions::statScale);
        registry.register("DROP_RATE", GameDataFunctions::dropRate);
        registry.register("EXP_CURVE", GameDataFunctions::expCurve);
        registry.register("GACHA_RATE", GameDataFunctions::gachaRate);
    }

    /**
     * DAMAGE_CALC(attack, defense) = floor(attack * 100 / (100 + defense)).
     */
    public static CellValue damageCalc(List<CellValue> args) {
        Double attack = ValueCoercion.toNumberOrNull(arg(args, 0));
        Double defense = ValueCoercion.toNumberOrNull(arg(args, 1));
        if (attack == null || defense == null || defense == -100) {
            return valueError();
        }
        return CellValue.number(Math.floor(attack * (100 / (100 + defense))));
    }

    /**
     * RARITY_BONUS(name): multiplier for a rarity tier name, 1.0 for unknown names.
     */
    public static CellValue rarityBonus(List<CellValue> args) {
        String rarity = ValueCoercion.toText(arg(args, 0)).toLowerCase();
        return CellValue.number(RARITY_BONUSES.getOrDefault(rarity, 1.0));
    }

    /**
     * STAT_SCALE(level, base, growth=10, curve="linear").
     * Curves: linear, exponential (growth in percent per level),
     * logarithmic and quadratic.
     */
    public static CellValue statScale(List<CellValue> args) {
        Double level = ValueCoercion.toNumberOrNull(arg(args, 0));
        Double base = ValueCoercion.toNumberOrNull(arg(args, 1));
        double growth = numberArg(args, 2, 10);
        String curve = args.size() > 3 && !arg(args, 3).isNull()
                ? ValueCoercion.toText(arg(args, 3)).toLowerCase()
                : "linear";

        if (level == null || base == null || level < 1) {
            return valueError();
        }

        switch (curve) {
            case "linear":
                return CellValue.number(base + (level - 1) * growth);
            case "exponential":
                return CellValue.number(base * Math.pow(1 + growth / 100, level - 1));
            case "logarithmic":
                return CellValue.number(base + growth * Math.log(level));
            case "quadratic":
                return CellValue.number(base + growth * Math.pow(level - 1, 2));
            default:
                return valueError();
        }
    }

    /**
     * DROP_RATE(base, luck=0, enemyLevel?, playerLevel?), in percent, capped at 100.
     * Each luck point adds 0.1; each level the player is above the enemy adds 2.5.
     */
    public static CellValue dropRate(List<CellValue> args) {
        Double base = ValueCoercion.toNumberOrNull(arg(args, 0));
        double luck = numberArg(args, 1, 0);
        Double enemyLevel = ValueCoercion.toNumberOrNull(arg(args, 2));
        Double playerLevel = ValueCoercion.toNumberOrNull(arg(args, 3));

        if (base == null) {
            return valueError();
        }

        double rate = base;
        if (luck > 0) {
            rate += luck * 0.1;
        }
        if (enemyLevel != null && playerLevel != null && playerLevel > enemyLevel) {
            rate += (playerLevel - enemyLevel) * 2.5;
        }
        return CellValue.number(Math.min(rate, 100));
    }

    /**
     * EXP_CURVE(level, base=100, multiplier=1.5, exponent=1.5)
     * = round(base * multiplier * level ^ exponent).
     */
    public static CellValue expCurve(List<CellValue> args) {
        Double level = ValueCoercion.toNumberOrNull(arg(args, 0));
        double base = numberArg(args, 1, 100);
        double multiplier = numberArg(args, 2, 1.5);
        double exponent = numberArg(args, 3, 1.5);

        if (level == null || level < 1) {
            return valueError();
        }
        return CellValue.number(Math.floor(base * multiplier * Math.pow(level, exponent) + 0.5));
    }

    /**
     * GACHA_RATE(rarity, pity=0, baseRate?, threshold=90), in percent.
     * At the threshold the pull is guaranteed (100). From 75% of the
     * threshold on ("soft pity") the rate ramps linearly up to ten times
     * the base rate, never above 99.
     */
    public static CellValue gachaRate(List<CellValue> args) {
        Double rarity = ValueCoercion.toNumberOrNull(arg(args, 0));
        double pity = numberArg(args, 1, 0);
        Double baseRate = ValueCoercion.toNumberOrNull(arg(args, 2));
        double threshold = numberArg(args, 3, 90);

        if (rarity == null || rarity < 1 || rarity > 6) {
            return valueError();
        }

        double base = baseRate != null ? baseRate : DEFAULT_GACHA_RATES[rarity.intValue() - 1];

        if (pity >= threshold) {
            return CellValue.number(100);
        }

        double softPityStart = Math.floor(threshold * 0.75);
        if (pity >= softPityStart && threshold > softPityStart) {
            double progress = (pity - softPityStart) / (threshold - softPityStart);
            double multiplier = 1 + progress * 9;
            return CellValue.number(Math.min(base * multiplier, 99));
        }
        return CellValue.number(base);
    }

    private static CellValue valueError() {
        return CellValue.text(VALUE_ERROR);
    }
}
