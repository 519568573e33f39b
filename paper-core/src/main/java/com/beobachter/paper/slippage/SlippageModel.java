package com.beobachter.paper.slippage;

import com.beobachter.paper.config.PaperTradingProperties;
import com.beobachter.paper.domain.Side;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Size-aware fill price simulation.
 *
 * <p>The impact rate grows linearly with stake relative to liquidity and is capped at the
 * configured maximum. Buys pay more, sells receive less. Prices are kept inside [0.01, 0.99].
 * The same model is used for entries, additions and exits.
 */
public class SlippageModel {

  static final BigDecimal MIN_PRICE = new BigDecimal("0.01");
  static final BigDecimal MAX_PRICE = new BigDecimal("0.99");
  private static final int SCALE = 8;

  public Fill fill(TradeDirection direction, BigDecimal price, BigDecimal stake, BigDecimal liquidityUsd,
                   PaperTradingProperties.Slippage params) {
    double rate = impactRate(stake, liquidityUsd, params);
    BigDecimal factor = direction == TradeDirection.BUY
        ? BigDecimal.ONE.add(BigDecimal.valueOf(rate))
        : BigDecimal.ONE.subtract(BigDecimal.valueOf(rate));
    BigDecimal adjusted = clampPrice(price.multiply(factor).setScale(SCALE, RoundingMode.HALF_UP));
    return new Fill(adjusted, price, rate);
  }

  /**
   * Resolution payout: 1 for the winning side, 0 otherwise, with no slippage.
   */
  public Fill settle(Side outcome, Side held) {
    BigDecimal payout = outcome == held ? BigDecimal.ONE : BigDecimal.ZERO;
    return new Fill(payout, payout, 0.0);
  }

  public double impactRate(BigDecimal stake, BigDecimal liquidityUsd, PaperTradingProperties.Slippage params) {
    BigDecimal floor = params.minLiquidityUsd();
    BigDecimal liquidity = liquidityUsd == null || liquidityUsd.compareTo(floor) < 0 ? floor : liquidityUsd;
    double ratio = stake.divide(liquidity, SCALE, RoundingMode.HALF_UP).doubleValue();
    double rate = params.baseRate() + params.impactCoefficient() * ratio;
    return Math.min(params.maxRate(), Math.max(0.0, rate));
  }

  private static BigDecimal clampPrice(BigDecimal price) {
    if (price.compareTo(MIN_PRICE) < 0) {
      return MIN_PRICE;
    }
    if (price.compareTo(MAX_PRICE) > 0) {
      return MAX_PRICE;
    }
    return price;
  }
}
