package com.beobachter.paper.slippage;

public enum TradeDirection {
  BUY,
  SELL
}
