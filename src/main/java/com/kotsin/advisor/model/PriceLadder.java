package com.kotsin.advisor.model;

/**
 * Stop-loss and the three take-profit levels. {@code takeProfit} is the primary target and equals tp3.
 */
public record PriceLadder(double stopLoss, double takeProfit, double tp1, double tp2, double tp3) {
}
