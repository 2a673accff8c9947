package com.marketscan.domain.enums;

/**
 * Position sizing strategies.
 *
 * <ul>
 *   <li>ATR_RISK: risk a fixed share of capital against a stop two ATRs away</li>
 *   <li>HALF_KELLY: half of the Kelly fraction derived from closed-trade history</li>
 * </ul>
 */
public enum PositionSizingType {
    ATR_RISK,
    HALF_KELLY
}
