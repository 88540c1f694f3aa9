package io.b2mash.ledger.money;

import java.math.BigDecimal;

/**
 * Derived amounts of one line, all at cent scale.
 *
 * @param lineTotal quantity times unit price, before discount
 * @param discountAmount portion of the line total removed by the discount
 * @param subtotal line total less the discount
 * @param taxAmount tax charged on the subtotal
 * @param total subtotal plus tax
 */
public record LineItemAmounts(
    BigDecimal lineTotal,
    BigDecimal discountAmount,
    BigDecimal subtotal,
    BigDecimal taxAmount,
    BigDecimal total) {}
