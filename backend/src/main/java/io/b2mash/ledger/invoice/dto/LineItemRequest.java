package io.b2mash.ledger.invoice.dto;

import io.b2mash.ledger.invoice.LineItemInput;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.UUID;

public record LineItemRequest(
    @NotBlank @Size(max = 1000) String description,
    // column precision: quantity NUMERIC(12,4), unit price NUMERIC(14,2)
    @NotNull @PositiveOrZero @Digits(integer = 8, fraction = 4) BigDecimal quantity,
    @NotNull @PositiveOrZero @Digits(integer = 12, fraction = 2) BigDecimal unitPrice,
    @DecimalMin("0") @DecimalMax("100") BigDecimal discountPercent,
    @DecimalMin("0") @DecimalMax("100") BigDecimal taxRate,
    UUID productId,
    UUID serviceId) {

  public LineItemInput toInput() {
    return new LineItemInput(
        description, quantity, unitPrice, discountPercent, taxRate, productId, serviceId);
  }
}
