package io.b2mash.ledger.config;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger settings bound from the {@code ledger.*} namespace.
 *
 * @param defaultCurrency ISO currency applied to invoices created without one
 * @param invoiceNumber prefix and zero-padded width of invoice numbers
 * @param sequencer retry budget of the document number sequencer
 * @param processorFee card processor fee schedule applied on gateway confirmation
 */
@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
    String defaultCurrency,
    InvoiceNumber invoiceNumber,
    Sequencer sequencer,
    ProcessorFee processorFee) {

  public record InvoiceNumber(String prefix, int width) {}

  public record Sequencer(int maxAttempts, long maxBackoffMillis) {}

  public record ProcessorFee(BigDecimal percent, BigDecimal fixed) {}
}
