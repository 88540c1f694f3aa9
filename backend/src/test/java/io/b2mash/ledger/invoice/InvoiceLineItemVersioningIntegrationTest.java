package io.b2mash.ledger.invoice;

import static io.b2mash.ledger.testutil.TestLedgerFactory.line;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.ledger.TestcontainersConfiguration;
import io.b2mash.ledger.customer.CustomerRepository;
import io.b2mash.ledger.invoice.dto.CreateInvoiceRequest;
import io.b2mash.ledger.invoice.dto.UpdateInvoiceRequest;
import io.b2mash.ledger.multitenancy.LedgerContext;
import io.b2mash.ledger.testutil.TestLedgerFactory;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class InvoiceLineItemVersioningIntegrationTest {

  @Autowired private InvoiceLedgerService invoiceLedgerService;
  @Autowired private InvoiceLineItemRepository lineItemRepository;
  @Autowired private CustomerRepository customerRepository;

  private LedgerContext context;
  private UUID customerId;

  @BeforeEach
  void setUp() {
    var orgId = UUID.randomUUID();
    context = new LedgerContext(orgId, UUID.randomUUID(), "127.0.0.1", "integration-test");
    customerId =
        customerRepository.save(TestLedgerFactory.customer(orgId, "Versioning Corp")).getId();
  }

  @Test
  void eachUpdateAppendsARevisionAndKeepsHistory() {
    var created =
        invoiceLedgerService.create(
            context,
            new CreateInvoiceRequest(
                customerId,
                null,
                List.of(line("Design", "10", "150.00", "13"), line("Hosting", "1", "75.00", null)),
                null,
                null,
                LocalDate.of(2026, 3, 1),
                null,
                null,
                null,
                null));
    assertThat(created.total()).isEqualByComparingTo("1770.00");

    invoiceLedgerService.update(
        context,
        created.id(),
        new UpdateInvoiceRequest(
            List.of(line("Design", "12", "150.00", "13"), line("Hosting", "1", "75.00", null)),
            null,
            null,
            null,
            null,
            null));
    var updated =
        invoiceLedgerService.update(
            context,
            created.id(),
            new UpdateInvoiceRequest(
                List.of(line("Design", "12", "150.00", "13")), null, null, null, null, null));

    assertThat(updated.total()).isEqualByComparingTo("2034.00");
    assertThat(updated.lineItems()).hasSize(1);
    assertThat(lineItemRepository.countByInvoiceId(created.id())).isEqualTo(5);

    var latest =
        lineItemRepository.findByInvoiceIdAndLatestVersionTrueOrderBySortOrder(created.id());
    assertThat(latest).hasSize(1);
    assertThat(latest.get(0).getVersion()).isEqualTo(3);
    assertThat(latest.get(0).getQuantity()).isEqualByComparingTo(new BigDecimal("12"));

    var history = invoiceLedgerService.lineItemHistory(context, created.id());
    assertThat(history).hasSize(5);
    var superseded = history.stream().filter(item -> !item.latestVersion()).toList();
    assertThat(superseded)
        .hasSize(4)
        .allSatisfy(item -> assertThat(item.supersededAt()).isNotNull());
    // The dropped hosting line has no replacement to link to
    assertThat(superseded).filteredOn(item -> item.supersededById() == null).hasSize(1);
  }
}
