package io.b2mash.ledger.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class LedgerContextTest {

  @Test
  void fromRequestCapturesClientMetadata() {
    var request = new MockHttpServletRequest();
    request.setRemoteAddr("10.0.0.7");
    request.addHeader("User-Agent", "curl/8.4.0");
    var orgId = UUID.randomUUID();
    var userId = UUID.randomUUID();

    var context = LedgerContext.fromRequest(orgId, userId, request);

    assertThat(context.organizationId()).isEqualTo(orgId);
    assertThat(context.userId()).isEqualTo(userId);
    assertThat(context.ipAddress()).isEqualTo("10.0.0.7");
    assertThat(context.userAgent()).isEqualTo("curl/8.4.0");
    assertThat(context.isSystem()).isFalse();
  }

  @Test
  void truncatesLongUserAgent() {
    var context = new LedgerContext(UUID.randomUUID(), null, null, "x".repeat(800));

    assertThat(context.userAgent()).hasSize(500);
    assertThat(context.isSystem()).isTrue();
  }

  @Test
  void requiresOrganization() {
    assertThatThrownBy(() -> LedgerContext.system(null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
