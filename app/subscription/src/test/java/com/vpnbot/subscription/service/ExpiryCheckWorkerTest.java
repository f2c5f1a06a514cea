package com.vpnbot.subscription.service;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExpiryCheckWorkerTest {

  @Mock private SubscriptionService subscriptionService;

  @InjectMocks private ExpiryCheckWorker worker;

  @Test
  void runMarksExpiredBeforeCountingExpiringSoon() {
    when(subscriptionService.checkExpirations()).thenReturn(2);
    when(subscriptionService.findExpiring()).thenReturn(List.of());

    worker.run();

    final InOrder order = inOrder(subscriptionService);
    order.verify(subscriptionService).checkExpirations();
    order.verify(subscriptionService).findExpiring();
  }
}
