package com.schemeengine.scheme.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Writes committed scheme events to the log.
 */
@Component
@Slf4j
public class SchemeEventLogger {

    @TransactionalEventListener
    public void onStateTransition(StateTransitionEvent event) {
        log.info("Scheme {} moved {} -> {}", event.getSchemeId(), event.getFrom(), event.getTo());
    }

    @TransactionalEventListener
    public void onTransfer(TransferEvent event) {
        log.info("Scheme {} shares: {} -> {} amount {}",
            event.getSchemeId(), event.getFrom(), event.getTo(), event.getAmount());
    }

    @TransactionalEventListener
    public void onApproval(ApprovalEvent event) {
        log.info("Scheme {} approval: {} allows {} up to {}",
            event.getSchemeId(), event.getOwner(), event.getSpender(), event.getAmount());
    }
}
