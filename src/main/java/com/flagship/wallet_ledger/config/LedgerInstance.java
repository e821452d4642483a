package com.flagship.wallet_ledger.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Identity of this service instance.
 *
 * Stamped on every outbox event so the change relay can skip events this
 * instance already delivered to its own subscribers.
 */
@Component
@Getter
@Slf4j
public class LedgerInstance {

    private final String id;

    public LedgerInstance(@Value("${ledger.instance-id:}") String configuredId) {
        this.id = configuredId == null || configuredId.isBlank()
                ? UUID.randomUUID().toString().substring(0, 8)
                : configuredId;
        log.info("Ledger instance id: {}", id);
    }

    public boolean isSelf(String instanceId) {
        return id.equals(instanceId);
    }
}
