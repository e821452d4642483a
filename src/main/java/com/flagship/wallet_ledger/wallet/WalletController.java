package com.flagship.wallet_ledger.wallet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.ledger.Amounts;
import com.flagship.wallet_ledger.ledger.BalanceRepository;
import com.flagship.wallet_ledger.ledger.LedgerException;
import com.flagship.wallet_ledger.ledger.LedgerReceipt;
import com.flagship.wallet_ledger.ledger.TransactionLog;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import com.flagship.wallet_ledger.ledger.TransferEngine;
import com.flagship.wallet_ledger.ledger.TransferRequest;
import com.flagship.wallet_ledger.notification.NotificationFanout;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.wallet.dto.BalanceResponse;
import com.flagship.wallet_ledger.wallet.dto.DepositRequest;
import com.flagship.wallet_ledger.wallet.dto.LedgerReceiptResponse;
import com.flagship.wallet_ledger.wallet.dto.TransactionResponse;
import com.flagship.wallet_ledger.wallet.dto.TransferRequestBody;
import com.flagship.wallet_ledger.wallet.exception.AccountAccessDeniedException;
import com.flagship.wallet_ledger.wallet.exception.GlobalExceptionHandler;
import com.flagship.wallet_ledger.wallet.exception.IdempotencyConflictException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * REST and server-sent-event API of the wallet.
 *
 * Mutations act on the caller's own account, identified by
 * {@link AccountIdentityResolver}. Reads and streams are limited to it too.
 *
 * Deposits and transfers accept an Idempotency-Key: repeating a request with
 * the same key returns the first outcome without moving funds again.
 */
@RestController
@RequestMapping("/api/wallet")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String REQUEST_TIMEOUT_HEADER = "Request-Timeout-Ms";
    static final String REPLAYED_HEADER = "Idempotent-Replayed";

    private final TransferEngine transferEngine;
    private final BalanceRepository balanceRepository;
    private final TransactionLog transactionLog;
    private final NotificationFanout fanout;
    private final IdempotencyService idempotencyService;
    private final AccountIdentityResolver identityResolver;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;

    @PostMapping("/deposits")
    public ResponseEntity<?> deposit(
            @Valid @RequestBody DepositRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = REQUEST_TIMEOUT_HEADER, required = false) Long timeoutMs,
            HttpServletRequest httpRequest) {

        String caller = identityResolver.resolve(httpRequest);
        log.info("Deposit requested: accountId={}, amount={}", caller, request.getAmount());

        return idempotent(caller, idempotencyKey, "deposit",
                IdempotencyService.fingerprint("deposit", request.getAmount()),
                () -> {
                    LedgerReceipt receipt = transferEngine.deposit(
                            caller, Amounts.parse(request.getAmount()), timeout(timeoutMs));
                    return ResponseEntity.status(HttpStatus.CREATED).body(LedgerReceiptResponse.from(receipt));
                });
    }

    @PostMapping("/transfers")
    public ResponseEntity<?> transfer(
            @Valid @RequestBody TransferRequestBody request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = REQUEST_TIMEOUT_HEADER, required = false) Long timeoutMs,
            HttpServletRequest httpRequest) {

        String caller = identityResolver.resolve(httpRequest);
        log.info("Transfer requested: accountId={}, recipient={}, amount={}",
                caller, request.getRecipient(), request.getAmount());

        return idempotent(caller, idempotencyKey, "transfer",
                IdempotencyService.fingerprint("transfer", request.getRecipient(), request.getAmount()),
                () -> {
                    TransferRequest transfer = TransferRequest.of(
                            caller, request.getRecipient(), Amounts.parse(request.getAmount()));
                    LedgerReceipt receipt = transferEngine.transfer(transfer, timeout(timeoutMs));
                    return ResponseEntity.status(HttpStatus.CREATED).body(LedgerReceiptResponse.from(receipt));
                });
    }

    @GetMapping("/accounts/{accountId}/balance")
    public BalanceResponse getBalance(@PathVariable("accountId") String accountId, HttpServletRequest httpRequest) {
        requireOwnAccount(accountId, httpRequest);
        return new BalanceResponse(accountId, balanceRepository.getBalance(accountId));
    }

    /**
     * History in arrival order, or newest first with {@code order=newest}.
     */
    @GetMapping("/accounts/{accountId}/transactions")
    public List<TransactionResponse> listTransactions(
            @PathVariable("accountId") String accountId,
            @RequestParam(value = "order", required = false) String order,
            HttpServletRequest httpRequest) {
        requireOwnAccount(accountId, httpRequest);

        List<TransactionRecord> records = transactionLog.list(accountId);
        if ("newest".equalsIgnoreCase(order)) {
            records = TransactionRecord.sortNewestFirst(records);
        } else if (order != null && !"arrival".equalsIgnoreCase(order)) {
            throw new IllegalArgumentException("Unknown order '" + order + "', expected 'newest' or 'arrival'");
        }
        return records.stream().map(TransactionResponse::from).toList();
    }

    @GetMapping(value = "/accounts/{accountId}/balance/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<BalanceResponse>> streamBalance(@PathVariable("accountId") String accountId,
                                                                HttpServletRequest httpRequest) {
        requireOwnAccount(accountId, httpRequest);
        return Flux.from(fanout.subscribeBalance(accountId))
                .map(amount -> ServerSentEvent.builder(new BalanceResponse(accountId, amount))
                        .event("balance")
                        .build());
    }

    @GetMapping(value = "/accounts/{accountId}/transactions/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<TransactionResponse>> streamTransactions(@PathVariable("accountId") String accountId,
                                                                         HttpServletRequest httpRequest) {
        requireOwnAccount(accountId, httpRequest);
        return Flux.from(fanout.subscribeTransactions(accountId))
                .map(record -> ServerSentEvent.builder(TransactionResponse.from(record))
                        .id(String.valueOf(record.getId()))
                        .event("transaction")
                        .build());
    }

    /**
     * Runs {@code action} once per idempotency key and stores what it answered.
     *
     * Retryable ledger failures and unexpected errors from the action release
     * the key instead, since nothing was committed for them. Once the action
     * has returned the key is never released.
     */
    private ResponseEntity<?> idempotent(String caller, String idempotencyKey, String operation,
                                         String requestHash, Supplier<ResponseEntity<?>> action) {
        if (idempotencyKey == null) {
            return action.get();
        }

        IdempotencyService.Claim claim = idempotencyService.claim(caller, idempotencyKey, operation, requestHash);
        switch (claim.getStatus()) {
            case REPLAY -> {
                log.info("Idempotency key {} already used, returning stored outcome", idempotencyKey);
                return ResponseEntity.status(claim.getResponse().getStatus())
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(REPLAYED_HEADER, "true")
                        .body(claim.getResponse().getBody());
            }
            case IN_PROGRESS -> throw new IdempotencyConflictException(idempotencyKey,
                    "A request with this Idempotency-Key is still being processed");
            case MISMATCH -> throw new IdempotencyConflictException(idempotencyKey,
                    "Idempotency-Key was already used for a different request");
            default -> {
                // claimed, run it below
            }
        }

        ResponseEntity<?> response;
        try {
            response = action.get();
        } catch (LedgerException e) {
            if (e.isRetryable()) {
                idempotencyService.release(caller, idempotencyKey);
            } else {
                storeOutcome(caller, idempotencyKey, requestHash,
                        GlobalExceptionHandler.statusFor(e.getKind()).value(), GlobalExceptionHandler.bodyFor(e));
            }
            throw e;
        } catch (RuntimeException e) {
            idempotencyService.release(caller, idempotencyKey);
            throw e;
        }

        storeOutcome(caller, idempotencyKey, requestHash, response.getStatusCode().value(), response.getBody());
        return response;
    }

    /**
     * Records the outcome of a request that reached the ledger. If the write
     * fails the claim stays IN_PROGRESS, so a retry with the key gets 409
     * instead of running the operation a second time.
     */
    private void storeOutcome(String caller, String idempotencyKey, String requestHash, int status, Object body) {
        try {
            idempotencyService.complete(caller, idempotencyKey, requestHash, status, toJson(body));
        } catch (RuntimeException e) {
            log.error("Could not store outcome for idempotency key {}, key stays in progress", idempotencyKey, e);
            metrics.recordIdempotencyOutcomeLost();
        }
    }

    private void requireOwnAccount(String accountId, HttpServletRequest httpRequest) {
        String caller = identityResolver.resolve(httpRequest);
        if (!caller.equals(accountId)) {
            throw new AccountAccessDeniedException(caller, accountId);
        }
    }

    private static Duration timeout(Long timeoutMs) {
        if (timeoutMs == null) {
            return null;
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException(REQUEST_TIMEOUT_HEADER + " cannot be negative");
        }
        return Duration.ofMillis(timeoutMs);
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response body", e);
        }
    }
}
