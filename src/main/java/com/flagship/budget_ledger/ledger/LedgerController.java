package com.flagship.budget_ledger.ledger;

import com.flagship.budget_ledger.ledger.dto.LedgerTransactionResponse;
import com.flagship.budget_ledger.ledger.dto.RecordTransactionRequest;
import com.flagship.budget_ledger.spend.DateNormalizer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Raw journal access: callers supply every posting of a transaction.
 *
 * A request whose external id was already recorded answers 200 with the
 * original transaction instead of 201.
 */
@RestController
@RequestMapping("/api/ledger/transactions")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private static final String USER_HEADER = "X-User-Id";

    private final JournalService journalService;
    private final LedgerService ledgerService;
    private final DateNormalizer dateNormalizer;

    @PostMapping
    public ResponseEntity<LedgerTransactionResponse> recordTransaction(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody RecordTransactionRequest request) {
        RecordedTransaction recorded = journalService.record(userId, toJournalRequest(request));
        HttpStatus status = recorded.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status)
            .body(LedgerTransactionResponse.from(recorded.getTransaction(), recorded.isDuplicate()));
    }

    @GetMapping("/{id}")
    public LedgerTransactionResponse getTransaction(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable("id") UUID transactionId) {
        return LedgerTransactionResponse.from(ledgerService.getTransaction(userId, transactionId));
    }

    @GetMapping
    public List<LedgerTransactionResponse> listTransactions(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ledgerService.listTransactions(userId, from, to).stream()
            .map(LedgerTransactionResponse::from)
            .toList();
    }

    @PutMapping("/{id}")
    public LedgerTransactionResponse updateTransaction(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable("id") UUID transactionId,
            @Valid @RequestBody RecordTransactionRequest request) {
        TransactionRevision revision = journalService.update(userId, transactionId, toJournalRequest(request));
        return LedgerTransactionResponse.from(revision.getCurrent());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTransaction(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable("id") UUID transactionId,
            @RequestParam(value = "hard", defaultValue = "false") boolean hard) {
        journalService.delete(userId, transactionId, hard);
        return ResponseEntity.noContent().build();
    }

    private JournalRequest toJournalRequest(RecordTransactionRequest request) {
        JournalRequest.JournalRequestBuilder builder = JournalRequest.builder()
            .description(request.getDescription())
            .occurredAt(dateNormalizer.parse(request.getDate()))
            .notes(request.getNotes())
            .externalId(request.getExternalId());
        for (RecordTransactionRequest.Entry entry : request.getEntries()) {
            boolean reportable = entry.getReportable() == null || entry.getReportable();
            builder.posting(JournalRequest.Posting.of(entry.getAccountId(), entry.getAmount(), reportable));
        }
        return builder.build();
    }
}
