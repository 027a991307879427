package com.flagship.budget_ledger.transaction;

import com.flagship.budget_ledger.ledger.RecordedTransaction;
import com.flagship.budget_ledger.ledger.dto.LedgerTransactionResponse;
import com.flagship.budget_ledger.spend.DateNormalizer;
import com.flagship.budget_ledger.transaction.dto.CreateTransactionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private static final String USER_HEADER = "X-User-Id";

    private final TransactionAdapter transactionAdapter;
    private final DateNormalizer dateNormalizer;

    @PostMapping
    public ResponseEntity<List<LedgerTransactionResponse>> createTransaction(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody CreateTransactionRequest request) {
        List<RecordedTransaction> recorded = transactionAdapter.record(userId, toCommand(request));
        boolean allDuplicates = recorded.stream().allMatch(RecordedTransaction::isDuplicate);
        return ResponseEntity.status(allDuplicates ? HttpStatus.OK : HttpStatus.CREATED)
            .body(recorded.stream()
                .map(result -> LedgerTransactionResponse.from(result.getTransaction(), result.isDuplicate()))
                .toList());
    }

    private TransactionCommand toCommand(CreateTransactionRequest request) {
        TransactionCommand.TransactionCommandBuilder builder = TransactionCommand.builder()
            .kind(request.resolveKind())
            .description(request.getDescription())
            .occurredAt(dateNormalizer.parse(request.getOccurredOn()))
            .notes(request.getNotes())
            .externalId(request.getExternalId())
            .amount(request.getAmount())
            .categoryId(request.getCategoryId())
            .sourceAccountId(request.getSourceAccountId())
            .destinationAccountId(request.getDestinationAccountId());
        if (request.getSplits() != null) {
            request.getSplits().forEach(split -> builder.split(
                new TransactionCommand.SplitLine(split.getCategoryId(), split.getAmount(), split.getDescription())));
        }
        if (request.getShare() != null) {
            builder.shareMethod(request.getShare().getMethod()).shareValue(request.getShare().getValue());
        }
        return builder.build();
    }
}
