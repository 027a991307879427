package com.flagship.budget_ledger.transaction;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.account.AccountType;
import com.flagship.budget_ledger.exception.NotFoundException;
import com.flagship.budget_ledger.exception.ValidationException;
import com.flagship.budget_ledger.ledger.JournalRequest;
import com.flagship.budget_ledger.ledger.JournalService;
import com.flagship.budget_ledger.ledger.RecordedTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns expenses, transfers, splits and shared expenses into balanced
 * journal requests. The source is always credited and the destination
 * debited, so every request it builds uses conventional signs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionAdapter {

    static final String DEFAULT_SOURCE_ACCOUNT = "Cash";
    static final String REIMBURSABLE_ACCOUNT = "Reimbursable";

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final BigDecimal SHARE_TOLERANCE = new BigDecimal("0.01");

    private final AccountService accountService;
    private final JournalService journalService;

    /**
     * Records the command. A split is recorded as one ledger transaction per
     * line, all of them or none.
     */
    public List<RecordedTransaction> record(UUID ownerId, TransactionCommand command) {
        List<JournalRequest> requests = buildRequests(ownerId, command);
        log.info("Recording {} transaction for {}: {} ledger transaction(s)", command.getKind(), ownerId,
            requests.size());
        if (requests.size() == 1) {
            return List.of(journalService.record(ownerId, requests.get(0)));
        }
        return journalService.recordAll(ownerId, requests);
    }

    List<JournalRequest> buildRequests(UUID ownerId, TransactionCommand command) {
        Account source = resolveSource(ownerId, command.getSourceAccountId());
        TransactionKind kind = command.getKind() != null ? command.getKind() : TransactionKind.EXPENSE;

        return switch (kind) {
            case TRANSFER -> List.of(transfer(source, command));
            case SPLIT -> splits(ownerId, source, command);
            case SHARED -> List.of(shared(ownerId, source, command));
            case EXPENSE -> List.of(expense(ownerId, source, command));
        };
    }

    private JournalRequest expense(UUID ownerId, Account source, TransactionCommand command) {
        BigDecimal amount = requireAmount(command.getAmount(), "amount");
        UUID categoryId = requireCategory(ownerId, command.getCategoryId());
        return header(command)
            .posting(JournalRequest.Posting.credit(source.getId(), amount))
            .posting(JournalRequest.Posting.debit(categoryId, amount))
            .build();
    }

    private JournalRequest transfer(Account source, TransactionCommand command) {
        if (command.getDestinationAccountId() == null) {
            throw ValidationException.forField("destination_account_id",
                "Destination account is required for a transfer");
        }
        BigDecimal amount = requireAmount(command.getAmount(), "amount");
        return header(command)
            .posting(JournalRequest.Posting.credit(source.getId(), amount))
            .posting(JournalRequest.Posting.debit(command.getDestinationAccountId(), amount))
            .build();
    }

    private List<JournalRequest> splits(UUID ownerId, Account source, TransactionCommand command) {
        if (command.getSplits().isEmpty()) {
            throw ValidationException.forField("splits", "A split transaction needs at least one split");
        }
        List<JournalRequest> requests = new ArrayList<>();
        for (int i = 0; i < command.getSplits().size(); i++) {
            TransactionCommand.SplitLine split = command.getSplits().get(i);
            BigDecimal amount = requireAmount(split.getAmount(), "splits[" + i + "].amount");
            UUID categoryId = requireCategory(ownerId, split.getCategoryId());
            String description = split.getDescription() != null && !split.getDescription().isBlank()
                ? split.getDescription()
                : command.getDescription();

            requests.add(header(command)
                .description(description)
                .externalId(command.getExternalId() != null ? command.getExternalId() + "#" + (i + 1) : null)
                .posting(JournalRequest.Posting.credit(source.getId(), amount))
                .posting(JournalRequest.Posting.debit(categoryId, amount))
                .build());
        }
        return requests;
    }

    private JournalRequest shared(UUID ownerId, Account source, TransactionCommand command) {
        BigDecimal amount = requireAmount(command.getAmount(), "amount");
        UUID categoryId = requireCategory(ownerId, command.getCategoryId());
        BigDecimal personal = personalShare(amount, command.getShareMethod(), command.getShareValue());
        BigDecimal reimbursable = amount.subtract(personal).setScale(2, RoundingMode.HALF_UP);

        JournalRequest.JournalRequestBuilder builder = header(command)
            .posting(JournalRequest.Posting.credit(source.getId(), amount));
        if (personal.signum() > 0) {
            builder.posting(JournalRequest.Posting.debit(categoryId, personal));
        }
        if (reimbursable.signum() > 0) {
            Account reimbursableAccount = accountService.getOrCreateAccount(ownerId, REIMBURSABLE_ACCOUNT,
                AccountType.ASSET);
            builder.posting(JournalRequest.Posting.of(reimbursableAccount.getId(), reimbursable, false));
        }
        return builder.build();
    }

    /**
     * Personal part of a shared expense, rounded to cents.
     *
     * @throws ValidationException if the share is negative or exceeds the total
     */
    static BigDecimal personalShare(BigDecimal amount, ShareMethod method, BigDecimal value) {
        if (method == null || value == null) {
            throw ValidationException.forField("share", "Share method and value are required");
        }
        BigDecimal personal = switch (method) {
            case FIXED -> value;
            case PERCENTAGE -> amount.multiply(value).divide(HUNDRED, 10, RoundingMode.HALF_UP);
            case EQUAL -> amount.divide(value.signum() <= 0 ? BigDecimal.ONE : value, 10, RoundingMode.HALF_UP);
        };

        if (personal.signum() < 0 || personal.compareTo(amount.add(SHARE_TOLERANCE)) > 0) {
            throw ValidationException.forField("share",
                String.format("Personal amount %s invalid for total %s", personal.stripTrailingZeros().toPlainString(),
                    amount.toPlainString()));
        }
        // within tolerance of the total, never more than it
        return personal.min(amount).setScale(2, RoundingMode.HALF_UP);
    }

    private Account resolveSource(UUID ownerId, UUID sourceAccountId) {
        if (sourceAccountId == null) {
            return accountService.getOrCreateAccount(ownerId, DEFAULT_SOURCE_ACCOUNT, AccountType.ASSET);
        }
        try {
            return accountService.requireAccount(ownerId, sourceAccountId);
        } catch (NotFoundException e) {
            throw ValidationException.forField("source_account_id", "Invalid source account: " + sourceAccountId);
        }
    }

    private UUID requireCategory(UUID ownerId, UUID categoryId) {
        if (categoryId == null) {
            throw ValidationException.forField("category_id", "Category is required");
        }
        return accountService.requireCategory(ownerId, categoryId).getId();
    }

    private static BigDecimal requireAmount(BigDecimal amount, String field) {
        if (amount == null || amount.signum() == 0) {
            throw ValidationException.forField(field, "Amount must be non-zero");
        }
        return amount.abs();
    }

    private static JournalRequest.JournalRequestBuilder header(TransactionCommand command) {
        return JournalRequest.builder()
            .description(command.getDescription())
            .occurredAt(command.getOccurredAt())
            .notes(command.getNotes())
            .externalId(command.getExternalId());
    }
}
