package com.flagship.expense_workflow.expense;

import com.flagship.expense_workflow.exception.BusinessRuleException;
import com.flagship.expense_workflow.expense.event.ExpenseApprovedEvent;
import com.flagship.expense_workflow.expense.event.ExpenseRejectedEvent;
import com.flagship.expense_workflow.expense.event.ExpenseSubmittedEvent;
import com.flagship.expense_workflow.identity.UserRole;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Expense request domain object.
 *
 * Holds the approval state machine and every business rule that guards it:
 * <ul>
 *   <li>DRAFT → SUBMITTED → APPROVED | REJECTED, never backwards</li>
 *   <li>Only the creator edits, attaches receipts to and submits a draft</li>
 *   <li>Amounts above the receipt threshold need an attachment before submission</li>
 *   <li>Only managers and admins process submitted requests, with the self,
 *       peer-manager and approval-ceiling exceptions checked in that order</li>
 * </ul>
 *
 * Instances are immutable. Every operation validates first and returns a new
 * instance, so a failed call leaves the original untouched. Status-changing
 * operations return an {@link ExpenseTransition} carrying the emitted event.
 */
@Value
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExpenseRequest {

    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 1000;
    public static final int MAX_REJECTION_REASON_LENGTH = 500;
    public static final int MAX_ATTACHMENT_URL_LENGTH = 2048;

    UUID id;
    UUID creatorId;
    UserRole creatorRole;
    UUID categoryId;
    String title;
    String description;
    BigDecimal amount;
    LocalDate expenseDate;
    ExpenseStatus status;
    Instant createdAt;
    Instant updatedAt;
    Instant submittedAt;
    Instant processedAt;
    UUID processedBy;
    String rejectionReason;
    List<String> attachmentUrls;

    /**
     * Creates a new request in DRAFT status using the default rules.
     */
    public static ExpenseRequest create(UUID creatorId, UserRole creatorRole, String title, String description,
                                        BigDecimal amount, LocalDate expenseDate, UUID categoryId) {
        return create(creatorId, creatorRole, title, description, amount, expenseDate, categoryId,
                ExpenseRules.defaults());
    }

    /**
     * Creates a new request in DRAFT status.
     *
     * @param creatorRole role of the creator at creation time, kept for the
     *                    approval exceptions; EMPLOYEE when unknown
     * @param categoryId  optional category reference
     * @throws BusinessRuleException if title, amount or expense date break a rule
     */
    public static ExpenseRequest create(UUID creatorId, UserRole creatorRole, String title, String description,
                                        BigDecimal amount, LocalDate expenseDate, UUID categoryId,
                                        ExpenseRules rules) {
        if (creatorId == null) {
            throw new BusinessRuleException("Creator is required.");
        }
        validateTitle(title);
        validateDescription(description);
        validateAmount(amount);
        validateExpenseDate(expenseDate, rules);

        Instant now = Instant.now();
        return ExpenseRequest.builder()
            .id(UUID.randomUUID())
            .creatorId(creatorId)
            .creatorRole(creatorRole != null ? creatorRole : UserRole.EMPLOYEE)
            .categoryId(categoryId)
            .title(title)
            .description(description != null ? description : "")
            .amount(amount)
            .expenseDate(expenseDate)
            .status(ExpenseStatus.DRAFT)
            .createdAt(now)
            .attachmentUrls(List.of())
            .build();
    }

    /**
     * Rebuilds a request from stored state without re-running creation rules.
     * Only the persistence adapter calls this.
     */
    static ExpenseRequest restore(UUID id, UUID creatorId, UserRole creatorRole, UUID categoryId,
                                  String title, String description, BigDecimal amount, LocalDate expenseDate,
                                  ExpenseStatus status, Instant createdAt, Instant updatedAt,
                                  Instant submittedAt, Instant processedAt, UUID processedBy,
                                  String rejectionReason, List<String> attachmentUrls) {
        return new ExpenseRequest(id, creatorId, creatorRole, categoryId, title, description, amount,
                expenseDate, status, createdAt, updatedAt, submittedAt, processedAt, processedBy,
                rejectionReason, attachmentUrls != null ? List.copyOf(attachmentUrls) : List.of());
    }

    /**
     * Replaces the editable fields of a draft.
     *
     * @throws BusinessRuleException if not DRAFT, not the creator, or the new values are invalid
     */
    public ExpenseRequest update(UUID userId, String title, String description, BigDecimal amount,
                                 UUID categoryId) {
        if (status != ExpenseStatus.DRAFT) {
            throw new BusinessRuleException("Only draft requests can be edited.");
        }
        if (!isOwnedBy(userId)) {
            throw new BusinessRuleException("Only the creator can edit this request.");
        }
        validateTitle(title);
        validateDescription(description);
        validateAmount(amount);

        return toBuilder()
            .title(title)
            .description(description != null ? description : "")
            .amount(amount)
            .categoryId(categoryId)
            .updatedAt(Instant.now())
            .build();
    }

    public ExpenseTransition<ExpenseSubmittedEvent> submit(UUID userId) {
        return submit(userId, ExpenseRules.defaults());
    }

    /**
     * DRAFT → SUBMITTED.
     *
     * @throws BusinessRuleException if not DRAFT, not the creator, or a receipt
     *                               is required and none is attached
     */
    public ExpenseTransition<ExpenseSubmittedEvent> submit(UUID userId, ExpenseRules rules) {
        if (status != ExpenseStatus.DRAFT) {
            throw new BusinessRuleException("Only drafts can be submitted.");
        }
        if (!isOwnedBy(userId)) {
            throw new BusinessRuleException("Only the creator can submit this request.");
        }
        if (rules.requiresReceipt(amount) && !hasAttachments()) {
            throw new BusinessRuleException(String.format(
                "Expenses over $%s require a receipt attachment.",
                rules.getReceiptThreshold().toPlainString()));
        }

        Instant now = Instant.now();
        ExpenseRequest submitted = toBuilder()
            .status(ExpenseStatus.SUBMITTED)
            .submittedAt(now)
            .updatedAt(now)
            .build();
        return new ExpenseTransition<>(status, submitted,
                ExpenseSubmittedEvent.of(id, userId, amount, now));
    }

    public ExpenseTransition<ExpenseApprovedEvent> approve(UUID actingUserId, UserRole actingRole) {
        return approve(actingUserId, actingRole, ExpenseRules.defaults());
    }

    /**
     * SUBMITTED → APPROVED.
     *
     * Guards run in a fixed order and the first failure wins:
     * role, status, self-approval, peer-manager approval, approval ceiling.
     *
     * @throws BusinessRuleException naming the guard that failed
     */
    public ExpenseTransition<ExpenseApprovedEvent> approve(UUID actingUserId, UserRole actingRole,
                                                           ExpenseRules rules) {
        if (actingRole == null || !actingRole.canProcessExpenses()) {
            throw new BusinessRuleException("Only managers or admins can approve requests.");
        }
        if (status != ExpenseStatus.SUBMITTED) {
            throw new BusinessRuleException("Only submitted requests can be approved.");
        }
        if (actingRole == UserRole.MANAGER && isOwnedBy(actingUserId)) {
            throw new BusinessRuleException(
                "Managers cannot approve their own expenses. Only admins can approve manager expenses.");
        }
        if (actingRole == UserRole.MANAGER && creatorRole == UserRole.MANAGER) {
            throw new BusinessRuleException(
                "Managers cannot approve other managers' expenses. Only admins can approve manager expenses.");
        }
        if (rules.requiresAdminApproval(amount) && actingRole != UserRole.ADMIN) {
            throw new BusinessRuleException(String.format(
                "Expenses over $%s require admin approval.",
                rules.getApprovalCeiling().toPlainString()));
        }

        Instant now = Instant.now();
        ExpenseRequest approved = toBuilder()
            .status(ExpenseStatus.APPROVED)
            .processedAt(now)
            .processedBy(actingUserId)
            .updatedAt(now)
            .build();
        return new ExpenseTransition<>(status, approved,
                ExpenseApprovedEvent.of(id, actingUserId, amount, now));
    }

    /**
     * SUBMITTED → REJECTED. The reason is stored verbatim.
     *
     * @throws BusinessRuleException if the role cannot process expenses, the
     *                               request is not SUBMITTED, or no reason is given
     */
    public ExpenseTransition<ExpenseRejectedEvent> reject(UUID actingUserId, UserRole actingRole, String reason) {
        if (actingRole == null || !actingRole.canProcessExpenses()) {
            throw new BusinessRuleException("Only managers or admins can reject requests.");
        }
        if (status != ExpenseStatus.SUBMITTED) {
            throw new BusinessRuleException("Only submitted requests can be rejected.");
        }
        if (reason == null || reason.isBlank()) {
            throw new BusinessRuleException("Rejection reason is required.");
        }
        if (reason.length() > MAX_REJECTION_REASON_LENGTH) {
            throw new BusinessRuleException(
                "Rejection reason cannot exceed " + MAX_REJECTION_REASON_LENGTH + " characters.");
        }

        Instant now = Instant.now();
        ExpenseRequest rejected = toBuilder()
            .status(ExpenseStatus.REJECTED)
            .processedAt(now)
            .processedBy(actingUserId)
            .rejectionReason(reason)
            .updatedAt(now)
            .build();
        return new ExpenseTransition<>(status, rejected,
                ExpenseRejectedEvent.of(id, actingUserId, reason, now));
    }

    /**
     * Appends a receipt URL to a draft.
     *
     * @throws BusinessRuleException if not DRAFT, or the URL is empty, too long or already attached
     */
    public ExpenseRequest addAttachment(String attachmentUrl) {
        if (status != ExpenseStatus.DRAFT) {
            throw new BusinessRuleException("Only draft requests can have attachments added.");
        }
        if (attachmentUrl == null || attachmentUrl.isBlank()) {
            throw new BusinessRuleException("Attachment URL cannot be empty.");
        }
        if (attachmentUrl.length() > MAX_ATTACHMENT_URL_LENGTH) {
            throw new BusinessRuleException(
                "Attachment URL cannot exceed " + MAX_ATTACHMENT_URL_LENGTH + " characters.");
        }
        if (attachmentUrls.contains(attachmentUrl)) {
            throw new BusinessRuleException("Attachment is already attached to this request.");
        }

        List<String> urls = new ArrayList<>(attachmentUrls);
        urls.add(attachmentUrl);
        return toBuilder()
            .attachmentUrls(List.copyOf(urls))
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Removes a receipt URL from a draft.
     *
     * @throws BusinessRuleException if not DRAFT or the URL is not attached
     */
    public ExpenseRequest removeAttachment(String attachmentUrl) {
        if (status != ExpenseStatus.DRAFT) {
            throw new BusinessRuleException("Only draft requests can have attachments removed.");
        }
        if (attachmentUrl == null || attachmentUrl.isBlank()) {
            throw new BusinessRuleException("Attachment URL cannot be empty.");
        }
        if (!attachmentUrls.contains(attachmentUrl)) {
            throw new BusinessRuleException("Attachment is not attached to this request.");
        }

        List<String> urls = new ArrayList<>(attachmentUrls);
        urls.remove(attachmentUrl);
        return toBuilder()
            .attachmentUrls(List.copyOf(urls))
            .updatedAt(Instant.now())
            .build();
    }

    public void ensureNotApproved() {
        if (status == ExpenseStatus.APPROVED) {
            throw new BusinessRuleException("Approved requests cannot be modified.");
        }
    }

    public void ensureNotRejected() {
        if (status == ExpenseStatus.REJECTED) {
            throw new BusinessRuleException("Rejected requests cannot be resubmitted.");
        }
    }

    /**
     * Returns a copy carrying the creator's current role from the identity store.
     * Called once by the approval flow, right before {@link #approve}.
     */
    ExpenseRequest withCreatorRole(UserRole role) {
        if (role == null || role == creatorRole) {
            return this;
        }
        return toBuilder().creatorRole(role).build();
    }

    public boolean isOwnedBy(UUID userId) {
        return Objects.equals(creatorId, userId);
    }

    public boolean hasAttachments() {
        return !attachmentUrls.isEmpty();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private static void validateTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new BusinessRuleException("Title cannot be empty.");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new BusinessRuleException("Title cannot exceed " + MAX_TITLE_LENGTH + " characters.");
        }
    }

    private static void validateDescription(String description) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new BusinessRuleException(
                "Description cannot exceed " + MAX_DESCRIPTION_LENGTH + " characters.");
        }
    }

    private static void validateAmount(BigDecimal amount) {
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new BusinessRuleException("Amount must be greater than zero.");
        }
        // stored as numeric(18,2)
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new BusinessRuleException("Amount cannot have more than two decimal places.");
        }
    }

    private static void validateExpenseDate(LocalDate expenseDate, ExpenseRules rules) {
        if (expenseDate == null) {
            throw new BusinessRuleException("Expense date is required.");
        }
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        if (expenseDate.isAfter(today)) {
            throw new BusinessRuleException("Expense date cannot be in the future.");
        }
        if (rules.limitsExpenseAge() && expenseDate.isBefore(today.minusDays(rules.getMaxExpenseAgeDays()))) {
            throw new BusinessRuleException(
                "Expense date cannot be more than " + rules.getMaxExpenseAgeDays() + " days in the past.");
        }
    }
}
