package com.flagship.expense_workflow.comment;

import com.flagship.expense_workflow.comment.dto.AddCommentRequest;
import com.flagship.expense_workflow.comment.dto.CommentResponse;
import com.flagship.expense_workflow.identity.CallerHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/expenses/{expenseId}/comments")
@RequiredArgsConstructor
public class ExpenseCommentController {

    private final ExpenseCommentService commentService;

    @GetMapping
    public ResponseEntity<List<CommentResponse>> getComments(@PathVariable("expenseId") UUID expenseId) {
        List<CommentResponse> comments = commentService.getComments(expenseId)
            .stream()
            .map(CommentResponse::from)
            .toList();
        return ResponseEntity.ok(comments);
    }

    @PostMapping
    public ResponseEntity<CommentResponse> addComment(
            @PathVariable("expenseId") UUID expenseId,
            @Valid @RequestBody AddCommentRequest request,
            @RequestHeader(CallerHeaders.USER_ID) UUID userId) {
        ExpenseComment comment = commentService.addComment(expenseId, userId, request.getText());
        return ResponseEntity.status(HttpStatus.CREATED).body(CommentResponse.from(comment));
    }
}
