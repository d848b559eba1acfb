package com.flagship.expense_workflow.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AddAttachmentRequest {

    @JsonProperty("attachment_url")
    private String attachmentUrl;
}
