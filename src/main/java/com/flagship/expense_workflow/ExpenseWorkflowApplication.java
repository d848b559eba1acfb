package com.flagship.expense_workflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExpenseWorkflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExpenseWorkflowApplication.class, args);
    }
}
