package com.casebattle.ledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Amount stays text so "1000,50" and " 1000.50 " reach the amount parser untouched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateTransactionRequest {

    @NotNull(message = "Type is required")
    @Pattern(regexp = "^(deposit|withdraw)$", message = "Type must be either deposit or withdraw")
    private String type;

    @NotBlank(message = "Amount is required")
    @Size(max = 64, message = "Amount must not exceed 64 characters")
    private String amount;
}
