package com.evently.common.dto;

import lombok.*;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentResultDto {

    private boolean success;
    private String transactionId;
    private BigDecimal amount;
    private String message;
}
