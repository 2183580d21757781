package com.freelancerpro.backend.dto.user;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.freelancerpro.backend.enums.Currency;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfileDTO {
    private String id;
    private String name;
    private String email;
    private Currency currency;
    private BigDecimal totalIncome;
    private BigDecimal totalSavings;
    private BigDecimal netWorth;
    private LocalDateTime createdAt;
}
