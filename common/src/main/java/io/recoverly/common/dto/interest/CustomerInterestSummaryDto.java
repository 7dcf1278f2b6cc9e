package io.recoverly.common.dto.interest;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Customer-level interest: all invoices plus the opening-balance term, counted once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerInterestSummaryDto {

    private String customerId;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate asOf;

    private int invoiceCount;
    private BigDecimal invoiceInterest;
    private BigDecimal openingBalanceInterest;
    private BigDecimal totalInterest;
    private InterestCombinationPolicy policy;
}
