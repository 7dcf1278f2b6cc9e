package io.recoverly.common.dto.interest;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Interest accrued on one allocation (payment breakdown row).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrancheInterestDto {

    private String receiptId;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate paymentDate;

    private BigDecimal allocatedAmount;
    private int daysOverdue;
    private BigDecimal interestAmount;
}
