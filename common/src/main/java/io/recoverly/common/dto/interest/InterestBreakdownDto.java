package io.recoverly.common.dto.interest;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Interest owed on an invoice, tranche by tranche.
 *
 * totalInterest covers settled tranches only. The unpaid* fields project
 * interest on the remaining balance up to asOf and are informational.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterestBreakdownDto {

    private String invoiceId;
    private String invoiceNumber;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate dueDate;

    private BigDecimal invoiceAmount;
    private BigDecimal annualRate;      // effective rate, 0 when none applies

    private List<TrancheInterestDto> tranches;
    private BigDecimal totalInterest;

    private BigDecimal paidAmount;
    private BigDecimal unpaidAmount;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate asOf;             // null when no projection requested

    private Integer unpaidDaysOverdue;
    private BigDecimal unpaidInterest;
    private BigDecimal totalWithUnpaid;

    private String message;             // set when there is nothing to show yet
}
