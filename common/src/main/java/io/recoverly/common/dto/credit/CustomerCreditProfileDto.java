package io.recoverly.common.dto.credit;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Customer master data relevant to credit and interest.
 *
 * Category is the collections category (Alpha, Beta, Gamma, Delta).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CustomerCreditProfileDto {

    private String customerId;
    private String customerName;
    private String category;

    private BigDecimal creditLimit;
    private BigDecimal categoryOpeningBalance;
    private BigDecimal customerOpeningBalance;

    private BigDecimal interestRate;            // annual %

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate interestApplicableFrom;   // anchor for opening-balance interest
}
