package io.recoverly.common.dto.ledger;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Data Transfer Object for Invoice entities.
 *
 * Due date is derived: dueDateOverride when set, otherwise invoiceDate + paymentTermsDays.
 * Status is written by the ledger only.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceDto {

    private String id;
    private String invoiceNumber;
    private String customerId;
    private String customerName;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate invoiceDate;

    private Integer paymentTermsDays;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate dueDateOverride;

    private BigDecimal invoiceAmount;
    private BigDecimal costBasis;       // null when unknown
    private BigDecimal interestRate;    // annual %, null = use customer rate

    private InvoiceStatus status;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;    // FIFO tie-break
}
