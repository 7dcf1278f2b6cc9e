package io.recoverly.common.dto.ledger;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Money from one receipt applied to one invoice (one tranche).
 *
 * Owned by the allocator: rows are regenerated, never edited.
 * Document ID: receiptId:invoiceId
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AllocationDto {

    private String id;
    private String receiptId;
    private String invoiceId;
    private String customerId;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate paymentDate;

    private BigDecimal allocatedAmount;
    private Integer daysOverdueAtPayment;

    public static String idOf(String receiptId, String invoiceId) {
        return receiptId + ":" + invoiceId;
    }
}
