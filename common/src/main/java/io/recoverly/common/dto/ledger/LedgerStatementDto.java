package io.recoverly.common.dto.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Customer ledger statement for a date range.
 *
 * Balances are absolute amounts paired with their side; a receivable is DR,
 * an excess payment CR. The opening balance carries the customer's opening
 * balance plus everything dated before {@code fromDate}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerStatementDto {

    private String customerId;
    private String customerName;
    private LocalDate fromDate;
    private LocalDate toDate;

    private BigDecimal openingBalance;
    private BalanceSide openingBalanceSide;

    private List<Entry> entries;

    private BigDecimal totalDebits;
    private BigDecimal totalCredits;
    private BigDecimal closingBalance;
    private BalanceSide closingBalanceSide;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private LocalDate date;
        private LedgerEntryType type;
        private String referenceId;
        private String voucherNumber;
        private BigDecimal debit;
        private BigDecimal credit;
        private BigDecimal balance;
        private BalanceSide balanceSide;
    }
}
