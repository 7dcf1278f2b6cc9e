package io.recoverly.common.dto.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * All debtors, largest balance first, with per-category totals.
 *
 * Debtors without a category are listed but not counted in any category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DebtorsListDto {

    private List<DebtorDto> debtors;
    private List<CategoryTotal> categories;
    private BigDecimal totalBalance;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryTotal {
        private String category;
        private int count;
        private BigDecimal totalBalance;
    }
}
