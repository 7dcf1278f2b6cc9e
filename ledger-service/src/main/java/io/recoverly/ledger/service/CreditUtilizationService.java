package io.recoverly.ledger.service;

import io.recoverly.common.dto.credit.CustomerCreditProfileDto;
import io.recoverly.common.dto.credit.UtilizationBand;
import io.recoverly.common.dto.credit.UtilizationDto;
import io.recoverly.common.dto.ledger.AllocationDto;
import io.recoverly.common.dto.ledger.InvoiceBalanceDto;
import io.recoverly.common.dto.ledger.InvoiceDto;
import io.recoverly.common.util.AmountUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Credit utilization per customer.
 *
 * utilizedLimit  = sum of remaining invoice balances + opening balance
 * availableLimit = creditLimit - utilizedLimit (negative when over limit)
 * utilizationPct = utilizedLimit / creditLimit x 100, null without a limit
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditUtilizationService {

    private final PaymentAllocationService paymentAllocationService;

    /**
     * @param profile             customer credit profile
     * @param outstandingBalances current balances of the customer's invoices
     */
    public UtilizationDto computeUtilization(CustomerCreditProfileDto profile,
                                             List<InvoiceBalanceDto> outstandingBalances) {
        BigDecimal outstanding = AmountUtils.sum(outstandingBalances.stream()
                .map(InvoiceBalanceDto::getRemainingBalance)
                .toList());
        BigDecimal openingBalance = applicableOpeningBalance(profile);
        BigDecimal utilized = outstanding.add(openingBalance);

        BigDecimal creditLimit = AmountUtils.nullToZero(profile.getCreditLimit());
        BigDecimal pct = creditLimit.signum() > 0 ? AmountUtils.percentage(utilized, creditLimit) : null;
        UtilizationBand band = UtilizationBand.of(pct);

        log.debug("Customer {} utilization: utilized={}, limit={}, pct={}, band={}",
                profile.getCustomerId(), utilized, creditLimit, pct, band);

        return UtilizationDto.builder()
                .customerId(profile.getCustomerId())
                .customerName(profile.getCustomerName())
                .category(profile.getCategory())
                .creditLimit(creditLimit)
                .outstandingInvoices(outstanding)
                .openingBalance(openingBalance)
                .utilizedLimit(utilized)
                .availableLimit(creditLimit.subtract(utilized))
                .utilizationPct(pct)
                .band(band)
                .build();
    }

    /**
     * Utilization derived straight from the customer's invoices and allocations.
     */
    public UtilizationDto computeUtilization(CustomerCreditProfileDto profile,
                                             List<InvoiceDto> invoices,
                                             List<AllocationDto> allocations) {
        return computeUtilization(profile, paymentAllocationService.summarizeBalances(invoices, allocations));
    }

    /**
     * Opening balance counted against the limit: the customer's own when set,
     * otherwise the category default.
     */
    public static BigDecimal applicableOpeningBalance(CustomerCreditProfileDto profile) {
        if (profile == null) {
            return AmountUtils.zero();
        }
        if (profile.getCustomerOpeningBalance() != null) {
            return AmountUtils.round(profile.getCustomerOpeningBalance());
        }
        return AmountUtils.nullToZero(profile.getCategoryOpeningBalance());
    }
}
