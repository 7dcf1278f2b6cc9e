package io.recoverly.ledger.service;

import io.recoverly.common.dto.ledger.AllocationDto;
import io.recoverly.common.dto.ledger.InvoiceBalanceDto;
import io.recoverly.common.dto.ledger.InvoiceDto;
import io.recoverly.common.dto.score.PaymentAnalyticsDashboardDto;
import io.recoverly.common.dto.score.PaymentClassification;
import io.recoverly.common.dto.score.PaymentScoreDto;
import io.recoverly.common.dto.score.SegmentSummaryDto;
import io.recoverly.common.util.AmountUtils;
import io.recoverly.ledger.repository.AllocationRepository;
import io.recoverly.ledger.repository.InvoiceRepository;
import io.recoverly.ledger.repository.PaymentScoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Payment analytics dashboard: customers grouped by payment classification.
 *
 * Reads the stored score records; customers without a classification (no
 * payments yet) are left out of segments and summary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentAnalyticsService {

    private final PaymentScoreRepository paymentScoreRepository;
    private final InvoiceRepository invoiceRepository;
    private final AllocationRepository allocationRepository;
    private final PaymentAllocationService paymentAllocationService;

    public PaymentAnalyticsDashboardDto getDashboard() {
        List<PaymentScoreDto> classified = paymentScoreRepository.findAll().stream()
                .filter(s -> s.getClassification() != null)
                .toList();

        Map<String, BigDecimal> outstanding = outstandingByCustomer();

        List<SegmentSummaryDto> segments = new ArrayList<>();
        for (PaymentClassification classification : PaymentClassification.values()) {
            List<PaymentScoreDto> members = classified.stream()
                    .filter(s -> s.getClassification() == classification)
                    .toList();
            segments.add(SegmentSummaryDto.builder()
                    .classification(classification)
                    .customerCount(members.size())
                    .totalOutstanding(totalOutstanding(members, outstanding))
                    .avgPaymentScore(average(members.stream()
                            .map(PaymentScoreDto::getPaymentScore)
                            .filter(Objects::nonNull)
                            .map(BigDecimal::valueOf)
                            .toList()))
                    .build());
        }

        PaymentAnalyticsDashboardDto dashboard = PaymentAnalyticsDashboardDto.builder()
                .segments(segments)
                .totalCustomers(classified.size())
                .avgOnTimeRate(average(classified.stream()
                        .map(PaymentScoreDto::getOnTimeRate)
                        .filter(Objects::nonNull)
                        .toList()))
                .totalOutstanding(totalOutstanding(classified, outstanding))
                .avgPaymentScore(average(classified.stream()
                        .map(PaymentScoreDto::getPaymentScore)
                        .filter(Objects::nonNull)
                        .map(BigDecimal::valueOf)
                        .toList()))
                .build();

        log.debug("Payment analytics dashboard: {} classified customers", classified.size());
        return dashboard;
    }

    // ==================== HELPER METHODS ====================

    private Map<String, BigDecimal> outstandingByCustomer() {
        List<AllocationDto> allocations = allocationRepository.findAll();
        Map<String, List<InvoiceDto>> invoicesByCustomer = invoiceRepository.findAll().stream()
                .filter(i -> i.getCustomerId() != null)
                .collect(Collectors.groupingBy(InvoiceDto::getCustomerId));

        Map<String, BigDecimal> outstanding = new HashMap<>();
        invoicesByCustomer.forEach((customerId, invoices) -> {
            List<InvoiceBalanceDto> balances = paymentAllocationService.summarizeBalances(invoices, allocations);
            outstanding.put(customerId, AmountUtils.sum(balances.stream()
                    .map(InvoiceBalanceDto::getRemainingBalance)
                    .toList()));
        });
        return outstanding;
    }

    private BigDecimal totalOutstanding(List<PaymentScoreDto> scores, Map<String, BigDecimal> outstanding) {
        return AmountUtils.sum(scores.stream()
                .map(s -> outstanding.getOrDefault(s.getCustomerId(), AmountUtils.zero()))
                .toList());
    }

    /**
     * Mean to 2 decimals, null for no values.
     */
    private BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return null;
        }
        BigDecimal total = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(values.size()), 2, RoundingMode.HALF_UP);
    }
}
