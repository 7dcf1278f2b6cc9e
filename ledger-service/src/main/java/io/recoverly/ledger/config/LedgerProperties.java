package io.recoverly.ledger.config;

import io.recoverly.common.dto.interest.InterestCombinationPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Business policy settings of the ledger engine (prefix "ledger").
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * Days after the due date that still count as paid on time on the status cards.
     */
    @Min(0)
    private int graceDays = 7;

    @Valid
    private Interest interest = new Interest();

    @Valid
    private Scoring scoring = new Scoring();

    @Valid
    private Recalculation recalculation = new Recalculation();

    @Getter
    @Setter
    public static class Interest {

        /**
         * Day-count basis of the daily rate (annualRate / daysInYear).
         */
        @Min(1)
        private int daysInYear = 365;

        @NotNull
        private InterestCombinationPolicy combinationPolicy = InterestCombinationPolicy.SUM;
    }

    @Getter
    @Setter
    public static class Scoring {

        @NotNull
        @DecimalMin("0")
        private BigDecimal onTimeWeight = new BigDecimal("0.7");

        @NotNull
        @DecimalMin("0")
        private BigDecimal delayWeight = new BigDecimal("0.3");

        /**
         * Points removed from the delay score per weighted day of delay.
         */
        @NotNull
        @DecimalMin("0")
        private BigDecimal delayPenaltyPerDay = BigDecimal.ONE;

        /**
         * Age (days before as-of) at which a payment counts half in the delay score.
         */
        @Min(1)
        private int recencyHalfLifeDays = 180;
    }

    @Getter
    @Setter
    public static class Recalculation {

        private boolean scheduleEnabled = false;

        private String cron = "0 30 2 * * *";
    }
}
