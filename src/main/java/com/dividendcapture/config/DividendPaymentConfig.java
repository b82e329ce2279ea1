package com.dividendcapture.config;

import com.dividendcapture.domain.enums.DividendPaymentPolicy;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DividendPaymentConfig {

    DividendPaymentPolicy policy;

    /** Business days after the record date, for RECORD_DATE_OFFSET. */
    @Builder.Default
    int paymentOffsetDays = 1;

    /** Calendar days after the record date for months without a fixed payment month, for FISCAL_MONTH. */
    @Builder.Default
    int fallbackPaymentDays = 75;

    void collectViolations(List<String> violations) {
        if (policy == null) {
            violations.add("dividend.payment-policy is required");
        }
        if (paymentOffsetDays < 0) {
            violations.add("dividend.payment-offset-days must be >= 0");
        }
        if (fallbackPaymentDays < 0) {
            violations.add("dividend.fallback-payment-days must be >= 0");
        }
    }
}
