package com.dividendcapture.domain.enums;

/**
 * Rule deciding on which simulation day a held position's dividend is credited to cash.
 *
 * <ul>
 *   <li>EX_DATE -- credit on the ex-dividend date itself</li>
 *   <li>RECORD_DATE_OFFSET -- credit a configured number of business days after the record date</li>
 *   <li>FISCAL_MONTH -- March/April records pay on June 30, September/October records on
 *       December 31, anything else a fixed number of calendar days after the record date;
 *       non-business days roll forward</li>
 * </ul>
 */
public enum DividendPaymentPolicy {
    EX_DATE,
    RECORD_DATE_OFFSET,
    FISCAL_MONTH
}
