package com.segs.alert.exception;

import com.segs.alert.entity.ConditionKey;
import lombok.Getter;

/**
 * An identical alert was created within the deduplication TTL.
 * This is a control-flow signal rather than a failure; the rule evaluator
 * logs it at debug and moves on.
 */
@Getter
public class DuplicateAlertSuppressedException extends AlertServiceException {

    private final ConditionKey condition;

    public DuplicateAlertSuppressedException(ConditionKey condition) {
        super("DUPLICATE_SUPPRESSED", String.format(
                "Duplicate alert suppressed: type=%s region=%s meter=%s",
                condition.type(), condition.region(), condition.meterId()));
        this.condition = condition;
    }
}
