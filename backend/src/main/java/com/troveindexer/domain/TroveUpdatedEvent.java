package com.troveindexer.domain;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * TroveUpdated: the lifecycle event folded into position state. Amounts are raw fixed-point integers.
 */
public record TroveUpdatedEvent(
        LogMeta meta,
        BigInteger debt,
        BigInteger collateral,
        BigInteger stake,
        int operationCode
) implements DomainEvent {

    public static final String NAME = "TroveUpdated";

    @Override
    public String name() {
        return NAME;
    }

    public LifecycleOperation operation() {
        return LifecycleOperation.fromCode(operationCode);
    }

    @Override
    public Map<String, Object> auditFields() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("_debt", debt);
        m.put("_coll", collateral);
        if (stake != null) {
            m.put("_stake", stake);
        }
        m.put("_operation", operationCode);
        return m;
    }
}
