package com.dcarunner.ability;

import com.dcarunner.ability.config.AbilityProperties;
import com.dcarunner.common.Blocking;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.failure.AmbiguousOutcomeException;
import com.dcarunner.failure.ExecutionRejectedException;
import com.dcarunner.failure.PrecheckRejectedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one ability: precheck, then execute only if precheck succeeded. Never retries either call.
 * A timeout surfaces as {@link com.dcarunner.common.CallTimeoutException}; a rejected call carries the request
 * params and the full response for diagnostics.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AbilityInvoker {

    private final AbilityClients abilityClients;
    private final AbilityProperties properties;

    /**
     * @param onPrechecked invoked after a successful precheck, before execute is sent
     * @return the execute result; its {@link AbilityResult#transactionHash()} is non-null
     */
    public AbilityResult invoke(OperationKind kind, String ability, Map<String, Object> params,
                                AbilityContext context, Runnable onPrechecked) {
        AbilityClient client = abilityClients.get(ability);

        AbilityResult precheck;
        try {
            precheck = Blocking.await(client.precheck(params, context),
                    Duration.ofMillis(properties.getPrecheckTimeoutMs()), "precheck " + ability);
        } catch (AbilityClientException e) {
            throw new PrecheckRejectedException(kind, ability, e.getMessage(), payload(params, null), e);
        }
        if (precheck == null || !precheck.success()) {
            throw new PrecheckRejectedException(kind, ability, errorOf(precheck), payload(params, precheck), null);
        }
        onPrechecked.run();

        AbilityResult execution;
        try {
            execution = Blocking.await(client.execute(params, context),
                    Duration.ofMillis(properties.getExecuteTimeoutMs()), "execute " + ability);
        } catch (AbilityClientException e) {
            throw new ExecutionRejectedException(kind, ability, e.getMessage(), payload(params, null), e);
        }
        if (execution == null || !execution.success()) {
            throw new ExecutionRejectedException(kind, ability, errorOf(execution), payload(params, execution), null);
        }
        if (execution.transactionHash() == null) {
            throw new AmbiguousOutcomeException(kind,
                    "execute " + ability + " acknowledged without a transaction hash",
                    payload(params, execution), null);
        }
        log.debug("{} executed for {}: {}", ability, context.delegatorAddress(), execution.transactionHash());
        return execution;
    }

    private static String errorOf(AbilityResult result) {
        if (result == null) {
            return "empty response";
        }
        return result.error() != null ? result.error() : "success=false";
    }

    private static Map<String, Object> payload(Map<String, Object> params, AbilityResult response) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("params", params);
        if (response != null) {
            payload.put("error", response.error());
            payload.put("response", response.result());
        }
        return payload;
    }
}
