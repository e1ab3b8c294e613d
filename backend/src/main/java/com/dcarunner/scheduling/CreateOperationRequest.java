package com.dcarunner.scheduling;

import com.dcarunner.domain.DcaSwapParams;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.OptionsTradeParams;
import com.dcarunner.domain.SettlementParams;
import com.dcarunner.domain.TransferParams;
import com.dcarunner.domain.WriteOptionParams;
import com.dcarunner.scheduling.validation.EvmAddressValue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * New recurring operation as submitted by its owner. Exactly the parameter block matching kind must be set.
 * Constraint messages are the error codes reported by OperationScheduleService.
 */
@NoArgsConstructor
@Getter
@Setter
public class CreateOperationRequest {

    @NotNull(message = "INVALID_REQUEST")
    private OperationKind kind;

    @NotBlank(message = "INVALID_ADDRESS")
    @EvmAddressValue
    private String ownerAddress;

    private String name;

    /** Defaults to the configured app id. */
    private String appId;

    /** Version the owner granted when creating the job. */
    @Min(value = 1, message = "INVALID_REQUEST")
    private int appVersion;

    /** e.g. "1 day" or "PT15M". */
    @NotBlank(message = "INVALID_FREQUENCY")
    private String frequency;

    private TransferParams transfer;
    private DcaSwapParams dcaSwap;
    private WriteOptionParams writeOption;
    private SettlementParams settlement;
    private OptionsTradeParams optionsTrade;
}
