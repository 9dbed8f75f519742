package com.deepansh.trader.action.input;

import com.deepansh.trader.action.ActionParam;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record SwapQuoteInput(
        @ActionParam("Mint being sold. Default: SOL (So11111111111111111111111111111111111111112)")
        String inputMint,

        @NotBlank
        @ActionParam("Mint being bought")
        String outputMint,

        @Positive
        @ActionParam("Amount in SOL when selling SOL (buys)")
        Double amountSol,

        @Positive
        @ActionParam("Amount in the input token's smallest unit, required when the input is not SOL (sells)")
        Long amountRaw,

        @Min(1) @Max(5000)
        @ActionParam("Slippage tolerance in basis points. Default: 100")
        Integer slippageBps
) {
}
