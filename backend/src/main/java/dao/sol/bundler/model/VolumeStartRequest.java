package dao.sol.bundler.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
public class VolumeStartRequest {

    @NotBlank
    private String tokenAddress;

    @NotEmpty
    private List<String> wallets;   // private keys

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal minAmount;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxAmount;

    private double intervalMin = 1;
    private double intervalMax = 5;

    @Min(0)
    private long duration;          // minutes

    private Integer slippageBps;
    private Integer sellPercent;
    private String protocol;
}
