package dao.sol.bundler.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
public class DispatchRequest {

    @NotEmpty
    @Valid
    private List<Wallet> wallets;

    @NotBlank
    private String tokenAddress;

    private String protocol = "auto";
    private TradeSide side = TradeSide.BUY;

    private BigDecimal solAmount;
    private List<BigDecimal> amounts;
    private BigDecimal sellPercent;

    private Integer slippageBps;
    private Long tipLamports;

    private String bundleMode = BundleMode.BATCH.value();
    private Long batchDelayMs;
    private Long singleDelayMs;

    @Data
    public static class Wallet {
        private String address;     // derived from the key when absent
        @NotBlank
        private String privateKey;
    }
}
