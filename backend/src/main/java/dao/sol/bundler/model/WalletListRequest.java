package dao.sol.bundler.model;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class WalletListRequest {

    @NotEmpty
    private List<String> wallets;   // private keys
}
