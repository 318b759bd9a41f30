package dao.sol.bundler.model;

import java.util.List;

public record WalletValidation(List<String> valid, List<String> invalid) {}
