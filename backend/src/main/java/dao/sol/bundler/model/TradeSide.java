package dao.sol.bundler.model;

public enum TradeSide {
    BUY,
    SELL
}
