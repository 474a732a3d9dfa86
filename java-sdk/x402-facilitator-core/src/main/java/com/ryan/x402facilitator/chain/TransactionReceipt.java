package com.ryan.x402facilitator.chain;

public record TransactionReceipt(String transactionHash, boolean successful) {
}
