package com.gymledger.backend.modules.payment.domain;

public enum PaymentMethod {
    CASH,
    DEBIT_CARD,
    BANK_TRANSFER,
    E_WALLET
}
