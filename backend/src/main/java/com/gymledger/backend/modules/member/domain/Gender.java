package com.gymledger.backend.modules.member.domain;

public enum Gender {
    M,
    F,
    O
}
