package com.dubbi.hostmaster.handle.domain;

public record ContactChangeReceipt(String recepNo) {}
