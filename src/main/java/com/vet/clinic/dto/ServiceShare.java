package com.vet.clinic.dto;

import java.math.BigDecimal;

public record ServiceShare(String serviceType, int count, BigDecimal revenue, double percentage) {}
